package edu.brandeis.cosi103a.gametheory.strategy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Append-only record of a repeated game from one player's point of view. Round numbers
 * start at 1 and increase by one with every appended turn.
 *
 * <p>Strategies are handed a {@link #readOnlyView()}, which follows the owning history as rounds
 * are appended but rejects {@link #append}.
 */
public final class ActionHistory {

    private final List<Turn> turns;
    private final List<Turn> view;
    private final boolean writable;

    public ActionHistory() {
        this(new ArrayList<>(), true);
    }

    private ActionHistory(List<Turn> turns, boolean writable) {
        this.turns = turns;
        this.view = Collections.unmodifiableList(turns);
        this.writable = writable;
    }

    /**
     * Builds a history from externally supplied turns.
     *
     * @throws IllegalArgumentException if the round numbers are not 1, 2, 3, ...
     */
    public static ActionHistory of(List<Turn> turns) {
        ActionHistory history = new ActionHistory();
        for (Turn turn : turns) {
            checkNotNull(turn, "turn");
            checkArgument(turn.round() == history.size() + 1,
                "Expected round %s but got %s", history.size() + 1, turn.round());
            history.append(turn.ownAction(), turn.opponentAction());
        }
        return history;
    }

    /**
     * Live view of this history that cannot be appended to.
     */
    public ActionHistory readOnlyView() {
        return writable ? new ActionHistory(turns, false) : this;
    }

    public boolean isReadOnly() {
        return !writable;
    }

    /**
     * Records the next round and returns it.
     *
     * @throws UnsupportedOperationException on a read-only view
     */
    public Turn append(Action own, Action opponent) {
        if (!writable) {
            throw new UnsupportedOperationException("History is read-only");
        }
        checkNotNull(own, "own action");
        checkNotNull(opponent, "opponent action");
        Turn turn = new Turn(turns.size() + 1, own, opponent);
        turns.add(turn);
        return turn;
    }

    public List<Turn> turns() {
        return view;
    }

    public int size() {
        return turns.size();
    }

    public boolean isEmpty() {
        return turns.isEmpty();
    }

    public Turn last() {
        checkArgument(!turns.isEmpty(), "history is empty");
        return turns.get(turns.size() - 1);
    }

    /**
     * Opponent's move {@code roundsAgo} rounds back; 1 is the most recent round.
     */
    public Action opponentAction(int roundsAgo) {
        checkArgument(roundsAgo >= 1 && roundsAgo <= turns.size(),
            "Cannot look %s rounds back in a history of %s", roundsAgo, turns.size());
        return turns.get(turns.size() - roundsAgo).opponentAction();
    }

    public int opponentCount(Action action) {
        int count = 0;
        for (Turn turn : turns) {
            if (turn.opponentAction() == action) {
                count++;
            }
        }
        return count;
    }

    public int ownCount(Action action) {
        int count = 0;
        for (Turn turn : turns) {
            if (turn.ownAction() == action) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ActionHistory[");
        for (Turn turn : turns) {
            sb.append(turn.ownAction().symbol()).append(turn.opponentAction().symbol()).append(' ');
        }
        return sb.toString().trim() + "]";
    }
}
