package edu.brandeis.cosi103a.gametheory.runner;

import edu.brandeis.cosi103a.gametheory.InvalidTurnCountException;
import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Plays a repeated stage game between two strategy instances.
 */
public class MatchSimulator {

    private final StageGame stageGame;

    public MatchSimulator() {
        this(StageGame.PRISONERS_DILEMMA);
    }

    public MatchSimulator(StageGame stageGame) {
        this.stageGame = checkNotNull(stageGame, "stageGame");
    }

    public StageGame stageGame() {
        return stageGame;
    }

    /**
     * Plays {@code turns} rounds. Both strategies decide on a read-only view of the completed
     * rounds only, then the stage payoff for the pair of moves is applied.
     *
     * @throws InvalidTurnCountException if turns is less than 1
     */
    public MatchResult playMatch(Strategy a, Strategy b, int turns) {
        checkNotNull(a, "strategy a");
        checkNotNull(b, "strategy b");
        if (turns < 1) {
            throw new InvalidTurnCountException("Turns must be at least 1, got " + turns);
        }

        ActionHistory historyA = new ActionHistory();
        ActionHistory historyB = new ActionHistory();
        ActionHistory seenByA = historyA.readOnlyView();
        ActionHistory seenByB = historyB.readOnlyView();
        List<Action> actionsA = new ArrayList<>(turns);
        List<Action> actionsB = new ArrayList<>(turns);
        int scoreA = 0;
        int scoreB = 0;

        for (int turn = 0; turn < turns; turn++) {
            Action moveA = checkNotNull(a.nextAction(seenByA), "%s returned no action", a.name());
            Action moveB = checkNotNull(b.nextAction(seenByB), "%s returned no action", b.name());

            scoreA += stageGame.payoff(moveA, moveB);
            scoreB += stageGame.payoff(moveB, moveA);
            historyA.append(moveA, moveB);
            historyB.append(moveB, moveA);
            actionsA.add(moveA);
            actionsB.add(moveB);
        }

        return new MatchResult(a.name(), b.name(), actionsA, actionsB, scoreA, scoreB,
            cooperationRate(actionsA), cooperationRate(actionsB));
    }

    static double cooperationRate(List<Action> actions) {
        if (actions.isEmpty()) {
            return 0.0;
        }
        long cooperations = actions.stream().filter(action -> action == Action.COOPERATE).count();
        return (double) cooperations / actions.size();
    }
}
