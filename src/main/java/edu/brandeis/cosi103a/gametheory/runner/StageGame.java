package edu.brandeis.cosi103a.gametheory.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.gametheory.strategy.Action;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One-shot payoff table applied every turn of a match.
 *
 * @param reward      both cooperate
 * @param sucker      own cooperation against a defection
 * @param temptation  own defection against a cooperation
 * @param punishment  both defect
 */
public record StageGame(
    @JsonProperty("reward") int reward,
    @JsonProperty("sucker") int sucker,
    @JsonProperty("temptation") int temptation,
    @JsonProperty("punishment") int punishment
) {
    /** Standard prisoner's dilemma: (3,3), (0,5), (5,0), (1,1). */
    public static final StageGame PRISONERS_DILEMMA = new StageGame(3, 0, 5, 1);

    public StageGame {
        checkArgument(temptation > reward && reward > punishment && punishment > sucker,
            "Payoffs must satisfy T > R > P > S, got T=%s R=%s P=%s S=%s",
            temptation, reward, punishment, sucker);
    }

    /**
     * Payoff to the player choosing {@code own} when the opponent chooses {@code opponent}.
     */
    public int payoff(Action own, Action opponent) {
        checkNotNull(own, "own");
        checkNotNull(opponent, "opponent");
        if (own == Action.COOPERATE) {
            return opponent == Action.COOPERATE ? reward : sucker;
        }
        return opponent == Action.COOPERATE ? temptation : punishment;
    }
}
