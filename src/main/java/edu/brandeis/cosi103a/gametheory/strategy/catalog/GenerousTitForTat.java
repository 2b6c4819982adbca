package edu.brandeis.cosi103a.gametheory.strategy.catalog;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDescription;

import java.util.Random;

/**
 * Tit for tat that forgives a defection with a fixed probability. The probability is
 * min(1 - (T - R) / (R - S), (R - P) / (T - P)) for the standard payoffs, i.e. 1/3.
 */
@StrategyDescription(value = "Tit for tat that forgives a defection one time in three",
    memoryDepth = 1, stochastic = true, basic = true)
public class GenerousTitForTat implements Strategy {

    static final double FORGIVENESS = 1.0 / 3.0;

    private final Random random;

    public GenerousTitForTat() {
        this(new Random());
    }

    public GenerousTitForTat(Random random) {
        this.random = random;
    }

    @Override
    public Action nextAction(ActionHistory history) {
        if (history.isEmpty() || history.opponentAction(1) == Action.COOPERATE) {
            return Action.COOPERATE;
        }
        return random.nextDouble() < FORGIVENESS ? Action.COOPERATE : Action.DEFECT;
    }
}
