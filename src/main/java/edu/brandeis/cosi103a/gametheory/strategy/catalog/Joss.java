package edu.brandeis.cosi103a.gametheory.strategy.catalog;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDescription;

import java.util.Random;

/**
 * Tit for tat that sneaks in a defection 10% of the time it would otherwise cooperate.
 */
@StrategyDescription(value = "Tit for tat that defects 10% of the time it would cooperate",
    memoryDepth = 1, stochastic = true, basic = true)
public class Joss implements Strategy {

    static final double SNEAK_PROBABILITY = 0.1;

    private final Random random;

    public Joss() {
        this(new Random());
    }

    public Joss(Random random) {
        this.random = random;
    }

    @Override
    public Action nextAction(ActionHistory history) {
        if (!history.isEmpty() && history.opponentAction(1) == Action.DEFECT) {
            return Action.DEFECT;
        }
        return random.nextDouble() < SNEAK_PROBABILITY ? Action.DEFECT : Action.COOPERATE;
    }
}
