package edu.brandeis.cosi103a.gametheory.strategy.catalog;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDescription;

import java.util.Random;

/**
 * Cooperates or defects uniformly at random. Used as a baseline opponent.
 */
@StrategyDescription(value = "Cooperates with probability 1/2", memoryDepth = 0, stochastic = true, basic = true)
public class RandomStrategy implements Strategy {

    private final Random random;

    public RandomStrategy() {
        this(new Random());
    }

    public RandomStrategy(Random random) {
        this.random = random;
    }

    @Override
    public String name() {
        return "Random";
    }

    @Override
    public Action nextAction(ActionHistory history) {
        return random.nextBoolean() ? Action.COOPERATE : Action.DEFECT;
    }
}
