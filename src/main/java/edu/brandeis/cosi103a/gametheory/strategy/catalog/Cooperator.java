package edu.brandeis.cosi103a.gametheory.strategy.catalog;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDescription;

/**
 * Always cooperates.
 */
@StrategyDescription(value = "Always cooperates", memoryDepth = 0, basic = true)
public class Cooperator implements Strategy {

    @Override
    public Action nextAction(ActionHistory history) {
        return Action.COOPERATE;
    }
}
