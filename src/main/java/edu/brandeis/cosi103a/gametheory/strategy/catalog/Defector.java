package edu.brandeis.cosi103a.gametheory.strategy.catalog;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDescription;

/**
 * Always defects.
 */
@StrategyDescription(value = "Always defects", memoryDepth = 0, basic = true)
public class Defector implements Strategy {

    @Override
    public Action nextAction(ActionHistory history) {
        return Action.DEFECT;
    }
}
