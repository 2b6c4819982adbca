package edu.brandeis.cosi103a.gametheory.strategy.catalog;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDescription;

@StrategyDescription(value = "Alternates cooperation and defection, starting with cooperation",
    memoryDepth = 1, basic = true)
public class Alternator implements Strategy {

    @Override
    public Action nextAction(ActionHistory history) {
        if (history.isEmpty()) {
            return Action.COOPERATE;
        }
        return history.last().ownAction().opposite();
    }
}
