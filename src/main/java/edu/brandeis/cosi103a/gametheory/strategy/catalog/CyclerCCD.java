package edu.brandeis.cosi103a.gametheory.strategy.catalog;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDescription;

@StrategyDescription(value = "Plays the fixed cycle C, C, D regardless of the opponent", memoryDepth = 2)
public class CyclerCCD implements Strategy {

    @Override
    public Action nextAction(ActionHistory history) {
        return history.size() % 3 == 2 ? Action.DEFECT : Action.COOPERATE;
    }
}
