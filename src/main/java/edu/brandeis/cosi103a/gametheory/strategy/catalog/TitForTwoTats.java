package edu.brandeis.cosi103a.gametheory.strategy.catalog;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDescription;

@StrategyDescription(value = "Defects only after two consecutive opponent defections", memoryDepth = 2, basic = true)
public class TitForTwoTats implements Strategy {

    @Override
    public Action nextAction(ActionHistory history) {
        if (history.size() < 2) {
            return Action.COOPERATE;
        }
        boolean twoDefections = history.opponentAction(1) == Action.DEFECT
            && history.opponentAction(2) == Action.DEFECT;
        return twoDefections ? Action.DEFECT : Action.COOPERATE;
    }
}
