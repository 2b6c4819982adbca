package edu.brandeis.cosi103a.gametheory.strategy.catalog;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDescription;

/**
 * Tit for tat that opens with a defection.
 */
@StrategyDescription(value = "Defects first, then copies the opponent's last move", memoryDepth = 1, basic = true)
public class SuspiciousTitForTat implements Strategy {

    @Override
    public Action nextAction(ActionHistory history) {
        if (history.isEmpty()) {
            return Action.DEFECT;
        }
        return history.opponentAction(1);
    }
}
