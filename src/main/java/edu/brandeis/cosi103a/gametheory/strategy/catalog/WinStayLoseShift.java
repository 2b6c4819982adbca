package edu.brandeis.cosi103a.gametheory.strategy.catalog;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDescription;
import edu.brandeis.cosi103a.gametheory.strategy.Turn;

/**
 * Also known as Pavlov. Repeats its last move after a good outcome (the opponent cooperated)
 * and switches after a bad one.
 */
@StrategyDescription(value = "Repeats its move after the opponent cooperates, switches after a defection",
    memoryDepth = 1, basic = true)
public class WinStayLoseShift implements Strategy {

    @Override
    public Action nextAction(ActionHistory history) {
        if (history.isEmpty()) {
            return Action.COOPERATE;
        }
        Turn last = history.last();
        return last.opponentAction() == Action.COOPERATE ? last.ownAction() : last.ownAction().opposite();
    }
}
