package edu.brandeis.cosi103a.gametheory.strategy.catalog;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDescription;

/**
 * Cooperates on the first move, then repeats whatever the opponent did last.
 */
@StrategyDescription(value = "Cooperates first, then copies the opponent's last move", memoryDepth = 1, basic = true)
public class TitForTat implements Strategy {

    @Override
    public Action nextAction(ActionHistory history) {
        if (history.isEmpty()) {
            return Action.COOPERATE;
        }
        return history.opponentAction(1);
    }
}
