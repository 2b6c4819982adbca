package edu.brandeis.cosi103a.gametheory.strategy.catalog;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDescription;

/**
 * Cooperates first, then cooperates whenever the opponent has cooperated at least as often
 * as it has defected.
 */
@StrategyDescription(value = "Cooperates unless the opponent has defected more often than it cooperated", basic = true)
public class SoftMajority implements Strategy {

    @Override
    public Action nextAction(ActionHistory history) {
        int defections = history.opponentCount(Action.DEFECT);
        int cooperations = history.opponentCount(Action.COOPERATE);
        return cooperations >= defections ? Action.COOPERATE : Action.DEFECT;
    }
}
