package edu.brandeis.cosi103a.gametheory.strategy.catalog;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDescription;

/**
 * Defects first, then defects whenever the opponent has defected at least as often as it
 * has cooperated.
 */
@StrategyDescription(value = "Defects unless the opponent has cooperated more often than it defected", basic = true)
public class HardMajority implements Strategy {

    @Override
    public Action nextAction(ActionHistory history) {
        int defections = history.opponentCount(Action.DEFECT);
        int cooperations = history.opponentCount(Action.COOPERATE);
        return defections >= cooperations ? Action.DEFECT : Action.COOPERATE;
    }
}
