package edu.brandeis.cosi103a.gametheory.extra;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDescription;

/**
 * Strategy picked up from an extra scan package in discovery tests.
 */
@StrategyDescription(value = "Defects only when the opponent defected in both of the last two rounds",
    memoryDepth = 2)
public class Forgiver implements Strategy {

    @Override
    public Action nextAction(ActionHistory history) {
        if (history.size() >= 2
                && history.opponentAction(1) == Action.DEFECT
                && history.opponentAction(2) == Action.DEFECT) {
            return Action.DEFECT;
        }
        return Action.COOPERATE;
    }
}
