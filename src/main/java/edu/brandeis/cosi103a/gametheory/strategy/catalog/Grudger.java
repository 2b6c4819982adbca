package edu.brandeis.cosi103a.gametheory.strategy.catalog;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDescription;

/**
 * Cooperates until the opponent defects once, then defects for the rest of the match.
 * The grudge is held in the instance, which is why matches never share instances.
 */
@StrategyDescription(value = "Cooperates until the opponent defects, then defects forever", basic = true)
public class Grudger implements Strategy {

    private boolean grudge;

    @Override
    public Action nextAction(ActionHistory history) {
        if (!grudge && history.opponentCount(Action.DEFECT) > 0) {
            grudge = true;
        }
        return grudge ? Action.DEFECT : Action.COOPERATE;
    }
}
