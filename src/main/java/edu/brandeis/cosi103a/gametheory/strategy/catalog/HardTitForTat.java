package edu.brandeis.cosi103a.gametheory.strategy.catalog;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDescription;

@StrategyDescription(value = "Defects if the opponent defected in any of the last three rounds", memoryDepth = 3)
public class HardTitForTat implements Strategy {

    private static final int WINDOW = 3;

    @Override
    public Action nextAction(ActionHistory history) {
        int lookBack = Math.min(WINDOW, history.size());
        for (int i = 1; i <= lookBack; i++) {
            if (history.opponentAction(i) == Action.DEFECT) {
                return Action.DEFECT;
            }
        }
        return Action.COOPERATE;
    }
}
