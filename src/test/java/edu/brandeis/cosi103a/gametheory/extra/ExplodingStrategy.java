package edu.brandeis.cosi103a.gametheory.extra;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;

/**
 * Discoverable strategy whose constructor always fails.
 */
public class ExplodingStrategy implements Strategy {

    public ExplodingStrategy() {
        throw new IllegalStateException("missing configuration");
    }

    @Override
    public Action nextAction(ActionHistory history) {
        return Action.DEFECT;
    }
}
