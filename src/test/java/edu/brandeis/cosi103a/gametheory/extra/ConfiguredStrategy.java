package edu.brandeis.cosi103a.gametheory.extra;

import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;

/**
 * Has no no-arg constructor, so discovery must skip it.
 */
public class ConfiguredStrategy implements Strategy {

    private final Action move;

    public ConfiguredStrategy(Action move) {
        this.move = move;
    }

    @Override
    public Action nextAction(ActionHistory history) {
        return move;
    }
}
