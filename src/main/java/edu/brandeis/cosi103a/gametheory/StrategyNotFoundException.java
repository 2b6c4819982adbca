package edu.brandeis.cosi103a.gametheory;

/**
 * Thrown when a strategy name (after alias resolution) is not in the registry.
 */
public class StrategyNotFoundException extends GameTheoryException {
    public StrategyNotFoundException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.STRATEGY_NOT_FOUND;
    }
}
