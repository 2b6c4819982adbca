package edu.brandeis.cosi103a.gametheory;

/**
 * Thrown when a requested experiment does not exist.
 */
public class ExperimentNotFoundException extends GameTheoryException {
    public ExperimentNotFoundException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.EXPERIMENT_NOT_FOUND;
    }
}
