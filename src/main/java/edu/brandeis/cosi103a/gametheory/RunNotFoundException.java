package edu.brandeis.cosi103a.gametheory;

/**
 * Thrown when a requested experiment run does not exist.
 */
public class RunNotFoundException extends GameTheoryException {
    public RunNotFoundException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.RUN_NOT_FOUND;
    }
}
