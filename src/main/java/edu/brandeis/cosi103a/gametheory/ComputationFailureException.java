package edu.brandeis.cosi103a.gametheory;

/**
 * Wraps an unexpected internal fault raised while simulating or aggregating results.
 */
public class ComputationFailureException extends GameTheoryException {
    public ComputationFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.COMPUTATION_FAILURE;
    }
}
