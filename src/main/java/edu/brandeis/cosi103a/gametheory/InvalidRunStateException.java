package edu.brandeis.cosi103a.gametheory;

/**
 * Thrown when a run is asked to make a lifecycle transition its current status does not allow.
 */
public class InvalidRunStateException extends GameTheoryException {
    public InvalidRunStateException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.INVALID_RUN_STATE;
    }
}
