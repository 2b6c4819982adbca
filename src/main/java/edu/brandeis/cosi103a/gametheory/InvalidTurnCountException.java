package edu.brandeis.cosi103a.gametheory;

/**
 * Thrown when a match or analysis is requested with fewer than one turn.
 */
public class InvalidTurnCountException extends GameTheoryException {
    public InvalidTurnCountException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.INVALID_TURN_COUNT;
    }
}
