package edu.brandeis.cosi103a.gametheory;

/**
 * Thrown when a tournament line-up or repetition count is rejected before any match is played.
 */
public class InvalidTournamentException extends GameTheoryException {
    public InvalidTournamentException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.INVALID_TOURNAMENT;
    }
}
