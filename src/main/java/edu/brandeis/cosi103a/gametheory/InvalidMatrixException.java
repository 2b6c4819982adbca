package edu.brandeis.cosi103a.gametheory;

/**
 * Thrown when a payoff matrix is empty, ragged, or has a shape the requested computation does not support.
 */
public class InvalidMatrixException extends GameTheoryException {
    public InvalidMatrixException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.INVALID_MATRIX;
    }
}
