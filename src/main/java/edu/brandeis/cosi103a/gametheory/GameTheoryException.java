package edu.brandeis.cosi103a.gametheory;

/**
 * Base class for every domain error raised by this project.
 */
public abstract class GameTheoryException extends RuntimeException {

    protected GameTheoryException(String message) {
        super(message);
    }

    protected GameTheoryException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the category recorded when this error ends a run.
     */
    public abstract ErrorCategory category();
}
