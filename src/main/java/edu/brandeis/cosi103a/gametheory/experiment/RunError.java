package edu.brandeis.cosi103a.gametheory.experiment;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.gametheory.ErrorCategory;
import edu.brandeis.cosi103a.gametheory.GameTheoryException;

import java.time.Instant;

/**
 * Failure recorded on a run whose worker threw.
 *
 * @param type simple class name of the exception
 */
public record RunError(
    @JsonProperty("message") String message,
    @JsonProperty("category") ErrorCategory category,
    @JsonProperty("type") String type,
    @JsonProperty("timestamp") Instant timestamp
) {
    /**
     * Domain exceptions keep their category; anything else is a computation failure.
     */
    public static RunError from(Throwable error, Instant timestamp) {
        ErrorCategory category = error instanceof GameTheoryException gte
            ? gte.category()
            : ErrorCategory.COMPUTATION_FAILURE;
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new RunError(message, category, error.getClass().getSimpleName(), timestamp);
    }
}
