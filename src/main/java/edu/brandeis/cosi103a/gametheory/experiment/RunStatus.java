package edu.brandeis.cosi103a.gametheory.experiment;

/**
 * Lifecycle of a run: PENDING, then RUNNING, then exactly one of the terminal states.
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
