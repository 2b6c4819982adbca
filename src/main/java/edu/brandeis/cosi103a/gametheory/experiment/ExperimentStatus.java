package edu.brandeis.cosi103a.gametheory.experiment;

/**
 * Lifecycle of an experiment. Transitions are made by callers; run outcomes never change it.
 */
public enum ExperimentStatus {
    DRAFT,
    RUNNING,
    COMPLETED,
    FAILED
}
