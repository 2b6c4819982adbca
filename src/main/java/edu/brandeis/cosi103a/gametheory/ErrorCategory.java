package edu.brandeis.cosi103a.gametheory;

/**
 * Classification of the failures the evaluation engine and the run orchestrator can report.
 * The category is persisted with failed runs so callers can tell validation problems from
 * unexpected faults without parsing messages.
 */
public enum ErrorCategory {
    INVALID_MATRIX,
    INVALID_TURN_COUNT,
    INVALID_TOURNAMENT,
    STRATEGY_NOT_FOUND,
    RUN_NOT_FOUND,
    EXPERIMENT_NOT_FOUND,
    INVALID_RUN_STATE,
    COMPUTATION_FAILURE
}
