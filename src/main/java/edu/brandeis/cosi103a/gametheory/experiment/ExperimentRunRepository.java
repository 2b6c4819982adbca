package edu.brandeis.cosi103a.gametheory.experiment;

import java.util.List;
import java.util.Optional;
import java.util.function.IntFunction;
import java.util.function.UnaryOperator;

/**
 * Persistence contract for runs. Every operation is atomic per run.
 */
public interface ExperimentRunRepository {

    /**
     * Stores a new run for {@code experimentId}. The repository picks the next run number
     * (1, 2, 3, ... with no gaps, even under concurrent calls) and passes it to {@code factory}.
     */
    ExperimentRun create(String experimentId, IntFunction<ExperimentRun> factory);

    Optional<ExperimentRun> findById(String id);

    /**
     * Runs of one experiment ordered by run number.
     */
    List<ExperimentRun> listByExperiment(String experimentId);

    /**
     * Atomically replaces a run with {@code change} applied to its current value. If
     * {@code change} throws, the stored run is left unchanged and the exception propagates.
     *
     * @return the new value, or empty if no run has this id
     */
    Optional<ExperimentRun> update(String id, UnaryOperator<ExperimentRun> change);

    /**
     * Removes every run of an experiment.
     *
     * @return number of runs removed
     */
    int deleteByExperiment(String experimentId);
}
