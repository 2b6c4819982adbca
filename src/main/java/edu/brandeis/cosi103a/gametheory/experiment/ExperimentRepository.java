package edu.brandeis.cosi103a.gametheory.experiment;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persistence contract for experiments. Every operation is atomic per experiment.
 */
public interface ExperimentRepository {

    Experiment create(Experiment experiment);

    Optional<Experiment> findById(String id);

    /**
     * Lists experiments newest first.
     *
     * @param status only experiments in this status, or all when empty
     * @param tags   only experiments carrying at least one of these tags, or all when empty
     */
    List<Experiment> list(Optional<ExperimentStatus> status, Collection<String> tags);

    /**
     * Atomically replaces an experiment with {@code change} applied to its current value.
     *
     * @return the new value, or empty if no experiment has this id
     */
    Optional<Experiment> update(String id, UnaryOperator<Experiment> change);

    boolean delete(String id);
}
