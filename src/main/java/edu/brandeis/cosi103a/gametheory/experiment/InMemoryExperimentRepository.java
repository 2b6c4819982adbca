package edu.brandeis.cosi103a.gametheory.experiment;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Experiment store backed by a ConcurrentHashMap. Contents are lost on restart.
 */
public class InMemoryExperimentRepository implements ExperimentRepository {

    private final Map<String, Experiment> experiments = new ConcurrentHashMap<>();

    @Override
    public Experiment create(Experiment experiment) {
        Experiment previous = experiments.putIfAbsent(experiment.id(), experiment);
        checkArgument(previous == null, "Experiment %s already exists", experiment.id());
        return experiment;
    }

    @Override
    public Optional<Experiment> findById(String id) {
        return Optional.ofNullable(experiments.get(id));
    }

    @Override
    public List<Experiment> list(Optional<ExperimentStatus> status, Collection<String> tags) {
        return experiments.values().stream()
            .filter(e -> status.isEmpty() || e.status() == status.get())
            .filter(e -> e.hasAnyTag(tags))
            .sorted(Comparator.comparing(Experiment::createdAt).reversed()
                .thenComparing(Experiment::id))
            .toList();
    }

    @Override
    public Optional<Experiment> update(String id, UnaryOperator<Experiment> change) {
        return Optional.ofNullable(experiments.computeIfPresent(id, (key, current) -> change.apply(current)));
    }

    @Override
    public boolean delete(String id) {
        return experiments.remove(id) != null;
    }
}
