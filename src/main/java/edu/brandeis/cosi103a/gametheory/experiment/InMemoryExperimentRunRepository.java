package edu.brandeis.cosi103a.gametheory.experiment;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;
import java.util.function.UnaryOperator;

import static com.google.common.base.Preconditions.checkState;

/**
 * Run store backed by ConcurrentHashMaps. Run numbers come from a per-experiment counter that
 * is advanced inside {@code compute}, so concurrent creators never see the same number.
 */
public class InMemoryExperimentRunRepository implements ExperimentRunRepository {

    private final Map<String, ExperimentRun> runs = new ConcurrentHashMap<>();
    private final Map<String, Integer> runCounts = new ConcurrentHashMap<>();

    @Override
    public ExperimentRun create(String experimentId, IntFunction<ExperimentRun> factory) {
        ExperimentRun[] created = new ExperimentRun[1];
        // the counter only advances when the run is stored, so failed factories leave no gap
        runCounts.compute(experimentId, (key, count) -> {
            int next = (count == null ? 0 : count) + 1;
            ExperimentRun run = factory.apply(next);
            checkState(run.runNumber() == next, "Factory ignored run number %s", next);
            checkState(runs.putIfAbsent(run.id(), run) == null, "Run %s already exists", run.id());
            created[0] = run;
            return next;
        });
        return created[0];
    }

    @Override
    public Optional<ExperimentRun> findById(String id) {
        return Optional.ofNullable(runs.get(id));
    }

    @Override
    public List<ExperimentRun> listByExperiment(String experimentId) {
        return runs.values().stream()
            .filter(run -> run.experimentId().equals(experimentId))
            .sorted(Comparator.comparingInt(ExperimentRun::runNumber))
            .toList();
    }

    @Override
    public Optional<ExperimentRun> update(String id, UnaryOperator<ExperimentRun> change) {
        return Optional.ofNullable(runs.computeIfPresent(id, (key, current) -> change.apply(current)));
    }

    @Override
    public int deleteByExperiment(String experimentId) {
        int[] removed = new int[1];
        runCounts.compute(experimentId, (key, count) -> {
            runs.values().removeIf(run -> {
                boolean match = run.experimentId().equals(experimentId);
                if (match) {
                    removed[0]++;
                }
                return match;
            });
            return null;
        });
        return removed[0];
    }
}
