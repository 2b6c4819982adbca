package edu.brandeis.cosi103a.gametheory.experiment;

import edu.brandeis.cosi103a.gametheory.ExperimentNotFoundException;
import edu.brandeis.cosi103a.gametheory.RunNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Experiment and run bookkeeping. Execution lives in {@link RunOrchestrator}.
 */
@Service
public class ExperimentService {

    private static final Logger log = LoggerFactory.getLogger(ExperimentService.class);

    private final ExperimentRepository experiments;
    private final ExperimentRunRepository runs;

    public ExperimentService(ExperimentRepository experiments, ExperimentRunRepository runs) {
        this.experiments = experiments;
        this.runs = runs;
    }

    /**
     * Creates an experiment in DRAFT status.
     *
     * @throws edu.brandeis.cosi103a.gametheory.GameTheoryException if the config is invalid
     */
    public Experiment createExperiment(String name, String hypothesis, String description,
                                       ExperimentConfig config, List<String> tags) {
        checkArgument(name != null && !name.isBlank(), "Experiment name must not be blank");
        checkNotNull(config, "config").validate();
        Instant now = Instant.now();
        Experiment experiment = experiments.create(new Experiment(
            UUID.randomUUID().toString(), name, hypothesis, description, config,
            tags == null ? List.of() : tags, ExperimentStatus.DRAFT, now, now));
        log.info("Created experiment {} ({})", experiment.id(), name);
        return experiment;
    }

    public Experiment getExperiment(String id) {
        return experiments.findById(id)
            .orElseThrow(() -> new ExperimentNotFoundException("Experiment not found: " + id));
    }

    public List<Experiment> listExperiments(Optional<ExperimentStatus> status, Collection<String> tags) {
        return experiments.list(status, tags == null ? List.of() : tags);
    }

    /**
     * Applies a partial update. Runs that already exist keep their config snapshot.
     */
    public Experiment updateExperiment(String id, ExperimentUpdate update) {
        checkNotNull(update, "update");
        update.config().ifPresent(ExperimentConfig::validate);
        Experiment updated = experiments.update(id, current -> update.applyTo(current, Instant.now()))
            .orElseThrow(() -> new ExperimentNotFoundException("Experiment not found: " + id));
        log.debug("Updated experiment {}", id);
        return updated;
    }

    /**
     * Deletes an experiment together with its runs.
     */
    public void deleteExperiment(String id) {
        if (!experiments.delete(id)) {
            throw new ExperimentNotFoundException("Experiment not found: " + id);
        }
        int removed = runs.deleteByExperiment(id);
        log.info("Deleted experiment {} and {} runs", id, removed);
    }

    /**
     * Creates a PENDING run holding a copy of the experiment's current config. If the experiment
     * is deleted concurrently, the run is removed again and ExperimentNotFoundException is thrown.
     */
    public ExperimentRun createRun(String experimentId) {
        Experiment experiment = getExperiment(experimentId);
        ExperimentConfig snapshot = copyOf(experiment.config());
        ExperimentRun run = runs.create(experimentId, runNumber -> ExperimentRun.pending(
            UUID.randomUUID().toString(), experimentId, runNumber, snapshot, Instant.now()));
        if (experiments.findById(experimentId).isEmpty()) {
            // deleted while the run was being created; deleteExperiment may already have swept
            int removed = runs.deleteByExperiment(experimentId);
            log.debug("Experiment {} was deleted during run creation, removed {} runs", experimentId, removed);
            throw new ExperimentNotFoundException("Experiment not found: " + experimentId);
        }
        log.debug("Created run {} #{} for experiment {}", run.id(), run.runNumber(), experimentId);
        return run;
    }

    public List<ExperimentRun> createRuns(String experimentId, int count) {
        checkArgument(count >= 1, "count must be at least 1, got %s", count);
        getExperiment(experimentId);
        List<ExperimentRun> created = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            created.add(createRun(experimentId));
        }
        return created;
    }

    public ExperimentRun getRun(String runId) {
        return runs.findById(runId)
            .orElseThrow(() -> new RunNotFoundException("Run not found: " + runId));
    }

    /**
     * Runs of an experiment ordered by run number.
     */
    public List<ExperimentRun> listRuns(String experimentId) {
        getExperiment(experimentId);
        return runs.listByExperiment(experimentId);
    }

    private static ExperimentConfig copyOf(ExperimentConfig config) {
        return new ExperimentConfig(List.copyOf(config.strategies()), config.turns(),
            config.repetitions(), config.targetRuns());
    }
}
