package edu.brandeis.cosi103a.gametheory.experiment;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.gametheory.runner.TournamentResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkState;

/**
 * One execution of an experiment's tournament.
 *
 * @param runNumber 1-based, assigned in creation order within the experiment
 * @param config    snapshot of the experiment config taken when the run was created
 */
public record ExperimentRun(
    @JsonProperty("id") String id,
    @JsonProperty("experimentId") String experimentId,
    @JsonProperty("runNumber") int runNumber,
    @JsonProperty("status") RunStatus status,
    @JsonProperty("config") ExperimentConfig config,
    @JsonProperty("results") Optional<TournamentResult> results,
    @JsonProperty("error") Optional<RunError> error,
    @JsonProperty("startedAt") Optional<Instant> startedAt,
    @JsonProperty("completedAt") Optional<Instant> completedAt,
    @JsonProperty("createdAt") Instant createdAt
) {
    public ExperimentRun {
        results = results == null ? Optional.empty() : results;
        error = error == null ? Optional.empty() : error;
        startedAt = startedAt == null ? Optional.empty() : startedAt;
        completedAt = completedAt == null ? Optional.empty() : completedAt;
    }

    /**
     * Creates a PENDING run.
     */
    public static ExperimentRun pending(String id, String experimentId, int runNumber,
                                        ExperimentConfig config, Instant createdAt) {
        return new ExperimentRun(id, experimentId, runNumber, RunStatus.PENDING, config,
            Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), createdAt);
    }

    public ExperimentRun markRunning(Instant now) {
        checkState(status == RunStatus.PENDING, "Run %s is %s, not PENDING", id, status);
        return new ExperimentRun(id, experimentId, runNumber, RunStatus.RUNNING, config,
            results, error, Optional.of(now), completedAt, createdAt);
    }

    public ExperimentRun markCompleted(TournamentResult result, Instant now) {
        checkState(status == RunStatus.RUNNING, "Run %s is %s, not RUNNING", id, status);
        return new ExperimentRun(id, experimentId, runNumber, RunStatus.COMPLETED, config,
            Optional.of(result), Optional.empty(), startedAt, Optional.of(notBeforeStart(now)), createdAt);
    }

    public ExperimentRun markFailed(RunError runError, Instant now) {
        checkState(status == RunStatus.RUNNING, "Run %s is %s, not RUNNING", id, status);
        return new ExperimentRun(id, experimentId, runNumber, RunStatus.FAILED, config,
            Optional.empty(), Optional.of(runError), startedAt, Optional.of(notBeforeStart(now)), createdAt);
    }

    /**
     * Wall time between start and completion, once both are known.
     */
    public Optional<Duration> duration() {
        if (startedAt.isEmpty() || completedAt.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startedAt.get(), completedAt.get()));
    }

    private Instant notBeforeStart(Instant now) {
        // the wall clock can step backwards between start and finish
        return startedAt.filter(start -> start.isAfter(now)).orElse(now);
    }
}
