package edu.brandeis.cosi103a.gametheory.experiment;

import edu.brandeis.cosi103a.gametheory.InvalidRunStateException;
import edu.brandeis.cosi103a.gametheory.RunNotFoundException;
import edu.brandeis.cosi103a.gametheory.runner.TournamentResult;
import edu.brandeis.cosi103a.gametheory.runner.TournamentRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;

/**
 * Moves runs through PENDING, RUNNING and a terminal state.
 *
 * <p>{@link #executeRun} marks the run RUNNING before handing it to the dispatcher, so a crash
 * mid-execution leaves it visibly RUNNING rather than PENDING. The worker records COMPLETED or
 * FAILED exactly once. Worker errors are stored on the run and never thrown to the caller.
 */
@Service
public class RunOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RunOrchestrator.class);

    private final ExperimentService experimentService;
    private final ExperimentRunRepository runs;
    private final TournamentRunner tournamentRunner;
    private final RunDispatcher dispatcher;

    public RunOrchestrator(ExperimentService experimentService, ExperimentRunRepository runs,
                           TournamentRunner tournamentRunner, RunDispatcher dispatcher) {
        this.experimentService = experimentService;
        this.runs = runs;
        this.tournamentRunner = tournamentRunner;
        this.dispatcher = dispatcher;
    }

    /**
     * Marks a PENDING run RUNNING and dispatches it.
     *
     * @return the run as it was when dispatched
     * @throws RunNotFoundException if there is no such run
     * @throws InvalidRunStateException if the run is not PENDING
     */
    public ExperimentRun executeRun(String runId) {
        ExperimentRun started = runs.update(runId, current -> {
            if (current.status() != RunStatus.PENDING) {
                throw new InvalidRunStateException(
                    "Run " + runId + " is " + current.status() + ", only PENDING runs can be executed");
            }
            return current.markRunning(Instant.now());
        }).orElseThrow(() -> new RunNotFoundException("Run not found: " + runId));

        try {
            dispatcher.dispatch(() -> executeWorker(started));
            log.info("Dispatched run {} #{} of experiment {}",
                started.id(), started.runNumber(), started.experimentId());
        } catch (RejectedExecutionException e) {
            log.error("Could not dispatch run {}: {}", runId, e.getMessage());
            return recordFailure(runId, e)
                .orElseThrow(() -> new RunNotFoundException("Run not found: " + runId));
        }
        return started;
    }

    /**
     * Dispatches every PENDING run of an experiment. Runs claimed by another caller in the
     * meantime are skipped.
     *
     * @return the runs that were dispatched, in run number order
     */
    public List<ExperimentRun> executePendingRuns(String experimentId) {
        List<ExperimentRun> dispatched = new ArrayList<>();
        for (ExperimentRun run : experimentService.listRuns(experimentId)) {
            if (run.status() != RunStatus.PENDING) {
                continue;
            }
            try {
                dispatched.add(executeRun(run.id()));
            } catch (InvalidRunStateException e) {
                log.debug("Skipping run {}: {}", run.id(), e.getMessage());
            }
        }
        log.info("Dispatched {} pending runs of experiment {}", dispatched.size(), experimentId);
        return dispatched;
    }

    /**
     * Worker body: runs the snapshot's tournament and stores the outcome. Errors thrown by
     * strategies, such as a StackOverflowError, fail the run like any exception.
     */
    void executeWorker(ExperimentRun run) {
        ExperimentConfig config = run.config();
        log.info("Run {} started: {} strategies, {} turns, {} repetitions",
            run.id(), config.strategies().size(), config.turns(), config.repetitions());
        try {
            TournamentResult result = tournamentRunner.runTournament(
                config.strategies(), config.turns(), config.repetitions());
            runs.update(run.id(), current -> current.markCompleted(result, Instant.now()));
            log.info("Run {} completed, winner {}", run.id(), result.winner());
        } catch (Exception | Error e) {
            log.error("Run {} failed: {}", run.id(), e.getMessage(), e);
            if (recordFailure(run.id(), e).isEmpty()) {
                log.warn("Run {} was deleted before its failure could be recorded", run.id());
            }
            // a stack overflow has unwound by now; other VM errors still reach the pool thread
            if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
                throw (Error) e;
            }
        }
    }

    private Optional<ExperimentRun> recordFailure(String runId, Throwable cause) {
        Instant now = Instant.now();
        return runs.update(runId, current -> current.markFailed(RunError.from(cause, now), now));
    }
}
