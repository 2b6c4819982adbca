package edu.brandeis.cosi103a.gametheory.experiment;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.gametheory.ErrorCategory;
import edu.brandeis.cosi103a.gametheory.config.ObjectMapperFactory;
import edu.brandeis.cosi103a.gametheory.runner.MatchSimulator;
import edu.brandeis.cosi103a.gametheory.runner.TournamentResult;
import edu.brandeis.cosi103a.gametheory.runner.TournamentRunner;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExperimentRunSerializationTest {

    private static final ExperimentConfig CONFIG = new ExperimentConfig(List.of("TitForTat", "Defector"), 10, 2, 1);
    private static final Instant CREATED = Instant.parse("2026-03-01T10:15:30.123Z");

    private final ObjectMapper mapper = ObjectMapperFactory.create();

    private ExperimentRun roundTrip(ExperimentRun run) throws Exception {
        return mapper.readValue(mapper.writeValueAsString(run), ExperimentRun.class);
    }

    @Test
    void pendingRun_roundTrip() throws Exception {
        ExperimentRun run = ExperimentRun.pending("run-1", "exp-1", 1, CONFIG, CREATED);

        ExperimentRun restored = roundTrip(run);

        assertEquals(run, restored);
        assertTrue(restored.results().isEmpty());
        assertTrue(restored.startedAt().isEmpty());
    }

    @Test
    void completedRun_roundTrip() throws Exception {
        TournamentResult result = new TournamentRunner(StrategyRegistry.builtIn(), new MatchSimulator(), 20)
            .runTournament(CONFIG.strategies(), CONFIG.turns(), CONFIG.repetitions());
        ExperimentRun run = ExperimentRun.pending("run-2", "exp-1", 2, CONFIG, CREATED)
            .markRunning(CREATED.plusSeconds(1))
            .markCompleted(result, CREATED.plusSeconds(3));

        assertEquals(run, roundTrip(run));
    }

    @Test
    void failedRun_roundTrip() throws Exception {
        Instant failedAt = CREATED.plusMillis(2500);
        ExperimentRun run = ExperimentRun.pending("run-3", "exp-1", 3, CONFIG, CREATED)
            .markRunning(CREATED.plusSeconds(1))
            .markFailed(new RunError("boom", ErrorCategory.COMPUTATION_FAILURE, "IllegalStateException", failedAt),
                failedAt);

        ExperimentRun restored = roundTrip(run);

        assertEquals(run, restored);
        assertEquals(ErrorCategory.COMPUTATION_FAILURE, restored.error().get().category());
    }

    @Test
    void experiment_roundTrip() throws Exception {
        Experiment experiment = new Experiment("exp-1", "name", "hypothesis", "description", CONFIG,
            List.of("pd"), ExperimentStatus.COMPLETED, CREATED, CREATED.plusSeconds(60));

        assertEquals(experiment, mapper.readValue(mapper.writeValueAsString(experiment), Experiment.class));
    }

    @Test
    void completion_neverPrecedesStart() {
        ExperimentRun running = ExperimentRun.pending("run-4", "exp-1", 4, CONFIG, CREATED)
            .markRunning(CREATED.plusSeconds(10));

        ExperimentRun failed = running.markFailed(
            new RunError("clock skew", ErrorCategory.COMPUTATION_FAILURE, "X", CREATED), CREATED.plusSeconds(5));

        assertEquals(CREATED.plusSeconds(10), failed.completedAt().get());
    }
}
