package edu.brandeis.cosi103a.gametheory.runner;

import edu.brandeis.cosi103a.gametheory.ComputationFailureException;
import edu.brandeis.cosi103a.gametheory.InvalidTournamentException;
import edu.brandeis.cosi103a.gametheory.InvalidTurnCountException;
import edu.brandeis.cosi103a.gametheory.StrategyNotFoundException;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verifyNoInteractions;

class TournamentRunnerTest {

    private final StrategyRegistry registry = StrategyRegistry.builtIn();
    private final TournamentRunner runner = new TournamentRunner(registry, new MatchSimulator(), 20);

    @Test
    void cooperatorVsDefector() {
        TournamentResult result = runner.runTournament(List.of("Cooperator", "Defector"), 10, 1);

        assertEquals(2, result.totalMatches());
        assertEquals("Defector", result.winner());
        Ranking first = result.rankings().get(0);
        Ranking second = result.rankings().get(1);
        assertEquals("Defector", first.strategy());
        assertEquals(1, first.rank());
        assertTrue(first.score() > second.score());
        assertEquals(50.0, first.score());
        assertEquals(0.0, second.score());
        assertEquals(1.0, result.cooperationRates().get("Cooperator"));
        assertEquals(0.0, result.cooperationRates().get("Defector"));
    }

    @Test
    void matchCount_coversBothOrderingsOfEveryPair() {
        TournamentResult result = runner.runTournament(List.of("TitForTat", "Grudger", "Defector"), 5, 2);

        assertEquals(3 * 2 * 2, result.totalMatches());
        assertEquals(3, result.rankings().size());
        assertEquals(5, result.turns());
        assertEquals(2, result.repetitions());
    }

    @Test
    void ties_keepEntryOrder() {
        TournamentResult forward = runner.runTournament(List.of("Cooperator", "TitForTat"), 10, 1);
        TournamentResult backward = runner.runTournament(List.of("TitForTat", "Cooperator"), 10, 1);

        assertEquals("Cooperator", forward.winner());
        assertEquals("TitForTat", backward.winner());
        assertEquals(30.0, forward.rankings().get(1).score());
    }

    @Test
    void aliasesAreReportedByCanonicalName() {
        TournamentResult result = runner.runTournament(List.of("pavlov", "TFT"), 5, 1);

        assertTrue(result.cooperationRates().containsKey("WinStayLoseShift"));
        assertTrue(result.cooperationRates().containsKey("TitForTat"));
    }

    @Test
    void unknownStrategy_failsBeforeAnyMatch() {
        MatchSimulator simulator = spy(new MatchSimulator());
        TournamentRunner spied = new TournamentRunner(registry, simulator, 20);

        assertThrows(StrategyNotFoundException.class,
            () -> spied.runTournament(List.of("Cooperator", "Defector", "Nope"), 10, 1));
        verifyNoInteractions(simulator);
    }

    @Test
    void invalidArguments() {
        assertThrows(InvalidTournamentException.class,
            () -> runner.runTournament(List.of("Cooperator"), 10, 1));
        assertThrows(InvalidTournamentException.class,
            () -> runner.runTournament(List.of("TFT", "TitForTat"), 10, 1));
        assertThrows(InvalidTournamentException.class,
            () -> runner.runTournament(List.of("Cooperator", "Defector"), 10, 0));
        assertThrows(InvalidTurnCountException.class,
            () -> runner.runTournament(List.of("Cooperator", "Defector"), 0, 1));

        TournamentRunner small = new TournamentRunner(registry, new MatchSimulator(), 2);
        assertThrows(InvalidTournamentException.class,
            () -> small.runTournament(List.of("Cooperator", "Defector", "Grudger"), 10, 1));
    }

    @Test
    void strategyFailure_isWrapped() {
        StrategyRegistry broken = StrategyRegistry.builtIn();
        broken.register("Broken", null, () -> history -> {
            throw new IllegalStateException("boom");
        });
        TournamentRunner brokenRunner = new TournamentRunner(broken, new MatchSimulator(), 20);

        ComputationFailureException e = assertThrows(ComputationFailureException.class,
            () -> brokenRunner.runTournament(List.of("Cooperator", "Broken"), 5, 1));
        assertTrue(e.getMessage().contains("boom"));
    }
}
