package edu.brandeis.cosi103a.gametheory.runner;

import edu.brandeis.cosi103a.gametheory.InvalidTurnCountException;
import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.catalog.Cooperator;
import edu.brandeis.cosi103a.gametheory.strategy.catalog.Defector;
import edu.brandeis.cosi103a.gametheory.strategy.catalog.SuspiciousTitForTat;
import edu.brandeis.cosi103a.gametheory.strategy.catalog.TitForTat;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static edu.brandeis.cosi103a.gametheory.strategy.Action.COOPERATE;
import static edu.brandeis.cosi103a.gametheory.strategy.Action.DEFECT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MatchSimulatorTest {

    private final MatchSimulator simulator = new MatchSimulator();

    @Test
    void stageGame_standardPayoffs() {
        StageGame pd = StageGame.PRISONERS_DILEMMA;

        assertEquals(3, pd.payoff(COOPERATE, COOPERATE));
        assertEquals(0, pd.payoff(COOPERATE, DEFECT));
        assertEquals(5, pd.payoff(DEFECT, COOPERATE));
        assertEquals(1, pd.payoff(DEFECT, DEFECT));
        assertThrows(IllegalArgumentException.class, () -> new StageGame(3, 0, 2, 1));
    }

    @Test
    void strategyCannotRewriteItsOwnHistory() {
        Strategy tamperer = new Strategy() {
            @Override
            public String name() {
                return "Tamperer";
            }

            @Override
            public Action nextAction(ActionHistory history) {
                history.append(COOPERATE, COOPERATE);
                return COOPERATE;
            }
        };

        assertThrows(UnsupportedOperationException.class, () -> simulator.playMatch(tamperer, new Defector(), 5));
    }

    @Test
    void cooperatorVsDefector() {
        MatchResult result = simulator.playMatch(new Cooperator(), new Defector(), 10);

        assertEquals(0, result.scoreA());
        assertEquals(50, result.scoreB());
        assertEquals(1.0, result.cooperationRateA());
        assertEquals(0.0, result.cooperationRateB());
        assertEquals(10, result.turns());
        assertEquals("Cooperator", result.strategyA());
        assertEquals("Defector", result.strategyB());
    }

    @Test
    void titForTatVsDefector_losesOnlyTheFirstRound() {
        MatchResult result = simulator.playMatch(new TitForTat(), new Defector(), 10);

        assertEquals(9, result.scoreA());
        assertEquals(14, result.scoreB());
        assertEquals(0.1, result.cooperationRateA(), 1e-12);
    }

    @Test
    void suspiciousVsTitForTat_echoesForever() {
        MatchResult result = simulator.playMatch(new SuspiciousTitForTat(), new TitForTat(), 4);

        assertEquals(List.of(DEFECT, COOPERATE, DEFECT, COOPERATE), result.actionsA());
        assertEquals(List.of(COOPERATE, DEFECT, COOPERATE, DEFECT), result.actionsB());
        assertEquals(10, result.scoreA());
        assertEquals(10, result.scoreB());
    }

    @Test
    void strategiesOnlySeeCompletedRounds() {
        List<Integer> seenSizes = new ArrayList<>();
        Strategy recorder = new Strategy() {
            @Override
            public Action nextAction(ActionHistory history) {
                seenSizes.add(history.size());
                return COOPERATE;
            }
        };

        simulator.playMatch(recorder, new Defector(), 3);

        assertEquals(List.of(0, 1, 2), seenSizes);
    }

    @Test
    void playMatch_rejectsNonPositiveTurns() {
        assertThrows(InvalidTurnCountException.class,
            () -> simulator.playMatch(new Cooperator(), new Defector(), 0));
        assertThrows(InvalidTurnCountException.class,
            () -> simulator.playMatch(new Cooperator(), new Defector(), -5));
    }
}
