package edu.brandeis.cosi103a.gametheory.runner;

import edu.brandeis.cosi103a.gametheory.equilibrium.EquilibriumCalculator;
import edu.brandeis.cosi103a.gametheory.equilibrium.EquilibriumResult;
import edu.brandeis.cosi103a.gametheory.equilibrium.GamePlayer;
import edu.brandeis.cosi103a.gametheory.equilibrium.PayoffMatrix;
import edu.brandeis.cosi103a.gametheory.equilibrium.StrategyProfile;
import edu.brandeis.cosi103a.gametheory.strategy.Action;
import edu.brandeis.cosi103a.gametheory.strategy.ActionHistory;
import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyInfo;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyRegistry;
import edu.brandeis.cosi103a.gametheory.strategy.Turn;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for synchronous evaluation: equilibria, tournaments, strategy analysis and
 * strategy lookup. Turn and repetition counts fall back to the configured defaults.
 */
@Service
public class EvaluationService {

    private final EquilibriumCalculator calculator;
    private final TournamentRunner tournamentRunner;
    private final StrategyAnalyzer strategyAnalyzer;
    private final StrategyRegistry registry;
    private final int defaultTurns;
    private final int defaultRepetitions;

    public EvaluationService(
            EquilibriumCalculator calculator,
            TournamentRunner tournamentRunner,
            StrategyAnalyzer strategyAnalyzer,
            StrategyRegistry registry,
            @Value("${evaluation.default-turns:200}") int defaultTurns,
            @Value("${evaluation.default-repetitions:10}") int defaultRepetitions) {
        this.calculator = calculator;
        this.tournamentRunner = tournamentRunner;
        this.strategyAnalyzer = strategyAnalyzer;
        this.registry = registry;
        this.defaultTurns = defaultTurns;
        this.defaultRepetitions = defaultRepetitions;
    }

    public EquilibriumResult computeEquilibria(PayoffMatrix matrix) {
        return calculator.computeEquilibria(matrix);
    }

    public boolean isDominantStrategy(PayoffMatrix matrix, int index, GamePlayer player) {
        return calculator.isDominantStrategy(matrix, index, player);
    }

    public double computeExpectedPayoff(PayoffMatrix matrix, StrategyProfile profile) {
        return calculator.computeExpectedPayoff(matrix, profile);
    }

    public TournamentResult runTournament(List<String> names) {
        return runTournament(names, defaultTurns, defaultRepetitions);
    }

    public TournamentResult runTournament(List<String> names, int turns, int repetitions) {
        return tournamentRunner.runTournament(names, turns, repetitions);
    }

    public AnalysisResult analyzeStrategy(String name) {
        return analyzeStrategy(name, defaultTurns);
    }

    public AnalysisResult analyzeStrategy(String name, int turns) {
        return strategyAnalyzer.analyze(name, turns);
    }

    /**
     * Fresh instance of the named strategy; aliases and any letter case are accepted.
     */
    public Strategy resolveStrategy(String name) {
        return registry.resolve(name);
    }

    public List<StrategyInfo> listStrategies(boolean basicOnly) {
        return registry.list(basicOnly);
    }

    /**
     * Move the named strategy would make after the given rounds.
     *
     * @throws IllegalArgumentException if round numbers are not 1, 2, 3, ...
     */
    public Action playAction(String name, List<Turn> history) {
        return registry.nextAction(name, ActionHistory.of(history));
    }
}
