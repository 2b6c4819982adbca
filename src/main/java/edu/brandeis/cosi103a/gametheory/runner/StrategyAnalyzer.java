package edu.brandeis.cosi103a.gametheory.runner;

import edu.brandeis.cosi103a.gametheory.strategy.Strategy;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyInfo;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyRegistry;
import edu.brandeis.cosi103a.gametheory.strategy.catalog.Cooperator;
import edu.brandeis.cosi103a.gametheory.strategy.catalog.Defector;
import edu.brandeis.cosi103a.gametheory.strategy.catalog.TitForTat;

import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Characterises a strategy by playing it once against an unconditional cooperator, an
 * unconditional defector and tit for tat.
 */
public class StrategyAnalyzer {

    private final StrategyRegistry registry;
    private final MatchSimulator simulator;

    public StrategyAnalyzer(StrategyRegistry registry, MatchSimulator simulator) {
        this.registry = checkNotNull(registry, "registry");
        this.simulator = checkNotNull(simulator, "simulator");
    }

    /**
     * @throws edu.brandeis.cosi103a.gametheory.StrategyNotFoundException if the name does not resolve
     * @throws edu.brandeis.cosi103a.gametheory.InvalidTurnCountException if turns is less than 1
     */
    public AnalysisResult analyze(String name, int turns) {
        StrategyInfo info = registry.describe(name);

        ProbeResult vsCooperator = probe(info.name(), Cooperator::new, turns);
        ProbeResult vsDefector = probe(info.name(), Defector::new, turns);
        ProbeResult vsTitForTat = probe(info.name(), TitForTat::new, turns);

        double cooperationRate = (vsCooperator.cooperationRate() + vsDefector.cooperationRate()
            + vsTitForTat.cooperationRate()) / 3.0;
        double averageScore = (vsCooperator.score() + vsDefector.score() + vsTitForTat.score()) / 3.0;

        return new AnalysisResult(info.name(), turns, cooperationRate, averageScore,
            vsCooperator, vsDefector, vsTitForTat, info.classifier());
    }

    private ProbeResult probe(String target, Supplier<Strategy> opponentFactory, int turns) {
        Strategy opponent = opponentFactory.get();
        MatchResult match = simulator.playMatch(registry.resolve(target), opponent, turns);
        return new ProbeResult(opponent.name(), match.scoreA(), match.cooperationRateA());
    }
}
