package edu.brandeis.cosi103a.gametheory.runner;

import edu.brandeis.cosi103a.gametheory.ComputationFailureException;
import edu.brandeis.cosi103a.gametheory.GameTheoryException;
import edu.brandeis.cosi103a.gametheory.InvalidTournamentException;
import edu.brandeis.cosi103a.gametheory.InvalidTurnCountException;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Round-robin tournament over registered strategies.
 *
 * <p>Every ordered pair of distinct entrants plays {@code repetitions} matches, so N entrants
 * play N * (N - 1) * repetitions matches. Each match uses fresh strategy instances. Scores and
 * cooperation rates are means over all matches an entrant took part in.
 */
public class TournamentRunner {

    private static final Logger log = LoggerFactory.getLogger(TournamentRunner.class);

    private final StrategyRegistry registry;
    private final MatchSimulator simulator;
    private final int maxStrategies;

    public TournamentRunner(StrategyRegistry registry, MatchSimulator simulator, int maxStrategies) {
        this.registry = checkNotNull(registry, "registry");
        this.simulator = checkNotNull(simulator, "simulator");
        this.maxStrategies = maxStrategies;
    }

    /**
     * Runs the tournament. All names are resolved and all arguments validated before the first
     * match is played.
     *
     * @throws edu.brandeis.cosi103a.gametheory.StrategyNotFoundException if a name does not resolve
     * @throws InvalidTurnCountException if turns is less than 1
     * @throws InvalidTournamentException if the entrant list or repetition count is unusable
     * @throws ComputationFailureException if a strategy fails during play
     */
    public TournamentResult runTournament(List<String> names, int turns, int repetitions) {
        checkNotNull(names, "names");
        List<String> entrants = new ArrayList<>(names.size());
        for (String name : names) {
            entrants.add(registry.canonicalName(name));
        }
        validate(entrants, turns, repetitions);

        int n = entrants.size();
        double[] totalScore = new double[n];
        double[] totalCooperation = new double[n];
        int[] matchesPlayed = new int[n];
        int totalMatches = 0;

        log.debug("Running tournament {} with {} turns x {} repetitions", entrants, turns, repetitions);
        try {
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    if (i == j) {
                        continue;
                    }
                    for (int r = 0; r < repetitions; r++) {
                        MatchResult match = simulator.playMatch(
                            registry.resolve(entrants.get(i)), registry.resolve(entrants.get(j)), turns);
                        totalScore[i] += match.scoreA();
                        totalScore[j] += match.scoreB();
                        totalCooperation[i] += match.cooperationRateA();
                        totalCooperation[j] += match.cooperationRateB();
                        matchesPlayed[i]++;
                        matchesPlayed[j]++;
                        totalMatches++;
                    }
                }
            }
        } catch (GameTheoryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ComputationFailureException("Tournament simulation failed: " + e.getMessage(), e);
        }

        Map<String, Double> cooperationRates = new LinkedHashMap<>();
        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            cooperationRates.put(entrants.get(i), totalCooperation[i] / matchesPlayed[i]);
            order.add(i);
        }
        // List.sort is stable, so equal scores keep entry order
        order.sort(Comparator.comparingDouble((Integer i) -> totalScore[i] / matchesPlayed[i]).reversed());

        List<Ranking> rankings = new ArrayList<>(n);
        for (int position = 0; position < n; position++) {
            int i = order.get(position);
            rankings.add(new Ranking(position + 1, entrants.get(i),
                totalScore[i] / matchesPlayed[i], totalCooperation[i] / matchesPlayed[i]));
        }

        TournamentResult result = new TournamentResult(rankings, totalMatches, rankings.get(0).strategy(),
            cooperationRates, turns, repetitions);
        log.debug("Tournament finished: {} matches, winner {}", totalMatches, result.winner());
        return result;
    }

    public int maxStrategies() {
        return maxStrategies;
    }

    private void validate(List<String> entrants, int turns, int repetitions) {
        if (turns < 1) {
            throw new InvalidTurnCountException("Turns must be at least 1, got " + turns);
        }
        if (repetitions < 1) {
            throw new InvalidTournamentException("Repetitions must be at least 1, got " + repetitions);
        }
        if (entrants.size() < 2) {
            throw new InvalidTournamentException(
                "A tournament needs at least 2 strategies, got " + entrants.size());
        }
        if (entrants.size() > maxStrategies) {
            throw new InvalidTournamentException(
                "A tournament allows at most " + maxStrategies + " strategies, got " + entrants.size());
        }
        Set<String> seen = new HashSet<>();
        for (String entrant : entrants) {
            if (!seen.add(entrant)) {
                throw new InvalidTournamentException("Strategy " + entrant + " is entered more than once");
            }
        }
    }
}
