package edu.brandeis.cosi103a.gametheory.runner;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated round-robin outcome.
 *
 * @param rankings         strategies by descending mean score; ties keep entry order
 * @param totalMatches     number of matches played
 * @param winner           name of the top-ranked strategy
 * @param cooperationRates mean cooperation rate per strategy, in entry order
 * @param turns            turns per match
 * @param repetitions      matches per ordered pair
 */
public record TournamentResult(
    @JsonProperty("rankings") List<Ranking> rankings,
    @JsonProperty("totalMatches") int totalMatches,
    @JsonProperty("winner") String winner,
    @JsonProperty("cooperationRates") Map<String, Double> cooperationRates,
    @JsonProperty("turns") int turns,
    @JsonProperty("repetitions") int repetitions
) {
    public TournamentResult {
        rankings = List.copyOf(rankings);
        cooperationRates = Collections.unmodifiableMap(new LinkedHashMap<>(cooperationRates));
    }

    /**
     * Mean of every entrant's mean score.
     */
    public double meanScore() {
        return rankings.stream().mapToDouble(Ranking::score).average().orElse(0.0);
    }

    /**
     * Mean of every entrant's cooperation rate.
     */
    public double meanCooperationRate() {
        return rankings.stream().mapToDouble(Ranking::cooperationRate).average().orElse(0.0);
    }
}
