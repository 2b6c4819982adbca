package edu.brandeis.cosi103a.gametheory.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Statistics over an experiment's runs.
 *
 * @param cooperation per-run mean cooperation rate, over completed runs
 * @param score       per-run mean score, over completed runs
 * @param strategies  per-strategy figures, best rating first
 */
public record ExperimentAnalysis(
    @JsonProperty("experimentId") String experimentId,
    @JsonProperty("experimentName") String experimentName,
    @JsonProperty("totalRuns") int totalRuns,
    @JsonProperty("successfulRuns") int successfulRuns,
    @JsonProperty("failedRuns") int failedRuns,
    @JsonProperty("cooperation") MetricStats cooperation,
    @JsonProperty("score") MetricStats score,
    @JsonProperty("strategies") List<StrategyStats> strategies
) {
    public ExperimentAnalysis {
        strategies = List.copyOf(strategies);
    }

    public double successRate() {
        return totalRuns == 0 ? 0.0 : (double) successfulRuns / totalRuns;
    }
}
