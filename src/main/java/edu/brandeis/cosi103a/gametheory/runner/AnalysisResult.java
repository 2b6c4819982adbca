package edu.brandeis.cosi103a.gametheory.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyClassifier;

/**
 * Behaviour of one strategy against the three canonical probes.
 *
 * @param cooperationRate mean of the three probe cooperation rates
 * @param averageScore    mean of the three probe scores
 */
public record AnalysisResult(
    @JsonProperty("strategyName") String strategyName,
    @JsonProperty("turns") int turns,
    @JsonProperty("cooperationRate") double cooperationRate,
    @JsonProperty("averageScore") double averageScore,
    @JsonProperty("vsCooperator") ProbeResult vsCooperator,
    @JsonProperty("vsDefector") ProbeResult vsDefector,
    @JsonProperty("vsTitForTat") ProbeResult vsTitForTat,
    @JsonProperty("classifier") StrategyClassifier classifier
) {}
