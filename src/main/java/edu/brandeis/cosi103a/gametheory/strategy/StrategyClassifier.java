package edu.brandeis.cosi103a.gametheory.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Behavioural tags of a strategy.
 *
 * @param memoryDepth number of past rounds consulted, or -1 when unbounded
 * @param stochastic  whether moves are randomised
 */
public record StrategyClassifier(
    @JsonProperty("memoryDepth") int memoryDepth,
    @JsonProperty("stochastic") boolean stochastic
) {}
