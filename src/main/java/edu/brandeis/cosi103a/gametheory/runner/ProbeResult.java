package edu.brandeis.cosi103a.gametheory.runner;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The analysed strategy's score and cooperation rate in a single probe match.
 */
public record ProbeResult(
    @JsonProperty("opponent") String opponent,
    @JsonProperty("score") int score,
    @JsonProperty("cooperationRate") double cooperationRate
) {}
