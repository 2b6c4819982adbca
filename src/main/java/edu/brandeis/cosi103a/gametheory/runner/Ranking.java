package edu.brandeis.cosi103a.gametheory.runner;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of a tournament leaderboard.
 */
public record Ranking(
    @JsonProperty("rank") int rank,
    @JsonProperty("strategy") String strategy,
    @JsonProperty("score") double score,
    @JsonProperty("cooperationRate") double cooperationRate
) {}
