package edu.brandeis.cosi103a.gametheory.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-strategy aggregate over the completed runs of an experiment.
 *
 * @param wins   runs in which the strategy ranked first
 * @param rating TrueSkill conservative rating (mu - 3 sigma) treating each run as one game
 */
public record StrategyStats(
    @JsonProperty("strategy") String strategy,
    @JsonProperty("runs") int runs,
    @JsonProperty("meanScore") double meanScore,
    @JsonProperty("meanCooperationRate") double meanCooperationRate,
    @JsonProperty("wins") int wins,
    @JsonProperty("rating") double rating
) {}
