package edu.brandeis.cosi103a.gametheory.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Catalog entry for a registered strategy.
 */
public record StrategyInfo(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("classifier") StrategyClassifier classifier,
    @JsonProperty("basic") boolean basic
) {}
