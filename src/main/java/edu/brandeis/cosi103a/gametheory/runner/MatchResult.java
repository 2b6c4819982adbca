package edu.brandeis.cosi103a.gametheory.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.gametheory.strategy.Action;

import java.util.List;

/**
 * Outcome of one repeated game between two strategies.
 */
public record MatchResult(
    @JsonProperty("strategyA") String strategyA,
    @JsonProperty("strategyB") String strategyB,
    @JsonProperty("actionsA") List<Action> actionsA,
    @JsonProperty("actionsB") List<Action> actionsB,
    @JsonProperty("scoreA") int scoreA,
    @JsonProperty("scoreB") int scoreB,
    @JsonProperty("cooperationRateA") double cooperationRateA,
    @JsonProperty("cooperationRateB") double cooperationRateB
) {
    public MatchResult {
        actionsA = List.copyOf(actionsA);
        actionsB = List.copyOf(actionsB);
    }

    public int turns() {
        return actionsA.size();
    }
}
