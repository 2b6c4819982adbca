package edu.brandeis.cosi103a.gametheory.experiment;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * A named hypothesis tested by repeated tournament runs.
 */
public record Experiment(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("hypothesis") String hypothesis,
    @JsonProperty("description") String description,
    @JsonProperty("config") ExperimentConfig config,
    @JsonProperty("tags") List<String> tags,
    @JsonProperty("status") ExperimentStatus status,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("updatedAt") Instant updatedAt
) {
    public Experiment {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * True when {@code wanted} is empty or shares at least one tag with this experiment.
     */
    public boolean hasAnyTag(Collection<String> wanted) {
        if (wanted == null || wanted.isEmpty()) {
            return true;
        }
        for (String tag : wanted) {
            if (tags.contains(tag)) {
                return true;
            }
        }
        return false;
    }
}
