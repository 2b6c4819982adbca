package edu.brandeis.cosi103a.gametheory.equilibrium;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A pure-strategy Nash equilibrium, identified by the cell both players settle on.
 */
public record PureEquilibrium(
    @JsonProperty("row") int row,
    @JsonProperty("col") int col
) {}
