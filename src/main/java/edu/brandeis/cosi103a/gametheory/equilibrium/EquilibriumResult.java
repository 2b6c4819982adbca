package edu.brandeis.cosi103a.gametheory.equilibrium;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of an equilibrium computation.
 *
 * @param equilibria     mixed-strategy equilibria found by support enumeration (deduplicated);
 *                       pure equilibria appear here in probability-one form
 * @param pureEquilibria cells that are pure-strategy equilibria
 * @param unique         true when exactly one equilibrium profile was found
 */
public record EquilibriumResult(
    @JsonProperty("equilibria") List<StrategyProfile> equilibria,
    @JsonProperty("pureEquilibria") List<PureEquilibrium> pureEquilibria,
    @JsonProperty("unique") boolean unique
) {
    public EquilibriumResult {
        equilibria = List.copyOf(equilibria);
        pureEquilibria = List.copyOf(pureEquilibria);
    }

    public static EquilibriumResult of(List<StrategyProfile> equilibria, List<PureEquilibrium> pureEquilibria) {
        return new EquilibriumResult(equilibria, pureEquilibria, equilibria.size() == 1);
    }

    public int equilibriumCount() {
        return equilibria.size();
    }
}
