package edu.brandeis.cosi103a.gametheory.equilibrium;

/**
 * Nash equilibrium computation over a single payoff matrix. Implementations are pure
 * functions of their inputs.
 */
public interface EquilibriumCalculator {

    /**
     * Finds the pure and mixed Nash equilibria of the symmetric game described by
     * {@code matrix}.
     *
     * @throws edu.brandeis.cosi103a.gametheory.InvalidMatrixException if the game shape is unsupported
     */
    EquilibriumResult computeEquilibria(PayoffMatrix matrix);

    /**
     * Checks whether the strategy at {@code index} does at least as well as every other
     * strategy of the same player against every opponent choice.
     */
    boolean isDominantStrategy(PayoffMatrix matrix, int index, GamePlayer player);

    /**
     * Row player's expected payoff {@code row^T * matrix * column}.
     */
    double computeExpectedPayoff(PayoffMatrix matrix, StrategyProfile profile);
}
