package edu.brandeis.cosi103a.gametheory.strategy;

/**
 * A decision rule for the iterated prisoner's dilemma.
 *
 * <p>Each match gets a fresh instance, so implementations may keep per-match state in fields.
 * Implementations discovered on the classpath need a public no-arg constructor and should
 * carry a {@link StrategyDescription}.
 */
public interface Strategy {

    /**
     * Canonical name used for registry lookup and in results.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Chooses the move for the next round. {@code history} holds only completed rounds; the
     * opponent's move for the round being decided is never visible.
     */
    Action nextAction(ActionHistory history);
}
