package edu.brandeis.cosi103a.gametheory.strategy;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Describes a Strategy implementation for listings and behavioural analysis.
 * Read by StrategyRegistry when a strategy class is registered.
 *
 * <p>Example usage:
 * <pre>
 * {@literal @}StrategyDescription(value = "Cooperates first, then copies the opponent", memoryDepth = 1)
 * public class TitForTat implements Strategy {
 *     // ...
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Documented
public @interface StrategyDescription {

    /**
     * A human-readable description of the strategy.
     */
    String value();

    /**
     * How many past rounds the strategy looks at; {@link #UNBOUNDED} if it may use the whole history.
     */
    int memoryDepth() default UNBOUNDED;

    /**
     * Whether the strategy's moves involve randomness.
     */
    boolean stochastic() default false;

    /**
     * Whether the strategy belongs to the short list of well-known basic strategies.
     */
    boolean basic() default false;

    int UNBOUNDED = -1;
}
