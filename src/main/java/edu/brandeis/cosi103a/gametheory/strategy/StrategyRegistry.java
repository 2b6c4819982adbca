package edu.brandeis.cosi103a.gametheory.strategy;

import edu.brandeis.cosi103a.gametheory.StrategyNotFoundException;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Name to constructor registry for strategies. Lookups are case-insensitive and resolve
 * aliases first; every lookup returns a fresh instance so no state leaks between matches.
 */
public class StrategyRegistry {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new ConcurrentHashMap<>();

    private record Entry(StrategyInfo info, Supplier<? extends Strategy> factory) {}

    /**
     * Returns a registry holding the built-in catalog and its default aliases.
     */
    public static StrategyRegistry builtIn() {
        return new StrategyDiscoveryService("").buildRegistry();
    }

    /**
     * Registers a strategy class by its public no-arg constructor, reading its
     * {@link StrategyDescription} if present.
     *
     * @return false if a strategy with the same name is already registered
     */
    public boolean register(Class<? extends Strategy> strategyClass) {
        checkNotNull(strategyClass, "strategyClass");
        Constructor<? extends Strategy> ctor;
        try {
            ctor = strategyClass.getConstructor();
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(strategyClass.getName() + " has no public no-arg constructor", e);
        }
        Supplier<Strategy> factory = () -> {
            try {
                return ctor.newInstance();
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Failed to create strategy " + strategyClass.getName(), e);
            }
        };
        return register(factory.get().name(), describe(strategyClass), factory);
    }

    /**
     * Registers a strategy under an explicit name.
     *
     * @return false if a strategy with the same name is already registered
     */
    public boolean register(String name, StrategyDescription description, Supplier<? extends Strategy> factory) {
        checkArgument(name != null && !name.isBlank(), "strategy name must not be blank");
        checkNotNull(factory, "factory");
        StrategyInfo info = description == null
            ? new StrategyInfo(name, "", new StrategyClassifier(StrategyDescription.UNBOUNDED, false), false)
            : new StrategyInfo(name, description.value(),
                new StrategyClassifier(description.memoryDepth(), description.stochastic()), description.basic());
        return entries.putIfAbsent(key(name), new Entry(info, factory)) == null;
    }

    /**
     * Makes {@code alias} resolve to the strategy registered as {@code canonicalName}.
     */
    public void alias(String alias, String canonicalName) {
        checkArgument(alias != null && !alias.isBlank(), "alias must not be blank");
        checkNotNull(canonicalName, "canonicalName");
        aliases.put(key(alias), canonicalName);
    }

    /**
     * Resolves a (possibly aliased, any-case) name to its canonical registered name.
     *
     * @throws StrategyNotFoundException if no strategy matches
     */
    public String canonicalName(String name) {
        return lookup(name).info().name();
    }

    public boolean contains(String name) {
        if (name == null) {
            return false;
        }
        return entries.containsKey(key(aliases.getOrDefault(key(name), name)));
    }

    /**
     * Creates a fresh instance of the named strategy.
     *
     * @throws StrategyNotFoundException if no strategy matches
     */
    public Strategy resolve(String name) {
        return lookup(name).factory().get();
    }

    public StrategyInfo describe(String name) {
        return lookup(name).info();
    }

    /**
     * Asks a fresh instance of the named strategy for its move after {@code history}.
     */
    public Action nextAction(String name, ActionHistory history) {
        checkNotNull(history, "history");
        return resolve(name).nextAction(history.readOnlyView());
    }

    /**
     * Lists registered strategies sorted by name.
     *
     * @param basicOnly restrict the listing to the well-known basic strategies
     */
    public List<StrategyInfo> list(boolean basicOnly) {
        List<StrategyInfo> result = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (!basicOnly || entry.info().basic()) {
                result.add(entry.info());
            }
        }
        result.sort(Comparator.comparing(StrategyInfo::name));
        return result;
    }

    public int size() {
        return entries.size();
    }

    private Entry lookup(String name) {
        if (name == null || name.isBlank()) {
            throw new StrategyNotFoundException("Strategy name must not be blank");
        }
        String resolved = aliases.getOrDefault(key(name), name);
        Entry entry = entries.get(key(resolved));
        if (entry == null) {
            throw new StrategyNotFoundException("Strategy '" + name + "' not found");
        }
        return entry;
    }

    private static StrategyDescription describe(Class<?> strategyClass) {
        return strategyClass.getAnnotation(StrategyDescription.class);
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
