package edu.brandeis.cosi103a.gametheory.strategy;

import edu.brandeis.cosi103a.gametheory.strategy.catalog.Cooperator;
import io.github.classgraph.ClassGraph;
import io.github.classgraph.ClassInfo;
import io.github.classgraph.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Finds Strategy implementations on the classpath and builds the registry from them.
 * The built-in catalog package is always scanned; further packages can be added through
 * the {@code strategies.scan-packages} property.
 */
@Service
public class StrategyDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(StrategyDiscoveryService.class);

    static final String CATALOG_PACKAGE = Cooperator.class.getPackageName();

    private final List<String> packages;

    public StrategyDiscoveryService(@Value("${strategies.scan-packages:}") String extraPackages) {
        List<String> all = new ArrayList<>();
        all.add(CATALOG_PACKAGE);
        Arrays.stream(extraPackages.split(","))
            .map(String::trim)
            .filter(p -> !p.isEmpty())
            .forEach(all::add);
        this.packages = List.copyOf(all);
    }

    /**
     * Scans the configured packages for concrete Strategy classes with a public no-arg
     * constructor, sorted by class name.
     */
    public List<Class<? extends Strategy>> scan() {
        List<Class<? extends Strategy>> found = new ArrayList<>();

        try (ScanResult result = new ClassGraph()
                .enableClassInfo()
                .enableAnnotationInfo()
                .acceptPackages(packages.toArray(new String[0]))
                .acceptClasses(Strategy.class.getName())
                .scan()) {

            for (ClassInfo classInfo : result.getClassesImplementing(Strategy.class.getName())) {
                if (classInfo.isInterface() || classInfo.isAbstract()) {
                    continue;
                }
                String className = classInfo.getName();
                try {
                    Class<?> candidate = Class.forName(className);
                    if (Modifier.isPublic(candidate.getModifiers()) && hasNoArgConstructor(candidate)) {
                        found.add(candidate.asSubclass(Strategy.class));
                    } else {
                        log.debug("Skipping {}: no public no-arg constructor", className);
                    }
                } catch (ClassNotFoundException | LinkageError e) {
                    log.warn("Could not load Strategy class {}: {}", className, e.getMessage());
                }
            }
        }

        found.sort(Comparator.comparing(Class::getName));
        return found;
    }

    /**
     * Builds a registry from every discovered strategy plus the default aliases.
     * When two classes share a strategy name, the first one (by class name) wins. Classes that
     * cannot be instantiated are logged and left out.
     */
    public StrategyRegistry buildRegistry() {
        StrategyRegistry registry = new StrategyRegistry();
        for (Class<? extends Strategy> strategyClass : scan()) {
            try {
                if (!registry.register(strategyClass)) {
                    log.warn("Ignoring {}: a strategy with the same name is already registered",
                        strategyClass.getName());
                }
            } catch (RuntimeException | LinkageError e) {
                log.warn("Skipping Strategy class {}: {}", strategyClass.getName(), e.getMessage());
            }
        }
        registry.alias("Pavlov", "WinStayLoseShift");
        registry.alias("TFT", "TitForTat");
        registry.alias("GTFT", "GenerousTitForTat");
        registry.alias("AlternatingCooperator", "Alternator");
        log.info("Registered {} strategies from {}", registry.size(), packages);
        return registry;
    }

    public List<String> packages() {
        return packages;
    }

    private static boolean hasNoArgConstructor(Class<?> type) {
        try {
            type.getConstructor();
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }
}
