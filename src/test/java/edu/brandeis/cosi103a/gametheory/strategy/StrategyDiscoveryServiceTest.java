package edu.brandeis.cosi103a.gametheory.strategy;

import edu.brandeis.cosi103a.gametheory.extra.ConfiguredStrategy;
import edu.brandeis.cosi103a.gametheory.extra.ExplodingStrategy;
import edu.brandeis.cosi103a.gametheory.extra.Forgiver;
import edu.brandeis.cosi103a.gametheory.strategy.catalog.TitForTat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StrategyDiscoveryServiceTest {

    @Test
    void scan_findsBuiltInCatalog() {
        StrategyDiscoveryService service = new StrategyDiscoveryService("");

        List<Class<? extends Strategy>> found = service.scan();

        assertEquals(15, found.size());
        assertTrue(found.contains(TitForTat.class));
        assertFalse(found.contains(Forgiver.class));
    }

    @Test
    void scan_includesExtraPackages() {
        StrategyDiscoveryService service =
            new StrategyDiscoveryService(" edu.brandeis.cosi103a.gametheory.extra , ");

        List<Class<? extends Strategy>> found = service.scan();

        assertTrue(found.contains(Forgiver.class));
        assertFalse(found.contains(ConfiguredStrategy.class), "needs a no-arg constructor");
        assertEquals(List.of(StrategyDiscoveryService.CATALOG_PACKAGE, "edu.brandeis.cosi103a.gametheory.extra"),
            service.packages());
    }

    @Test
    void buildRegistry_registersDiscoveredStrategiesAndAliases() {
        StrategyRegistry registry =
            new StrategyDiscoveryService("edu.brandeis.cosi103a.gametheory.extra").buildRegistry();

        assertEquals(16, registry.size());
        assertEquals("Forgiver", registry.resolve("forgiver").name());
        assertEquals(2, registry.describe("Forgiver").classifier().memoryDepth());
        assertEquals("WinStayLoseShift", registry.canonicalName("pavlov"));
    }

    @Test
    void buildRegistry_skipsClassesThatFailToInstantiate() {
        StrategyDiscoveryService service = new StrategyDiscoveryService("edu.brandeis.cosi103a.gametheory.extra");
        assertTrue(service.scan().contains(ExplodingStrategy.class));

        StrategyRegistry registry = service.buildRegistry();

        assertFalse(registry.contains("ExplodingStrategy"));
        assertTrue(registry.contains("Forgiver"));
        assertTrue(registry.contains("TitForTat"));
    }

    @Test
    void scan_isSortedByClassName() {
        List<Class<? extends Strategy>> found = new StrategyDiscoveryService("").scan();

        for (int i = 1; i < found.size(); i++) {
            assertTrue(found.get(i - 1).getName().compareTo(found.get(i).getName()) < 0);
        }
    }
}
