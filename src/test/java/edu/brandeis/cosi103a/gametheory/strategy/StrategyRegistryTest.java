package edu.brandeis.cosi103a.gametheory.strategy;

import edu.brandeis.cosi103a.gametheory.StrategyNotFoundException;
import edu.brandeis.cosi103a.gametheory.strategy.catalog.Cooperator;
import edu.brandeis.cosi103a.gametheory.strategy.catalog.Grudger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StrategyRegistryTest {

    private StrategyRegistry registry;

    @BeforeEach
    void setUp() {
        registry = StrategyRegistry.builtIn();
    }

    @Test
    void resolve_isCaseInsensitive() {
        assertEquals("TitForTat", registry.resolve("titfortat").name());
        assertEquals("TitForTat", registry.resolve("TITFORTAT").name());
        assertEquals("Random", registry.resolve("random").name());
    }

    @Test
    void resolve_followsAliases() {
        assertEquals("WinStayLoseShift", registry.canonicalName("Pavlov"));
        assertEquals("TitForTat", registry.canonicalName("tft"));
        assertEquals("GenerousTitForTat", registry.canonicalName("GTFT"));
        assertEquals("Alternator", registry.canonicalName("AlternatingCooperator"));
    }

    @Test
    void resolve_unknownName() {
        StrategyNotFoundException e = assertThrows(StrategyNotFoundException.class,
            () -> registry.resolve("NoSuchStrategy"));
        assertTrue(e.getMessage().contains("NoSuchStrategy"));
        assertThrows(StrategyNotFoundException.class, () -> registry.resolve(" "));
        assertFalse(registry.contains("NoSuchStrategy"));
        assertTrue(registry.contains("pavlov"));
    }

    @Test
    void resolve_returnsFreshInstances() {
        Strategy first = registry.resolve("Grudger");
        Strategy second = registry.resolve("Grudger");

        assertInstanceOf(Grudger.class, first);
        assertNotSame(first, second);
    }

    @Test
    void list_sortedAndFilterable() {
        List<StrategyInfo> all = registry.list(false);
        List<StrategyInfo> basic = registry.list(true);

        assertEquals(15, all.size());
        assertEquals(13, basic.size());
        assertTrue(basic.stream().allMatch(StrategyInfo::basic));
        for (int i = 1; i < all.size(); i++) {
            assertTrue(all.get(i - 1).name().compareTo(all.get(i).name()) < 0,
                "Strategies should be sorted by name");
        }
    }

    @Test
    void describe_readsAnnotation() {
        StrategyInfo grudger = registry.describe("grudger");
        StrategyInfo gtft = registry.describe("GTFT");

        assertEquals(StrategyDescription.UNBOUNDED, grudger.classifier().memoryDepth());
        assertFalse(grudger.classifier().stochastic());
        assertEquals(1, gtft.classifier().memoryDepth());
        assertTrue(gtft.classifier().stochastic());
        assertFalse(grudger.description().isEmpty());
    }

    @Test
    void register_doesNotOverrideExistingName() {
        assertFalse(registry.register(Cooperator.class));
        assertFalse(registry.register("cooperator", null, Cooperator::new));
        assertTrue(registry.register("AlwaysNice", null, Cooperator::new));
        assertEquals(16, registry.size());
    }

    @Test
    void nextAction_usesSuppliedHistory() {
        ActionHistory history = ActionHistory.of(List.of(
            new Turn(1, Action.COOPERATE, Action.DEFECT),
            new Turn(2, Action.DEFECT, Action.COOPERATE)));

        assertEquals(Action.DEFECT, registry.nextAction("Grudger", history));
        assertEquals(Action.COOPERATE, registry.nextAction("TFT", history));
    }
}
