package edu.brandeis.cosi103a.gametheory.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MetricStatsTest {

    @Test
    void noSamples_allZero() {
        assertEquals(new MetricStats(0, 0.0, 0.0, 0.0, 0.0), MetricStats.of(List.of()));
    }

    @Test
    void singleSample_hasNoSpread() {
        MetricStats stats = MetricStats.of(List.of(2.5));

        assertEquals(1, stats.count());
        assertEquals(2.5, stats.mean(), 1e-12);
        assertEquals(0.0, stats.stdDev(), 1e-12);
        assertEquals(2.5, stats.ciLower(), 1e-12);
        assertEquals(2.5, stats.ciUpper(), 1e-12);
    }

    @Test
    void usesSampleStandardDeviation() {
        MetricStats stats = MetricStats.of(List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0));

        assertEquals(5.0, stats.mean(), 1e-12);
        // squared deviations sum to 32 over 7 degrees of freedom
        assertEquals(Math.sqrt(32.0 / 7.0), stats.stdDev(), 1e-12);
        double margin = 1.96 * Math.sqrt(32.0 / 7.0) / Math.sqrt(8);
        assertEquals(5.0 - margin, stats.ciLower(), 1e-12);
        assertEquals(5.0 + margin, stats.ciUpper(), 1e-12);
    }
}
