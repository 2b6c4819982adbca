package edu.brandeis.cosi103a.gametheory.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Summary statistics of one metric across runs.
 *
 * @param stdDev  sample standard deviation, 0 with fewer than two samples
 * @param ciLower lower end of the 95% normal-approximation confidence interval of the mean
 * @param ciUpper upper end of that interval
 */
public record MetricStats(
    @JsonProperty("count") int count,
    @JsonProperty("mean") double mean,
    @JsonProperty("stdDev") double stdDev,
    @JsonProperty("ciLower") double ciLower,
    @JsonProperty("ciUpper") double ciUpper
) {
    static final double Z_95 = 1.96;

    public static MetricStats of(List<Double> samples) {
        int n = samples.size();
        if (n == 0) {
            return new MetricStats(0, 0.0, 0.0, 0.0, 0.0);
        }
        double mean = samples.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double stdDev = 0.0;
        if (n > 1) {
            double squares = 0.0;
            for (double sample : samples) {
                squares += (sample - mean) * (sample - mean);
            }
            stdDev = Math.sqrt(squares / (n - 1));
        }
        double margin = Z_95 * stdDev / Math.sqrt(n);
        return new MetricStats(n, mean, stdDev, mean - margin, mean + margin);
    }
}
