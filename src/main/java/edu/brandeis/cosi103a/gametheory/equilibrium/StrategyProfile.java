package edu.brandeis.cosi103a.gametheory.equilibrium;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A pair of probability distributions over the row and column player's pure strategies.
 *
 * @param row    probability of each row strategy
 * @param column probability of each column strategy
 */
public record StrategyProfile(
    @JsonProperty("row") List<Double> row,
    @JsonProperty("column") List<Double> column
) {
    static final double SUM_TOLERANCE = 1e-6;

    public StrategyProfile {
        row = validated(row, "row");
        column = validated(column, "column");
    }

    /**
     * Creates a profile from primitive arrays.
     */
    public static StrategyProfile of(double[] row, double[] column) {
        return new StrategyProfile(toList(row), toList(column));
    }

    /**
     * Creates the degenerate profile where the row player plays {@code rowIndex} and the
     * column player plays {@code colIndex} with probability one.
     */
    public static StrategyProfile pure(int rows, int cols, int rowIndex, int colIndex) {
        double[] r = new double[rows];
        double[] c = new double[cols];
        r[rowIndex] = 1.0;
        c[colIndex] = 1.0;
        return of(r, c);
    }

    public double[] rowArray() {
        return row.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public double[] columnArray() {
        return column.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static List<Double> validated(List<Double> distribution, String side) {
        checkArgument(distribution != null && !distribution.isEmpty(),
            "%s distribution must not be empty", side);
        double sum = 0.0;
        for (Double p : distribution) {
            checkArgument(p != null && p >= 0.0 && Double.isFinite(p),
                "%s distribution has an invalid probability: %s", side, p);
            sum += p;
        }
        checkArgument(Math.abs(sum - 1.0) <= SUM_TOLERANCE,
            "%s distribution sums to %s, expected 1.0", side, sum);
        return List.copyOf(distribution);
    }

    private static List<Double> toList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) {
            list.add(v);
        }
        return list;
    }
}
