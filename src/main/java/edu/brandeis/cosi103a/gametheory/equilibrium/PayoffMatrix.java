package edu.brandeis.cosi103a.gametheory.equilibrium;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.gametheory.InvalidMatrixException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable R x C matrix of row-player payoffs. In the symmetric games this project
 * supports, the column player's payoffs are the transpose of the same matrix.
 */
public final class PayoffMatrix {

    private final double[][] values;

    private PayoffMatrix(double[][] values) {
        this.values = values;
    }

    /**
     * Creates a matrix from raw values, copying them so later edits to the caller's array
     * cannot affect a running computation.
     *
     * @throws InvalidMatrixException if the matrix is empty, ragged or holds non-finite values
     */
    public static PayoffMatrix of(double[][] values) {
        if (values == null || values.length == 0) {
            throw new InvalidMatrixException("Payoff matrix must have at least one row");
        }
        int cols = values[0] == null ? 0 : values[0].length;
        if (cols == 0) {
            throw new InvalidMatrixException("Payoff matrix must have at least one column");
        }
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null || values[i].length != cols) {
                throw new InvalidMatrixException(
                    "Payoff matrix is ragged: row " + i + " does not have " + cols + " columns");
            }
            for (double v : values[i]) {
                if (!Double.isFinite(v)) {
                    throw new InvalidMatrixException("Payoff matrix contains a non-finite value in row " + i);
                }
            }
            copy[i] = values[i].clone();
        }
        return new PayoffMatrix(copy);
    }

    /**
     * Creates a matrix from nested lists (the JSON form).
     */
    @JsonCreator
    public static PayoffMatrix fromRows(@JsonProperty("values") List<List<Double>> rows) {
        if (rows == null) {
            throw new InvalidMatrixException("Payoff matrix must have at least one row");
        }
        double[][] raw = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            List<Double> row = rows.get(i);
            if (row == null) {
                throw new InvalidMatrixException("Payoff matrix row " + i + " is missing");
            }
            raw[i] = new double[row.size()];
            for (int j = 0; j < row.size(); j++) {
                Double v = row.get(j);
                if (v == null) {
                    throw new InvalidMatrixException("Payoff matrix has an empty cell at (" + i + "," + j + ")");
                }
                raw[i][j] = v;
            }
        }
        return of(raw);
    }

    public int rows() {
        return values.length;
    }

    public int cols() {
        return values[0].length;
    }

    @JsonIgnore
    public boolean isSquare() {
        return rows() == cols();
    }

    public double get(int row, int col) {
        return values[row][col];
    }

    /**
     * Returns the matrix as nested lists, row by row.
     */
    @JsonProperty("values")
    public List<List<Double>> toRows() {
        List<List<Double>> rows = new ArrayList<>(values.length);
        for (double[] row : values) {
            List<Double> copy = new ArrayList<>(row.length);
            for (double v : row) {
                copy.add(v);
            }
            rows.add(List.copyOf(copy));
        }
        return List.copyOf(rows);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PayoffMatrix other)) {
            return false;
        }
        return Arrays.deepEquals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return "PayoffMatrix" + Arrays.deepToString(values);
    }
}
