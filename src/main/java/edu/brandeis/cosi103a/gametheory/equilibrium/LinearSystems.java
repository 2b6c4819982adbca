package edu.brandeis.cosi103a.gametheory.equilibrium;

import java.util.Optional;

/**
 * Small dense linear algebra helpers for support enumeration.
 */
final class LinearSystems {

    private static final double PIVOT_EPSILON = 1e-12;
    private static final double RESIDUAL_EPSILON = 1e-9;

    private LinearSystems() {
        // Utility class
    }

    /**
     * Solves {@code a * x = b} by Gauss-Jordan elimination with partial pivoting.
     * The system may have more equations than unknowns.
     *
     * @return the solution, or empty if the system is inconsistent or has infinitely many solutions
     */
    static Optional<double[]> solveUnique(double[][] a, double[] b) {
        int m = a.length;
        int n = a[0].length;
        double[][] aug = new double[m][n + 1];
        for (int r = 0; r < m; r++) {
            System.arraycopy(a[r], 0, aug[r], 0, n);
            aug[r][n] = b[r];
        }

        int[] pivotColumns = new int[Math.min(m, n)];
        int rank = 0;
        for (int col = 0; col < n && rank < m; col++) {
            int pivot = rank;
            for (int r = rank + 1; r < m; r++) {
                if (Math.abs(aug[r][col]) > Math.abs(aug[pivot][col])) {
                    pivot = r;
                }
            }
            if (Math.abs(aug[pivot][col]) < PIVOT_EPSILON) {
                // free variable
                return Optional.empty();
            }
            double[] tmp = aug[pivot];
            aug[pivot] = aug[rank];
            aug[rank] = tmp;

            double scale = aug[rank][col];
            for (int c = col; c <= n; c++) {
                aug[rank][c] /= scale;
            }
            for (int r = 0; r < m; r++) {
                if (r == rank || aug[r][col] == 0.0) {
                    continue;
                }
                double factor = aug[r][col];
                for (int c = col; c <= n; c++) {
                    aug[r][c] -= factor * aug[rank][c];
                }
            }
            pivotColumns[rank] = col;
            rank++;
        }

        if (rank < n) {
            return Optional.empty();
        }
        for (int r = rank; r < m; r++) {
            if (Math.abs(aug[r][n]) > RESIDUAL_EPSILON) {
                return Optional.empty();
            }
        }

        double[] x = new double[n];
        for (int r = 0; r < n; r++) {
            x[pivotColumns[r]] = aug[r][n];
        }
        return Optional.of(x);
    }
}
