package edu.brandeis.cosi103a.gametheory.equilibrium;

import edu.brandeis.cosi103a.gametheory.InvalidMatrixException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Equilibrium calculator for symmetric two-player games.
 *
 * <p>Pure equilibria are found by a best-response scan over every cell. Mixed equilibria are
 * found by support enumeration: every pair of non-empty row and column supports is tested by
 * solving the indifference equations of both players and keeping solutions that are valid
 * distributions with no profitable deviation outside the support.
 *
 * <p>The column player's payoff for cell (i, j) is {@code matrix[j][i]}, so both the pure scan
 * and support enumeration require a square matrix.
 */
public class SupportEnumerationCalculator implements EquilibriumCalculator {

    static final double TOLERANCE = 1e-9;
    private static final double DUPLICATE_TOLERANCE = 1e-7;

    @Override
    public EquilibriumResult computeEquilibria(PayoffMatrix matrix) {
        checkNotNull(matrix, "matrix");
        requireSquare(matrix);

        List<PureEquilibrium> pure = findPureEquilibria(matrix);
        List<StrategyProfile> mixed = enumerateSupports(matrix);
        return EquilibriumResult.of(mixed, pure);
    }

    @Override
    public boolean isDominantStrategy(PayoffMatrix matrix, int index, GamePlayer player) {
        checkNotNull(matrix, "matrix");
        checkNotNull(player, "player");
        if (player == GamePlayer.COLUMN) {
            requireSquare(matrix);
        }
        int strategies = player == GamePlayer.ROW ? matrix.rows() : matrix.cols();
        int opponentChoices = player == GamePlayer.ROW ? matrix.cols() : matrix.rows();
        checkElementIndex(index, strategies, "strategy index");

        for (int other = 0; other < strategies; other++) {
            if (other == index) {
                continue;
            }
            for (int opp = 0; opp < opponentChoices; opp++) {
                // symmetric game: the column player's payoff for playing j against row i is
                // matrix[j][i], so both players compare rows of the same matrix
                if (matrix.get(index, opp) < matrix.get(other, opp)) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public double computeExpectedPayoff(PayoffMatrix matrix, StrategyProfile profile) {
        checkNotNull(matrix, "matrix");
        checkNotNull(profile, "profile");
        checkArgument(profile.row().size() == matrix.rows(),
            "Row distribution has %s entries but the matrix has %s rows", profile.row().size(), matrix.rows());
        checkArgument(profile.column().size() == matrix.cols(),
            "Column distribution has %s entries but the matrix has %s columns",
            profile.column().size(), matrix.cols());

        double total = 0.0;
        for (int i = 0; i < matrix.rows(); i++) {
            double rowWeight = profile.row().get(i);
            if (rowWeight == 0.0) {
                continue;
            }
            for (int j = 0; j < matrix.cols(); j++) {
                total += rowWeight * matrix.get(i, j) * profile.column().get(j);
            }
        }
        return total;
    }

    private static void requireSquare(PayoffMatrix matrix) {
        if (!matrix.isSquare()) {
            throw new InvalidMatrixException(
                "Only square symmetric games are supported, got " + matrix.rows() + "x" + matrix.cols());
        }
    }

    List<PureEquilibrium> findPureEquilibria(PayoffMatrix matrix) {
        int n = matrix.rows();
        List<PureEquilibrium> result = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                // row player cannot improve by switching rows against column j
                boolean rowBest = matrix.get(i, j) >= columnMax(matrix, j) - TOLERANCE;
                // column player cannot improve by switching columns against row i
                boolean colBest = matrix.get(j, i) >= columnMax(matrix, i) - TOLERANCE;
                if (rowBest && colBest) {
                    result.add(new PureEquilibrium(i, j));
                }
            }
        }
        return result;
    }

    private static double columnMax(PayoffMatrix matrix, int col) {
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < matrix.rows(); i++) {
            max = Math.max(max, matrix.get(i, col));
        }
        return max;
    }

    List<StrategyProfile> enumerateSupports(PayoffMatrix matrix) {
        int n = matrix.rows();
        List<int[]> supports = supportsBySize(n);
        List<StrategyProfile> found = new ArrayList<>();

        for (int[] rowSupport : supports) {
            for (int[] colSupport : supports) {
                Optional<StrategyProfile> candidate = solveSupportPair(matrix, rowSupport, colSupport);
                if (candidate.isPresent() && !containsProfile(found, candidate.get())) {
                    found.add(candidate.get());
                }
            }
        }
        return found;
    }

    /**
     * Solves the indifference equations for one pair of supports. Returns empty when the system
     * has no unique solution, the solution is not a distribution with full support, or some
     * strategy outside the support is a strictly better response.
     */
    private Optional<StrategyProfile> solveSupportPair(PayoffMatrix matrix, int[] rowSupport, int[] colSupport) {
        int n = matrix.rows();

        // column mix y makes the row player indifferent across rowSupport
        Optional<double[]> colSolution = solveIndifference(matrix, rowSupport, colSupport);
        if (colSolution.isEmpty()) {
            return Optional.empty();
        }
        // row mix x makes the column player indifferent across colSupport
        Optional<double[]> rowSolution = solveIndifference(matrix, colSupport, rowSupport);
        if (rowSolution.isEmpty()) {
            return Optional.empty();
        }

        double[] y = expand(colSolution.get(), colSupport, n);
        double rowValue = colSolution.get()[colSupport.length];
        double[] x = expand(rowSolution.get(), rowSupport, n);
        double colValue = rowSolution.get()[rowSupport.length];

        if (!positiveOnSupport(x, rowSupport) || !positiveOnSupport(y, colSupport)) {
            return Optional.empty();
        }

        for (int k = 0; k < n; k++) {
            double rowPayoff = 0.0;
            double colPayoff = 0.0;
            for (int l = 0; l < n; l++) {
                rowPayoff += matrix.get(k, l) * y[l];
                colPayoff += matrix.get(k, l) * x[l];
            }
            if (rowPayoff > rowValue + TOLERANCE || colPayoff > colValue + TOLERANCE) {
                return Optional.empty();
            }
        }
        return Optional.of(StrategyProfile.of(clean(x), clean(y)));
    }

    /**
     * Builds and solves the system: for every {@code own} in {@code indifferentSupport},
     * sum over {@code opp} in {@code mixedSupport} of matrix[own][opp] * p_opp - v = 0, and
     * the p values sum to one. Unknowns are the p values followed by v. The same form serves
     * both players because the column player's payoffs are the transpose.
     */
    private static Optional<double[]> solveIndifference(PayoffMatrix matrix, int[] indifferentSupport,
                                                        int[] mixedSupport) {
        int unknowns = mixedSupport.length + 1;
        int equations = indifferentSupport.length + 1;
        double[][] a = new double[equations][unknowns];
        double[] b = new double[equations];

        for (int e = 0; e < indifferentSupport.length; e++) {
            for (int u = 0; u < mixedSupport.length; u++) {
                a[e][u] = matrix.get(indifferentSupport[e], mixedSupport[u]);
            }
            a[e][mixedSupport.length] = -1.0;
        }
        for (int u = 0; u < mixedSupport.length; u++) {
            a[indifferentSupport.length][u] = 1.0;
        }
        b[indifferentSupport.length] = 1.0;
        return LinearSystems.solveUnique(a, b);
    }

    private static double[] expand(double[] solution, int[] support, int size) {
        double[] full = new double[size];
        for (int i = 0; i < support.length; i++) {
            full[support[i]] = solution[i];
        }
        return full;
    }

    private static boolean positiveOnSupport(double[] distribution, int[] support) {
        for (int index : support) {
            if (distribution[index] <= TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    private static double[] clean(double[] distribution) {
        double[] cleaned = new double[distribution.length];
        double sum = 0.0;
        for (int i = 0; i < distribution.length; i++) {
            cleaned[i] = distribution[i] < TOLERANCE ? 0.0 : distribution[i];
            sum += cleaned[i];
        }
        for (int i = 0; i < cleaned.length; i++) {
            cleaned[i] /= sum;
        }
        return cleaned;
    }

    private static boolean containsProfile(List<StrategyProfile> found, StrategyProfile candidate) {
        for (StrategyProfile existing : found) {
            if (close(existing.row(), candidate.row()) && close(existing.column(), candidate.column())) {
                return true;
            }
        }
        return false;
    }

    private static boolean close(List<Double> a, List<Double> b) {
        for (int i = 0; i < a.size(); i++) {
            if (Math.abs(a.get(i) - b.get(i)) > DUPLICATE_TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    /**
     * All non-empty subsets of {0..n-1}, smallest first, each in ascending order.
     */
    static List<int[]> supportsBySize(int n) {
        List<int[]> result = new ArrayList<>();
        for (int size = 1; size <= n; size++) {
            collect(n, size, 0, new int[size], 0, result);
        }
        return result;
    }

    private static void collect(int n, int size, int start, int[] current, int depth, List<int[]> out) {
        if (depth == size) {
            out.add(current.clone());
            return;
        }
        for (int i = start; i <= n - (size - depth); i++) {
            current[depth] = i;
            collect(n, size, i + 1, current, depth + 1, out);
        }
    }
}
