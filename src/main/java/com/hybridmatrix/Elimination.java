package com.hybridmatrix;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Row-reduction kernels shared by {@link Matrix#determinant()},
 * {@link Matrix#inverse()} and {@link Matrix#rank(double)}.
 *
 * <p>Every routine works on a private copy of the grid it is given; the
 * caller's entries are never touched, so a failure part way through leaves
 * the source matrix as it was. Pivots are chosen as the first entry that is
 * not zero in the current column, not by magnitude.
 */
final class Elimination {

    private static final Logger log = LoggerFactory.getLogger(Elimination.class);

    private Elimination() {}

    /**
     * Gaussian elimination with row swaps. In integer mode every multiplier
     * must divide exactly, so this can fail with {@code NON_EXACT_DIVISION}
     * even though the determinant itself is an integer.
     */
    static <T extends Entry> T determinant(Entry[][] source, NumOps<T> ops) {
        T[][] a = Coercion.coerceGrid(source, ops);
        int n = a.length;
        T det = ops.one();
        boolean negate = false;

        for (int i = 0; i < n; i++) {
            int pivotRow = firstPivot(a, i, i, ops, NumOps.DEFAULT_TOLERANCE);
            if (pivotRow < 0) {
                log.debug("No pivot in column {}; determinant is zero", i);
                return ops.zero();
            }
            if (pivotRow != i) {
                swap(a, i, pivotRow);
                negate = !negate;
            }
            T pivot = a[i][i];
            det = ops.mul(det, pivot);

            for (int r = i + 1; r < n; r++) {
                if (ops.isZero(a[r][i])) continue;
                T mult = ops.div(a[r][i], pivot);
                for (int c = i; c < n; c++) {
                    a[r][c] = ops.sub(a[r][c], ops.mul(mult, a[i][c]));
                }
            }
        }
        return negate ? ops.negate(det) : det;
    }

    /**
     * Gauss-Jordan elimination on {@code [A | I]}; returns the right half.
     *
     * @throws MatrixException {@code SINGULAR} when a column has no pivot
     */
    static <T extends Entry> Entry[][] inverse(Entry[][] source, NumOps<T> ops) {
        T[][] a = Coercion.coerceGrid(source, ops);
        int n = a.length;
        int w = 2 * n;

        T[][] aug = Coercion.newGrid(n, w);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                aug[i][j] = a[i][j];
                aug[i][n + j] = i == j ? ops.one() : ops.zero();
            }
        }

        for (int col = 0; col < n; col++) {
            int pivotRow = firstPivot(aug, col, col, ops, NumOps.DEFAULT_TOLERANCE);
            if (pivotRow < 0) {
                throw new MatrixException(MatrixException.Reason.SINGULAR,
                        "Matrix is singular (no pivot in column " + col + ")");
            }
            if (pivotRow != col) swap(aug, col, pivotRow);

            T pivot = aug[col][col];
            for (int j = 0; j < w; j++) {
                aug[col][j] = ops.div(aug[col][j], pivot);
            }

            for (int r = 0; r < n; r++) {
                if (r == col) continue;
                T factor = aug[r][col];
                if (ops.isZero(factor)) continue;
                for (int j = 0; j < w; j++) {
                    aug[r][j] = ops.sub(aug[r][j], ops.mul(factor, aug[col][j]));
                }
            }
        }

        Entry[][] inv = new Entry[n][n];
        for (int i = 0; i < n; i++) {
            System.arraycopy(aug[i], n, inv[i], 0, n);
        }
        return inv;
    }

    /**
     * Row-echelon rank. Real and complex grids clear each row below a pivot
     * with one scale-and-subtract step. Integer grids use Bareiss
     * elimination: {@code (p*row - x*pivotRow) / prev}, where {@code prev}
     * is the previous pivot. That division is always exact, so entries stay
     * the size of minors of the input and the count is exact.
     */
    static <T extends Entry> int rank(Entry[][] source, NumOps<T> ops, double tolerance) {
        T[][] a = Coercion.coerceGrid(source, ops);
        int m = a.length;
        int n = m == 0 ? 0 : a[0].length;
        boolean exact = ops.mode() == NumericMode.BIG_INTEGER;
        T prev = ops.one();

        int rank = 0;
        int row = 0;
        for (int col = 0; col < n && row < m; col++) {
            int sel = firstPivot(a, col, row, ops, tolerance);
            if (sel < 0) continue;
            swap(a, row, sel);
            T pivot = a[row][col];

            for (int r = row + 1; r < m; r++) {
                T x = a[r][col];
                if (exact) {
                    // every row below is rescaled, zero leading entry or not
                    for (int j = col + 1; j < n; j++) {
                        a[r][j] = ops.div(ops.sub(ops.mul(pivot, a[r][j]), ops.mul(x, a[row][j])), prev);
                    }
                } else {
                    if (ops.isZero(x, tolerance)) continue;
                    T factor = ops.div(x, pivot);
                    for (int j = col + 1; j < n; j++) {
                        a[r][j] = ops.sub(a[r][j], ops.mul(factor, a[row][j]));
                    }
                }
                a[r][col] = ops.zero();
            }
            prev = pivot;
            row++;
            rank++;
        }
        log.debug("Rank of {}x{} {} grid is {}", m, n, ops.mode().keyword(), rank);
        return rank;
    }

    private static <T extends Entry> int firstPivot(T[][] a, int col, int from, NumOps<T> ops, double tolerance) {
        for (int r = from; r < a.length; r++) {
            if (!ops.isZero(a[r][col], tolerance)) return r;
        }
        return -1;
    }

    private static <T> void swap(T[][] a, int i, int j) {
        if (i == j) return;
        T[] tmp = a[i];
        a[i] = a[j];
        a[j] = tmp;
    }
}
