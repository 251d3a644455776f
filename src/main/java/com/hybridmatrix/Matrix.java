package com.hybridmatrix;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A dense matrix whose entries are reals, arbitrary-precision integers or
 * complex numbers. Rows and columns are indexed from zero.
 *
 * <p>The numeric mode is derived from the entries on first use and cached
 * until the next {@link #set}. Resolving to {@link NumericMode#BIG_INTEGER}
 * truncates any real entries toward zero; this is lossy and is logged.
 *
 * <p>Not thread-safe: {@code set} mutates the grid and the cached mode
 * without synchronization. Read-only operations may run concurrently as
 * long as no {@code set} runs at the same time.
 */
public class Matrix {

    private static final Logger log = LoggerFactory.getLogger(Matrix.class);

    private final int rows;
    private final int cols;
    private final Entry[][] data;

    private NumericMode mode;                  // null until resolved

    /** Constructs a {@code rows × cols} matrix of real zeros. */
    public Matrix(int rows, int cols) {
        this(rows, cols, Real.ZERO);
    }

    /** Constructs a {@code rows × cols} matrix with every entry set to {@code fill}. */
    public Matrix(int rows, int cols, Entry fill) {
        if (rows <= 0 || cols <= 0) {
            throw new MatrixException(MatrixException.Reason.INVALID_DIMENSIONS,
                    "rows and cols must be positive, got " + rows + " x " + cols);
        }
        if (fill == null) throw new IllegalArgumentException("fill value is null");
        this.rows = rows;
        this.cols = cols;
        this.data = new Entry[rows][cols];
        for (Entry[] row : data) Arrays.fill(row, fill);
    }

    // takes ownership of grid
    private Matrix(Entry[][] grid, NumericMode mode) {
        this.rows = grid.length;
        this.cols = grid[0].length;
        this.data = grid;
        this.mode = mode;
    }

    /**
     * Builds a matrix from a rectangular array, copying it.
     *
     * @throws MatrixException {@code SHAPE_MISMATCH} for empty or jagged input
     *         or null entries
     */
    public static Matrix fromArray(Entry[][] grid) {
        if (grid == null || grid.length == 0 || grid[0] == null || grid[0].length == 0) {
            throw new MatrixException(MatrixException.Reason.SHAPE_MISMATCH, "Input must be a non-empty 2D array");
        }
        int n = grid[0].length;
        Entry[][] copy = new Entry[grid.length][];
        for (int i = 0; i < grid.length; i++) {
            if (grid[i] == null || grid[i].length != n) {
                throw new MatrixException(MatrixException.Reason.SHAPE_MISMATCH,
                        "Jagged array not supported: row " + i + " does not have " + n + " columns");
            }
            for (int j = 0; j < n; j++) {
                if (grid[i][j] == null) {
                    throw new MatrixException(MatrixException.Reason.SHAPE_MISMATCH,
                            "Null entry at (" + i + ", " + j + ")");
                }
            }
            copy[i] = grid[i].clone();
        }
        Matrix m = new Matrix(copy, null);
        m.resolve();
        return m;
    }

    public static Matrix ofReals(double[][] values) {
        Entry[][] grid = new Entry[values.length][];
        for (int i = 0; i < values.length; i++) {
            grid[i] = new Entry[values[i].length];
            for (int j = 0; j < values[i].length; j++) grid[i][j] = Real.of(values[i][j]);
        }
        return fromArray(grid);
    }

    public static Matrix ofIntegers(long[][] values) {
        Entry[][] grid = new Entry[values.length][];
        for (int i = 0; i < values.length; i++) {
            grid[i] = new Entry[values[i].length];
            for (int j = 0; j < values[i].length; j++) grid[i][j] = BigInt.of(values[i][j]);
        }
        return fromArray(grid);
    }

    public static Matrix identity(int n) {
        return identity(n, NumericMode.REAL);
    }

    public static Matrix identity(int n, NumericMode mode) {
        if (n <= 0) {
            throw new MatrixException(MatrixException.Reason.INVALID_DIMENSIONS, "n must be positive, got " + n);
        }
        NumOps<? extends Entry> o = mode.ops();
        Entry[][] grid = new Entry[n][n];
        for (int i = 0; i < n; i++) {
            Arrays.fill(grid[i], o.zero());
            grid[i][i] = o.one();
        }
        return new Matrix(grid, mode);
    }

    public int rows() { return rows; }
    public int cols() { return cols; }

    /** {@code "rows x cols"}. */
    public String dimension() { return rows + " x " + cols; }

    public NumericMode mode() {
        NumericMode m = mode;
        return m != null ? m : resolve();
    }

    public Entry get(int r, int c) {
        checkBounds(r, c);
        return data[r][c];
    }

    /** Sets one entry and drops the cached mode; the next use re-detects it. */
    public void set(int r, int c, Entry value) {
        checkBounds(r, c);
        if (value == null) throw new IllegalArgumentException("value is null");
        data[r][c] = value;
        mode = null;
    }

    private void checkBounds(int r, int c) {
        if (r < 0 || r >= rows || c < 0 || c >= cols) {
            throw new MatrixException(MatrixException.Reason.INDEX_OUT_OF_RANGE,
                    "Index (" + r + ", " + c + ") out of bounds for " + dimension());
        }
    }

    public Matrix copy() {
        return new Matrix(toArray(), mode);
    }

    /** A fresh copy of the grid; entries are immutable and shared. */
    public Entry[][] toArray() {
        Entry[][] out = new Entry[rows][];
        for (int i = 0; i < rows; i++) out[i] = data[i].clone();
        return out;
    }

    public Matrix transpose() {
        Entry[][] t = new Entry[cols][rows];
        for (int i = 0; i < rows; i++)
            for (int j = 0; j < cols; j++)
                t[j][i] = data[i][j];
        return new Matrix(t, null);
    }

    /** Transpose with complex entries conjugated; other entries are copied as they are. */
    public Matrix conjugateTranspose() {
        Entry[][] t = new Entry[cols][rows];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                Entry v = data[i][j];
                t[j][i] = v instanceof Complex ? ComplexOps.INSTANCE.conjugate((Complex) v) : v;
            }
        }
        return new Matrix(t, null);
    }

    // ---- arithmetic ----

    /**
     * Matrix product {@code this · other} in the wider of the two modes.
     *
     * @throws MatrixException {@code DIMENSION_MISMATCH} unless
     *         {@code cols() == other.rows()}
     */
    public Matrix multiply(Matrix other) {
        if (cols != other.rows) {
            throw new MatrixException(MatrixException.Reason.DIMENSION_MISMATCH,
                    "Cannot multiply " + dimension() + " by " + other.dimension());
        }
        NumericMode combined = NumericMode.widest(mode(), other.mode());
        return new Matrix(product(data, other.data, combined.ops()), combined);
    }

    public Matrix add(Matrix other) {
        return elementwise(other, false);
    }

    public Matrix subtract(Matrix other) {
        return elementwise(other, true);
    }

    private Matrix elementwise(Matrix other, boolean subtract) {
        if (rows != other.rows || cols != other.cols) {
            throw new MatrixException(MatrixException.Reason.DIMENSION_MISMATCH,
                    "Shapes differ: " + dimension() + " and " + other.dimension());
        }
        NumericMode combined = NumericMode.widest(mode(), other.mode());
        return new Matrix(sum(data, other.data, combined.ops(), subtract), combined);
    }

    private static <T extends Entry> Entry[][] product(Entry[][] left, Entry[][] right, NumOps<T> ops) {
        T[][] a = Coercion.coerceGrid(left, ops);
        T[][] b = Coercion.coerceGrid(right, ops);
        int n = a.length, inner = b.length, p = b[0].length;
        Entry[][] out = new Entry[n][p];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < p; j++) {
                T acc = ops.zero();
                for (int k = 0; k < inner; k++) acc = ops.add(acc, ops.mul(a[i][k], b[k][j]));
                out[i][j] = acc;
            }
        }
        return out;
    }

    private static <T extends Entry> Entry[][] sum(Entry[][] left, Entry[][] right, NumOps<T> ops, boolean subtract) {
        T[][] a = Coercion.coerceGrid(left, ops);
        T[][] b = Coercion.coerceGrid(right, ops);
        Entry[][] out = new Entry[a.length][a[0].length];
        for (int i = 0; i < a.length; i++)
            for (int j = 0; j < a[0].length; j++)
                out[i][j] = subtract ? ops.sub(a[i][j], b[i][j]) : ops.add(a[i][j], b[i][j]);
        return out;
    }

    // ---- equality ----

    /**
     * Same dimensions, same resolved mode, and entries equal within
     * {@code tolerance} (exactly, in integer mode).
     */
    public boolean equals(Matrix other, double tolerance) {
        if (other == null || rows != other.rows || cols != other.cols) return false;
        NumericMode m = mode();
        if (m != other.mode()) return false;
        return entriesEqual(data, other.data, m.ops(), tolerance);
    }

    private static <T extends Entry> boolean entriesEqual(Entry[][] a, Entry[][] b, NumOps<T> ops, double tolerance) {
        for (int i = 0; i < a.length; i++)
            for (int j = 0; j < a[i].length; j++)
                if (!ops.eq(ops.coerce(a[i][j]), ops.coerce(b[i][j]), tolerance)) return false;
        return true;
    }

    /** Exact equality of shape, mode and entries; see {@link #equals(Matrix, double)} for tolerance. */
    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Matrix)) return false;
        Matrix o = (Matrix) obj;
        NumericMode m = mode();
        if (rows != o.rows || cols != o.cols || m != o.mode()) return false;
        return Arrays.deepEquals(Coercion.coerceGrid(data, m.ops()), Coercion.coerceGrid(o.data, m.ops()));
    }

    @Override public int hashCode() {
        return Arrays.deepHashCode(Coercion.coerceGrid(data, mode().ops()));
    }

    // ---- structure ----

    public boolean isSquare() { return rows == cols; }
    public boolean isRowMatrix() { return rows == 1; }
    public boolean isColumnMatrix() { return cols == 1; }

    public boolean isZeroMatrix() { return Structure.isZero(data, ops()); }
    public boolean isIdentity() { return Structure.isIdentity(data, ops()); }
    public boolean isDiagonal() { return Structure.isDiagonal(data, ops()); }
    public boolean isScalarMatrix() { return Structure.isScalar(data, ops()); }
    public boolean isSymmetric() { return Structure.isSymmetric(data, ops()); }
    public boolean isHermitian() { return Structure.isHermitian(data, ops()); }
    public boolean isUpperTriangular() { return Structure.isUpperTriangular(data, ops()); }
    public boolean isLowerTriangular() { return Structure.isLowerTriangular(data, ops()); }

    public boolean isOrthogonal() { return isOrthogonal(NumOps.DEFAULT_TOLERANCE); }

    /**
     * Orthogonal (real) or unitary (complex): {@code A·Aᵀ} or {@code A·Aᴴ}
     * equals the identity within {@code tolerance}.
     *
     * @throws MatrixException {@code UNSUPPORTED_OPERATION} in integer mode
     */
    public boolean isOrthogonal(double tolerance) {
        NumericMode m = mode();
        if (!isSquare()) return false;
        if (m == NumericMode.BIG_INTEGER) {
            throw new MatrixException(MatrixException.Reason.UNSUPPORTED_OPERATION,
                    "Orthogonal/unitary check not supported in integer mode");
        }
        Matrix adjoint = m == NumericMode.COMPLEX ? conjugateTranspose() : transpose();
        return multiply(adjoint).equals(identity(rows, m), tolerance);
    }

    public MatrixType classify() { return MatrixType.classify(this); }

    /** Human-readable label of the first matching {@link MatrixType}, e.g. {@code "Square Matrix"}. */
    public String type() { return classify().label(); }

    // ---- elimination ----

    /**
     * @throws MatrixException {@code DIMENSION_MISMATCH} when not square;
     *         division failures of the active mode propagate
     */
    public Entry determinant() {
        requireSquare("Determinant");
        return Elimination.determinant(data, ops());
    }

    /**
     * @throws MatrixException {@code DIMENSION_MISMATCH} when not square,
     *         {@code UNSUPPORTED_OPERATION} in integer mode, {@code SINGULAR}
     *         when not invertible
     */
    public Matrix inverse() {
        requireSquare("Inverse");
        NumericMode m = mode();
        if (m == NumericMode.BIG_INTEGER) {
            throw new MatrixException(MatrixException.Reason.UNSUPPORTED_OPERATION,
                    "Inverse is not supported in integer mode");
        }
        return new Matrix(Elimination.inverse(data, m.ops()), m);
    }

    public int rank() { return rank(NumOps.DEFAULT_TOLERANCE); }

    /** Entries with magnitude below {@code tolerance} count as zero (ignored in integer mode). */
    public int rank(double tolerance) {
        return Elimination.rank(data, ops(), tolerance);
    }

    private void requireSquare(String op) {
        if (!isSquare()) {
            throw new MatrixException(MatrixException.Reason.DIMENSION_MISMATCH,
                    op + " only defined for square matrices, got " + dimension());
        }
    }

    // ---- mode ----

    private NumOps<? extends Entry> ops() {
        return mode().ops();
    }

    // writes mode last; readers load the field once
    private NumericMode resolve() {
        NumericMode detected = NumericMode.detect(data);
        if (detected == NumericMode.BIG_INTEGER) {
            int truncated = 0;
            for (Entry[] row : data) {
                for (int j = 0; j < row.length; j++) {
                    if (row[j] instanceof Real) {
                        row[j] = Coercion.toBigInt(row[j]);
                        truncated++;
                    }
                }
            }
            if (truncated > 0) {
                log.warn("Converted {} real entries of a {} matrix to integers (fractional parts dropped)",
                        truncated, dimension());
            }
        }
        log.debug("Resolved {} matrix to {} mode", dimension(), detected.keyword());
        this.mode = detected;
        return detected;
    }

    // ---- display ----

    /** Display strings laid out as an aligned table, one row per line. */
    public String format() {
        String[][] cells = display(data, ops());
        int[] width = new int[cols];
        for (String[] row : cells)
            for (int j = 0; j < cols; j++) width[j] = Math.max(width[j], row[j].length());

        StringBuilder sb = new StringBuilder();
        for (String[] row : cells) {
            for (int j = 0; j < cols; j++) {
                if (j > 0) sb.append("  ");
                for (int pad = row[j].length(); pad < width[j]; pad++) sb.append(' ');
                sb.append(row[j]);
            }
            sb.append(System.lineSeparator());
        }
        return sb.toString();
    }

    static <T extends Entry> String[][] display(Entry[][] grid, NumOps<T> ops) {
        String[][] out = new String[grid.length][];
        for (int i = 0; i < grid.length; i++) {
            out[i] = new String[grid[i].length];
            for (int j = 0; j < grid[i].length; j++) out[i][j] = ops.toDisplay(ops.coerce(grid[i][j]));
        }
        return out;
    }

    @Override public String toString() { return format(); }
}
