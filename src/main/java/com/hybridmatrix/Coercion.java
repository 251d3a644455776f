package com.hybridmatrix;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Conversions of single entries between modes. Real-to-integer truncates
 * toward zero. Everything else either converts exactly or fails with
 * {@code UNSUPPORTED_COERCION}, including integers too large for a double.
 */
public final class Coercion {

    private Coercion() {}

    public static Entry coerce(Entry value, NumericMode target) {
        switch (target) {
            case COMPLEX: return toComplex(value);
            case BIG_INTEGER: return toBigInt(value);
            default: return toReal(value);
        }
    }

    public static Complex toComplex(Entry e) {
        if (e instanceof Complex) return (Complex) e;
        if (e instanceof BigInt) return Complex.of(toReal(e).value());
        if (e instanceof Real) return Complex.of(((Real) e).value());
        throw unknown(e);
    }

    /** Lossy for reals with a fractional part: {@code 2.7 -> 2}, {@code -2.7 -> -2}. */
    public static BigInt toBigInt(Entry e) {
        if (e instanceof BigInt) return (BigInt) e;
        if (e instanceof Real) {
            double d = ((Real) e).value();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new MatrixException(MatrixException.Reason.UNSUPPORTED_COERCION,
                        "Cannot coerce non-finite real " + d + " to integer");
            }
            return BigInt.of(BigDecimal.valueOf(d).toBigInteger());
        }
        if (e instanceof Complex) {
            throw new MatrixException(MatrixException.Reason.UNSUPPORTED_COERCION,
                    "Cannot coerce complex " + e + " to integer");
        }
        throw unknown(e);
    }

    /** Exact: complex values need an imaginary part of exactly zero. */
    public static Real toReal(Entry e) {
        if (e instanceof Real) return (Real) e;
        if (e instanceof BigInt) {
            BigInteger v = ((BigInt) e).value();
            double d = v.doubleValue();
            if (Double.isInfinite(d)) {
                throw new MatrixException(MatrixException.Reason.UNSUPPORTED_COERCION,
                        "Integer " + v + " is out of range for a real");
            }
            return Real.of(d);
        }
        if (e instanceof Complex) {
            Complex c = (Complex) e;
            if (c.im() != 0.0) {
                throw new MatrixException(MatrixException.Reason.UNSUPPORTED_COERCION,
                        "Cannot coerce complex " + c + " with nonzero imaginary part to real");
            }
            return Real.of(c.re());
        }
        throw unknown(e);
    }

    /** Fresh grid with every entry converted into the mode of {@code ops}. */
    static <T extends Entry> T[][] coerceGrid(Entry[][] grid, NumOps<T> ops) {
        T[][] out = newGrid(grid.length, grid.length == 0 ? 0 : grid[0].length);
        for (int i = 0; i < grid.length; i++)
            for (int j = 0; j < out[i].length; j++) out[i][j] = ops.coerce(grid[i][j]);
        return out;
    }

    /** Empty working grid; backed by {@code Entry[][]}, so it never leaves this package typed as {@code T[][]}. */
    @SuppressWarnings("unchecked")
    static <T extends Entry> T[][] newGrid(int rows, int cols) {
        return (T[][]) new Entry[rows][cols];
    }

    private static MatrixException unknown(Entry e) {
        return new MatrixException(MatrixException.Reason.UNSUPPORTED_COERCION,
                "Unsupported entry type: " + (e == null ? "null" : e.getClass().getName()));
    }
}
