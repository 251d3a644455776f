package com.hybridmatrix;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

/**
 * Tests for the matrix container: construction, bounds-checked access, mode
 * detection and invalidation, copying, transposes and mixed-mode arithmetic.
 */
public class MatrixTest {

    private static Matrix complex2x2() {
        return Matrix.fromArray(new Entry[][] {
                { Complex.of(1, 0), Complex.of(2, 1) },
                { Complex.of(2, -1), Complex.of(3, 0) }
        });
    }

    @Test
    public void testConstructorFillsAndValidates() {
        Matrix m = new Matrix(2, 3);
        assertEquals(2, m.rows());
        assertEquals(3, m.cols());
        assertEquals("2 x 3", m.dimension());
        assertEquals(Real.ZERO, m.get(1, 2));
        assertEquals(NumericMode.REAL, m.mode());

        Matrix filled = new Matrix(2, 2, BigInt.of(7));
        assertEquals(NumericMode.BIG_INTEGER, filled.mode());
        assertEquals(BigInt.of(7), filled.get(1, 1));

        MatrixException e = assertThrows(MatrixException.class, () -> new Matrix(0, 2));
        assertEquals(MatrixException.Reason.INVALID_DIMENSIONS, e.reason());
        e = assertThrows(MatrixException.class, () -> new Matrix(2, -1));
        assertEquals(MatrixException.Reason.INVALID_DIMENSIONS, e.reason());
    }

    @Test
    public void testFromArrayRejectsJaggedAndEmpty() {
        MatrixException e = assertThrows(MatrixException.class, () -> Matrix.fromArray(new Entry[][] {
                { Real.of(1), Real.of(2) },
                { Real.of(3) }
        }));
        assertEquals(MatrixException.Reason.SHAPE_MISMATCH, e.reason());
        e = assertThrows(MatrixException.class, () -> Matrix.fromArray(new Entry[0][0]));
        assertEquals(MatrixException.Reason.SHAPE_MISMATCH, e.reason());
        e = assertThrows(MatrixException.class, () -> Matrix.ofReals(new double[][] { {} }));
        assertEquals(MatrixException.Reason.SHAPE_MISMATCH, e.reason());
    }

    @Test
    public void testBoundsChecks() {
        Matrix m = new Matrix(2, 2);
        for (int[] rc : new int[][] { { -1, 0 }, { 2, 0 }, { 0, 2 }, { 0, -1 } }) {
            MatrixException e = assertThrows(MatrixException.class, () -> m.get(rc[0], rc[1]));
            assertEquals(MatrixException.Reason.INDEX_OUT_OF_RANGE, e.reason());
            e = assertThrows(MatrixException.class, () -> m.set(rc[0], rc[1], Real.ONE));
            assertEquals(MatrixException.Reason.INDEX_OUT_OF_RANGE, e.reason());
        }
    }

    @Test
    public void testRoundTripAndNoAliasing() {
        Entry[][] g = {
                { Real.of(1.5), Real.of(-2) },
                { Real.of(0), Real.of(4.25) },
                { Real.of(7), Real.of(8) }
        };
        Matrix m = Matrix.fromArray(g);
        assertArrayEquals(g, m.toArray());

        g[0][0] = Real.of(99);
        assertEquals(Real.of(1.5), m.get(0, 0), "source array is copied");

        Entry[][] out = m.toArray();
        out[1][1] = Real.of(99);
        assertEquals(Real.of(4.25), m.get(1, 1), "toArray returns a copy");

        Entry[][] c = complex2x2().toArray();
        assertArrayEquals(c, Matrix.fromArray(c).toArray());
    }

    @Test
    public void testMixedIntegerAndRealTruncatesOnDetection() {
        Matrix m = Matrix.fromArray(new Entry[][] {
                { Real.of(1.7), BigInt.of(2) },
                { Real.of(-2.9), Real.of(4) }
        });
        assertEquals(NumericMode.BIG_INTEGER, m.mode());
        assertEquals(BigInt.of(1), m.get(0, 0));
        assertEquals(BigInt.of(-2), m.get(1, 0));
        assertEquals(BigInt.of(4), m.get(1, 1));
    }

    @Test
    public void testSetInvalidatesMode() {
        Matrix m = Matrix.ofReals(new double[][] { { 1, 2 }, { 3, 4 } });
        assertEquals(NumericMode.REAL, m.mode());

        m.set(0, 1, Complex.of(0, 1));
        assertEquals(NumericMode.COMPLEX, m.mode());

        m.set(0, 1, Real.of(2.5));
        assertEquals(NumericMode.REAL, m.mode());

        m.set(1, 1, BigInt.of(4));
        assertEquals(NumericMode.BIG_INTEGER, m.mode());
        assertEquals(BigInt.of(2), m.get(0, 1));
    }

    @Test
    public void testCopyIsIndependent() {
        Matrix m = Matrix.ofIntegers(new long[][] { { 1, 2 }, { 3, 4 } });
        Matrix c = m.copy();
        assertEquals(m, c);
        c.set(0, 0, Complex.of(5, 5));
        assertEquals(BigInt.of(1), m.get(0, 0));
        assertEquals(NumericMode.BIG_INTEGER, m.mode());
        assertEquals(NumericMode.COMPLEX, c.mode());
    }

    @Test
    public void testTranspose() {
        Matrix m = Matrix.ofReals(new double[][] { { 1, 2, 3 }, { 4, 5, 6 } });
        Matrix t = m.transpose();
        assertEquals(3, t.rows());
        assertEquals(2, t.cols());
        assertEquals(Real.of(4), t.get(0, 1));
        assertEquals(Real.of(3), t.get(2, 0));
        assertEquals(m, t.transpose());
    }

    @Test
    public void testConjugateTranspose() {
        Matrix m = Matrix.fromArray(new Entry[][] {
                { Complex.of(1, 1), Real.of(2) },
                { Complex.of(0, -3), BigInt.of(4) }
        });
        Matrix h = m.conjugateTranspose();
        assertEquals(Complex.of(1, -1), h.get(0, 0));
        assertEquals(Complex.of(0, 3), h.get(0, 1));
        assertEquals(Real.of(2), h.get(1, 0));
        assertEquals(BigInt.of(4), h.get(1, 1));
        assertEquals(NumericMode.COMPLEX, h.mode());

        Matrix real = Matrix.ofReals(new double[][] { { 1, 2 }, { 3, 4 } });
        assertEquals(real.transpose(), real.conjugateTranspose());
    }

    @Test
    public void testMultiply() {
        Matrix a = Matrix.ofReals(new double[][] { { 1, 2 }, { 3, 4 } });
        Matrix b = Matrix.ofReals(new double[][] { { 5, 6 }, { 7, 8 } });
        Matrix expected = Matrix.ofReals(new double[][] { { 19, 22 }, { 43, 50 } });
        assertTrue(a.multiply(b).equals(expected, 1e-12));

        Matrix row = Matrix.ofReals(new double[][] { { 1, 2, 3 } });
        Matrix col = Matrix.ofReals(new double[][] { { 4 }, { 5 }, { 6 } });
        Matrix dot = row.multiply(col);
        assertEquals("1 x 1", dot.dimension());
        assertEquals(Real.of(32), dot.get(0, 0));

        MatrixException e = assertThrows(MatrixException.class, () -> row.multiply(row));
        assertEquals(MatrixException.Reason.DIMENSION_MISMATCH, e.reason());
    }

    @Test
    public void testMultiplyPromotesToWidestMode() {
        Matrix real = Matrix.ofReals(new double[][] { { 1, 2 } });
        Matrix complex = Matrix.fromArray(new Entry[][] { { Complex.of(1, 1) }, { Complex.of(2, -1) } });
        Matrix p = real.multiply(complex);
        assertEquals(NumericMode.COMPLEX, p.mode());
        assertEquals(Complex.of(5, -1), p.get(0, 0));

        // reals are truncated when the other operand is integer
        Matrix fractional = Matrix.ofReals(new double[][] { { 1.5, 2 } });
        Matrix ints = Matrix.ofIntegers(new long[][] { { 3 }, { 4 } });
        Matrix q = fractional.multiply(ints);
        assertEquals(NumericMode.BIG_INTEGER, q.mode());
        assertEquals(BigInt.of(11), q.get(0, 0));
        assertEquals(NumericMode.REAL, fractional.mode(), "operands keep their own mode");
    }

    @Test
    public void testMultiplyByIdentity() {
        Matrix[] samples = {
                Matrix.ofReals(new double[][] { { 1.5, -2 }, { 0.25, 9 } }),
                Matrix.ofIntegers(new long[][] { { 1, 2, 3 }, { 4, 5, 6 }, { 7, 8, 9 } }),
                complex2x2()
        };
        for (Matrix a : samples) {
            Matrix product = a.multiply(Matrix.identity(a.rows(), a.mode()));
            assertTrue(product.equals(a, NumOps.DEFAULT_TOLERANCE), "A*I == A for " + a.mode());
        }
    }

    @Test
    public void testAddAndSubtract() {
        Matrix a = Matrix.ofIntegers(new long[][] { { 1, 2 }, { 3, 4 } });
        Matrix b = Matrix.ofIntegers(new long[][] { { 10, 20 }, { 30, 40 } });
        assertEquals(Matrix.ofIntegers(new long[][] { { 11, 22 }, { 33, 44 } }), a.add(b));
        assertEquals(Matrix.ofIntegers(new long[][] { { 9, 18 }, { 27, 36 } }), b.subtract(a));

        Matrix c = complex2x2().subtract(complex2x2());
        assertTrue(c.isZeroMatrix());
        assertEquals(NumericMode.COMPLEX, c.mode());

        MatrixException e = assertThrows(MatrixException.class, () -> a.add(new Matrix(2, 3)));
        assertEquals(MatrixException.Reason.DIMENSION_MISMATCH, e.reason());
    }

    @Test
    public void testEqualityNeedsSameShapeAndMode() {
        Matrix real = Matrix.identity(2);
        Matrix ints = Matrix.identity(2, NumericMode.BIG_INTEGER);
        assertFalse(real.equals(ints, 1.0));
        assertNotEquals(real, ints);
        assertFalse(real.equals(Matrix.identity(3), 1.0));
        assertFalse(real.equals(null, 1.0));

        Matrix near = Matrix.ofReals(new double[][] { { 1 + 1e-12, 0 }, { 0, 1 } });
        assertTrue(real.equals(near, NumOps.DEFAULT_TOLERANCE));
        assertNotEquals(real, near);
        assertFalse(real.equals(near, 1e-15));
    }

    @Test
    public void testHashCodeConsistentWithEquals() {
        Matrix a = Matrix.ofIntegers(new long[][] { { 1, 2 }, { 3, 4 } });
        Matrix b = Matrix.fromArray(a.toArray());
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());

        // a real entry inside a complex matrix compares as its complex widening
        Matrix c1 = Matrix.fromArray(new Entry[][] { { Real.of(1), Complex.of(0, 1) } });
        Matrix c2 = Matrix.fromArray(new Entry[][] { { Complex.of(1, 0), Complex.of(0, 1) } });
        assertEquals(c1, c2);
        assertEquals(c1.hashCode(), c2.hashCode());
    }

    @Test
    public void testFormat() {
        Matrix m = Matrix.ofReals(new double[][] { { 1, -2.5 }, { 10, 3 } });
        String nl = System.lineSeparator();
        assertEquals(" 1  -2.5" + nl + "10     3" + nl, m.format());
        assertEquals(m.format(), m.toString());

        String c = complex2x2().format();
        assertTrue(c.contains("2+1i"));
        assertTrue(c.contains("2-1i"));
    }

    @Test
    public void testConcurrentReadsAfterSetResolveModeOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (int round = 0; round < 200; round++) {
                Matrix m = Matrix.ofIntegers(new long[][] { { 0, 0 }, { 0, 0 } });
                m.set(0, 0, BigInt.of(0));
                List<Callable<Boolean>> reads = new ArrayList<>();
                for (int t = 0; t < 4; t++) reads.add(m::isZeroMatrix);
                for (Future<Boolean> f : pool.invokeAll(reads)) assertTrue(f.get());
                assertEquals(NumericMode.BIG_INTEGER, m.mode());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
