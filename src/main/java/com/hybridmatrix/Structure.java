package com.hybridmatrix;

/**
 * Read-only structural scans behind the {@code is*} predicates of
 * {@link Matrix}. Each takes the raw grid and the operation set of its
 * resolved mode.
 */
final class Structure {

    private Structure() {}

    static <T extends Entry> boolean isZero(Entry[][] g, NumOps<T> ops) {
        for (Entry[] row : g)
            for (Entry e : row)
                if (!ops.isZero(ops.coerce(e))) return false;
        return true;
    }

    static <T extends Entry> boolean isIdentity(Entry[][] g, NumOps<T> ops) {
        if (!isSquare(g)) return false;
        for (int i = 0; i < g.length; i++) {
            for (int j = 0; j < g.length; j++) {
                T v = ops.coerce(g[i][j]);
                if (i == j ? !ops.eq(v, ops.one()) : !ops.isZero(v)) return false;
            }
        }
        return true;
    }

    static <T extends Entry> boolean isDiagonal(Entry[][] g, NumOps<T> ops) {
        if (!isSquare(g)) return false;
        for (int i = 0; i < g.length; i++)
            for (int j = 0; j < g.length; j++)
                if (i != j && !ops.isZero(ops.coerce(g[i][j]))) return false;
        return true;
    }

    /** Diagonal with every diagonal entry equal to the first. */
    static <T extends Entry> boolean isScalar(Entry[][] g, NumOps<T> ops) {
        if (!isDiagonal(g, ops)) return false;
        T first = ops.coerce(g[0][0]);
        for (int i = 1; i < g.length; i++)
            if (!ops.eq(ops.coerce(g[i][i]), first)) return false;
        return true;
    }

    static <T extends Entry> boolean isSymmetric(Entry[][] g, NumOps<T> ops) {
        if (!isSquare(g)) return false;
        for (int i = 1; i < g.length; i++)
            for (int j = 0; j < i; j++)
                if (!ops.eq(ops.coerce(g[i][j]), ops.coerce(g[j][i]))) return false;
        return true;
    }

    /** {@code a[i][j] == conj(a[j][i])}, which also forces a real diagonal. */
    static <T extends Entry> boolean isHermitian(Entry[][] g, NumOps<T> ops) {
        if (!isSquare(g)) return false;
        for (int i = 0; i < g.length; i++)
            for (int j = 0; j <= i; j++)
                if (!ops.eq(ops.coerce(g[i][j]), ops.conjugate(ops.coerce(g[j][i])))) return false;
        return true;
    }

    static <T extends Entry> boolean isUpperTriangular(Entry[][] g, NumOps<T> ops) {
        if (!isSquare(g)) return false;
        for (int i = 1; i < g.length; i++)
            for (int j = 0; j < i; j++)
                if (!ops.isZero(ops.coerce(g[i][j]))) return false;
        return true;
    }

    static <T extends Entry> boolean isLowerTriangular(Entry[][] g, NumOps<T> ops) {
        if (!isSquare(g)) return false;
        for (int i = 0; i < g.length; i++)
            for (int j = i + 1; j < g.length; j++)
                if (!ops.isZero(ops.coerce(g[i][j]))) return false;
        return true;
    }

    static boolean isSquare(Entry[][] g) { return g.length == g[0].length; }
}
