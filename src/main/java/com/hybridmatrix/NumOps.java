package com.hybridmatrix;

/**
 * Arithmetic for one {@link NumericMode}. Implementations are stateless
 * singletons; algorithm code selects one per call through
 * {@link NumericMode#ops()} and threads it through its loops.
 */
public interface NumOps<T extends Entry> {
    double DEFAULT_TOLERANCE = 1e-9;

    NumericMode mode();

    T zero();
    T one();

    T add(T a, T b);
    T sub(T a, T b);
    T mul(T a, T b);

    /**
     * @throws MatrixException {@code DIVISION_BY_ZERO} when {@code b} is zero,
     *         {@code NON_EXACT_DIVISION} when the mode only allows exact quotients
     */
    T div(T a, T b);

    T negate(T a);

    boolean eq(T a, T b, double tolerance);
    default boolean eq(T a, T b) { return eq(a, b, DEFAULT_TOLERANCE); }

    boolean isZero(T a, double tolerance);
    default boolean isZero(T a) { return isZero(a, DEFAULT_TOLERANCE); }

    T conjugate(T a);

    String toDisplay(T a);

    /**
     * Converts any entry into this mode.
     *
     * @throws MatrixException {@code UNSUPPORTED_COERCION} when the value has no
     *         representation in this mode
     */
    T coerce(Entry e);
}
