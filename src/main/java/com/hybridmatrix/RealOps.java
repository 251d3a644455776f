package com.hybridmatrix;

final class RealOps implements NumOps<Real> {
    static final RealOps INSTANCE = new RealOps();

    private RealOps() {}

    @Override public NumericMode mode() { return NumericMode.REAL; }

    @Override public Real zero() { return Real.ZERO; }
    @Override public Real one()  { return Real.ONE; }

    @Override public Real add(Real a, Real b) { return Real.of(a.value() + b.value()); }
    @Override public Real sub(Real a, Real b) { return Real.of(a.value() - b.value()); }
    @Override public Real mul(Real a, Real b) { return Real.of(a.value() * b.value()); }

    @Override public Real div(Real a, Real b) {
        if (b.value() == 0.0) {
            throw new MatrixException(MatrixException.Reason.DIVISION_BY_ZERO, "Division by zero (real)");
        }
        return Real.of(a.value() / b.value());
    }

    @Override public Real negate(Real a) { return Real.of(-a.value()); }

    @Override public boolean eq(Real a, Real b, double tolerance) {
        return Math.abs(a.value() - b.value()) < tolerance;
    }

    @Override public boolean isZero(Real a, double tolerance) {
        return Math.abs(a.value()) < tolerance;
    }

    @Override public Real conjugate(Real a) { return a; }

    @Override public String toDisplay(Real a) { return a.toString(); }

    @Override public Real coerce(Entry e) { return Coercion.toReal(e); }
}
