package com.hybridmatrix;

final class ComplexOps implements NumOps<Complex> {
    static final ComplexOps INSTANCE = new ComplexOps();

    private ComplexOps() {}

    @Override public NumericMode mode() { return NumericMode.COMPLEX; }

    @Override public Complex zero() { return Complex.ZERO; }
    @Override public Complex one()  { return Complex.ONE; }

    @Override public Complex add(Complex a, Complex b) { return Complex.of(a.re() + b.re(), a.im() + b.im()); }
    @Override public Complex sub(Complex a, Complex b) { return Complex.of(a.re() - b.re(), a.im() - b.im()); }

    @Override public Complex mul(Complex a, Complex b) {
        return Complex.of(a.re() * b.re() - a.im() * b.im(),
                          a.re() * b.im() + a.im() * b.re());
    }

    @Override public Complex div(Complex a, Complex b) {
        double denom = b.re() * b.re() + b.im() * b.im();
        if (denom == 0.0) {
            throw new MatrixException(MatrixException.Reason.DIVISION_BY_ZERO, "Division by zero (complex)");
        }
        return Complex.of((a.re() * b.re() + a.im() * b.im()) / denom,
                          (a.im() * b.re() - a.re() * b.im()) / denom);
    }

    @Override public Complex negate(Complex a) { return Complex.of(-a.re(), -a.im()); }

    @Override public boolean eq(Complex a, Complex b, double tolerance) {
        return Math.abs(a.re() - b.re()) < tolerance && Math.abs(a.im() - b.im()) < tolerance;
    }

    @Override public boolean isZero(Complex a, double tolerance) {
        return Math.abs(a.re()) < tolerance && Math.abs(a.im()) < tolerance;
    }

    @Override public Complex conjugate(Complex a) { return Complex.of(a.re(), -a.im()); }

    @Override public String toDisplay(Complex a) { return a.toString(); }

    @Override public Complex coerce(Entry e) { return Coercion.toComplex(e); }
}
