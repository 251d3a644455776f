package com.hybridmatrix;

import java.math.BigInteger;

/** Exact integer arithmetic; division is only defined when it leaves no remainder. */
final class BigIntOps implements NumOps<BigInt> {
    static final BigIntOps INSTANCE = new BigIntOps();

    private BigIntOps() {}

    @Override public NumericMode mode() { return NumericMode.BIG_INTEGER; }

    @Override public BigInt zero() { return BigInt.ZERO; }
    @Override public BigInt one()  { return BigInt.ONE; }

    @Override public BigInt add(BigInt a, BigInt b) { return BigInt.of(a.value().add(b.value())); }
    @Override public BigInt sub(BigInt a, BigInt b) { return BigInt.of(a.value().subtract(b.value())); }
    @Override public BigInt mul(BigInt a, BigInt b) { return BigInt.of(a.value().multiply(b.value())); }

    @Override public BigInt div(BigInt a, BigInt b) {
        if (b.value().signum() == 0) {
            throw new MatrixException(MatrixException.Reason.DIVISION_BY_ZERO, "Division by zero (integer)");
        }
        BigInteger[] qr = a.value().divideAndRemainder(b.value());
        if (qr[1].signum() != 0) {
            throw new MatrixException(MatrixException.Reason.NON_EXACT_DIVISION,
                    "Non-exact division " + a + " / " + b + " in integer mode");
        }
        return BigInt.of(qr[0]);
    }

    @Override public BigInt negate(BigInt a) { return BigInt.of(a.value().negate()); }

    // tolerance does not apply to exact values
    @Override public boolean eq(BigInt a, BigInt b, double tolerance) { return a.value().equals(b.value()); }

    @Override public boolean isZero(BigInt a, double tolerance) { return a.value().signum() == 0; }

    @Override public BigInt conjugate(BigInt a) { return a; }

    @Override public String toDisplay(BigInt a) { return a.toString(); }

    @Override public BigInt coerce(Entry e) { return Coercion.toBigInt(e); }
}
