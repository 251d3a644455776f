package com.hybridmatrix;

import java.math.BigInteger;
import java.util.Objects;

/** Immutable arbitrary-precision integer entry. */
public final class BigInt implements Entry {
    public static final BigInt ZERO = new BigInt(BigInteger.ZERO);
    public static final BigInt ONE  = new BigInt(BigInteger.ONE);

    private final BigInteger value;

    private BigInt(BigInteger value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    /** Factories */
    public static BigInt of(long k) { return new BigInt(BigInteger.valueOf(k)); }
    public static BigInt of(BigInteger k) { return new BigInt(k); }

    /** Parse a decimal integer such as {@code "-42"} (whitespace ok). */
    public static BigInt parse(String s) { return new BigInt(new BigInteger(s.trim())); }

    public BigInteger value() { return value; }

    @Override public NumericMode mode() { return NumericMode.BIG_INTEGER; }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BigInt)) return false;
        return value.equals(((BigInt) obj).value);
    }

    @Override public int hashCode() { return value.hashCode(); }

    @Override public String toString() { return value.toString(); }
}
