package com.hybridmatrix;

/** Immutable floating-point entry. */
public final class Real implements Entry {
    public static final Real ZERO = new Real(0.0);
    public static final Real ONE  = new Real(1.0);

    private final double value;

    private Real(double value) { this.value = value; }

    public static Real of(double value) { return new Real(value); }

    /** Parse a decimal literal such as {@code "-1.5"} or {@code "3"}. */
    public static Real parse(String s) {
        return new Real(Double.parseDouble(s.trim()));
    }

    public double value() { return value; }

    @Override public NumericMode mode() { return NumericMode.REAL; }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Real)) return false;
        return Double.compare(value, ((Real) obj).value) == 0;
    }

    @Override public int hashCode() { return Double.hashCode(value); }

    @Override public String toString() { return format(value); }

    /** Integral values print without a fractional part: 2.0 prints as {@code 2}. */
    static String format(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }
}
