package com.hybridmatrix;

/** Immutable complex entry with floating-point components. */
public final class Complex implements Entry {
    public static final Complex ZERO = new Complex(0.0, 0.0);
    public static final Complex ONE  = new Complex(1.0, 0.0);

    private final double re;
    private final double im;

    private Complex(double re, double im) {
        this.re = re;
        this.im = im;
    }

    public static Complex of(double re, double im) { return new Complex(re, im); }
    public static Complex of(double re) { return new Complex(re, 0.0); }

    /**
     * Parse {@code "a"}, {@code "bi"}, {@code "a+bi"} or {@code "a-bi"}; a bare
     * {@code "i"} or {@code "-i"} means a unit imaginary part.
     */
    public static Complex parse(String s) {
        String t = s.trim();
        if (t.isEmpty()) throw new NumberFormatException("Empty complex literal");
        if (!t.endsWith("i")) return new Complex(Double.parseDouble(t), 0.0);

        String body = t.substring(0, t.length() - 1);
        int split = -1;
        for (int k = body.length() - 1; k > 0; k--) {
            char ch = body.charAt(k);
            if ((ch == '+' || ch == '-') && Character.toLowerCase(body.charAt(k - 1)) != 'e') {
                split = k;
                break;
            }
        }
        if (split < 0) return new Complex(0.0, imaginary(body));
        return new Complex(Double.parseDouble(body.substring(0, split)), imaginary(body.substring(split)));
    }

    private static double imaginary(String coefficient) {
        if (coefficient.isEmpty() || coefficient.equals("+")) return 1.0;
        if (coefficient.equals("-")) return -1.0;
        return Double.parseDouble(coefficient);
    }

    public double re() { return re; }
    public double im() { return im; }

    @Override public NumericMode mode() { return NumericMode.COMPLEX; }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Complex)) return false;
        Complex o = (Complex) obj;
        return Double.compare(re, o.re) == 0 && Double.compare(im, o.im) == 0;
    }

    @Override public int hashCode() { return Double.hashCode(re) * 31 + Double.hashCode(im); }

    /** {@code re+imi}, e.g. {@code 2+1i}, {@code 2-1i}, {@code 0+3i}. */
    @Override public String toString() {
        return Real.format(re) + (im >= 0 || Double.isNaN(im) ? "+" : "") + Real.format(im) + "i";
    }
}
