package com.hybridmatrix;

/**
 * Active numeric representation of a matrix. Constants are declared in
 * promotion order, so a later constant is the wider one.
 */
public enum NumericMode {
    REAL("real"),
    BIG_INTEGER("integer"),
    COMPLEX("complex");

    private final String keyword;

    NumericMode(String keyword) { this.keyword = keyword; }

    /** Lower-case name used in text headers ({@code real}, {@code integer}, {@code complex}). */
    public String keyword() { return keyword; }

    public NumOps<? extends Entry> ops() {
        switch (this) {
            case COMPLEX: return ComplexOps.INSTANCE;
            case BIG_INTEGER: return BigIntOps.INSTANCE;
            default: return RealOps.INSTANCE;
        }
    }

    public static NumericMode widest(NumericMode a, NumericMode b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * Any complex entry makes the grid complex; otherwise any integer entry
     * makes it integer; otherwise it is real. An empty grid is real.
     */
    public static NumericMode detect(Entry[][] grid) {
        NumericMode mode = REAL;
        for (Entry[] row : grid) {
            for (Entry e : row) {
                if (e.mode() == COMPLEX) return COMPLEX;
                mode = widest(mode, e.mode());
            }
        }
        return mode;
    }

    public static NumericMode fromKeyword(String keyword) {
        for (NumericMode m : values()) {
            if (m.keyword.equalsIgnoreCase(keyword)) return m;
        }
        throw new IllegalArgumentException("Unknown numeric mode: " + keyword);
    }
}
