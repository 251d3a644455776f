package com.hybridmatrix;

/**
 * What the report CLI prints for one input matrix. With no operation flag
 * set, the determinant and the rank are printed.
 */
public final class ReportOptions {
    public final boolean determinant;
    public final boolean rank;
    public final boolean inverse;
    public final boolean transpose;
    public final double tolerance;          // zero threshold for rank / orthogonality

    private ReportOptions(Builder b) {
        boolean none = !b.determinant && !b.rank && !b.inverse && !b.transpose;
        this.determinant = b.determinant || none;
        this.rank = b.rank || none;
        this.inverse = b.inverse;
        this.transpose = b.transpose;
        this.tolerance = b.tolerance;
    }

    public static final class Builder {
        private boolean determinant, rank, inverse, transpose;
        private double tolerance = NumOps.DEFAULT_TOLERANCE;

        public Builder determinant(boolean v){ this.determinant=v; return this; }
        public Builder rank(boolean v){ this.rank=v; return this; }
        public Builder inverse(boolean v){ this.inverse=v; return this; }
        public Builder transpose(boolean v){ this.transpose=v; return this; }
        public Builder tolerance(double v){
            if (!(v > 0)) throw new IllegalArgumentException("Tolerance must be positive: " + v);
            this.tolerance=v; return this;
        }
        public ReportOptions build(){ return new ReportOptions(this); }
    }
}
