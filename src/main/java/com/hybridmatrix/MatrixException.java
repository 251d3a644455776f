package com.hybridmatrix;

import java.util.Objects;

/**
 * Unchecked failure raised by matrix construction, access and arithmetic.
 * The {@link Reason} tells callers which rule was violated; the receiver of
 * the failing call is never left half-modified.
 */
public class MatrixException extends RuntimeException {

    public enum Reason {
        INVALID_DIMENSIONS,
        SHAPE_MISMATCH,
        INDEX_OUT_OF_RANGE,
        DIMENSION_MISMATCH,
        DIVISION_BY_ZERO,
        NON_EXACT_DIVISION,
        UNSUPPORTED_OPERATION,
        UNSUPPORTED_COERCION,
        SINGULAR
    }

    private final Reason reason;

    public MatrixException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() { return reason; }
}
