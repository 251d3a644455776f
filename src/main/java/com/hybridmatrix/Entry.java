package com.hybridmatrix;

/**
 * One matrix entry: a {@link Real}, a {@link BigInt} or a {@link Complex}.
 * Implementations are immutable, so entries can be shared between grids
 * without copying.
 */
public interface Entry {
    /** The narrowest mode that represents this entry without loss. */
    NumericMode mode();
}
