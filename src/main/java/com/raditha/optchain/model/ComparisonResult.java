package com.raditha.optchain.model;

/**
 * Structural relation between two expressions. This is not a value comparison.
 */
public enum ComparisonResult {
    /** The two expressions are the same and one of them is a redundant guard. */
    EQUAL,
    /** The right expression extends the left one with further member or call access. */
    SUBSET,
    /** No safe relation; a chain must break here. */
    INVALID
}
