package com.raditha.optchain.model;

/**
 * Canonical shape of a guard operand.
 */
public enum ComparisonKind {
    /** {@code x != null}, {@code x != undefined} */
    NOT_EQUAL_NULL_OR_UNDEFINED,
    /** {@code x == null}, {@code x == undefined} */
    EQUAL_NULL_OR_UNDEFINED,

    /** {@code x !== null} */
    NOT_STRICT_EQUAL_NULL,
    /** {@code x === null} */
    STRICT_EQUAL_NULL,

    /** {@code x !== undefined}, {@code typeof x !== 'undefined'} */
    NOT_STRICT_EQUAL_UNDEFINED,
    /** {@code x === undefined}, {@code typeof x === 'undefined'} */
    STRICT_EQUAL_UNDEFINED,

    /** {@code !x} */
    NOT_BOOLEAN,
    /** {@code x} */
    BOOLEAN
}
