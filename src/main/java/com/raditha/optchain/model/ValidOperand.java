package com.raditha.optchain.model;

/**
 * A guard operand that may take part in an optional chain.
 *
 * @param comparedName   id of the expression being guarded
 * @param comparisonKind canonical shape of the guard
 * @param node           id of the whole operand expression
 */
public record ValidOperand(int comparedName, ComparisonKind comparisonKind, int node) implements Operand {

    @Override
    public boolean isValid() {
        return true;
    }
}
