package com.raditha.optchain.model;

/**
 * Classification of one leaf of a flattened logical run.
 * Either a {@link ValidOperand} usable in a chain or an {@link InvalidOperand} boundary.
 */
public interface Operand {

    boolean isValid();
}
