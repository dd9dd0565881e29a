package com.raditha.optchain.model;

/**
 * An operand that cannot take part in any chain.
 */
public record InvalidOperand() implements Operand {

    public static final InvalidOperand INSTANCE = new InvalidOperand();

    @Override
    public boolean isValid() {
        return false;
    }
}
