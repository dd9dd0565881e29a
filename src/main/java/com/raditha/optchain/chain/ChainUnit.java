package com.raditha.optchain.chain;

import com.raditha.optchain.model.Range;
import com.raditha.optchain.model.ValidOperand;

import java.util.List;

/**
 * One step of a chain: a single guard or a merged pair such as
 * {@code x !== null && x !== undefined}.
 *
 * @param operands the guards in source order, one or two
 * @param range    source range from the first operand to the last
 */
public record ChainUnit(List<ValidOperand> operands, Range range) {

    public ChainUnit {
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("A chain unit needs at least one operand");
        }
        operands = List.copyOf(operands);
    }

    /**
     * The expression the unit guards. Only the last operand matters for extension.
     */
    public int comparedName() {
        return operands.get(operands.size() - 1).comparedName();
    }

    public int size() {
        return operands.size();
    }
}
