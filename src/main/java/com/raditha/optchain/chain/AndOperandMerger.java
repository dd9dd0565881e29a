package com.raditha.optchain.chain;

import com.raditha.optchain.model.ComparisonKind;
import com.raditha.optchain.model.ValidOperand;
import com.raditha.optchain.similarity.StructuralComparator;

import java.util.List;
import java.util.Optional;

/**
 * Units of an {@code &&} run. {@code x !== null && x !== undefined} (either
 * order) is one unit; a lone strict check still stands on its own.
 */
public class AndOperandMerger extends OperandMerger {

    public AndOperandMerger(StructuralComparator comparator) {
        super(comparator);
    }

    @Override
    public Optional<ChainUnit> merge(List<ValidOperand> segment, int index) {
        ValidOperand operand = segment.get(index);
        return switch (operand.comparisonKind()) {
            case BOOLEAN, NOT_EQUAL_NULL_OR_UNDEFINED -> Optional.of(single(operand));
            case NOT_STRICT_EQUAL_NULL -> Optional.of(
                    pairWith(segment, index, ComparisonKind.NOT_STRICT_EQUAL_UNDEFINED).orElse(single(operand)));
            case NOT_STRICT_EQUAL_UNDEFINED -> Optional.of(
                    pairWith(segment, index, ComparisonKind.NOT_STRICT_EQUAL_NULL).orElse(single(operand)));
            default -> Optional.empty();
        };
    }
}
