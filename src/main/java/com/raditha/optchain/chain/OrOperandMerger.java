package com.raditha.optchain.chain;

import com.raditha.optchain.model.ComparisonKind;
import com.raditha.optchain.model.ValidOperand;
import com.raditha.optchain.similarity.StructuralComparator;

import java.util.List;
import java.util.Optional;

/**
 * Units of an {@code ||} run. {@code x === null || x === undefined} (either
 * order) is one unit. A lone strict check does not prove the value nullish
 * and is rejected. A bare operand is only accepted as the final access of the
 * segment, as in {@code !a || a.b}.
 */
public class OrOperandMerger extends OperandMerger {

    public OrOperandMerger(StructuralComparator comparator) {
        super(comparator);
    }

    @Override
    public Optional<ChainUnit> merge(List<ValidOperand> segment, int index) {
        ValidOperand operand = segment.get(index);
        return switch (operand.comparisonKind()) {
            case NOT_BOOLEAN, EQUAL_NULL_OR_UNDEFINED -> Optional.of(single(operand));
            case STRICT_EQUAL_NULL -> pairWith(segment, index, ComparisonKind.STRICT_EQUAL_UNDEFINED);
            case STRICT_EQUAL_UNDEFINED -> pairWith(segment, index, ComparisonKind.STRICT_EQUAL_NULL);
            case BOOLEAN -> index == segment.size() - 1 ? Optional.of(single(operand)) : Optional.empty();
            default -> Optional.empty();
        };
    }
}
