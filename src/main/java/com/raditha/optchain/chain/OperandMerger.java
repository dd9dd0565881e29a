package com.raditha.optchain.chain;

import com.raditha.optchain.model.ComparisonKind;
import com.raditha.optchain.model.ComparisonResult;
import com.raditha.optchain.model.ExpressionTree;
import com.raditha.optchain.model.LogicalOperator;
import com.raditha.optchain.model.Range;
import com.raditha.optchain.model.ValidOperand;
import com.raditha.optchain.similarity.StructuralComparator;

import java.util.List;
import java.util.Optional;

/**
 * Operator specific step that turns the operand at a position into a chain unit.
 * <p>
 * Strict null and undefined checks on the same expression pair up into one
 * unit; other guards stand alone or are rejected.
 */
public abstract class OperandMerger {

    protected final StructuralComparator comparator;

    protected OperandMerger(StructuralComparator comparator) {
        this.comparator = comparator;
    }

    /**
     * Create the merger for a run operator.
     *
     * @throws IllegalArgumentException for {@code ??}, whose runs never form chains
     */
    public static OperandMerger forOperator(LogicalOperator operator, StructuralComparator comparator) {
        return switch (operator) {
            case AND -> new AndOperandMerger(comparator);
            case OR -> new OrOperandMerger(comparator);
            case NULLISH -> throw new IllegalArgumentException("Nullish coalescing runs are not chain analyzed");
        };
    }

    /**
     * Build the unit that starts at {@code index}.
     *
     * @return the unit, or empty when the operand cannot take part in a chain
     */
    public abstract Optional<ChainUnit> merge(List<ValidOperand> segment, int index);

    protected ChainUnit single(ValidOperand operand) {
        return unit(List.of(operand));
    }

    /**
     * Pair the operand at {@code index} with its successor when the successor has
     * {@code partnerKind} and guards an equal expression.
     */
    protected Optional<ChainUnit> pairWith(List<ValidOperand> segment, int index, ComparisonKind partnerKind) {
        if (index + 1 >= segment.size()) {
            return Optional.empty();
        }
        ValidOperand operand = segment.get(index);
        ValidOperand next = segment.get(index + 1);
        if (next.comparisonKind() == partnerKind
                && comparator.compare(operand.comparedName(), next.comparedName()) == ComparisonResult.EQUAL) {
            return Optional.of(unit(List.of(operand, next)));
        }
        return Optional.empty();
    }

    private ChainUnit unit(List<ValidOperand> operands) {
        ExpressionTree tree = comparator.tree();
        Range first = tree.node(operands.get(0).node()).range();
        Range last = tree.node(operands.get(operands.size() - 1).node()).range();
        return new ChainUnit(operands, Range.span(first, last));
    }
}
