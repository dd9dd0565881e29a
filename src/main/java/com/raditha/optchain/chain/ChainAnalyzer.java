package com.raditha.optchain.chain;

import com.raditha.optchain.model.Diagnostic;
import com.raditha.optchain.model.LogicalOperator;
import com.raditha.optchain.model.ValidOperand;
import com.raditha.optchain.similarity.StructuralComparator;

import java.util.List;
import java.util.Optional;

/**
 * Finds mergeable chains inside one segment of valid operands.
 */
public class ChainAnalyzer {

    private final StructuralComparator comparator;

    public ChainAnalyzer(StructuralComparator comparator) {
        this.comparator = comparator;
    }

    /**
     * Analyze a segment that lies between invalid operands.
     *
     * @param operator operator of the run, {@code &&} or {@code ||}
     * @param segment  valid operands in source order
     * @return one diagnostic per chain of two or more units
     */
    public List<Diagnostic> analyze(LogicalOperator operator, List<ValidOperand> segment) {
        // a chain needs two operands
        if (segment.size() <= 1) {
            return List.of();
        }
        OperandMerger merger = OperandMerger.forOperator(operator, comparator);
        ChainState state = new ChainState(comparator);

        int index = 0;
        while (index < segment.size()) {
            Optional<ChainUnit> unit = merger.merge(segment, index);
            if (unit.isPresent()) {
                state.advance(unit.get());
                index += unit.get().size();
            } else {
                state.reject();
                index++;
            }
        }
        return state.flush();
    }
}
