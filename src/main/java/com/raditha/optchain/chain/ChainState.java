package com.raditha.optchain.chain;

import com.raditha.optchain.model.ComparisonResult;
import com.raditha.optchain.model.Diagnostic;
import com.raditha.optchain.model.Range;
import com.raditha.optchain.similarity.StructuralComparator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Open chain of one segment plus the diagnostics it has produced so far.
 * <p>
 * {@link #advance(ChainUnit)} extends, ignores or restarts the chain,
 * {@link #reject()} closes it without a successor and {@link #flush()} closes
 * it at the end of the segment.
 */
public class ChainState {

    private final StructuralComparator comparator;
    private final List<ChainUnit> openChain = new ArrayList<>();
    private final List<Diagnostic> results = new ArrayList<>();

    public ChainState(StructuralComparator comparator) {
        this.comparator = comparator;
    }

    public void advance(ChainUnit unit) {
        if (openChain.isEmpty()) {
            openChain.add(unit);
            return;
        }
        ChainUnit last = openChain.get(openChain.size() - 1);
        ComparisonResult result = comparator.compare(last.comparedName(), unit.comparedName());
        switch (result) {
            case SUBSET -> openChain.add(unit);
            // a repeated guard is a no-op, so `foo && foo` is not reported
            case EQUAL -> {
            }
            case INVALID -> {
                close();
                openChain.add(unit);
            }
        }
    }

    public void reject() {
        close();
    }

    /**
     * Close the open chain and return every diagnostic produced.
     */
    public List<Diagnostic> flush() {
        close();
        return Collections.unmodifiableList(results);
    }

    public int openLength() {
        return openChain.size();
    }

    private void close() {
        if (openChain.size() > 1) {
            Range range = Range.span(openChain.get(0).range(), openChain.get(openChain.size() - 1).range());
            results.add(Diagnostic.mergeableChain(range));
        }
        openChain.clear();
    }
}
