package com.raditha.optchain.refactoring;

import com.raditha.optchain.model.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies suggested rewrites to source text in memory.
 * Nothing is written back to disk.
 */
public class SuggestionApplier {

    private static final Logger logger = LoggerFactory.getLogger(SuggestionApplier.class);

    /**
     * Apply every non-overlapping suggestion.
     * When two suggestions overlap, the one starting first wins.
     *
     * @param source      original source text
     * @param diagnostics diagnostics of that source, in any order
     * @return the previewed text
     */
    public String apply(String source, List<Diagnostic> diagnostics) {
        List<Diagnostic> accepted = select(source, diagnostics);

        StringBuilder sb = new StringBuilder(source);
        // later ranges first so earlier offsets stay valid
        for (int i = accepted.size() - 1; i >= 0; i--) {
            Diagnostic diagnostic = accepted.get(i);
            sb.replace(diagnostic.rangeStart(), diagnostic.rangeEnd(), diagnostic.suggestedRewrite());
        }
        return sb.toString();
    }

    /**
     * The suggestions that {@link #apply(String, List)} would use, in source order.
     */
    public List<Diagnostic> select(String source, List<Diagnostic> diagnostics) {
        List<Diagnostic> candidates = diagnostics.stream()
                .filter(Diagnostic::hasSuggestion)
                .filter(d -> d.range().isKnown() && d.rangeEnd() <= source.length())
                .sorted(Comparator.comparingInt(Diagnostic::rangeStart).thenComparingInt(Diagnostic::rangeEnd))
                .toList();

        List<Diagnostic> accepted = new ArrayList<>();
        for (Diagnostic candidate : candidates) {
            if (!accepted.isEmpty() && accepted.get(accepted.size() - 1).range().overlaps(candidate.range())) {
                logger.debug("Skipping suggestion at {}: overlaps an earlier one", candidate.range());
                continue;
            }
            accepted.add(candidate);
        }
        return accepted;
    }
}
