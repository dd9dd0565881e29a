package com.raditha.optchain.model;

import org.jspecify.annotations.Nullable;

/**
 * One finding of the detector.
 *
 * @param range            source range the finding covers
 * @param kind             what was found
 * @param suggestedRewrite replacement text for {@code range}, or null when no safe rewrite exists
 */
public record Diagnostic(
        Range range,
        DiagnosticKind kind,
        @Nullable String suggestedRewrite) {

    public static Diagnostic mergeableChain(Range range) {
        return new Diagnostic(range, DiagnosticKind.MERGEABLE_CHAIN, null);
    }

    public static Diagnostic emptyObjectFallback(Range range, @Nullable String suggestedRewrite) {
        return new Diagnostic(range, DiagnosticKind.EMPTY_OBJECT_FALLBACK, suggestedRewrite);
    }

    public int rangeStart() {
        return range.start();
    }

    public int rangeEnd() {
        return range.end();
    }

    public String message() {
        return kind.message();
    }

    public boolean hasSuggestion() {
        return suggestedRewrite != null;
    }
}
