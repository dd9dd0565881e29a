package com.raditha.optchain.model;

/**
 * Kinds of findings reported by the detector.
 */
public enum DiagnosticKind {
    /** A run of guards that can collapse into one optional chain. */
    MERGEABLE_CHAIN("mergeable-chain",
            "Prefer using an optional chain expression instead, as it's more concise and easier to read."),
    /** {@code (x || {}).y} or {@code (x ?? {}).y}. */
    EMPTY_OBJECT_FALLBACK("empty-object-fallback", "Change to an optional chain.");

    private final String id;
    private final String message;

    DiagnosticKind(String id, String message) {
        this.id = id;
        this.message = message;
    }

    public String id() {
        return id;
    }

    public String message() {
        return message;
    }
}
