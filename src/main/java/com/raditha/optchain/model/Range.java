package com.raditha.optchain.model;

/**
 * Represents a source range as character offsets.
 *
 * @param start first offset (inclusive)
 * @param end   last offset (exclusive)
 */
public record Range(int start, int end) {

    /**
     * Create a range covering both inputs.
     */
    public static Range span(Range first, Range last) {
        return new Range(first.start, last.end);
    }

    /**
     * Whether both offsets are known.
     */
    public boolean isKnown() {
        return start >= 0 && end >= start;
    }

    public boolean overlaps(Range other) {
        return start < other.end && other.start < end;
    }

    /**
     * Format as "[12, 30)" for display.
     */
    public String toDisplayString() {
        return "[" + start + ", " + end + ")";
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
