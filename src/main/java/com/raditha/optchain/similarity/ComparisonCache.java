package com.raditha.optchain.similarity;

import com.raditha.optchain.model.ComparisonResult;

import java.util.HashMap;
import java.util.Map;

/**
 * Memoized comparison results keyed by an ordered pair of node ids.
 * <p>
 * Node ids only identify a node inside one tree, so a cache must never be
 * shared between trees.
 */
public class ComparisonCache {

    private final Map<Long, ComparisonResult> results = new HashMap<>();
    private int hits;
    private int misses;

    /**
     * Look up the result for {@code (left, right)}, or null if it has not been computed yet.
     */
    public ComparisonResult get(int left, int right) {
        ComparisonResult result = results.get(key(left, right));
        if (result == null) {
            misses++;
        } else {
            hits++;
        }
        return result;
    }

    public void put(int left, int right, ComparisonResult result) {
        results.put(key(left, right), result);
    }

    public int size() {
        return results.size();
    }

    public int hits() {
        return hits;
    }

    public int misses() {
        return misses;
    }

    private static long key(int left, int right) {
        return ((long) left << 32) | (right & 0xffffffffL);
    }
}
