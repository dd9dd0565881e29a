package com.raditha.optchain.model;

import java.util.List;
import java.util.Map;

/**
 * One immutable node of an {@link ExpressionTree}.
 *
 * @param id         index of the node inside its tree
 * @param kind       node kind
 * @param start      source offset of the first character (inclusive), or -1 when unknown
 * @param end        source offset after the last character (exclusive), or -1 when unknown
 * @param parent     id of the parent node, or {@link ExpressionTree#NO_NODE} for the root
 * @param children   child ids per slot; single slots hold zero or one id, list slots may
 *                   contain {@link ExpressionTree#NO_NODE} for holes such as {@code [, a]}
 * @param attributes scalar attributes; values may be null (a {@code null} literal value)
 */
public record TreeNode(
        int id,
        NodeKind kind,
        int start,
        int end,
        int parent,
        Map<Slot, List<Integer>> children,
        Map<Attribute, Object> attributes) {

    /**
     * Get the single child held by a slot.
     *
     * @return the child id, or {@link ExpressionTree#NO_NODE} if the slot is empty
     */
    public int child(Slot slot) {
        List<Integer> ids = children.get(slot);
        if (ids == null || ids.isEmpty()) {
            return ExpressionTree.NO_NODE;
        }
        return ids.get(0);
    }

    /**
     * Get every child held by a slot, in order. Never null.
     */
    public List<Integer> children(Slot slot) {
        return children.getOrDefault(slot, List.of());
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }

    public Object attribute(Attribute attribute) {
        return attributes.get(attribute);
    }

    public boolean hasAttribute(Attribute attribute) {
        return attributes.containsKey(attribute);
    }

    /**
     * Boolean attribute, false when absent.
     */
    public boolean flag(Attribute attribute) {
        return Boolean.TRUE.equals(attributes.get(attribute));
    }

    /**
     * Identifier or private name, null for other kinds.
     */
    public String name() {
        Object name = attributes.get(Attribute.NAME);
        return name == null ? null : name.toString();
    }

    /**
     * Operator of a unary, binary, logical, assignment or update node, null otherwise.
     */
    public String operator() {
        Object operator = attributes.get(Attribute.OPERATOR);
        return operator == null ? null : operator.toString();
    }

    public Range range() {
        return new Range(start, end);
    }
}
