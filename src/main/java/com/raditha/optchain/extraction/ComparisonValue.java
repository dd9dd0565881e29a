package com.raditha.optchain.extraction;

import com.raditha.optchain.model.Attribute;
import com.raditha.optchain.model.ExpressionTree;
import com.raditha.optchain.model.NodeKind;
import com.raditha.optchain.model.TreeNode;

import java.util.Optional;

/**
 * Nullish marker found on one side of an equality comparison.
 */
public enum ComparisonValue {
    /** The literal {@code null}. */
    NULL,
    /** The identifier {@code undefined}. */
    UNDEFINED,
    /** The string {@code 'undefined'}, meaningful only against {@code typeof}. */
    UNDEFINED_STRING_LITERAL;

    /**
     * Detect the marker held by a node, if any.
     */
    public static Optional<ComparisonValue> of(ExpressionTree tree, int nodeId) {
        TreeNode node = tree.node(nodeId);
        if (node.is(NodeKind.LITERAL)) {
            Object value = node.attribute(Attribute.VALUE);
            if (value == null && "null".equals(node.attribute(Attribute.RAW))) {
                return Optional.of(NULL);
            }
            if ("undefined".equals(value)) {
                return Optional.of(UNDEFINED_STRING_LITERAL);
            }
        } else if (node.is(NodeKind.IDENTIFIER) && "undefined".equals(node.name())) {
            return Optional.of(UNDEFINED);
        }
        return Optional.empty();
    }
}
