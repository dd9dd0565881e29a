package com.raditha.optchain.fallback;

import com.raditha.optchain.model.Attribute;
import com.raditha.optchain.model.Diagnostic;
import com.raditha.optchain.model.ExpressionTree;
import com.raditha.optchain.model.LogicalOperator;
import com.raditha.optchain.model.NodeKind;
import com.raditha.optchain.model.Slot;
import com.raditha.optchain.model.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Detects {@code (foo || {}).bar} and {@code (foo ?? {}).bar}, which read
 * better as {@code foo?.bar}.
 */
public class EmptyObjectFallbackDetector {

    private static final Logger logger = LoggerFactory.getLogger(EmptyObjectFallbackDetector.class);

    private final ExpressionTree tree;

    public EmptyObjectFallbackDetector(ExpressionTree tree) {
        this.tree = tree;
    }

    /**
     * Check one logical node.
     *
     * @param logicalId a node of kind {@link NodeKind#LOGICAL}
     * @return a diagnostic on the enclosing member access, or empty when the idiom does not apply
     */
    public Optional<Diagnostic> detect(int logicalId) {
        TreeNode logical = tree.node(logicalId);
        if (!logical.is(NodeKind.LOGICAL) || LogicalOperator.of(logical) == LogicalOperator.AND) {
            return Optional.empty();
        }
        if (!isEmptyObject(logical.child(Slot.RIGHT))) {
            return Optional.empty();
        }
        int parentId = logical.parent();
        if (parentId == ExpressionTree.NO_NODE) {
            return Optional.empty();
        }
        TreeNode member = tree.node(parentId);
        if (!member.is(NodeKind.MEMBER) || member.child(Slot.OBJECT) != logicalId
                || member.flag(Attribute.OPTIONAL)) {
            return Optional.empty();
        }

        String rewrite = rewrite(logical, member);
        if (rewrite == null) {
            logger.debug("No source text for node {}, reporting without a rewrite", logicalId);
        }
        return Optional.of(Diagnostic.emptyObjectFallback(member.range(), rewrite));
    }

    private boolean isEmptyObject(int nodeId) {
        if (nodeId == ExpressionTree.NO_NODE) {
            return false;
        }
        TreeNode node = tree.node(nodeId);
        return node.is(NodeKind.OBJECT) && node.children(Slot.PROPERTIES).isEmpty();
    }

    private String rewrite(TreeNode logical, TreeNode member) {
        int left = logical.child(Slot.LEFT);
        Optional<String> leftText = tree.text(left);
        Optional<String> propertyText = tree.text(member.child(Slot.PROPERTY));
        if (leftText.isEmpty() || propertyText.isEmpty()) {
            return null;
        }
        String object = OperatorPrecedence.of(tree.node(left)).isLowerThan(OperatorPrecedence.LEFT_HAND_SIDE)
                ? "(" + leftText.get() + ")"
                : leftText.get();
        String property = member.flag(Attribute.COMPUTED)
                ? "[" + propertyText.get() + "]"
                : propertyText.get();
        return object + "?." + property;
    }
}
