package com.raditha.optchain.extraction;

import com.raditha.optchain.model.ExpressionTree;
import com.raditha.optchain.model.LogicalOperator;
import com.raditha.optchain.model.NodeKind;
import com.raditha.optchain.model.Slot;
import com.raditha.optchain.model.TreeNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Flattens a run of same-operator logical expressions into its operands.
 * <p>
 * Logical operators associate to the left, so for
 * {@code foo && foo.bar && foo.bar.baz} the deepest node holds the first
 * operand. A depth-first walk that visits left before right yields the
 * operands in source order. Operands joined by a different operator are not
 * descended into and stay single operands.
 */
public class LogicalFlattener {

    private final ExpressionTree tree;

    public LogicalFlattener(ExpressionTree tree) {
        this.tree = tree;
    }

    /**
     * Flatten the run rooted at a logical node.
     *
     * @throws IllegalArgumentException if the node is not a logical expression
     */
    public FlattenedRun flatten(int logicalId) {
        TreeNode root = tree.node(logicalId);
        LogicalOperator operator = LogicalOperator.of(root);

        List<Integer> operands = new ArrayList<>();
        Set<Integer> consumed = new LinkedHashSet<>();
        consumed.add(logicalId);

        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(root.child(Slot.RIGHT));
        stack.push(root.child(Slot.LEFT));
        while (!stack.isEmpty()) {
            int current = stack.pop();
            TreeNode node = tree.node(current);
            if (node.is(NodeKind.LOGICAL) && operator.symbol().equals(node.operator())) {
                consumed.add(current);
                stack.push(node.child(Slot.RIGHT));
                stack.push(node.child(Slot.LEFT));
            } else {
                operands.add(current);
            }
        }
        return new FlattenedRun(logicalId, operator, Collections.unmodifiableList(operands),
                Collections.unmodifiableSet(consumed));
    }

    /**
     * Operands of one same-operator run.
     *
     * @param root     the outermost logical node
     * @param operator the shared operator
     * @param operands leaf operands in source order
     * @param consumed every logical node that belongs to the run, root included
     */
    public record FlattenedRun(int root, LogicalOperator operator, List<Integer> operands, Set<Integer> consumed) {
    }
}
