package com.raditha.optchain.extraction;

import com.raditha.optchain.analysis.LooseBooleanChecker;
import com.raditha.optchain.analysis.LooseBooleanChecker.BooleanSense;
import com.raditha.optchain.model.ComparisonKind;
import com.raditha.optchain.model.ExpressionTree;
import com.raditha.optchain.model.InvalidOperand;
import com.raditha.optchain.model.LogicalOperator;
import com.raditha.optchain.model.NodeKind;
import com.raditha.optchain.model.Operand;
import com.raditha.optchain.model.Slot;
import com.raditha.optchain.model.TreeNode;
import com.raditha.optchain.model.ValidOperand;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns each operand of a flattened run into a {@link ValidOperand} guard or
 * the {@link InvalidOperand} boundary.
 */
public class OperandClassifier {

    private final ExpressionTree tree;
    private final LooseBooleanChecker booleanChecker;

    public OperandClassifier(ExpressionTree tree, LooseBooleanChecker booleanChecker) {
        this.tree = tree;
        this.booleanChecker = booleanChecker;
    }

    /**
     * Classify every operand of a run, preserving order.
     */
    public List<Operand> classify(LogicalFlattener.FlattenedRun run) {
        List<Operand> result = new ArrayList<>(run.operands().size());
        for (int operand : run.operands()) {
            result.add(classify(operand, run.operator()));
        }
        return result;
    }

    /**
     * Classify one operand of a run joined by {@code operator}.
     */
    public Operand classify(int operandId, LogicalOperator operator) {
        TreeNode operand = tree.node(operandId);
        return switch (operand.kind()) {
            case BINARY -> classifyComparison(operand);
            case UNARY -> classifyNegation(operand, operator);
            // mixed runs are never merged
            case LOGICAL -> InvalidOperand.INSTANCE;
            default -> booleanChecker.isSafe(operandId, operator, BooleanSense.POSITIVE)
                    ? new ValidOperand(operandId, ComparisonKind.BOOLEAN, operandId)
                    : InvalidOperand.INSTANCE;
        };
    }

    private Operand classifyComparison(TreeNode operand) {
        String op = operand.operator();
        if (!isEquality(op)) {
            return InvalidOperand.INSTANCE;
        }
        boolean negated = op.startsWith("!");
        boolean strict = op.length() == 3;

        // yoda checks such as `null != x` are rare, so the right side goes first
        int compared = operand.child(Slot.LEFT);
        Optional<ComparisonValue> value = ComparisonValue.of(tree, operand.child(Slot.RIGHT));
        if (value.isEmpty()) {
            compared = operand.child(Slot.RIGHT);
            value = ComparisonValue.of(tree, operand.child(Slot.LEFT));
        }
        if (value.isEmpty()) {
            return InvalidOperand.INSTANCE;
        }

        if (value.get() == ComparisonValue.UNDEFINED_STRING_LITERAL) {
            TreeNode comparedNode = tree.node(compared);
            if (comparedNode.is(NodeKind.UNARY) && "typeof".equals(comparedNode.operator())) {
                return new ValidOperand(comparedNode.child(Slot.ARGUMENT),
                        negated ? ComparisonKind.NOT_STRICT_EQUAL_UNDEFINED : ComparisonKind.STRICT_EQUAL_UNDEFINED,
                        operand.id());
            }
            // y === 'undefined'
            return InvalidOperand.INSTANCE;
        }

        ComparisonKind kind;
        if (!strict) {
            kind = negated ? ComparisonKind.NOT_EQUAL_NULL_OR_UNDEFINED : ComparisonKind.EQUAL_NULL_OR_UNDEFINED;
        } else if (value.get() == ComparisonValue.NULL) {
            kind = negated ? ComparisonKind.NOT_STRICT_EQUAL_NULL : ComparisonKind.STRICT_EQUAL_NULL;
        } else {
            kind = negated ? ComparisonKind.NOT_STRICT_EQUAL_UNDEFINED : ComparisonKind.STRICT_EQUAL_UNDEFINED;
        }
        return new ValidOperand(compared, kind, operand.id());
    }

    private Operand classifyNegation(TreeNode operand, LogicalOperator operator) {
        int argument = operand.child(Slot.ARGUMENT);
        if ("!".equals(operand.operator())
                && booleanChecker.isSafe(argument, operator, BooleanSense.NEGATIVE)) {
            return new ValidOperand(argument, ComparisonKind.NOT_BOOLEAN, operand.id());
        }
        return InvalidOperand.INSTANCE;
    }

    private static boolean isEquality(String operator) {
        return "==".equals(operator) || "!=".equals(operator)
                || "===".equals(operator) || "!==".equals(operator);
    }
}
