package com.raditha.optchain.fallback;

import com.raditha.optchain.model.Attribute;
import com.raditha.optchain.model.Slot;
import com.raditha.optchain.model.TreeNode;

/**
 * Expression precedence levels, weakest first.
 * <p>
 * Used to decide whether an expression needs parentheses before it can be
 * followed by {@code ?.}.
 */
public enum OperatorPrecedence {
    /** Unmodeled kinds. Always parenthesized. */
    INVALID,
    COMMA,
    SPREAD,
    YIELD,
    ASSIGNMENT,
    /** Also covers {@code ??}. */
    CONDITIONAL,
    LOGICAL_OR,
    LOGICAL_AND,
    BITWISE_OR,
    BITWISE_XOR,
    BITWISE_AND,
    EQUALITY,
    RELATIONAL,
    SHIFT,
    ADDITIVE,
    MULTIPLICATIVE,
    EXPONENTIATION,
    UNARY,
    UPDATE,
    LEFT_HAND_SIDE,
    MEMBER,
    PRIMARY;

    /**
     * Precedence of the expression a node represents.
     */
    public static OperatorPrecedence of(TreeNode node) {
        return switch (node.kind()) {
            case SEQUENCE -> COMMA;
            case SPREAD -> SPREAD;
            case YIELD -> YIELD;
            // an arrow body extends as far right as it can
            case ASSIGNMENT, ARROW_FUNCTION -> ASSIGNMENT;
            case CONDITIONAL -> CONDITIONAL;
            case BINARY, LOGICAL -> ofBinaryOperator(node.operator());
            case UNARY, AWAIT, NON_NULL -> UNARY;
            case UPDATE -> node.flag(Attribute.PREFIX) ? UNARY : UPDATE;
            case AS_EXPRESSION, SATISFIES_EXPRESSION -> RELATIONAL;
            case CALL, CHAIN -> LEFT_HAND_SIDE;
            case NEW -> node.children(Slot.ARGUMENTS).isEmpty() ? LEFT_HAND_SIDE : MEMBER;
            case MEMBER, TAGGED_TEMPLATE, META_PROPERTY -> MEMBER;
            case IDENTIFIER, PRIVATE_IDENTIFIER, THIS, SUPER, LITERAL, TEMPLATE_LITERAL, ARRAY, OBJECT,
                    FUNCTION, CLASS, JSX_ELEMENT, JSX_FRAGMENT -> PRIMARY;
            default -> INVALID;
        };
    }

    /**
     * Precedence of a binary or logical operator symbol.
     */
    public static OperatorPrecedence ofBinaryOperator(String operator) {
        if (operator == null) {
            return INVALID;
        }
        return switch (operator) {
            case "??" -> CONDITIONAL;
            case "||" -> LOGICAL_OR;
            case "&&" -> LOGICAL_AND;
            case "|" -> BITWISE_OR;
            case "^" -> BITWISE_XOR;
            case "&" -> BITWISE_AND;
            case "==", "!=", "===", "!==" -> EQUALITY;
            case "<", ">", "<=", ">=", "instanceof", "in" -> RELATIONAL;
            case "<<", ">>", ">>>" -> SHIFT;
            case "+", "-" -> ADDITIVE;
            case "*", "/", "%" -> MULTIPLICATIVE;
            case "**" -> EXPONENTIATION;
            default -> INVALID;
        };
    }

    public boolean isLowerThan(OperatorPrecedence other) {
        return compareTo(other) < 0;
    }
}
