package com.raditha.optchain.model;

/**
 * Operator of a logical (combinator) expression.
 */
public enum LogicalOperator {
    AND("&&"),
    OR("||"),
    NULLISH("??");

    private final String symbol;

    LogicalOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Convert an operator symbol to a LogicalOperator.
     *
     * @throws IllegalArgumentException if the symbol is not a logical operator
     */
    public static LogicalOperator fromSymbol(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Logical operator cannot be null");
        }
        return switch (symbol) {
            case "&&" -> AND;
            case "||" -> OR;
            case "??" -> NULLISH;
            default -> throw new IllegalArgumentException("Not a logical operator: " + symbol);
        };
    }

    /**
     * Operator of a {@link NodeKind#LOGICAL} node.
     */
    public static LogicalOperator of(TreeNode logical) {
        if (!logical.is(NodeKind.LOGICAL)) {
            throw new IllegalArgumentException("Node " + logical.id() + " is a " + logical.kind() + ", not a logical expression");
        }
        return fromSymbol(logical.operator());
    }
}
