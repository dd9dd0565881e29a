package com.raditha.optchain.model;

/**
 * Scalar (non-node) properties carried by tree nodes.
 */
public enum Attribute {
    NAME("name"),
    RAW("raw"),
    /** Literal value: String, Double, Boolean or null. */
    VALUE("value"),
    /** Cooked text of a template element. */
    COOKED("cooked"),
    OPERATOR("operator"),
    COMPUTED("computed"),
    OPTIONAL("optional"),
    PREFIX("prefix"),
    DELEGATE("delegate"),
    TAIL("tail"),
    SHORTHAND("shorthand"),
    /** Original node type of an {@link NodeKind#UNKNOWN} node. */
    SOURCE_TYPE("type");

    private final String estreeProperty;

    Attribute(String estreeProperty) {
        this.estreeProperty = estreeProperty;
    }

    public String estreeProperty() {
        return estreeProperty;
    }
}
