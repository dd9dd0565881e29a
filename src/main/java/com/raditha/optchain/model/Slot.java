package com.raditha.optchain.model;

/**
 * Named child position of a tree node.
 * A slot either holds at most one child or an ordered list of children.
 */
public enum Slot {
    OBJECT("object", false),
    PROPERTY("property", false),
    CALLEE("callee", false),
    ARGUMENTS("arguments", true),
    TYPE_ARGUMENTS("typeArguments", false),
    EXPRESSION("expression", false),
    ARGUMENT("argument", false),
    LEFT("left", false),
    RIGHT("right", false),
    TEST("test", false),
    CONSEQUENT("consequent", false),
    ALTERNATE("alternate", false),
    EXPRESSIONS("expressions", true),
    QUASIS("quasis", true),
    ELEMENTS("elements", true),
    PROPERTIES("properties", true),
    KEY("key", false),
    VALUE("value", false),
    PARAMS("params", true),
    BODY("body", false),
    META("meta", false),
    TAG("tag", false),
    QUASI("quasi", false),
    TYPES("types", true),
    TYPE_ANNOTATION("typeAnnotation", false),
    TYPE_NAME("typeName", false),
    ID("id", false),
    SUPER_CLASS("superClass", false),
    LITERAL("literal", false),

    /**
     * Every nested node of a kind whose layout is not modeled, in document order.
     */
    CHILDREN(null, true);

    private final String estreeProperty;
    private final boolean list;

    Slot(String estreeProperty, boolean list) {
        this.estreeProperty = estreeProperty;
        this.list = list;
    }

    /**
     * Property name holding this slot in an ESTree document, or null for {@link #CHILDREN}.
     */
    public String estreeProperty() {
        return estreeProperty;
    }

    public boolean isList() {
        return list;
    }
}
