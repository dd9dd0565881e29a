package com.raditha.optchain.model;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed set of expression node kinds understood by the detector.
 * <p>
 * Each kind declares its child slots and scalar attributes in a fixed order.
 * The structural comparator walks these declarations for kinds it has no
 * dedicated rule for, and the ESTree reader uses them to decide which
 * properties of a JSON node to keep.
 */
public enum NodeKind {
    IDENTIFIER("Identifier", Category.PLAIN, List.of(), List.of(Attribute.NAME)),
    PRIVATE_IDENTIFIER("PrivateIdentifier", Category.PLAIN, List.of(), List.of(Attribute.NAME)),
    THIS("ThisExpression", Category.PLAIN, List.of(), List.of()),
    SUPER("Super", Category.PLAIN, List.of(), List.of()),
    LITERAL("Literal", Category.PLAIN, List.of(), List.of(Attribute.RAW, Attribute.VALUE)),
    TEMPLATE_LITERAL("TemplateLiteral", Category.PLAIN, List.of(Slot.QUASIS, Slot.EXPRESSIONS), List.of()),
    TEMPLATE_ELEMENT("TemplateElement", Category.PLAIN, List.of(), List.of(Attribute.COOKED, Attribute.TAIL)),
    TAGGED_TEMPLATE("TaggedTemplateExpression", Category.PLAIN, List.of(Slot.TAG, Slot.TYPE_ARGUMENTS, Slot.QUASI), List.of()),
    MEMBER("MemberExpression", Category.PLAIN, List.of(Slot.OBJECT, Slot.PROPERTY), List.of(Attribute.COMPUTED, Attribute.OPTIONAL)),
    CALL("CallExpression", Category.PLAIN, List.of(Slot.CALLEE, Slot.TYPE_ARGUMENTS, Slot.ARGUMENTS), List.of(Attribute.OPTIONAL)),
    CHAIN("ChainExpression", Category.PLAIN, List.of(Slot.EXPRESSION), List.of()),
    NON_NULL("TSNonNullExpression", Category.PLAIN, List.of(Slot.EXPRESSION), List.of()),
    META_PROPERTY("MetaProperty", Category.PLAIN, List.of(Slot.META, Slot.PROPERTY), List.of()),
    UNARY("UnaryExpression", Category.PLAIN, List.of(Slot.ARGUMENT), List.of(Attribute.OPERATOR)),
    BINARY("BinaryExpression", Category.PLAIN, List.of(Slot.LEFT, Slot.RIGHT), List.of(Attribute.OPERATOR)),
    LOGICAL("LogicalExpression", Category.PLAIN, List.of(Slot.LEFT, Slot.RIGHT), List.of(Attribute.OPERATOR)),
    CONDITIONAL("ConditionalExpression", Category.PLAIN, List.of(Slot.TEST, Slot.CONSEQUENT, Slot.ALTERNATE), List.of()),
    SEQUENCE("SequenceExpression", Category.PLAIN, List.of(Slot.EXPRESSIONS), List.of()),
    AWAIT("AwaitExpression", Category.PLAIN, List.of(Slot.ARGUMENT), List.of()),
    SPREAD("SpreadElement", Category.PLAIN, List.of(Slot.ARGUMENT), List.of()),
    OBJECT_PROPERTY("Property", Category.PLAIN, List.of(Slot.KEY, Slot.VALUE), List.of(Attribute.COMPUTED, Attribute.SHORTHAND)),

    // every evaluation produces a fresh value
    ARRAY("ArrayExpression", Category.ALLOCATING, List.of(Slot.ELEMENTS), List.of()),
    OBJECT("ObjectExpression", Category.ALLOCATING, List.of(Slot.PROPERTIES), List.of()),
    FUNCTION("FunctionExpression", Category.ALLOCATING, List.of(Slot.ID, Slot.PARAMS, Slot.BODY), List.of()),
    ARROW_FUNCTION("ArrowFunctionExpression", Category.ALLOCATING, List.of(Slot.PARAMS, Slot.BODY), List.of()),
    CLASS("ClassExpression", Category.ALLOCATING, List.of(Slot.ID, Slot.SUPER_CLASS, Slot.BODY), List.of()),
    NEW("NewExpression", Category.ALLOCATING, List.of(Slot.CALLEE, Slot.TYPE_ARGUMENTS, Slot.ARGUMENTS), List.of()),
    JSX_ELEMENT("JSXElement", Category.ALLOCATING, List.of(Slot.CHILDREN), List.of()),
    JSX_FRAGMENT("JSXFragment", Category.ALLOCATING, List.of(Slot.CHILDREN), List.of()),

    // every evaluation may change program state
    ASSIGNMENT("AssignmentExpression", Category.SIDE_EFFECT, List.of(Slot.LEFT, Slot.RIGHT), List.of(Attribute.OPERATOR)),
    UPDATE("UpdateExpression", Category.SIDE_EFFECT, List.of(Slot.ARGUMENT), List.of(Attribute.OPERATOR, Attribute.PREFIX)),
    YIELD("YieldExpression", Category.SIDE_EFFECT, List.of(Slot.ARGUMENT), List.of(Attribute.DELEGATE)),

    ARRAY_PATTERN("ArrayPattern", Category.PATTERN, List.of(Slot.ELEMENTS), List.of()),
    OBJECT_PATTERN("ObjectPattern", Category.PATTERN, List.of(Slot.PROPERTIES), List.of()),

    AS_EXPRESSION("TSAsExpression", Category.PLAIN, List.of(Slot.EXPRESSION, Slot.TYPE_ANNOTATION), List.of()),
    SATISFIES_EXPRESSION("TSSatisfiesExpression", Category.PLAIN, List.of(Slot.EXPRESSION, Slot.TYPE_ANNOTATION), List.of()),
    TYPE_ARGUMENT_LIST("TSTypeParameterInstantiation", Category.PLAIN, List.of(Slot.PARAMS), List.of()),
    TYPE_REFERENCE("TSTypeReference", Category.PLAIN, List.of(Slot.TYPE_NAME, Slot.TYPE_ARGUMENTS), List.of()),
    TEMPLATE_LITERAL_TYPE("TSTemplateLiteralType", Category.PLAIN, List.of(Slot.QUASIS, Slot.TYPES), List.of()),
    LITERAL_TYPE("TSLiteralType", Category.PLAIN, List.of(Slot.LITERAL), List.of()),
    ANY_KEYWORD("TSAnyKeyword", Category.PLAIN, List.of(), List.of()),
    UNKNOWN_KEYWORD("TSUnknownKeyword", Category.PLAIN, List.of(), List.of()),
    STRING_KEYWORD("TSStringKeyword", Category.PLAIN, List.of(), List.of()),
    NUMBER_KEYWORD("TSNumberKeyword", Category.PLAIN, List.of(), List.of()),
    BOOLEAN_KEYWORD("TSBooleanKeyword", Category.PLAIN, List.of(), List.of()),
    BIGINT_KEYWORD("TSBigIntKeyword", Category.PLAIN, List.of(), List.of()),
    SYMBOL_KEYWORD("TSSymbolKeyword", Category.PLAIN, List.of(), List.of()),
    OBJECT_KEYWORD("TSObjectKeyword", Category.PLAIN, List.of(), List.of()),
    NULL_KEYWORD("TSNullKeyword", Category.PLAIN, List.of(), List.of()),
    UNDEFINED_KEYWORD("TSUndefinedKeyword", Category.PLAIN, List.of(), List.of()),
    VOID_KEYWORD("TSVoidKeyword", Category.PLAIN, List.of(), List.of()),
    NEVER_KEYWORD("TSNeverKeyword", Category.PLAIN, List.of(), List.of()),

    /**
     * Anything else, including statements and declarations. Never compares equal
     * to anything; its nested nodes are kept only so that traversal reaches them.
     */
    UNKNOWN(null, Category.PLAIN, List.of(Slot.CHILDREN), List.of(Attribute.SOURCE_TYPE));

    /**
     * Broad evaluation behaviour of a kind.
     */
    public enum Category {
        PLAIN,
        /** Array/object/class/function literals, {@code new}, JSX. */
        ALLOCATING,
        /** Assignment, update and yield. */
        SIDE_EFFECT,
        /** Destructuring patterns, which are not valid expressions. */
        PATTERN
    }

    private static final Map<String, NodeKind> BY_ESTREE_TYPE = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            if (kind.estreeType != null) {
                BY_ESTREE_TYPE.put(kind.estreeType, kind);
            }
        }
    }

    private final String estreeType;
    private final Category category;
    private final List<Slot> slots;
    private final List<Attribute> attributes;

    NodeKind(String estreeType, Category category, List<Slot> slots, List<Attribute> attributes) {
        this.estreeType = estreeType;
        this.category = category;
        this.slots = slots;
        this.attributes = attributes;
    }

    /**
     * Map an ESTree {@code type} string to a kind.
     *
     * @param estreeType the node type as written by the parser
     * @return the matching kind, or {@link #UNKNOWN}
     */
    public static NodeKind fromEstreeType(String estreeType) {
        return BY_ESTREE_TYPE.getOrDefault(estreeType, UNKNOWN);
    }

    public Category category() {
        return category;
    }

    public List<Slot> slots() {
        return slots;
    }

    public List<Attribute> attributes() {
        return attributes;
    }

    /**
     * Whether two evaluations of a node of this kind can never be treated as the same value.
     */
    public boolean producesFreshValue() {
        return category != Category.PLAIN;
    }
}
