package com.raditha.optchain;

import com.raditha.optchain.analysis.AnnotatedTypeService;
import com.raditha.optchain.model.Attribute;
import com.raditha.optchain.model.ExpressionTree;
import com.raditha.optchain.model.NodeKind;
import com.raditha.optchain.model.Slot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Test helper that writes JavaScript expressions and their tree at the same time,
 * so every node carries the offsets it would get from a real parser.
 * <pre>
 * Js.Expr a = Js.id("a");
 * Js.Built built = Js.build(Js.and(a, Js.member(Js.id("a"), "b")));
 * built.source();   // "a &amp;&amp; a.b"
 * built.id(a);      // node id of the first `a`
 * </pre>
 * Unless built with {@link #buildUntyped(Expr)}, every node without an explicit
 * {@link Expr#typed(String...)} annotation is typed {@code object | undefined}.
 */
public final class Js {

    private Js() {
    }

    public static Expr id(String name) {
        return new Expr(NodeKind.IDENTIFIER).text(name).attr(Attribute.NAME, name);
    }

    public static Expr undef() {
        return id("undefined");
    }

    public static Expr nul() {
        return new Expr(NodeKind.LITERAL).text("null").attr(Attribute.RAW, "null").attr(Attribute.VALUE, null);
    }

    public static Expr str(String value) {
        return new Expr(NodeKind.LITERAL).text("'" + value + "'")
                .attr(Attribute.RAW, "'" + value + "'").attr(Attribute.VALUE, value);
    }

    public static Expr num(int value) {
        return new Expr(NodeKind.LITERAL).text(String.valueOf(value))
                .attr(Attribute.RAW, String.valueOf(value)).attr(Attribute.VALUE, (double) value);
    }

    public static Expr thisExpr() {
        return new Expr(NodeKind.THIS).text("this");
    }

    public static Expr member(Expr object, String property) {
        return new Expr(NodeKind.MEMBER).child(Slot.OBJECT, object).text(".").child(Slot.PROPERTY, id(property))
                .attr(Attribute.COMPUTED, false).attr(Attribute.OPTIONAL, false);
    }

    /**
     * {@code object?.property}. Wrap the outermost access in {@link #chain(Expr)}.
     */
    public static Expr optMember(Expr object, String property) {
        return new Expr(NodeKind.MEMBER).child(Slot.OBJECT, object).text("?.").child(Slot.PROPERTY, id(property))
                .attr(Attribute.COMPUTED, false).attr(Attribute.OPTIONAL, true);
    }

    public static Expr index(Expr object, Expr property) {
        return new Expr(NodeKind.MEMBER).child(Slot.OBJECT, object).text("[").child(Slot.PROPERTY, property).text("]")
                .attr(Attribute.COMPUTED, true).attr(Attribute.OPTIONAL, false);
    }

    public static Expr privateMember(Expr object, String name) {
        Expr property = new Expr(NodeKind.PRIVATE_IDENTIFIER).text("#" + name).attr(Attribute.NAME, name);
        return new Expr(NodeKind.MEMBER).child(Slot.OBJECT, object).text(".").child(Slot.PROPERTY, property)
                .attr(Attribute.COMPUTED, false).attr(Attribute.OPTIONAL, false);
    }

    public static Expr call(Expr callee, Expr... arguments) {
        return new Expr(NodeKind.CALL).child(Slot.CALLEE, callee).text("(")
                .children(Slot.ARGUMENTS, ", ", arguments).text(")")
                .attr(Attribute.OPTIONAL, false);
    }

    public static Expr newExpr(Expr callee) {
        return new Expr(NodeKind.NEW).text("new ").child(Slot.CALLEE, callee).text("(")
                .children(Slot.ARGUMENTS, ", ").text(")");
    }

    public static Expr chain(Expr expression) {
        return new Expr(NodeKind.CHAIN).child(Slot.EXPRESSION, expression);
    }

    public static Expr nonNull(Expr expression) {
        return new Expr(NodeKind.NON_NULL).child(Slot.EXPRESSION, expression).text("!");
    }

    public static Expr meta(String meta, String property) {
        return new Expr(NodeKind.META_PROPERTY).child(Slot.META, id(meta)).text(".").child(Slot.PROPERTY, id(property));
    }

    public static Expr bin(Expr left, String operator, Expr right) {
        return new Expr(NodeKind.BINARY).child(Slot.LEFT, left).text(" " + operator + " ").child(Slot.RIGHT, right)
                .attr(Attribute.OPERATOR, operator);
    }

    public static Expr not(Expr argument) {
        return unary("!", argument);
    }

    public static Expr typeOf(Expr argument) {
        return unary("typeof", argument);
    }

    public static Expr unary(String operator, Expr argument) {
        String prefix = Character.isLetter(operator.charAt(0)) ? operator + " " : operator;
        return new Expr(NodeKind.UNARY).text(prefix).child(Slot.ARGUMENT, argument)
                .attr(Attribute.OPERATOR, operator).attr(Attribute.PREFIX, true);
    }

    public static Expr and(Expr... operands) {
        return logical("&&", operands);
    }

    public static Expr or(Expr... operands) {
        return logical("||", operands);
    }

    public static Expr nullish(Expr... operands) {
        return logical("??", operands);
    }

    /**
     * Left-associative run, as a parser builds it.
     */
    public static Expr logical(String operator, Expr... operands) {
        Expr result = operands[0];
        for (int i = 1; i < operands.length; i++) {
            result = new Expr(NodeKind.LOGICAL).child(Slot.LEFT, result).text(" " + operator + " ")
                    .child(Slot.RIGHT, operands[i]).attr(Attribute.OPERATOR, operator);
        }
        return result;
    }

    public static Expr cond(Expr test, Expr consequent, Expr alternate) {
        return new Expr(NodeKind.CONDITIONAL).child(Slot.TEST, test).text(" ? ").child(Slot.CONSEQUENT, consequent)
                .text(" : ").child(Slot.ALTERNATE, alternate);
    }

    public static Expr assign(Expr left, Expr right) {
        return new Expr(NodeKind.ASSIGNMENT).child(Slot.LEFT, left).text(" = ").child(Slot.RIGHT, right)
                .attr(Attribute.OPERATOR, "=");
    }

    /**
     * {@code () => body}.
     */
    public static Expr arrow(Expr body) {
        return new Expr(NodeKind.ARROW_FUNCTION).text("(").children(Slot.PARAMS, ", ").text(") => ")
                .child(Slot.BODY, body);
    }

    public static Expr emptyObject() {
        return new Expr(NodeKind.OBJECT).text("{").children(Slot.PROPERTIES, ", ").text("}");
    }

    public static Expr array(Expr... elements) {
        return new Expr(NodeKind.ARRAY).text("[").children(Slot.ELEMENTS, ", ", elements).text("]");
    }

    /**
     * Template literal without substitutions.
     */
    public static Expr template(String cooked) {
        Expr quasi = new Expr(NodeKind.TEMPLATE_ELEMENT).text(cooked)
                .attr(Attribute.COOKED, cooked).attr(Attribute.TAIL, true);
        return new Expr(NodeKind.TEMPLATE_LITERAL).text("`").children(Slot.QUASIS, "", quasi).text("`")
                .children(Slot.EXPRESSIONS, "");
    }

    /**
     * Parentheses. Not a node of its own.
     */
    public static Expr paren(Expr inner) {
        return new Expr(null).text("(").child(null, inner).text(")");
    }

    public static Built build(Expr root) {
        return build(root, true);
    }

    public static Built buildUntyped(Expr root) {
        return build(root, false);
    }

    private static Built build(Expr root, boolean defaultTypes) {
        StringBuilder source = new StringBuilder();
        // render into a scratch builder first to learn the source text
        Layout scratch = new Layout(ExpressionTree.builder(), source);
        scratch.render(root);

        Layout layout = new Layout(ExpressionTree.builder(source.toString()), new StringBuilder());
        int rootId = layout.render(root);
        ExpressionTree tree = layout.builder.build(rootId);

        AnnotatedTypeService types = new AnnotatedTypeService();
        for (Map.Entry<Expr, Integer> entry : layout.ids.entrySet()) {
            Expr expr = entry.getKey();
            if (expr.types != null) {
                types.annotate(entry.getValue(), expr.types);
            } else if (defaultTypes) {
                types.annotate(entry.getValue(), "object", "undefined");
            }
        }
        return new Built(tree, types, source.toString(), layout.ids);
    }

    /**
     * Result of {@link #build(Expr)}.
     */
    public record Built(ExpressionTree tree, AnnotatedTypeService types, String source, Map<Expr, Integer> ids) {

        /**
         * Node id of an expression of this tree.
         */
        public int id(Expr expr) {
            Integer id = ids.get(expr);
            if (id == null) {
                throw new IllegalArgumentException("Expression is not a node of this tree: " + expr);
            }
            return id;
        }
    }

    /**
     * Description of one expression. Compared by identity.
     */
    public static final class Expr {
        private final NodeKind kind;
        private final List<Object> parts = new ArrayList<>();
        private final Map<Attribute, Object> attributes = new EnumMap<>(Attribute.class);
        private String[] types;

        private Expr(NodeKind kind) {
            this.kind = kind;
        }

        /**
         * Give the node an inferred type, for example {@code typed("string", "undefined")}.
         */
        public Expr typed(String... typeNames) {
            this.types = typeNames;
            return this;
        }

        private Expr text(String text) {
            parts.add(text);
            return this;
        }

        private Expr child(Slot slot, Expr expr) {
            parts.add(new Child(slot, expr));
            return this;
        }

        private Expr children(Slot slot, String separator, Expr... exprs) {
            parts.add(new Children(slot, separator, Arrays.asList(exprs)));
            return this;
        }

        private Expr attr(Attribute attribute, Object value) {
            attributes.put(attribute, value);
            return this;
        }

        @Override
        public String toString() {
            return kind + attributes.toString();
        }
    }

    private record Child(Slot slot, Expr expr) {
    }

    private record Children(Slot slot, String separator, List<Expr> exprs) {
    }

    private static final class Layout {
        private final ExpressionTree.Builder builder;
        private final StringBuilder text;
        private final Map<Expr, Integer> ids = new IdentityHashMap<>();

        Layout(ExpressionTree.Builder builder, StringBuilder text) {
            this.builder = builder;
            this.text = text;
        }

        int render(Expr expr) {
            int start = text.length();
            Map<Slot, List<Integer>> slots = new EnumMap<>(Slot.class);
            int inner = ExpressionTree.NO_NODE;
            for (Object part : expr.parts) {
                if (part instanceof String s) {
                    text.append(s);
                } else if (part instanceof Child c) {
                    int id = render(c.expr());
                    if (c.slot() == null) {
                        inner = id;
                    } else {
                        slots.put(c.slot(), List.of(id));
                    }
                } else if (part instanceof Children c) {
                    List<Integer> list = new ArrayList<>();
                    for (int i = 0; i < c.exprs().size(); i++) {
                        if (i > 0) {
                            text.append(c.separator());
                        }
                        list.add(render(c.exprs().get(i)));
                    }
                    slots.put(c.slot(), list);
                }
            }
            if (expr.kind == null) {
                return inner;
            }

            ExpressionTree.NodeBuilder node = builder.node(expr.kind, start, text.length());
            for (Map.Entry<Slot, List<Integer>> slot : slots.entrySet()) {
                if (slot.getKey().isList()) {
                    node.children(slot.getKey(), slot.getValue());
                } else {
                    node.child(slot.getKey(), slot.getValue().get(0));
                }
            }
            for (Map.Entry<Attribute, Object> attribute : expr.attributes.entrySet()) {
                node.attribute(attribute.getKey(), attribute.getValue());
            }
            int id = node.add();
            ids.put(expr, id);
            return id;
        }
    }
}
