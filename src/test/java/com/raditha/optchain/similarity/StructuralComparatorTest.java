package com.raditha.optchain.similarity;

import com.raditha.optchain.Js;
import com.raditha.optchain.model.Attribute;
import com.raditha.optchain.model.ComparisonResult;
import com.raditha.optchain.model.ExpressionTree;
import com.raditha.optchain.model.NodeKind;
import com.raditha.optchain.model.Slot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raditha.optchain.Js.*;
import static org.junit.jupiter.api.Assertions.*;

class StructuralComparatorTest {

    /**
     * Compare two expressions placed side by side in one tree.
     */
    private static ComparisonResult compare(Js.Expr left, Js.Expr right) {
        Js.Built built = Js.build(Js.array(left, right));
        return new StructuralComparator(built.tree()).compare(built.id(left), built.id(right));
    }

    @Test
    void testSameIdentifierIsEqual() {
        assertEquals(ComparisonResult.EQUAL, compare(id("a"), id("a")));
        assertEquals(ComparisonResult.INVALID, compare(id("a"), id("b")));
    }

    @Test
    void testMemberExtensionIsSubset() {
        assertEquals(ComparisonResult.SUBSET, compare(id("a"), member(id("a"), "b")));
        assertEquals(ComparisonResult.SUBSET, compare(id("a"), member(member(id("a"), "b"), "c")));
        assertEquals(ComparisonResult.SUBSET, compare(member(id("a"), "b"), member(member(id("a"), "b"), "c")));
    }

    @Test
    void testDifferentPropertyIsInvalid() {
        assertEquals(ComparisonResult.INVALID, compare(member(id("a"), "b"), member(id("a"), "c")));
        assertEquals(ComparisonResult.INVALID, compare(id("a"), member(id("b"), "a")));
    }

    @Test
    void testSameMemberIsEqual() {
        assertEquals(ComparisonResult.EQUAL, compare(member(id("a"), "b"), member(id("a"), "b")));
        assertEquals(ComparisonResult.EQUAL, compare(index(id("a"), num(0)), index(id("a"), num(0))));
        assertEquals(ComparisonResult.INVALID, compare(index(id("a"), num(0)), index(id("a"), num(1))));
    }

    @Test
    void testComputedFlagMustMatch() {
        assertEquals(ComparisonResult.INVALID, compare(index(id("a"), str("b")), member(id("a"), "b")));
    }

    @Test
    void testOptionalFlagIsIgnored() {
        assertEquals(ComparisonResult.EQUAL, compare(optMember(id("a"), "b"), member(id("a"), "b")));
    }

    @Test
    void testCallExtensionIsSubset() {
        assertEquals(ComparisonResult.SUBSET, compare(id("a"), call(id("a"))));
        assertEquals(ComparisonResult.SUBSET, compare(call(id("a")), member(call(id("a")), "b")));
        assertEquals(ComparisonResult.SUBSET, compare(member(id("a"), "b"), call(member(id("a"), "b"))));
        // foo() && foo()(bar)
        assertEquals(ComparisonResult.SUBSET, compare(call(id("foo")), call(call(id("foo")), id("bar"))));
    }

    @Test
    void testCallArgumentsMustMatch() {
        assertEquals(ComparisonResult.EQUAL, compare(call(id("a"), id("x")), call(id("a"), id("x"))));
        assertEquals(ComparisonResult.INVALID, compare(call(id("a"), id("x")), call(id("a"), id("y"))));
        assertEquals(ComparisonResult.INVALID, compare(call(id("a"), id("x")), call(id("a"))));
    }

    @Test
    void testPrivatePropertyIsNeverChained() {
        assertEquals(ComparisonResult.INVALID, compare(id("a"), privateMember(id("a"), "secret")));
        assertEquals(ComparisonResult.INVALID,
                compare(privateMember(thisExpr(), "x"), privateMember(thisExpr(), "x")));
    }

    @Test
    void testAllocatingExpressionsAreInvalid() {
        assertEquals(ComparisonResult.INVALID, compare(emptyObject(), emptyObject()));
        assertEquals(ComparisonResult.INVALID, compare(array(), array()));
        assertEquals(ComparisonResult.INVALID, compare(newExpr(id("Foo")), newExpr(id("Foo"))));
        assertEquals(ComparisonResult.INVALID,
                compare(member(emptyObject(), "a"), member(member(emptyObject(), "a"), "b")));
    }

    @Test
    void testAssignmentIsInvalid() {
        assertEquals(ComparisonResult.INVALID, compare(assign(id("a"), id("b")), assign(id("a"), id("b"))));
    }

    @Test
    void testChainWrapperIsLookedThrough() {
        // a?.b && a.b.c
        Js.Expr left = chain(optMember(id("a"), "b"));
        Js.Expr right = member(member(id("a"), "b"), "c");
        assertEquals(ComparisonResult.SUBSET, compare(left, right));
    }

    @Test
    void testParenthesizedChainIsNotLookedThrough() {
        // (a?.b).c && a.b.c
        Js.Expr left = member(paren(chain(optMember(id("a"), "b"))), "c");
        Js.Expr right = member(member(id("a"), "b"), "c");
        assertEquals(ComparisonResult.INVALID, compare(left, right));
    }

    @Test
    void testNonNullAssertionIsLookedThrough() {
        assertEquals(ComparisonResult.SUBSET, compare(nonNull(member(id("a"), "b")), member(member(id("a"), "b"), "c")));
        assertEquals(ComparisonResult.EQUAL, compare(member(id("a"), "b"), nonNull(member(id("a"), "b"))));
    }

    @Test
    void testMetaPropertyPrefix() {
        assertEquals(ComparisonResult.SUBSET, compare(meta("import", "meta"), member(meta("import", "meta"), "env")));
        assertEquals(ComparisonResult.EQUAL, compare(meta("import", "meta"), meta("import", "meta")));
    }

    @Test
    void testTemplateLiteralsCompareByCookedText() {
        assertEquals(ComparisonResult.EQUAL, compare(template("x"), template("x")));
        assertEquals(ComparisonResult.INVALID, compare(template("x"), template("y")));
    }

    @Test
    void testGenericPathComparesOperators() {
        assertEquals(ComparisonResult.EQUAL, compare(not(id("a")), not(id("a"))));
        assertEquals(ComparisonResult.INVALID, compare(not(id("a")), unary("-", id("a"))));
        assertEquals(ComparisonResult.EQUAL, compare(bin(id("a"), "+", id("b")), bin(id("a"), "+", id("b"))));
        assertEquals(ComparisonResult.INVALID, compare(bin(id("a"), "+", id("b")), bin(id("a"), "-", id("b"))));
        assertEquals(ComparisonResult.EQUAL, compare(thisExpr(), thisExpr()));
    }

    @Test
    void testGenericPathNeverYieldsSubset() {
        assertEquals(ComparisonResult.INVALID, compare(not(id("a")), not(member(id("a"), "b"))));
    }

    @Test
    void testAbsentNodes() {
        Js.Built built = Js.build(id("a"));
        StructuralComparator comparator = new StructuralComparator(built.tree());

        assertEquals(ComparisonResult.EQUAL, comparator.compare(ExpressionTree.NO_NODE, ExpressionTree.NO_NODE));
        assertEquals(ComparisonResult.INVALID, comparator.compare(ExpressionTree.NO_NODE, built.tree().root()));
        assertEquals(ComparisonResult.INVALID, comparator.compare(built.tree().root(), ExpressionTree.NO_NODE));
    }

    @Test
    void testUnknownKindIsInvalid() {
        ExpressionTree.Builder builder = ExpressionTree.builder();
        int first = builder.node(NodeKind.UNKNOWN, 0, 1).attribute(Attribute.SOURCE_TYPE, "Decorator").add();
        int second = builder.node(NodeKind.UNKNOWN, 2, 3).attribute(Attribute.SOURCE_TYPE, "Decorator").add();
        int root = builder.node(NodeKind.UNKNOWN, 0, 3).children(Slot.CHILDREN, List.of(first, second)).add();
        StructuralComparator comparator = new StructuralComparator(builder.build(root));

        assertEquals(ComparisonResult.INVALID, comparator.compare(first, second));
        assertEquals(ComparisonResult.INVALID, comparator.compare(first, first));
    }

    @Test
    void testResultsAreMemoized() {
        Js.Expr left = member(id("a"), "b");
        Js.Expr right = call(member(member(id("a"), "b"), "c"));
        Js.Built built = Js.build(Js.array(left, right));
        StructuralComparator comparator = new StructuralComparator(built.tree());

        ComparisonResult first = comparator.compare(built.id(left), built.id(right));
        int cached = comparator.cacheSize();
        int hitsBefore = comparator.cache().hits();
        int missesBefore = comparator.cache().misses();
        ComparisonResult second = comparator.compare(built.id(left), built.id(right));

        assertEquals(ComparisonResult.SUBSET, first);
        assertEquals(first, second, "Cached result must match the computed one");
        assertEquals(cached, comparator.cacheSize(), "A repeated comparison must not add entries");
        assertEquals(hitsBefore + 1, comparator.cache().hits());
        assertEquals(missesBefore, comparator.cache().misses());
    }

    @Test
    void testCacheKeysAreOrdered() {
        Js.Expr shorter = id("a");
        Js.Expr longer = member(id("a"), "b");
        Js.Built built = Js.build(Js.array(shorter, longer));
        StructuralComparator comparator = new StructuralComparator(built.tree());

        assertEquals(ComparisonResult.SUBSET, comparator.compare(built.id(shorter), built.id(longer)));
        assertEquals(ComparisonResult.INVALID, comparator.compare(built.id(longer), built.id(shorter)));
    }
}
