package com.raditha.optchain.similarity;

import com.raditha.optchain.model.Attribute;
import com.raditha.optchain.model.ComparisonResult;
import com.raditha.optchain.model.ExpressionTree;
import com.raditha.optchain.model.NodeKind;
import com.raditha.optchain.model.Slot;
import com.raditha.optchain.model.TreeNode;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether one expression is a safe prefix of another.
 * <p>
 * {@code compare(a, b)} answers {@link ComparisonResult#EQUAL} when both
 * expressions denote the same access path, {@link ComparisonResult#SUBSET}
 * when {@code b} extends {@code a} with further member or call access, and
 * {@link ComparisonResult#INVALID} otherwise. Results are memoized for the
 * lifetime of the comparator, which is bound to one tree.
 */
public class StructuralComparator {

    private final ExpressionTree tree;
    private final ComparisonCache cache = new ComparisonCache();

    public StructuralComparator(ExpressionTree tree) {
        this.tree = tree;
    }

    /**
     * Compare two nodes of this comparator's tree. Either side may be
     * {@link ExpressionTree#NO_NODE}.
     */
    public ComparisonResult compare(int left, int right) {
        if (left == ExpressionTree.NO_NODE || right == ExpressionTree.NO_NODE) {
            return left == right ? ComparisonResult.EQUAL : ComparisonResult.INVALID;
        }
        ComparisonResult cached = cache.get(left, right);
        if (cached != null) {
            return cached;
        }
        // not computeIfAbsent: the computation recurses into the cache
        ComparisonResult result = compareUncached(tree.node(left), tree.node(right));
        cache.put(left, right, result);
        return result;
    }

    public ExpressionTree tree() {
        return tree;
    }

    public int cacheSize() {
        return cache.size();
    }

    ComparisonCache cache() {
        return cache;
    }

    private ComparisonResult compareUncached(TreeNode a, TreeNode b) {
        if (a.kind() != b.kind()) {
            return compareMismatched(a, b);
        }

        NodeKind kind = a.kind();
        if (kind.producesFreshValue()) {
            return ComparisonResult.INVALID;
        }
        return switch (kind) {
            case CALL -> compareCalls(a, b);
            case CHAIN -> compare(a.id(), b.child(Slot.EXPRESSION));
            case IDENTIFIER, PRIVATE_IDENTIFIER -> Objects.equals(a.name(), b.name())
                    ? ComparisonResult.EQUAL
                    : ComparisonResult.INVALID;
            case LITERAL -> Objects.equals(a.attribute(Attribute.RAW), b.attribute(Attribute.RAW))
                    && Objects.equals(a.attribute(Attribute.VALUE), b.attribute(Attribute.VALUE))
                    ? ComparisonResult.EQUAL
                    : ComparisonResult.INVALID;
            case MEMBER -> compareMembers(a, b);
            case TEMPLATE_LITERAL, TEMPLATE_LITERAL_TYPE -> compareTemplates(a, b);
            case TEMPLATE_ELEMENT -> Objects.equals(a.attribute(Attribute.COOKED), b.attribute(Attribute.COOKED))
                    ? ComparisonResult.EQUAL
                    : ComparisonResult.INVALID;
            case UNKNOWN -> ComparisonResult.INVALID;
            default -> compareBySlots(a, b);
        };
    }

    /**
     * Kinds differ: look through wrappers, then try the prefix relation.
     */
    private ComparisonResult compareMismatched(TreeNode a, TreeNode b) {
        // a?.b && a.b.c : the chain node only delimits the optional chain
        if (isChainToLookThrough(a)) {
            return compare(a.child(Slot.EXPRESSION), b.id());
        }
        if (isChainToLookThrough(b)) {
            return compare(a.id(), b.child(Slot.EXPRESSION));
        }

        // a.b! && a.b.c : the assertion is type-only
        if (a.is(NodeKind.NON_NULL)) {
            return compare(a.child(Slot.EXPRESSION), b.id());
        }
        if (b.is(NodeKind.NON_NULL)) {
            return compare(a.id(), b.child(Slot.EXPRESSION));
        }

        // a && a.b, a && a(), a.b && a.b(), a() && a().b, import.meta && import.meta.b
        if (a.is(NodeKind.CALL) || a.is(NodeKind.IDENTIFIER) || a.is(NodeKind.MEMBER)
                || a.is(NodeKind.META_PROPERTY)) {
            if (b.is(NodeKind.MEMBER)) {
                if (hasPrivateProperty(b)) {
                    return ComparisonResult.INVALID;
                }
                return subsetIfRelated(a.id(), b.child(Slot.OBJECT));
            }
            if (b.is(NodeKind.CALL)) {
                return subsetIfRelated(a.id(), b.child(Slot.CALLEE));
            }
        }
        return ComparisonResult.INVALID;
    }

    private ComparisonResult compareCalls(TreeNode a, TreeNode b) {
        // foo() && foo()(bar) : arguments of b are not inspected
        if (compare(a.id(), b.child(Slot.CALLEE)) != ComparisonResult.INVALID) {
            return ComparisonResult.SUBSET;
        }
        // optional flags are ignored, the rewrite is an optional chain anyway
        if (compare(a.child(Slot.CALLEE), b.child(Slot.CALLEE)) != ComparisonResult.EQUAL) {
            return ComparisonResult.INVALID;
        }
        if (compareLists(a.children(Slot.ARGUMENTS), b.children(Slot.ARGUMENTS)) != ComparisonResult.EQUAL) {
            return ComparisonResult.INVALID;
        }
        return compare(a.child(Slot.TYPE_ARGUMENTS), b.child(Slot.TYPE_ARGUMENTS)) == ComparisonResult.EQUAL
                ? ComparisonResult.EQUAL
                : ComparisonResult.INVALID;
    }

    private ComparisonResult compareMembers(TreeNode a, TreeNode b) {
        // private names cannot appear in an optional chain
        if (hasPrivateProperty(b)) {
            return ComparisonResult.INVALID;
        }
        // foo.bar && foo.bar.baz : the property of b is not inspected
        if (compare(a.id(), b.child(Slot.OBJECT)) != ComparisonResult.INVALID) {
            return ComparisonResult.SUBSET;
        }
        if (a.flag(Attribute.COMPUTED) != b.flag(Attribute.COMPUTED)) {
            return ComparisonResult.INVALID;
        }
        if (compare(a.child(Slot.OBJECT), b.child(Slot.OBJECT)) != ComparisonResult.EQUAL) {
            return ComparisonResult.INVALID;
        }
        return compare(a.child(Slot.PROPERTY), b.child(Slot.PROPERTY));
    }

    private ComparisonResult compareTemplates(TreeNode a, TreeNode b) {
        List<Integer> quasisA = a.children(Slot.QUASIS);
        List<Integer> quasisB = b.children(Slot.QUASIS);
        if (quasisA.size() != quasisB.size()) {
            return ComparisonResult.INVALID;
        }
        for (int i = 0; i < quasisA.size(); i++) {
            Object cookedA = tree.node(quasisA.get(i)).attribute(Attribute.COOKED);
            Object cookedB = tree.node(quasisB.get(i)).attribute(Attribute.COOKED);
            if (!Objects.equals(cookedA, cookedB)) {
                return ComparisonResult.INVALID;
            }
        }
        return compareBySlots(a, b);
    }

    /**
     * Generic path for kinds without a dedicated rule. Never yields SUBSET.
     */
    private ComparisonResult compareBySlots(TreeNode a, TreeNode b) {
        for (Attribute attribute : a.kind().attributes()) {
            if (!Objects.equals(a.attribute(attribute), b.attribute(attribute))) {
                return ComparisonResult.INVALID;
            }
        }
        // keyword-like constants
        if (a.kind().slots().isEmpty()) {
            return ComparisonResult.EQUAL;
        }
        for (Slot slot : a.kind().slots()) {
            if (compareLists(a.children(slot), b.children(slot)) != ComparisonResult.EQUAL) {
                return ComparisonResult.INVALID;
            }
        }
        return ComparisonResult.EQUAL;
    }

    private ComparisonResult compareLists(List<Integer> left, List<Integer> right) {
        if (left.size() != right.size()) {
            return ComparisonResult.INVALID;
        }
        for (int i = 0; i < left.size(); i++) {
            if (compare(left.get(i), right.get(i)) != ComparisonResult.EQUAL) {
                return ComparisonResult.INVALID;
            }
        }
        return ComparisonResult.EQUAL;
    }

    private ComparisonResult subsetIfRelated(int left, int right) {
        return compare(left, right) != ComparisonResult.INVALID
                ? ComparisonResult.SUBSET
                : ComparisonResult.INVALID;
    }

    private boolean hasPrivateProperty(TreeNode member) {
        int property = member.child(Slot.PROPERTY);
        return property != ExpressionTree.NO_NODE && tree.node(property).is(NodeKind.PRIVATE_IDENTIFIER);
    }

    /**
     * A chain node can be looked through unless parentheses give it runtime
     * meaning, as in {@code (a?.b).c} or {@code (a?.b)()}.
     */
    private boolean isChainToLookThrough(TreeNode node) {
        if (!node.is(NodeKind.CHAIN)) {
            return false;
        }
        int parentId = node.parent();
        if (parentId == ExpressionTree.NO_NODE) {
            return true;
        }
        TreeNode parent = tree.node(parentId);
        if (parent.is(NodeKind.MEMBER) && parent.child(Slot.OBJECT) == node.id()) {
            return false;
        }
        return !(parent.is(NodeKind.CALL) && parent.child(Slot.CALLEE) == node.id());
    }
}
