package com.raditha.optchain.model;

import org.jspecify.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable arena of expression nodes for one source file.
 * <p>
 * Nodes are addressed by dense integer ids. Identity of a node only has
 * meaning inside the tree that owns it, so ids must never be compared across
 * trees.
 */
public final class ExpressionTree {

    /** Marker for an absent child or parent. */
    public static final int NO_NODE = -1;

    private final List<TreeNode> nodes;
    private final int root;
    private final String sourceText;
    private final int[] lineStarts;

    private ExpressionTree(List<TreeNode> nodes, int root, @Nullable String sourceText) {
        this.nodes = nodes;
        this.root = root;
        this.sourceText = sourceText;
        this.lineStarts = sourceText == null ? new int[] { 0 } : computeLineStarts(sourceText);
    }

    public static Builder builder() {
        return new Builder(null);
    }

    public static Builder builder(@Nullable String sourceText) {
        return new Builder(sourceText);
    }

    /**
     * Get a node by id.
     *
     * @throws IllegalArgumentException if the id does not belong to this tree
     */
    public TreeNode node(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IllegalArgumentException("No node with id " + id + " in a tree of " + nodes.size());
        }
        return nodes.get(id);
    }

    public NodeKind kind(int id) {
        return node(id).kind();
    }

    public int parent(int id) {
        return node(id).parent();
    }

    public int root() {
        return root;
    }

    public int size() {
        return nodes.size();
    }

    public Optional<String> sourceText() {
        return Optional.ofNullable(sourceText);
    }

    /**
     * Source text covered by a node, when the source is known and the node has a valid range.
     */
    public Optional<String> text(int id) {
        TreeNode node = node(id);
        if (sourceText == null || !node.range().isKnown() || node.end() > sourceText.length()) {
            return Optional.empty();
        }
        return Optional.of(sourceText.substring(node.start(), node.end()));
    }

    /**
     * All nodes reachable from the root, parents before children, children in slot order.
     */
    public List<Integer> preOrder() {
        List<Integer> order = new ArrayList<>(nodes.size());
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            order.add(current);
            List<Integer> children = childrenOf(node(current));
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return order;
    }

    /**
     * Convert an offset into a 1-based line and column.
     */
    public Position position(int offset) {
        if (offset < 0) {
            return new Position(0, 0);
        }
        int index = Arrays.binarySearch(lineStarts, offset);
        int line = index >= 0 ? index : -index - 2;
        return new Position(line + 1, offset - lineStarts[line] + 1);
    }

    private static List<Integer> childrenOf(TreeNode node) {
        List<Integer> result = new ArrayList<>();
        for (Slot slot : node.kind().slots()) {
            for (int child : node.children(slot)) {
                if (child != NO_NODE) {
                    result.add(child);
                }
            }
        }
        return result;
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Line and column of a source offset, both 1-based. (0, 0) means unknown.
     */
    public record Position(int line, int column) {
        @Override
        public String toString() {
            return line + ":" + column;
        }
    }

    /**
     * Collects nodes bottom-up: children must be added before their parent.
     * Parent links are resolved when the tree is built.
     */
    public static final class Builder {
        private final String sourceText;
        private final List<PendingNode> pending = new ArrayList<>();

        private Builder(@Nullable String sourceText) {
            this.sourceText = sourceText;
        }

        /**
         * Start a node of the given kind covering {@code [start, end)}.
         */
        public NodeBuilder node(NodeKind kind, int start, int end) {
            return new NodeBuilder(this, kind, start, end);
        }

        public int size() {
            return pending.size();
        }

        /**
         * Freeze the collected nodes.
         *
         * @param root id of the root node
         * @throws IllegalArgumentException if a child id is unknown or a node has two parents
         */
        public ExpressionTree build(int root) {
            if (root < 0 || root >= pending.size()) {
                throw new IllegalArgumentException("Root " + root + " was never added");
            }
            int[] parents = new int[pending.size()];
            Arrays.fill(parents, NO_NODE);
            for (int id = 0; id < pending.size(); id++) {
                for (List<Integer> ids : pending.get(id).children.values()) {
                    for (int child : ids) {
                        if (child == NO_NODE) {
                            continue;
                        }
                        if (child >= id) {
                            throw new IllegalArgumentException("Child " + child + " must be added before parent " + id);
                        }
                        if (parents[child] != NO_NODE) {
                            throw new IllegalArgumentException("Node " + child + " already has parent " + parents[child]);
                        }
                        parents[child] = id;
                    }
                }
            }

            List<TreeNode> nodes = new ArrayList<>(pending.size());
            for (int id = 0; id < pending.size(); id++) {
                PendingNode p = pending.get(id);
                nodes.add(new TreeNode(id, p.kind, p.start, p.end, parents[id],
                        Collections.unmodifiableMap(p.children),
                        Collections.unmodifiableMap(p.attributes)));
            }
            return new ExpressionTree(Collections.unmodifiableList(nodes), root, sourceText);
        }

        private int add(PendingNode node) {
            pending.add(node);
            return pending.size() - 1;
        }
    }

    /**
     * Fluent description of one node, finished by {@link #add()}.
     */
    public static final class NodeBuilder {
        private final Builder owner;
        private final PendingNode node;

        private NodeBuilder(Builder owner, NodeKind kind, int start, int end) {
            this.owner = owner;
            this.node = new PendingNode(kind, start, end);
        }

        /**
         * Set a single-valued slot. {@link #NO_NODE} leaves it empty.
         */
        public NodeBuilder child(Slot slot, int id) {
            node.children.put(slot, id == NO_NODE ? List.of() : List.of(id));
            return this;
        }

        /**
         * Set a list slot.
         */
        public NodeBuilder children(Slot slot, List<Integer> ids) {
            node.children.put(slot, List.copyOf(ids));
            return this;
        }

        public NodeBuilder attribute(Attribute attribute, @Nullable Object value) {
            node.attributes.put(attribute, value);
            return this;
        }

        /**
         * Append the node to the arena.
         *
         * @return the new node's id
         */
        public int add() {
            return owner.add(node);
        }
    }

    private static final class PendingNode {
        final NodeKind kind;
        final int start;
        final int end;
        final Map<Slot, List<Integer>> children = new EnumMap<>(Slot.class);
        final Map<Attribute, Object> attributes = new EnumMap<>(Attribute.class);

        PendingNode(NodeKind kind, int start, int end) {
            this.kind = kind;
            this.start = start;
            this.end = end;
        }
    }
}
