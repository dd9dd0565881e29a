package com.raditha.optchain.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.optchain.analysis.AnnotatedTypeService;
import com.raditha.optchain.model.Attribute;
import com.raditha.optchain.model.ExpressionTree;
import com.raditha.optchain.model.NodeKind;
import com.raditha.optchain.model.Slot;
import com.raditha.optchain.model.TypeTag;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads ESTree JSON, as produced by TypeScript/JavaScript parsers, into an
 * {@link ExpressionTree}.
 * <p>
 * Offsets come from {@code range: [start, end]}, falling back to
 * {@code start}/{@code end}. An optional {@code inferredType} property (a type
 * name or an array of names) on any node is recorded as that node's type.
 * Node types without a {@link NodeKind} become {@link NodeKind#UNKNOWN}; their
 * nested nodes are still read so that every expression of a file is reached.
 */
public class EstreeTreeReader {

    private static final Logger logger = LoggerFactory.getLogger(EstreeTreeReader.class);

    public static final String INFERRED_TYPE = "inferredType";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Properties that never hold child nodes. */
    private static final Set<String> NON_CHILD_PROPERTIES = Set.of(
            "type", "parent", "range", "loc", "start", "end", INFERRED_TYPE, "comments", "tokens");

    /**
     * Read a JSON file and, when given, the source text it was parsed from.
     */
    public ParsedTree read(Path json, @Nullable Path source) throws IOException {
        String jsonText = Files.readString(json, StandardCharsets.UTF_8);
        String sourceText = source == null ? null : Files.readString(source, StandardCharsets.UTF_8);
        logger.debug("Reading {} (source: {})", json, source);
        return read(jsonText, sourceText);
    }

    /**
     * Read a JSON document.
     *
     * @throws TreeReadException if the text is not JSON or not an ESTree node
     */
    public ParsedTree read(String json, @Nullable String sourceText) throws TreeReadException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TreeReadException("Not a valid JSON document: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new TreeReadException("Empty JSON document");
        }
        Session session = new Session(ExpressionTree.builder(sourceText));
        int rootId = session.readNode(root, "$");
        ExpressionTree tree = session.builder.build(rootId);
        logger.debug("Read {} nodes, {} with inferred types", tree.size(), session.types.size());
        return new ParsedTree(tree, session.types);
    }

    /**
     * State of one read. Nodes are appended children first.
     */
    private static final class Session {
        private final ExpressionTree.Builder builder;
        private final AnnotatedTypeService types = new AnnotatedTypeService();

        Session(ExpressionTree.Builder builder) {
            this.builder = builder;
        }

        int readNode(JsonNode json, String path) throws TreeReadException {
            if (!json.isObject() || !json.path("type").isTextual()) {
                throw new TreeReadException("Expected an ESTree node with a type at " + path);
            }
            String type = json.get("type").asText();
            NodeKind kind = NodeKind.fromEstreeType(type);

            List<SlotValue> slots = new ArrayList<>();
            for (Slot slot : kind.slots()) {
                if (slot.estreeProperty() == null) {
                    slots.add(new SlotValue(slot, readNestedNodes(json, path)));
                } else if (slot.isList()) {
                    slots.add(new SlotValue(slot, readList(property(json, kind, slot), path + "." + slot.estreeProperty())));
                } else {
                    JsonNode child = property(json, kind, slot);
                    int id = child.isObject()
                            ? readNode(child, path + "." + slot.estreeProperty())
                            : ExpressionTree.NO_NODE;
                    slots.add(new SlotValue(slot, List.of(id)));
                }
            }

            int[] range = range(json);
            ExpressionTree.NodeBuilder node = builder.node(kind, range[0], range[1]);
            for (SlotValue value : slots) {
                if (value.slot.isList()) {
                    node.children(value.slot, value.ids);
                } else {
                    node.child(value.slot, value.ids.get(0));
                }
            }
            readAttributes(json, kind, node);
            int id = node.add();

            if (json.has(INFERRED_TYPE)) {
                types.annotate(id, inferredType(json.get(INFERRED_TYPE), path));
            }
            return id;
        }

        private List<Integer> readList(JsonNode array, String path) throws TreeReadException {
            List<Integer> ids = new ArrayList<>();
            if (!array.isArray()) {
                return ids;
            }
            for (int i = 0; i < array.size(); i++) {
                JsonNode element = array.get(i);
                // holes such as `[, a]`
                ids.add(element.isObject() ? readNode(element, path + "[" + i + "]") : ExpressionTree.NO_NODE);
            }
            return ids;
        }

        /**
         * Every node-valued property of a node we do not model, in document order.
         */
        private List<Integer> readNestedNodes(JsonNode json, String path) throws TreeReadException {
            List<Integer> ids = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (NON_CHILD_PROPERTIES.contains(field.getKey())) {
                    continue;
                }
                JsonNode value = field.getValue();
                String childPath = path + "." + field.getKey();
                if (isNode(value)) {
                    ids.add(readNode(value, childPath));
                } else if (value.isArray()) {
                    for (int i = 0; i < value.size(); i++) {
                        if (isNode(value.get(i))) {
                            ids.add(readNode(value.get(i), childPath + "[" + i + "]"));
                        }
                    }
                }
            }
            return ids;
        }

        private static void readAttributes(JsonNode json, NodeKind kind, ExpressionTree.NodeBuilder node) {
            for (Attribute attribute : kind.attributes()) {
                switch (attribute) {
                    case VALUE -> node.attribute(attribute, scalar(json.get("value")));
                    case COOKED -> node.attribute(attribute, scalar(json.path("value").get("cooked")));
                    default -> {
                        JsonNode value = json.get(attribute.estreeProperty());
                        if (value != null && !value.isNull()) {
                            node.attribute(attribute, scalar(value));
                        }
                    }
                }
            }
        }

        private static JsonNode property(JsonNode json, NodeKind kind, Slot slot) {
            JsonNode value = json.path(slot.estreeProperty());
            // older parsers call type arguments typeParameters
            if (value.isMissingNode() && slot == Slot.TYPE_ARGUMENTS && kind != NodeKind.TYPE_ARGUMENT_LIST) {
                value = json.path("typeParameters");
            }
            return value;
        }

        private static Object scalar(@Nullable JsonNode value) {
            if (value == null || value.isNull() || value.isMissingNode()) {
                return null;
            }
            if (value.isBoolean()) {
                return value.booleanValue();
            }
            if (value.isNumber()) {
                return value.doubleValue();
            }
            if (value.isTextual()) {
                return value.textValue();
            }
            // a regular expression value serializes as an empty object
            return null;
        }

        private static Set<TypeTag> inferredType(JsonNode value, String path) throws TreeReadException {
            Set<TypeTag> tags = EnumSet.noneOf(TypeTag.class);
            try {
                if (value.isTextual()) {
                    tags.addAll(TypeTag.parse(value.textValue()));
                } else if (value.isArray()) {
                    for (JsonNode element : value) {
                        tags.addAll(TypeTag.parse(element.asText()));
                    }
                }
            } catch (IllegalArgumentException e) {
                throw new TreeReadException("Bad " + INFERRED_TYPE + " at " + path + ": " + e.getMessage(), e);
            }
            if (tags.isEmpty()) {
                throw new TreeReadException("Empty " + INFERRED_TYPE + " at " + path);
            }
            return tags;
        }

        private static int[] range(JsonNode json) {
            JsonNode range = json.get("range");
            if (range != null && range.isArray() && range.size() == 2) {
                return new int[] { range.get(0).asInt(-1), range.get(1).asInt(-1) };
            }
            return new int[] { json.path("start").asInt(-1), json.path("end").asInt(-1) };
        }

        private static boolean isNode(JsonNode value) {
            return value != null && value.isObject() && value.path("type").isTextual();
        }
    }

    private record SlotValue(Slot slot, List<Integer> ids) {
    }
}
