package com.raditha.optchain.analysis;

import com.raditha.optchain.model.TypeTag;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Type service backed by per-node annotations, typically the {@code inferredType}
 * properties recorded by the ESTree reader.
 */
public class AnnotatedTypeService implements TypeService {

    private final Map<Integer, Set<TypeTag>> types = new HashMap<>();

    /**
     * Record the inferred type of a node, replacing any earlier annotation.
     *
     * @throws IllegalArgumentException if the tag set is empty
     */
    public AnnotatedTypeService annotate(int nodeId, Set<TypeTag> tags) {
        if (tags.isEmpty()) {
            throw new IllegalArgumentException("Node " + nodeId + " needs at least one type tag");
        }
        types.put(nodeId, Collections.unmodifiableSet(EnumSet.copyOf(tags)));
        return this;
    }

    /**
     * Record a type given by name, for example {@code "string"} or {@code "boolean"}.
     */
    public AnnotatedTypeService annotate(int nodeId, String... typeNames) {
        Set<TypeTag> tags = EnumSet.noneOf(TypeTag.class);
        for (String name : typeNames) {
            tags.addAll(TypeTag.parse(name));
        }
        return annotate(nodeId, tags);
    }

    @Override
    public Optional<Set<TypeTag>> typeOf(int nodeId) {
        return Optional.ofNullable(types.get(nodeId));
    }

    public int size() {
        return types.size();
    }
}
