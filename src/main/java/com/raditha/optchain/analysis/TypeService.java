package com.raditha.optchain.analysis;

import com.raditha.optchain.model.TypeTag;

import java.util.Optional;
import java.util.Set;

/**
 * Source of statically inferred types for expression nodes.
 */
public interface TypeService {

    /**
     * Inferred type of a node as the set of its union constituents.
     *
     * @param nodeId id of the node inside the tree being analyzed
     * @return the constituents, or empty when no type information is available
     */
    Optional<Set<TypeTag>> typeOf(int nodeId);

    /**
     * A service that knows nothing. Every loose truthiness guard is then rejected.
     */
    static TypeService none() {
        return nodeId -> Optional.empty();
    }
}
