package com.raditha.merge.signature;

import com.raditha.merge.model.Node;

/**
 * Tags a node with a caller-defined merge type. The tag selects an entry of a
 * per-type preference map.
 */
@FunctionalInterface
public interface NodeTyping {

    /**
     * @param node the node to tag
     * @return the merge type, or null to leave the node untyped
     */
    String mergeTypeOf(Node node);

    /**
     * Tags every node with its lower-case kind name, e.g. {@code definition}.
     */
    static NodeTyping byKind() {
        return node -> node.kind().tag();
    }
}
