package com.raditha.merge.signature;

import com.raditha.merge.model.Node;
import com.raditha.merge.model.Signature;

/**
 * Computes the structural identity key of a node.
 */
@FunctionalInterface
public interface SignatureGenerator {

    /**
     * @param node the node to identify
     * @return the signature, or null when the node has no identity
     */
    Signature signature(Node node);

    /**
     * Compose a custom generator with a fallback used whenever the custom
     * generator returns null.
     */
    static SignatureGenerator withFallback(SignatureGenerator custom, SignatureGenerator fallback) {
        if (custom == null) {
            return fallback;
        }
        return node -> {
            Signature signature = custom.signature(node);
            return signature != null ? signature : fallback.signature(node);
        };
    }
}
