package com.raditha.merge.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Structural identity key of a node: a kind tag followed by discriminants.
 * Two nodes correspond when their signatures are equal.
 *
 * @param parts the tag and discriminants, compared element by element
 */
public record Signature(List<Object> parts) {

    public Signature {
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("signature needs at least a kind tag");
        }
        parts = Collections.unmodifiableList(Arrays.asList(parts.toArray()));
    }

    public static Signature of(Object... parts) {
        return new Signature(Arrays.asList(parts));
    }

    public String tag() {
        return String.valueOf(parts.get(0));
    }

    @Override
    public String toString() {
        return parts.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
    }
}
