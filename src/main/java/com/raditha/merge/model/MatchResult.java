package com.raditha.merge.model;

/**
 * A fuzzy pairing of a template definition with a destination definition.
 *
 * @param templateNode the template definition
 * @param destNode     the destination definition
 * @param score        combined similarity in [0, 1]
 */
public record MatchResult(Node templateNode, Node destNode, double score) {
}
