package com.raditha.merge.model;

/**
 * The two inputs of a merge.
 */
public enum Side {
    TEMPLATE,
    DESTINATION;

    /**
     * Parse from a case-insensitive string ("template", "destination", "dest").
     */
    public static Side fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("side cannot be null");
        }
        return switch (value.trim().toLowerCase()) {
            case "template" -> TEMPLATE;
            case "destination", "dest" -> DESTINATION;
            default -> throw new IllegalArgumentException(
                    "Unknown side: " + value + " (expected template or destination)");
        };
    }
}
