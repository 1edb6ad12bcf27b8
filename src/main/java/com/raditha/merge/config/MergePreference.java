package com.raditha.merge.config;

import com.raditha.merge.model.Side;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Which side wins when two matched nodes differ.
 * Either a single side, or a map from merge type to side with a default.
 *
 * @param defaultSide side used for untyped nodes and unknown merge types
 * @param byMergeType per-type overrides, keyed by the tag a {@code NodeTyping} assigns
 */
public record MergePreference(Side defaultSide, Map<String, Side> byMergeType) {

    public MergePreference {
        if (defaultSide == null) {
            throw new IllegalArgumentException("defaultSide cannot be null");
        }
        byMergeType = byMergeType == null ? Map.of() : Map.copyOf(byMergeType);
    }

    public static MergePreference of(Side side) {
        return new MergePreference(side, Map.of());
    }

    /**
     * Template wins: shared structure is updated.
     */
    public static MergePreference template() {
        return of(Side.TEMPLATE);
    }

    /**
     * Destination wins: local customizations are kept.
     */
    public static MergePreference destination() {
        return of(Side.DESTINATION);
    }

    /**
     * Build a per-type preference. A {@code "default"} key in the map overrides
     * {@code fallback}.
     */
    public static MergePreference perType(Map<String, Side> byMergeType, Side fallback) {
        Map<String, Side> copy = new LinkedHashMap<>(byMergeType);
        Side defaultSide = copy.containsKey("default") ? copy.remove("default") : fallback;
        return new MergePreference(defaultSide, copy);
    }

    public boolean isPerType() {
        return !byMergeType.isEmpty();
    }

    /**
     * Side for a merge type, falling back to the default for null or unknown types.
     */
    public Side forMergeType(String mergeType) {
        if (mergeType == null) {
            return defaultSide;
        }
        return byMergeType.getOrDefault(mergeType, defaultSide);
    }

    public boolean hasMergeType(String mergeType) {
        return mergeType != null && byMergeType.containsKey(mergeType);
    }

    @Override
    public String toString() {
        if (!isPerType()) {
            return defaultSide.name().toLowerCase();
        }
        return byMergeType + " (default " + defaultSide.name().toLowerCase() + ")";
    }
}
