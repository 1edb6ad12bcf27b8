package com.raditha.merge.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.raditha.merge.model.NodeKind;
import com.raditha.merge.model.Side;
import com.raditha.merge.signature.NodeTyping;
import com.raditha.merge.similarity.MethodMatchRefiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Loads merge options from a YAML file (jmerge.yml).
 * <p>
 * Settings may sit under a top-level {@code jmerge} key or at the root of the file.
 * Configuration priority: CLI arguments > jmerge.yml > defaults. The CLI applies
 * its overrides on the options returned here.
 */
public class MergeSettings {

    private static final Logger logger = LoggerFactory.getLogger(MergeSettings.class);

    private static final String CONFIG_KEY = "jmerge";

    private static final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    private MergeSettings() {
    }

    /**
     * Read a settings file and apply it over the defaults.
     */
    public static MergeOptions load(Path configFile) throws IOException {
        return apply(readConfig(configFile), MergeOptions.defaults());
    }

    /**
     * Read the settings map of a YAML file.
     */
    public static Map<String, Object> readConfig(Path configFile) throws IOException {
        Map<String, Object> root = mapper.readValue(configFile.toFile(), new TypeReference<Map<String, Object>>() {
        });
        if (root == null) {
            return Map.of();
        }
        Object nested = root.get(CONFIG_KEY);
        if (nested instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> config = (Map<String, Object>) nested;
            return config;
        }
        return root;
    }

    /**
     * Apply a settings map over existing options. Keys that are absent leave
     * the option unchanged.
     */
    public static MergeOptions apply(Map<String, Object> config, MergeOptions base) {
        MergeOptions options = base;

        Object preference = config.get("preference");
        if (preference instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> perType = (Map<String, Object>) preference;
            options = withPerTypePreference(options, perType);
        } else if (preference != null) {
            options = options.withPreference(Side.fromString(preference.toString()));
        }

        options = options.withIncludeTemplateOnlyNodes(
                getBoolean(config, "add_template_only_nodes", options.includeTemplateOnlyNodes()));

        if (!getBoolean(config, "freeze_enabled", true)) {
            options = options.withFreezeToken(null);
        } else {
            options = options.withFreezeToken(getString(config, "freeze_token", options.freezeToken()));
        }

        options = options.withMaxRecursionDepth(
                getInt(config, "max_recursion_depth", options.maxRecursionDepth()));

        MethodMatchRefiner refiner = buildRefiner(config);
        if (refiner != null) {
            options = options.withMatchRefiner(refiner);
        }

        List<String> patterns = getListString(config, "directive_patterns");
        if (!patterns.isEmpty()) {
            options = options.withDirectivePatterns(patterns.stream().map(Pattern::compile).toList());
        }

        logger.debug("Loaded settings: preference={}, templateOnly={}, freezeToken={}, maxDepth={}",
                options.preference(), options.includeTemplateOnlyNodes(), options.freezeToken(),
                options.maxRecursionDepth());
        return options;
    }

    /**
     * A per-type preference. Keys naming a node kind are typed by kind, other
     * keys need a custom typing supplied through the API.
     */
    private static MergeOptions withPerTypePreference(MergeOptions options, Map<String, Object> perType) {
        Map<String, Side> sides = new LinkedHashMap<>();
        Map<NodeKind, NodeTyping> typing = new EnumMap<>(NodeKind.class);
        typing.putAll(options.nodeTyping());
        for (Map.Entry<String, Object> entry : perType.entrySet()) {
            sides.put(entry.getKey(), Side.fromString(String.valueOf(entry.getValue())));
            NodeKind kind = kindOrNull(entry.getKey());
            if (kind != null) {
                typing.putIfAbsent(kind, NodeTyping.byKind());
            }
        }
        return options
                .withPreference(MergePreference.perType(sides, options.preference().defaultSide()))
                .withNodeTyping(typing);
    }

    private static NodeKind kindOrNull(String key) {
        if ("default".equals(key)) {
            return null;
        }
        try {
            return NodeKind.fromTag(key);
        } catch (IllegalArgumentException e) {
            logger.debug("Preference key '{}' is not a node kind", key);
            return null;
        }
    }

    private static MethodMatchRefiner buildRefiner(Map<String, Object> config) {
        Object fuzzyObj = config.get("fuzzy_methods");
        if (fuzzyObj instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> fuzzy = (Map<String, Object>) fuzzyObj;
            if (!getBoolean(fuzzy, "enabled", true)) {
                return null;
            }
            double threshold = getDouble(fuzzy, "threshold", MethodMatchRefiner.DEFAULT_THRESHOLD);
            FuzzyMatchWeights balanced = FuzzyMatchWeights.balanced();
            FuzzyMatchWeights weights = new FuzzyMatchWeights(
                    getDouble(fuzzy, "name_weight", balanced.nameWeight()),
                    getDouble(fuzzy, "params_weight", balanced.paramsWeight()));
            return new MethodMatchRefiner(threshold, weights);
        }
        if (Boolean.TRUE.equals(fuzzyObj)) {
            return new MethodMatchRefiner();
        }
        return null;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List) {
            return (List<String>) value;
        }
        return List.of();
    }
}
