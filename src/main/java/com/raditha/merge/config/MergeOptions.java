package com.raditha.merge.config;

import com.raditha.merge.model.NodeKind;
import com.raditha.merge.model.Side;
import com.raditha.merge.signature.NodeTyping;
import com.raditha.merge.signature.SignatureGenerator;
import com.raditha.merge.similarity.MethodMatchRefiner;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Options controlling a merge.
 *
 * @param preference               which side wins for matched nodes
 * @param includeTemplateOnlyNodes emit template nodes that have no destination counterpart
 * @param freezeToken              marker token for freeze regions, null disables them
 * @param signatureGenerator       custom signatures, falls back to the default when it returns null
 * @param nodeTyping               per-kind taggers used with a per-type preference
 * @param maxRecursionDepth        how deep container bodies are merged, 0 for atomic top-level nodes
 * @param matchRefiner             fuzzy pairing of renamed definitions, null to disable
 * @param directivePatterns        comments that must stay at the top of the destination
 */
public record MergeOptions(
        MergePreference preference,
        boolean includeTemplateOnlyNodes,
        String freezeToken,
        SignatureGenerator signatureGenerator,
        Map<NodeKind, NodeTyping> nodeTyping,
        int maxRecursionDepth,
        MethodMatchRefiner matchRefiner,
        List<Pattern> directivePatterns) {

    public static final String DEFAULT_FREEZE_TOKEN = "jmerge";

    public static final List<Pattern> DEFAULT_DIRECTIVE_PATTERNS = List.of(
            Pattern.compile("@formatter:(on|off)"),
            Pattern.compile("CHECKSTYLE[:.]\\s*\\w+"),
            Pattern.compile("^\\s*noinspection\\b"),
            Pattern.compile("spotless:(on|off)"),
            Pattern.compile("\\bNOSONAR\\b"),
            Pattern.compile("\\bNOPMD\\b"));

    /**
     * Validate options.
     */
    public MergeOptions {
        if (preference == null) {
            throw new IllegalArgumentException("preference cannot be null");
        }
        if (freezeToken != null && freezeToken.isBlank()) {
            throw new IllegalArgumentException("freezeToken cannot be blank, use null to disable freeze regions");
        }
        if (maxRecursionDepth < 0) {
            throw new IllegalArgumentException("maxRecursionDepth must be >= 0");
        }
        nodeTyping = nodeTyping == null || nodeTyping.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(nodeTyping));
        directivePatterns = directivePatterns == null ? List.of() : List.copyOf(directivePatterns);
    }

    /**
     * Destination wins, template-only nodes dropped, freeze regions on,
     * unbounded recursion and no fuzzy matching.
     */
    public static MergeOptions defaults() {
        return new MergeOptions(
                MergePreference.destination(),
                false,
                DEFAULT_FREEZE_TOKEN,
                null,
                Map.of(),
                Integer.MAX_VALUE,
                null,
                DEFAULT_DIRECTIVE_PATTERNS);
    }

    public boolean freezeEnabled() {
        return freezeToken != null;
    }

    public MergeOptions withPreference(MergePreference newPreference) {
        return new MergeOptions(newPreference, includeTemplateOnlyNodes, freezeToken, signatureGenerator,
                nodeTyping, maxRecursionDepth, matchRefiner, directivePatterns);
    }

    public MergeOptions withPreference(Side side) {
        return withPreference(MergePreference.of(side));
    }

    public MergeOptions withIncludeTemplateOnlyNodes(boolean include) {
        return new MergeOptions(preference, include, freezeToken, signatureGenerator,
                nodeTyping, maxRecursionDepth, matchRefiner, directivePatterns);
    }

    public MergeOptions withFreezeToken(String token) {
        return new MergeOptions(preference, includeTemplateOnlyNodes, token, signatureGenerator,
                nodeTyping, maxRecursionDepth, matchRefiner, directivePatterns);
    }

    public MergeOptions withSignatureGenerator(SignatureGenerator generator) {
        return new MergeOptions(preference, includeTemplateOnlyNodes, freezeToken, generator,
                nodeTyping, maxRecursionDepth, matchRefiner, directivePatterns);
    }

    public MergeOptions withNodeTyping(Map<NodeKind, NodeTyping> typing) {
        return new MergeOptions(preference, includeTemplateOnlyNodes, freezeToken, signatureGenerator,
                typing, maxRecursionDepth, matchRefiner, directivePatterns);
    }

    public MergeOptions withMaxRecursionDepth(int depth) {
        return new MergeOptions(preference, includeTemplateOnlyNodes, freezeToken, signatureGenerator,
                nodeTyping, depth, matchRefiner, directivePatterns);
    }

    public MergeOptions withMatchRefiner(MethodMatchRefiner refiner) {
        return new MergeOptions(preference, includeTemplateOnlyNodes, freezeToken, signatureGenerator,
                nodeTyping, maxRecursionDepth, refiner, directivePatterns);
    }

    public MergeOptions withDirectivePatterns(List<Pattern> patterns) {
        return new MergeOptions(preference, includeTemplateOnlyNodes, freezeToken, signatureGenerator,
                nodeTyping, maxRecursionDepth, matchRefiner, patterns);
    }
}
