package com.raditha.merge.resolution;

import com.raditha.merge.analysis.FileAnalysis;
import com.raditha.merge.config.MergeOptions;
import com.raditha.merge.config.MergePreference;
import com.raditha.merge.model.Node;
import com.raditha.merge.model.NodeKind;
import com.raditha.merge.model.Side;
import com.raditha.merge.signature.NodeTyping;

import java.util.Map;

/**
 * Decides which side wins for a pair of matched nodes.
 * A destination node that holds a freeze region always wins. Otherwise the
 * merge type of the template node selects the preference, then the merge type
 * of the destination node, then the default.
 */
public class PreferenceResolver {

    private final MergePreference preference;
    private final Map<NodeKind, NodeTyping> nodeTyping;

    public PreferenceResolver(MergeOptions options) {
        this(options.preference(), options.nodeTyping());
    }

    public PreferenceResolver(MergePreference preference, Map<NodeKind, NodeTyping> nodeTyping) {
        this.preference = preference;
        this.nodeTyping = nodeTyping == null ? Map.of() : nodeTyping;
    }

    /**
     * Winning side for a matched pair, honouring freeze regions in the destination.
     */
    public Side resolve(Node template, Node dest, FileAnalysis destAnalysis) {
        if (destAnalysis.containsFreezeRegion(dest)) {
            return Side.DESTINATION;
        }
        return preferenceFor(template, dest);
    }

    /**
     * Winning side from the configured preference alone.
     */
    public Side preferenceFor(Node template, Node dest) {
        if (!preference.isPerType()) {
            return preference.defaultSide();
        }
        String templateType = mergeTypeOf(template);
        if (preference.hasMergeType(templateType)) {
            return preference.forMergeType(templateType);
        }
        String destType = mergeTypeOf(dest);
        if (preference.hasMergeType(destType)) {
            return preference.forMergeType(destType);
        }
        return preference.defaultSide();
    }

    /**
     * Merge type assigned by the typing function for the node's kind, or null.
     */
    public String mergeTypeOf(Node node) {
        if (node == null) {
            return null;
        }
        NodeTyping typing = nodeTyping.get(node.kind());
        return typing == null ? null : typing.mergeTypeOf(node);
    }
}
