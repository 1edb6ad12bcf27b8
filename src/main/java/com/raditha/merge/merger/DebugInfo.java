package com.raditha.merge.merger;

import com.raditha.merge.config.MergePreference;

/**
 * Inputs of a merge as reported by {@link SmartMerger#mergeWithDebug()}.
 *
 * @param templateStatements    top-level units in the template
 * @param destinationStatements top-level units in the destination
 * @param preference            preference in effect
 * @param addTemplateOnlyNodes  whether template-only units were emitted
 * @param freezeToken           freeze token, null when freeze handling is off
 * @param provenanceReport      line-by-line provenance dump
 */
public record DebugInfo(
        int templateStatements,
        int destinationStatements,
        MergePreference preference,
        boolean addTemplateOnlyNodes,
        String freezeToken,
        String provenanceReport) {
}
