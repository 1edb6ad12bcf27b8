package com.raditha.merge.merger;

import com.raditha.merge.model.Decision;

import java.util.Map;

/**
 * Merged content together with line statistics and a summary of the merge inputs.
 *
 * @param content    the merged document
 * @param statistics lines per decision
 * @param debugInfo  summary of the inputs and options
 */
public record MergeOutcome(String content, Map<Decision, Integer> statistics, DebugInfo debugInfo) {

    public MergeOutcome {
        statistics = statistics == null ? Map.of() : Map.copyOf(statistics);
    }
}
