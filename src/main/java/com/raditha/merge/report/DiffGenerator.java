package com.raditha.merge.report;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.raditha.merge.parser.SourceText;

import java.util.List;

/**
 * Generates unified diffs between a destination file and its merged version.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    private static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Generate a unified diff with three lines of context.
     *
     * @param fileName name shown in the diff header
     * @param original destination content before the merge
     * @param merged   merged content
     * @return unified diff, empty when the contents are equal
     */
    public String generateUnifiedDiff(String fileName, String original, String merged) {
        return generateUnifiedDiff(fileName, original, merged, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(String fileName, String original, String merged, int contextLines) {
        List<String> originalLines = SourceText.splitLines(original);
        List<String> mergedLines = SourceText.splitLines(merged);

        Patch<String> patch = DiffUtils.diff(originalLines, mergedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                originalLines,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }
}
