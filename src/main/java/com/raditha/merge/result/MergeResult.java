package com.raditha.merge.result;

import com.raditha.merge.analysis.FileAnalysis;
import com.raditha.merge.model.Decision;
import com.raditha.merge.model.LineProvenance;
import com.raditha.merge.model.LineRange;
import com.raditha.merge.model.Side;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Accumulates merged lines together with the provenance of every line.
 * A result belongs to a single merge call.
 */
public class MergeResult {

    private static final int DEBUG_CONTENT_WIDTH = 60;

    private final List<String> lines = new ArrayList<>();
    private final List<LineProvenance> provenance = new ArrayList<>();

    /**
     * Append one line.
     *
     * @param content      line text without terminator
     * @param decision     why the line is emitted
     * @param templateLine source line in the template, or null
     * @param destLine     source line in the destination, or null
     * @param comment      optional note for debugging
     */
    public void addLine(String content, Decision decision, Integer templateLine, Integer destLine, String comment) {
        lines.add(content);
        provenance.add(new LineProvenance(decision, templateLine, destLine, comment, lines.size() - 1));
    }

    /**
     * Append one line copied from a source document.
     */
    public void addLine(String content, Decision decision, Side source, int sourceLine) {
        if (source == Side.TEMPLATE) {
            addLine(content, decision, sourceLine, null, null);
        } else {
            addLine(content, decision, null, sourceLine, null);
        }
    }

    /**
     * Append a line range of an analysed document.
     */
    public void addLines(FileAnalysis analysis, LineRange range, Decision decision, Side source) {
        if (range == null) {
            return;
        }
        for (int line = range.startLine(); line <= range.endLine(); line++) {
            addLine(analysis.lineAt(line), decision, source, line);
        }
    }

    /**
     * Number of blank lines at the end of the output.
     */
    public int trailingBlankLines() {
        int count = 0;
        for (int i = lines.size() - 1; i >= 0 && lines.get(i).isBlank(); i--) {
            count++;
        }
        return count;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public int size() {
        return lines.size();
    }

    public List<String> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public List<LineProvenance> getProvenance() {
        return Collections.unmodifiableList(provenance);
    }

    /**
     * The merged document: lines joined with newlines and a final newline.
     */
    public String content() {
        if (lines.isEmpty()) {
            return "";
        }
        return String.join("\n", lines) + "\n";
    }

    /**
     * Count of lines per decision. Decisions that never occurred are absent.
     */
    public Map<Decision, Integer> statistics() {
        Map<Decision, Integer> stats = new EnumMap<>(Decision.class);
        for (LineProvenance meta : provenance) {
            stats.merge(meta.decision(), 1, Integer::sum);
        }
        return stats;
    }

    public int count(Decision decision) {
        return statistics().getOrDefault(decision, 0);
    }

    public List<LineProvenance> linesByDecision(Decision decision) {
        return provenance.stream().filter(meta -> meta.decision() == decision).toList();
    }

    /**
     * Human readable dump of every line with its provenance.
     */
    public String debugOutput() {
        List<String> output = new ArrayList<>();
        output.add("=== Merge Result Debug ===");
        output.add("Total lines: " + lines.size());
        output.add("Statistics: " + statisticsSummary());
        output.add("");
        output.add("Line-by-line provenance:");

        for (int i = 0; i < lines.size(); i++) {
            LineProvenance meta = provenance.get(i);
            String line = lines.get(i);
            String content = line.length() > DEBUG_CONTENT_WIDTH ? line.substring(0, DEBUG_CONTENT_WIDTH) : line;
            output.add(String.format("%4s %-20s %-8s %-8s | %s",
                    (i + 1) + ":",
                    meta.decision().label(),
                    meta.templateLine() != null ? "T:" + meta.templateLine() : "",
                    meta.destLine() != null ? "D:" + meta.destLine() : "",
                    content));
        }
        return String.join("\n", output);
    }

    private String statisticsSummary() {
        return statistics().entrySet().stream()
                .map(entry -> entry.getKey().label() + "=" + entry.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public String toString() {
        return content();
    }
}
