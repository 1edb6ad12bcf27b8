package com.raditha.merge.parser;

import com.github.javaparser.Range;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Line-oriented view of a source document.
 * Lines are 1-indexed and stored without their terminators.
 */
public class SourceText {

    private final List<String> lines;

    public SourceText(String content) {
        this.lines = splitLines(content);
    }

    /**
     * Split text into lines, accepting both LF and CRLF terminators.
     * A single trailing terminator does not produce an extra empty line.
     */
    public static List<String> splitLines(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        List<String> result = new ArrayList<>(Arrays.asList(content.split("\r?\n", -1)));
        if (result.get(result.size() - 1).isEmpty()) {
            result.remove(result.size() - 1);
        }
        return List.copyOf(result);
    }

    /**
     * Collapse runs of whitespace to a single space and trim.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    public List<String> lines() {
        return lines;
    }

    public int lineCount() {
        return lines.size();
    }

    /**
     * The text of a line, or the empty string when out of range.
     */
    public String line(int lineNumber) {
        if (lineNumber < 1 || lineNumber > lines.size()) {
            return "";
        }
        return lines.get(lineNumber - 1);
    }

    /**
     * Extract the exact text covered by a JavaParser range (columns are inclusive).
     */
    public String slice(Range range) {
        int beginLine = range.begin.line;
        int endLine = range.end.line;
        if (beginLine == endLine) {
            return cut(line(beginLine), range.begin.column - 1, range.end.column);
        }
        StringBuilder sb = new StringBuilder();
        String first = line(beginLine);
        sb.append(cut(first, range.begin.column - 1, first.length()));
        for (int i = beginLine + 1; i < endLine; i++) {
            sb.append('\n').append(line(i));
        }
        sb.append('\n').append(cut(line(endLine), 0, range.end.column));
        return sb.toString();
    }

    private static String cut(String line, int from, int to) {
        int start = Math.max(0, Math.min(from, line.length()));
        int end = Math.max(start, Math.min(to, line.length()));
        return line.substring(start, end);
    }
}
