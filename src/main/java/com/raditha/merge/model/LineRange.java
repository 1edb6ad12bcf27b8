package com.raditha.merge.model;

/**
 * An inclusive range of 1-indexed source lines.
 *
 * @param startLine first line of the range
 * @param endLine   last line of the range (inclusive)
 */
public record LineRange(int startLine, int endLine) {

    public LineRange {
        if (startLine < 1) {
            throw new IllegalArgumentException("startLine must be >= 1, got: " + startLine);
        }
        if (endLine < startLine) {
            throw new IllegalArgumentException(
                    "endLine must be >= startLine, got: " + startLine + "-" + endLine);
        }
    }

    /**
     * Create from a JavaParser range, dropping the columns.
     */
    public static LineRange from(com.github.javaparser.Range jpRange) {
        return new LineRange(jpRange.begin.line, jpRange.end.line);
    }

    public static LineRange of(int startLine, int endLine) {
        return new LineRange(startLine, endLine);
    }

    /**
     * A range that may be empty. Returns null when {@code endLine < startLine}.
     */
    public static LineRange ofNullable(int startLine, int endLine) {
        if (startLine < 1 || endLine < startLine) {
            return null;
        }
        return new LineRange(startLine, endLine);
    }

    public int lineCount() {
        return endLine - startLine + 1;
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }

    /**
     * True when {@code other} lies completely within this range.
     */
    public boolean encloses(LineRange other) {
        return other.startLine >= startLine && other.endLine <= endLine;
    }

    public boolean overlaps(LineRange other) {
        return other != null && startLine <= other.endLine && other.startLine <= endLine;
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return "L" + startLine;
        }
        return "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
