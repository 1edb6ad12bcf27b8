package com.raditha.merge.model;

/**
 * A comment found in a source document.
 *
 * @param range       lines covered by the comment
 * @param startColumn 1-indexed column of the first comment character
 * @param text        the comment as written, including delimiters
 * @param content     the comment body without delimiters
 */
public record SourceComment(LineRange range, int startColumn, String text, String content) {

    public int startLine() {
        return range.startLine();
    }

    public int endLine() {
        return range.endLine();
    }
}
