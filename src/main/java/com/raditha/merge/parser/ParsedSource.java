package com.raditha.merge.parser;

import com.raditha.merge.model.Node;
import com.raditha.merge.model.SourceComment;

import java.util.List;

/**
 * Result of parsing one document.
 *
 * @param content     the original text
 * @param lines       the text split into lines
 * @param valid       whether the document parsed without errors
 * @param diagnostics parser problems, empty when valid
 * @param nodes       top-level nodes in source order
 * @param comments    every comment in the document, in source order
 */
public record ParsedSource(
        String content,
        List<String> lines,
        boolean valid,
        List<String> diagnostics,
        List<Node> nodes,
        List<SourceComment> comments) {

    public ParsedSource {
        content = content == null ? "" : content;
        lines = lines == null ? List.of() : List.copyOf(lines);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        comments = comments == null ? List.of() : List.copyOf(comments);
    }

    /**
     * An invalid parse with the given diagnostics.
     */
    public static ParsedSource invalid(String content, List<String> diagnostics) {
        return new ParsedSource(content, SourceText.splitLines(content), false, diagnostics, List.of(), List.of());
    }
}
