package com.raditha.merge.analysis;

import com.raditha.merge.model.LineRange;
import com.raditha.merge.model.Node;
import com.raditha.merge.model.Signature;
import com.raditha.merge.model.SourceComment;

import java.util.List;

/**
 * A node as seen at one merge level, together with the comments that travel
 * with it and its signature.
 *
 * @param node             the node or freeze block
 * @param index            position among the units of its level
 * @param leadingComments  own-line comments between the previous unit and this one
 * @param inlineComments   comments that start on the node's last line, after the node
 * @param trailingComments comments after the last unit of the level
 * @param signature        identity key, null for nodes without identity
 */
public record NodeInfo(
        Node node,
        int index,
        List<SourceComment> leadingComments,
        List<SourceComment> inlineComments,
        List<SourceComment> trailingComments,
        Signature signature) {

    public NodeInfo {
        leadingComments = leadingComments == null ? List.of() : List.copyOf(leadingComments);
        inlineComments = inlineComments == null ? List.of() : List.copyOf(inlineComments);
        trailingComments = trailingComments == null ? List.of() : List.copyOf(trailingComments);
    }

    public LineRange lineRange() {
        return node.range();
    }

    /**
     * First line that belongs to this unit, including leading comments.
     */
    public int firstLine() {
        return leadingComments.isEmpty() ? node.startLine() : leadingComments.get(0).startLine();
    }

    /**
     * Last line of the node and its inline comments.
     */
    public int contentEndLine() {
        int end = node.endLine();
        for (SourceComment comment : inlineComments) {
            end = Math.max(end, comment.endLine());
        }
        return end;
    }

    /**
     * Last line that belongs to this unit, including trailing comments.
     */
    public int lastLine() {
        int end = contentEndLine();
        for (SourceComment comment : trailingComments) {
            end = Math.max(end, comment.endLine());
        }
        return end;
    }

    /**
     * Lines from the first leading comment to the last trailing comment.
     */
    public LineRange fullRange() {
        return LineRange.of(firstLine(), lastLine());
    }
}
