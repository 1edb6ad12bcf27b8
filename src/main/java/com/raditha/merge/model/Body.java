package com.raditha.merge.model;

import java.util.List;

/**
 * The single brace-delimited block of a node that can be merged recursively.
 *
 * @param openLine  line holding the opening brace
 * @param closeLine line holding the closing brace
 * @param children  direct statement-level children of the block
 */
public record Body(int openLine, int closeLine, List<Node> children) {

    public Body {
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * True when the members sit strictly between the brace lines, so that the
     * lines of the block can be split into header, window and footer.
     */
    public boolean isWindowed() {
        if (openLine >= closeLine) {
            return false;
        }
        for (Node child : children) {
            if (child.startLine() <= openLine || child.endLine() >= closeLine) {
                return false;
            }
        }
        return true;
    }

    /**
     * Lines strictly between the braces, or null when the braces are adjacent.
     */
    public LineRange window() {
        return LineRange.ofNullable(openLine + 1, closeLine - 1);
    }

    public boolean hasMergeableChild() {
        return children.stream().anyMatch(Node::isMergeable);
    }
}
