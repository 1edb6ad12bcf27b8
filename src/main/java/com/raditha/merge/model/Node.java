package com.raditha.merge.model;

import java.util.List;

/**
 * A parsed syntax element. Nodes are created by a parser and never change
 * afterwards; merging only reads them and emits new text.
 *
 * @param kind         closed kind used for dispatch
 * @param syntaxType   name of the underlying syntax class, used in diagnostics
 * @param keyword      the construct keyword ({@code class}, {@code if}, {@code field}, ...)
 * @param range        lines covered by the node
 * @param endColumn    1-indexed column of the last character on the end line
 * @param name         identity name, may be null
 * @param parameters   declared parameter names, empty for non-definitions
 * @param discriminant whitespace-normalized identity text, may be null
 * @param text         the raw source text of the node
 * @param body         the block that can be merged recursively, may be null
 * @param children     every nested statement-level node, from all blocks
 */
public record Node(
        NodeKind kind,
        String syntaxType,
        String keyword,
        LineRange range,
        int endColumn,
        String name,
        List<String> parameters,
        String discriminant,
        String text,
        Body body,
        List<Node> children) {

    public Node {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (range == null) {
            throw new IllegalArgumentException("range cannot be null");
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        children = children == null ? List.of() : List.copyOf(children);
        text = text == null ? "" : text;
    }

    /**
     * Create the stand-in node for a freeze region.
     */
    public static Node freezeBlock(LineRange range, String text, String normalizedContent, List<Node> enclosed) {
        return new Node(NodeKind.FREEZE_BLOCK, "FreezeBlock", "freeze_block", range, Integer.MAX_VALUE,
                null, List.of(), normalizedContent, text, null, enclosed);
    }

    /**
     * Create a node for a group of comments that stands on its own.
     *
     * @param directiveType the directive name when the block is a tool directive, otherwise null
     */
    public static Node commentBlock(LineRange range, String text, String normalizedText, String directiveType) {
        if (directiveType != null) {
            return new Node(NodeKind.COMMENT, "CommentBlock", "directive", range, Integer.MAX_VALUE,
                    null, List.of(), directiveType, text, null, List.of());
        }
        return new Node(NodeKind.COMMENT, "CommentBlock", "comment", range, Integer.MAX_VALUE,
                null, List.of(), normalizedText, text, null, List.of());
    }

    public int startLine() {
        return range.startLine();
    }

    public int endLine() {
        return range.endLine();
    }

    public boolean hasBody() {
        return body != null;
    }

    public boolean isFreezeBlock() {
        return kind == NodeKind.FREEZE_BLOCK;
    }

    /**
     * Whether the node carries an identity of its own, so that a block holding
     * it is worth merging member by member.
     */
    public boolean isMergeable() {
        return switch (kind) {
            case DEFINITION, TYPE_DECLARATION, INITIALIZER, CALL, CONDITIONAL, LOOP, TRY,
                    CONSTANT, VARIABLE, PACKAGE, IMPORT -> true;
            case LITERAL, COMMENT, FREEZE_BLOCK, OTHER -> false;
        };
    }

    /**
     * Whether a freeze region may lie entirely inside this node.
     */
    public boolean canEncompassFreezeRegion() {
        return switch (kind) {
            case TYPE_DECLARATION, INITIALIZER, DEFINITION, CONDITIONAL, LOOP, TRY -> true;
            case CALL, CONSTANT, VARIABLE, LITERAL, COMMENT, PACKAGE, IMPORT, FREEZE_BLOCK, OTHER ->
                    body != null || !children.isEmpty();
        };
    }

    /**
     * Short human readable description, e.g. "MethodDeclaration greet".
     */
    public String describe() {
        return name == null ? syntaxType : syntaxType + " " + name;
    }

    @Override
    public String toString() {
        return describe() + " at lines " + range.startLine() + "-" + range.endLine();
    }
}
