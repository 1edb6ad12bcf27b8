package com.raditha.merge.analysis;

import com.raditha.merge.model.LineRange;
import com.raditha.merge.model.Node;
import com.raditha.merge.model.SourceComment;
import com.raditha.merge.parser.SourceText;
import com.raditha.merge.signature.SignatureGenerator;

import java.util.ArrayList;
import java.util.List;

/**
 * Associates comments with the units of one merge level.
 * <p>
 * A comment that starts on a unit's last line after the unit is inline. Own-line
 * comments between two units lead the second one. Comments after the last unit
 * trail it. Comments inside a unit are part of its text and are not attached.
 */
class CommentAttacher {

    private final List<String> lines;
    private final DirectiveComments directives;

    CommentAttacher(List<String> lines, DirectiveComments directives) {
        this.lines = lines;
        this.directives = directives;
    }

    /**
     * Comments that lie completely inside a line window.
     */
    static List<SourceComment> commentsWithin(List<SourceComment> comments, int firstLine, int lastLine) {
        return comments.stream()
                .filter(c -> c.startLine() >= firstLine && c.endLine() <= lastLine)
                .toList();
    }

    /**
     * Group comments into blocks separated by blank lines and turn each block
     * into a comment node.
     */
    List<Node> commentBlocks(List<SourceComment> comments) {
        List<Node> blocks = new ArrayList<>();
        List<SourceComment> current = new ArrayList<>();
        for (SourceComment comment : comments) {
            if (!current.isEmpty() && comment.startLine() > current.get(current.size() - 1).endLine() + 1) {
                blocks.add(toBlock(current));
                current = new ArrayList<>();
            }
            current.add(comment);
        }
        if (!current.isEmpty()) {
            blocks.add(toBlock(current));
        }
        return blocks;
    }

    private Node toBlock(List<SourceComment> comments) {
        LineRange range = LineRange.of(comments.get(0).startLine(), comments.get(comments.size() - 1).endLine());
        String text = String.join("\n", lines.subList(range.startLine() - 1, range.endLine()));
        StringBuilder content = new StringBuilder();
        for (SourceComment comment : comments) {
            content.append(comment.content()).append(' ');
        }
        String directiveType = comments.size() == 1 ? directives.directiveType(comments.get(0)) : null;
        return Node.commentBlock(range, text, SourceText.normalize(content.toString()), directiveType);
    }

    /**
     * Attach comments to units.
     *
     * @param units       units of the level, ordered by start line
     * @param comments    comments inside the level's attachment window, in order
     * @param generator   signature generator for the units
     * @return one {@link NodeInfo} per unit
     */
    List<NodeInfo> attach(List<Node> units, List<SourceComment> comments, SignatureGenerator generator) {
        int count = units.size();
        List<List<SourceComment>> leading = new ArrayList<>();
        List<List<SourceComment>> inline = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            leading.add(new ArrayList<>());
            inline.add(new ArrayList<>());
        }
        List<SourceComment> trailing = new ArrayList<>();

        int[] contentEnd = new int[count];
        for (int i = 0; i < count; i++) {
            contentEnd[i] = units.get(i).endLine();
        }

        int next = 0;
        for (SourceComment comment : comments) {
            int owner = unitContaining(units, comment.startLine());
            if (owner >= 0) {
                Node unit = units.get(owner);
                if (comment.startLine() == unit.endLine() && comment.startColumn() > unit.endColumn()) {
                    inline.get(owner).add(comment);
                    contentEnd[owner] = Math.max(contentEnd[owner], comment.endLine());
                }
                continue;
            }
            while (next < count && units.get(next).startLine() <= comment.startLine()) {
                next++;
            }
            int previous = next - 1;
            if (previous >= 0 && comment.startLine() <= contentEnd[previous]) {
                inline.get(previous).add(comment);
                contentEnd[previous] = Math.max(contentEnd[previous], comment.endLine());
            } else if (next < count) {
                leading.get(next).add(comment);
            } else if (count > 0) {
                trailing.add(comment);
            }
        }

        List<NodeInfo> infos = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Node unit = units.get(i);
            infos.add(new NodeInfo(unit, i, leading.get(i), inline.get(i),
                    i == count - 1 ? trailing : List.of(), generator.signature(unit)));
        }
        return infos;
    }

    private static int unitContaining(List<Node> units, int line) {
        for (int i = 0; i < units.size(); i++) {
            if (units.get(i).range().contains(line)) {
                return i;
            }
        }
        return -1;
    }
}
