package com.raditha.merge.analysis;

import com.raditha.merge.model.SourceComment;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes tool directive comments such as {@code // @formatter:off} or
 * {@code // CHECKSTYLE:OFF}. Directives at the top of a destination file are
 * kept in place ahead of all merged content.
 */
public class DirectiveComments {

    private final List<Pattern> patterns;

    public DirectiveComments(List<Pattern> patterns) {
        this.patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    public boolean isDirective(SourceComment comment) {
        return directiveType(comment) != null;
    }

    /**
     * The matched directive text, e.g. {@code @formatter:off}, or null.
     */
    public String directiveType(SourceComment comment) {
        String content = comment.content().trim();
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(content);
            if (matcher.find()) {
                return matcher.group().trim();
            }
        }
        return null;
    }
}
