package com.raditha.merge.freeze;

import com.raditha.merge.model.SourceComment;

import java.util.regex.Pattern;

/**
 * Recognizes freeze start and end marker comments for a token, e.g.
 * {@code // jmerge:freeze} and {@code // jmerge:unfreeze}.
 * Matching is case-insensitive.
 */
public class FreezeMarkers {

    private final String token;
    private final Pattern startPattern;
    private final Pattern endPattern;

    public FreezeMarkers(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("freeze token cannot be blank");
        }
        this.token = token;
        this.startPattern = Pattern.compile(Pattern.quote(token) + ":freeze\\b", Pattern.CASE_INSENSITIVE);
        this.endPattern = Pattern.compile(Pattern.quote(token) + ":unfreeze\\b", Pattern.CASE_INSENSITIVE);
    }

    public String getToken() {
        return token;
    }

    public boolean isStart(SourceComment comment) {
        return startPattern.matcher(comment.content()).find();
    }

    public boolean isEnd(SourceComment comment) {
        return endPattern.matcher(comment.content()).find();
    }
}
