package com.raditha.merge.exception;

import java.util.List;

/**
 * A merge input could not be parsed.
 */
public class ParseException extends MergeException {

    private final String content;
    private final List<String> diagnostics;

    public ParseException(String message, String content, List<String> diagnostics) {
        super(buildMessage(message, diagnostics));
        this.content = content;
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    private static String buildMessage(String message, List<String> diagnostics) {
        if (diagnostics == null || diagnostics.isEmpty()) {
            return message;
        }
        return message + ": " + String.join("; ", diagnostics);
    }

    /**
     * The text that failed to parse.
     */
    public String getContent() {
        return content;
    }

    /**
     * Parser diagnostics, one entry per problem.
     */
    public List<String> getDiagnostics() {
        return diagnostics;
    }
}
