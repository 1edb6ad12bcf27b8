package com.raditha.merge.exception;

import java.util.List;

/**
 * The template document is not valid source.
 */
public class TemplateParseException extends ParseException {

    public TemplateParseException(String content, List<String> diagnostics) {
        super("Template has parsing errors", content, diagnostics);
    }
}
