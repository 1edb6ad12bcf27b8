package com.raditha.merge.exception;

import java.util.List;

/**
 * The destination document is not valid source.
 */
public class DestinationParseException extends ParseException {

    public DestinationParseException(String content, List<String> diagnostics) {
        super("Destination has parsing errors", content, diagnostics);
    }
}
