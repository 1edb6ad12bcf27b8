package com.raditha.merge.exception;

/**
 * Base class for every failure raised by the merge engine.
 * All of them are deterministic; retrying with the same input fails the same way.
 */
public class MergeException extends RuntimeException {

    public MergeException(String message) {
        super(message);
    }

    public MergeException(String message, Throwable cause) {
        super(message, cause);
    }
}
