package io.memoria.core.model;

/**
 * Raised when an external payload cannot be converted into the pipeline's value types.
 */
public final class MalformedInputException extends RuntimeException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
