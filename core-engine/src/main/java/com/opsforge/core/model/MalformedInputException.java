package com.opsforge.core.model;

/**
 * Raised when structural input cannot be trusted: a required field is missing,
 * a timestamp cannot be parsed, or a numeric parameter is out of range.
 *
 * <p>
 * This signals a bug in the caller or the ingestion path. Analytics components
 * never catch it.
 * </p>
 *
 * @since 1.0.0
 */
public class MalformedInputException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
