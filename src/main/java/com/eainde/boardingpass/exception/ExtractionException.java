package com.eainde.boardingpass.exception;

/**
 * Base type for errors raised by the boarding pass extraction pipeline.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
