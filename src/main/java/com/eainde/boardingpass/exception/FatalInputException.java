package com.eainde.boardingpass.exception;

/**
 * Raised before any extraction work starts when the uploaded document cannot be processed at all.
 * This is the only exception that escapes {@code BoardingPassExtractionService#extract}.
 */
public class FatalInputException extends ExtractionException {

    public enum Reason {
        EMPTY,
        UNREADABLE,
        UNSUPPORTED_MEDIA_TYPE,
        TOO_LARGE
    }

    private final Reason reason;

    public FatalInputException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public FatalInputException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
