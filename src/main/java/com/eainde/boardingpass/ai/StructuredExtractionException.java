package com.eainde.boardingpass.ai;

import com.eainde.boardingpass.exception.ExtractionException;

public class StructuredExtractionException extends ExtractionException {

    private final boolean timeout;

    public StructuredExtractionException(String message, boolean timeout) {
        super(message);
        this.timeout = timeout;
    }

    public StructuredExtractionException(String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
