package com.eainde.boardingpass.ocr;

import com.eainde.boardingpass.exception.ExtractionException;

/**
 * Recognition of one variant failed. Converted into a failed attempt by the OCR strategy.
 */
public class OcrException extends ExtractionException {

    public OcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
