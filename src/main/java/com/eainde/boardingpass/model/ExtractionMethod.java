package com.eainde.boardingpass.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Which strategy produced a result. Serialized as {@code barcode:<format>}, {@code ai_structured} or {@code ocr}.
 */
public final class ExtractionMethod {

    /**
     * Strategy kinds ordered by trust: on equal confidence a barcode beats the AI extractor, which beats OCR.
     */
    public enum Kind {
        BARCODE("barcode", 3),
        AI_STRUCTURED("ai_structured", 2),
        OCR("ocr", 1);

        private final String label;
        private final int priority;

        Kind(String label, int priority) {
            this.label = label;
            this.priority = priority;
        }

        public String label() {
            return label;
        }

        public int priority() {
            return priority;
        }
    }

    private static final ExtractionMethod AI = new ExtractionMethod(Kind.AI_STRUCTURED, null);
    private static final ExtractionMethod OCR_METHOD = new ExtractionMethod(Kind.OCR, null);

    private final Kind kind;
    private final String barcodeFormat;

    private ExtractionMethod(Kind kind, String barcodeFormat) {
        this.kind = kind;
        this.barcodeFormat = barcodeFormat;
    }

    public static ExtractionMethod barcode(String format) {
        return new ExtractionMethod(Kind.BARCODE, Objects.requireNonNull(format, "format"));
    }

    public static ExtractionMethod aiStructured() {
        return AI;
    }

    public static ExtractionMethod ocr() {
        return OCR_METHOD;
    }

    public Kind kind() {
        return kind;
    }

    public String barcodeFormat() {
        return barcodeFormat;
    }

    @JsonValue
    public String label() {
        return kind == Kind.BARCODE ? kind.label() + ":" + barcodeFormat : kind.label();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractionMethod)) return false;
        ExtractionMethod that = (ExtractionMethod) o;
        return kind == that.kind && Objects.equals(barcodeFormat, that.barcodeFormat);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, barcodeFormat);
    }

    @Override
    public String toString() {
        return label();
    }
}
