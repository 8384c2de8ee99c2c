package com.eainde.boardingpass.pipeline;

import com.eainde.boardingpass.model.ExtractionField;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable tuning values for one pipeline instance. Built from Spring properties in production and
 * directly in tests.
 *
 * <pre>
 * ExtractionSettings settings = ExtractionSettings.builder()
 *         .aiEnabled(true)
 *         .aiConfidenceThreshold(0.7)
 *         .build();
 * </pre>
 */
public final class ExtractionSettings {

    private final long maxUploadBytes;
    private final int maxPages;
    private final int renderDpi;
    private final Duration defaultTimeout;
    private final boolean barcodeEnabled;
    private final Duration barcodeBudget;
    private final boolean aiEnabled;
    private final Duration aiTimeout;
    private final double aiConfidenceThreshold;
    private final boolean ocrEnabled;
    private final Duration ocrBudget;
    private final int ocrMinFields;
    private final int upscaleBelowWidth;
    private final Map<ExtractionField, Double> fieldWeights;

    private ExtractionSettings(Builder builder) {
        this.maxUploadBytes = builder.maxUploadBytes;
        this.maxPages = builder.maxPages;
        this.renderDpi = builder.renderDpi;
        this.defaultTimeout = builder.defaultTimeout;
        this.barcodeEnabled = builder.barcodeEnabled;
        this.barcodeBudget = builder.barcodeBudget;
        this.aiEnabled = builder.aiEnabled;
        this.aiTimeout = builder.aiTimeout;
        this.aiConfidenceThreshold = builder.aiConfidenceThreshold;
        this.ocrEnabled = builder.ocrEnabled;
        this.ocrBudget = builder.ocrBudget;
        this.ocrMinFields = builder.ocrMinFields;
        this.upscaleBelowWidth = builder.upscaleBelowWidth;

        Map<ExtractionField, Double> weights = new EnumMap<>(ExtractionField.class);
        for (ExtractionField field : ExtractionField.values()) {
            weights.put(field, field.defaultWeight());
        }
        weights.putAll(builder.fieldWeights);
        this.fieldWeights = Collections.unmodifiableMap(weights);
    }

    public long getMaxUploadBytes() {
        return maxUploadBytes;
    }

    public int getMaxPages() {
        return maxPages;
    }

    public int getRenderDpi() {
        return renderDpi;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public boolean isBarcodeEnabled() {
        return barcodeEnabled;
    }

    public Duration getBarcodeBudget() {
        return barcodeBudget;
    }

    public boolean isAiEnabled() {
        return aiEnabled;
    }

    public Duration getAiTimeout() {
        return aiTimeout;
    }

    public double getAiConfidenceThreshold() {
        return aiConfidenceThreshold;
    }

    public boolean isOcrEnabled() {
        return ocrEnabled;
    }

    public Duration getOcrBudget() {
        return ocrBudget;
    }

    public int getOcrMinFields() {
        return ocrMinFields;
    }

    public int getUpscaleBelowWidth() {
        return upscaleBelowWidth;
    }

    public Map<ExtractionField, Double> getFieldWeights() {
        return fieldWeights;
    }

    public double weight(ExtractionField field) {
        return fieldWeights.get(field);
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static ExtractionSettings defaults() {
        return builder().build();
    }

    public static class Builder {
        private long maxUploadBytes = 10L * 1024 * 1024;
        private int maxPages = 1;
        private int renderDpi = 200;
        private Duration defaultTimeout = Duration.ofSeconds(60);
        private boolean barcodeEnabled = true;
        private Duration barcodeBudget = Duration.ofSeconds(5);
        private boolean aiEnabled = false;
        private Duration aiTimeout = Duration.ofSeconds(30);
        private double aiConfidenceThreshold = 0.6;
        private boolean ocrEnabled = true;
        private Duration ocrBudget = Duration.ofSeconds(20);
        private int ocrMinFields = 3;
        private int upscaleBelowWidth = 1000;
        private final Map<ExtractionField, Double> fieldWeights = new EnumMap<>(ExtractionField.class);

        /** Largest accepted upload. Default: 10 MiB. */
        public Builder maxUploadBytes(long maxUploadBytes) {
            if (maxUploadBytes <= 0) throw new IllegalArgumentException("maxUploadBytes must be > 0");
            this.maxUploadBytes = maxUploadBytes;
            return this;
        }

        /** Upper bound on pages scanned for barcodes in a multi-page document. Default: 1, the first page only. */
        public Builder maxPages(int maxPages) {
            if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
            this.maxPages = maxPages;
            return this;
        }

        public Builder renderDpi(int renderDpi) {
            if (renderDpi < 72) throw new IllegalArgumentException("renderDpi must be >= 72");
            this.renderDpi = renderDpi;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = requirePositive(defaultTimeout, "defaultTimeout");
            return this;
        }

        public Builder barcodeEnabled(boolean barcodeEnabled) {
            this.barcodeEnabled = barcodeEnabled;
            return this;
        }

        public Builder barcodeBudget(Duration barcodeBudget) {
            this.barcodeBudget = requirePositive(barcodeBudget, "barcodeBudget");
            return this;
        }

        public Builder aiEnabled(boolean aiEnabled) {
            this.aiEnabled = aiEnabled;
            return this;
        }

        public Builder aiTimeout(Duration aiTimeout) {
            this.aiTimeout = requirePositive(aiTimeout, "aiTimeout");
            return this;
        }

        /** AI results scoring below this also trigger the OCR chain and a merge. Default: 0.6. */
        public Builder aiConfidenceThreshold(double aiConfidenceThreshold) {
            if (aiConfidenceThreshold < 0 || aiConfidenceThreshold > 1) {
                throw new IllegalArgumentException("aiConfidenceThreshold must be within [0,1]");
            }
            this.aiConfidenceThreshold = aiConfidenceThreshold;
            return this;
        }

        public Builder ocrEnabled(boolean ocrEnabled) {
            this.ocrEnabled = ocrEnabled;
            return this;
        }

        public Builder ocrBudget(Duration ocrBudget) {
            this.ocrBudget = requirePositive(ocrBudget, "ocrBudget");
            return this;
        }

        public Builder ocrMinFields(int ocrMinFields) {
            if (ocrMinFields < 1) throw new IllegalArgumentException("ocrMinFields must be >= 1");
            this.ocrMinFields = ocrMinFields;
            return this;
        }

        public Builder upscaleBelowWidth(int upscaleBelowWidth) {
            this.upscaleBelowWidth = upscaleBelowWidth;
            return this;
        }

        public Builder fieldWeight(ExtractionField field, double weight) {
            if (weight <= 0) throw new IllegalArgumentException("weight for " + field.key() + " must be > 0");
            this.fieldWeights.put(field, weight);
            return this;
        }

        public ExtractionSettings build() {
            return new ExtractionSettings(this);
        }

        private static Duration requirePositive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
