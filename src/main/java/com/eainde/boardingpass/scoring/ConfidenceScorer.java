package com.eainde.boardingpass.scoring;

import com.eainde.boardingpass.model.ExtractionField;
import com.eainde.boardingpass.pipeline.ExtractionSettings;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Weighted mean of field confidences. The denominator always includes the required fields, so a
 * result missing any of them stays strictly below 1.
 */
public class ConfidenceScorer {

    private final ExtractionSettings settings;

    public ConfidenceScorer(ExtractionSettings settings) {
        this.settings = settings;
    }

    public double score(Map<ExtractionField, Double> fieldConfidence) {
        if (fieldConfidence.isEmpty()) {
            return 0.0;
        }
        Set<ExtractionField> counted = EnumSet.copyOf(ExtractionField.requiredFields());
        counted.addAll(fieldConfidence.keySet());

        double numerator = 0.0;
        double denominator = 0.0;
        for (ExtractionField field : counted) {
            double weight = settings.weight(field);
            denominator += weight;
            Double confidence = fieldConfidence.get(field);
            if (confidence != null) {
                numerator += weight * confidence;
            }
        }
        if (denominator <= 0.0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, numerator / denominator));
    }
}
