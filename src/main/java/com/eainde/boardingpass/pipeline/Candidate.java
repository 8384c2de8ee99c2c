package com.eainde.boardingpass.pipeline;

import com.eainde.boardingpass.model.ExtractionField;
import com.eainde.boardingpass.model.ExtractionMethod;
import com.eainde.boardingpass.model.FlightSegment;
import com.eainde.boardingpass.model.Passenger;
import lombok.Builder;
import lombok.Singular;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * What one strategy extracted, with a confidence in [0,1] per field it found. A field missing
 * from {@code fieldConfidence} was not found.
 */
@Builder(toBuilder = true)
public record Candidate(
        ExtractionMethod method,
        @Singular List<FlightSegment> segments,
        @Singular List<Passenger> passengers,
        String bookingReference,
        Map<ExtractionField, Double> fieldConfidence,
        @Singular List<String> warnings
) {

    public Candidate {
        fieldConfidence = fieldConfidence == null || fieldConfidence.isEmpty()
                ? new EnumMap<>(ExtractionField.class)
                : new EnumMap<>(fieldConfidence);
        for (Map.Entry<ExtractionField, Double> e : fieldConfidence.entrySet()) {
            e.setValue(Math.max(0.0, Math.min(1.0, e.getValue())));
        }
        segments = List.copyOf(segments);
        passengers = List.copyOf(passengers);
        warnings = List.copyOf(warnings);
    }

    public double confidence(ExtractionField field) {
        return fieldConfidence.getOrDefault(field, 0.0);
    }

    public boolean has(ExtractionField field) {
        return fieldConfidence.containsKey(field);
    }

    public FlightSegment primarySegment() {
        return segments.isEmpty() ? FlightSegment.empty() : segments.get(0);
    }

    public int fieldCount() {
        return fieldConfidence.size();
    }

    public double averageConfidence() {
        return fieldConfidence.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    /** Confidence map is a defensive copy; callers may modify it. */
    @Override
    public Map<ExtractionField, Double> fieldConfidence() {
        return new EnumMap<>(fieldConfidence);
    }
}
