package com.eainde.boardingpass.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Final structured outcome of one extraction call.
 *
 * <p>On success {@code flightSegments} and {@code passengers} are non-empty and {@code method}
 * names the winning strategy. On failure both lists are empty, {@code method} is null and the
 * overall confidence is zero.
 */
public record ExtractionResult(
        @JsonProperty("success") boolean success,
        @JsonProperty("method") ExtractionMethod method,
        @JsonProperty("flightSegments") List<FlightSegment> flightSegments,
        @JsonProperty("passengers") List<Passenger> passengers,
        @JsonProperty("bookingReference") String bookingReference,
        @JsonProperty("fieldConfidence") Map<String, Double> fieldConfidence,
        @JsonProperty("overallConfidence") double overallConfidence,
        @JsonProperty("warnings") List<String> warnings,
        @JsonProperty("errors") List<String> errors,
        @JsonProperty("attempts") List<StrategyAttempt> attempts,
        @JsonProperty("processingTimeMs") long processingTimeMs
) {

    public ExtractionResult {
        flightSegments = List.copyOf(flightSegments);
        passengers = List.copyOf(passengers);
        fieldConfidence = Map.copyOf(fieldConfidence);
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
        attempts = List.copyOf(attempts);
    }

    public static ExtractionResult failure(List<String> warnings, List<String> errors,
                                           List<StrategyAttempt> attempts, long processingTimeMs) {
        return new ExtractionResult(false, null, List.of(), List.of(), null, Map.of(), 0.0,
                warnings, errors, attempts, processingTimeMs);
    }

    public ExtractionResult withProcessingTime(long millis) {
        return new ExtractionResult(success, method, flightSegments, passengers, bookingReference, fieldConfidence,
                overallConfidence, warnings, errors, attempts, millis);
    }

    public FlightSegment primarySegment() {
        return flightSegments.isEmpty() ? null : flightSegments.get(0);
    }
}
