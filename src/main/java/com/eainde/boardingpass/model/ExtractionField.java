package com.eainde.boardingpass.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The fields a boarding pass extraction can produce, with the key used in
 * {@link ExtractionResult#fieldConfidence()} and the default scoring weight.
 */
public enum ExtractionField {

    FLIGHT_NUMBER("flightNumber", true, 1.5),
    AIRLINE("airline", false, 0.3),
    DEPARTURE_AIRPORT("departureAirport", true, 1.2),
    ARRIVAL_AIRPORT("arrivalAirport", true, 1.2),
    FLIGHT_DATE("flightDate", true, 1.3),
    DEPARTURE_TIME("departureTime", false, 0.8),
    ARRIVAL_TIME("arrivalTime", false, 0.4),
    BOARDING_TIME("boardingTime", false, 0.3),
    GATE_CLOSING_TIME("gateClosingTime", false, 0.3),
    SEAT("seat", false, 0.4),
    PASSENGER_NAME("passengerName", true, 0.8),
    BOOKING_REFERENCE("bookingReference", false, 0.5);

    private final String key;
    private final boolean required;
    private final double defaultWeight;

    ExtractionField(String key, boolean required, double defaultWeight) {
        this.key = key;
        this.required = required;
        this.defaultWeight = defaultWeight;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public boolean isRequired() {
        return required;
    }

    public double defaultWeight() {
        return defaultWeight;
    }

    public static Optional<ExtractionField> fromKey(String key) {
        return Arrays.stream(values())
                .filter(f -> f.key.equals(key))
                .findFirst();
    }

    public static Set<ExtractionField> requiredFields() {
        return Arrays.stream(values())
                .filter(ExtractionField::isRequired)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(ExtractionField.class)));
    }
}
