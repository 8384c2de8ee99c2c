package com.eainde.boardingpass.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * One flown leg. Airport codes are 3-letter IATA codes that were validated against the airport dataset.
 *
 * @param arrivalNextDay true when the document marks the arrival as "+1", i.e. after midnight of the flight date
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlightSegment(
        @JsonProperty("flightNumber") String flightNumber,
        @JsonProperty("airline") String airline,
        @JsonProperty("departureAirport") String departureAirport,
        @JsonProperty("arrivalAirport") String arrivalAirport,
        @JsonProperty("flightDate") LocalDate flightDate,
        @JsonProperty("departureTime") LocalTime departureTime,
        @JsonProperty("arrivalTime") LocalTime arrivalTime,
        @JsonProperty("boardingTime") LocalTime boardingTime,
        @JsonProperty("gateClosingTime") LocalTime gateClosingTime,
        @JsonProperty("seat") String seat,
        @JsonProperty("arrivalNextDay") boolean arrivalNextDay
) {

    /**
     * Two-letter (or letter+digit) carrier designator at the start of the flight number, if any.
     */
    @JsonIgnore
    public String carrierCode() {
        if (flightNumber == null || flightNumber.length() < 3) {
            return null;
        }
        return flightNumber.substring(0, 2);
    }

    public static FlightSegment empty() {
        return FlightSegment.builder().build();
    }
}
