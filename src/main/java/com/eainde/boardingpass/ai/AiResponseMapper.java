package com.eainde.boardingpass.ai;

import com.eainde.boardingpass.airport.AirportDirectory;
import com.eainde.boardingpass.model.ExtractionField;
import com.eainde.boardingpass.model.ExtractionMethod;
import com.eainde.boardingpass.model.FlightSegment;
import com.eainde.boardingpass.model.Passenger;
import com.eainde.boardingpass.pipeline.Candidate;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a schema-conforming model answer to a {@link Candidate}. {@value BoardingPassPrompts#NOT_FOUND}
 * and blank values are absent fields; values that fail local validation are dropped with a warning.
 */
public class AiResponseMapper {

    static final double FOUND_CONFIDENCE = 0.9;

    private static final Pattern FLIGHT_NUMBER = Pattern.compile("([A-Z][A-Z0-9]|[0-9][A-Z])0*(\\d{1,4}[A-Z]?)");
    private static final Pattern AIRPORT = Pattern.compile("[A-Z]{3}");
    private static final Pattern SEAT = Pattern.compile("0*(\\d{1,3}[A-Z])");
    private static final Pattern BOOKING = Pattern.compile("[A-Z0-9]{5,8}");
    private static final Pattern NEXT_DAY = Pattern.compile("\\s*\\+\\s*1\\s*$");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("H:mm", Locale.ROOT);

    private final AirportDirectory airports;

    public AiResponseMapper(AirportDirectory airports) {
        this.airports = airports;
    }

    public Candidate map(JsonNode root) {
        Map<ExtractionField, Double> confidence = new EnumMap<>(ExtractionField.class);
        List<String> warnings = new ArrayList<>();
        Candidate.CandidateBuilder candidate = Candidate.builder().method(ExtractionMethod.aiStructured());

        boolean primary = true;
        for (JsonNode node : root.path("flightSegments")) {
            FlightSegment segment = mapSegment(node, warnings);
            if (segment.flightNumber() == null && segment.departureAirport() == null && segment.arrivalAirport() == null) {
                continue;
            }
            if (primary) {
                recordSegmentFields(segment, confidence);
                primary = false;
            }
            candidate.segment(segment);
        }

        for (JsonNode node : root.path("passengers")) {
            String first = text(node, "firstName");
            String last = text(node, "lastName");
            if (last == null && first == null) {
                continue;
            }
            candidate.passenger(new Passenger(first, last));
            confidence.put(ExtractionField.PASSENGER_NAME, FOUND_CONFIDENCE);
        }

        String booking = upper(text(root, "bookingReference"));
        if (booking != null) {
            booking = booking.replace(" ", "");
            if (BOOKING.matcher(booking).matches()) {
                candidate.bookingReference(booking);
                confidence.put(ExtractionField.BOOKING_REFERENCE, FOUND_CONFIDENCE);
            } else {
                warnings.add("Discarded AI booking reference '" + booking + "': unexpected format");
            }
        }

        return candidate.fieldConfidence(confidence).warnings(warnings).build();
    }

    private FlightSegment mapSegment(JsonNode node, List<String> warnings) {
        FlightSegment.FlightSegmentBuilder segment = FlightSegment.builder();

        String flight = upper(text(node, "flightNumber"));
        if (flight != null) {
            Matcher m = FLIGHT_NUMBER.matcher(flight.replace(" ", ""));
            if (m.matches()) {
                segment.flightNumber(m.group(1) + m.group(2));
            } else {
                warnings.add("Discarded AI flight number '" + flight + "': unexpected format");
            }
        }
        segment.airline(text(node, "airline"));
        segment.departureAirport(airport(text(node, "departureAirport"), warnings));
        segment.arrivalAirport(airport(text(node, "arrivalAirport"), warnings));

        String date = text(node, "flightDate");
        if (date != null) {
            try {
                segment.flightDate(LocalDate.parse(date));
            } catch (DateTimeParseException e) {
                warnings.add("Discarded AI flight date '" + date + "': not an ISO date");
            }
        }

        String arrival = text(node, "arrivalTime");
        if (arrival != null && NEXT_DAY.matcher(arrival).find()) {
            segment.arrivalNextDay(true);
            arrival = NEXT_DAY.matcher(arrival).replaceFirst("");
        }
        segment.departureTime(time("departure time", text(node, "departureTime"), warnings));
        segment.arrivalTime(time("arrival time", arrival, warnings));
        segment.boardingTime(time("boarding time", text(node, "boardingTime"), warnings));
        segment.gateClosingTime(time("gate closing time", text(node, "gateClosingTime"), warnings));

        String seat = upper(text(node, "seat"));
        if (seat != null) {
            Matcher m = SEAT.matcher(seat.replace(" ", ""));
            if (m.matches()) {
                segment.seat(m.group(1));
            } else {
                warnings.add("Discarded AI seat '" + seat + "': unexpected format");
            }
        }
        return segment.build();
    }

    private static void recordSegmentFields(FlightSegment segment, Map<ExtractionField, Double> confidence) {
        put(confidence, ExtractionField.FLIGHT_NUMBER, segment.flightNumber());
        put(confidence, ExtractionField.AIRLINE, segment.airline());
        put(confidence, ExtractionField.DEPARTURE_AIRPORT, segment.departureAirport());
        put(confidence, ExtractionField.ARRIVAL_AIRPORT, segment.arrivalAirport());
        put(confidence, ExtractionField.FLIGHT_DATE, segment.flightDate());
        put(confidence, ExtractionField.DEPARTURE_TIME, segment.departureTime());
        put(confidence, ExtractionField.ARRIVAL_TIME, segment.arrivalTime());
        put(confidence, ExtractionField.BOARDING_TIME, segment.boardingTime());
        put(confidence, ExtractionField.GATE_CLOSING_TIME, segment.gateClosingTime());
        put(confidence, ExtractionField.SEAT, segment.seat());
    }

    private static void put(Map<ExtractionField, Double> confidence, ExtractionField field, Object value) {
        if (value != null) {
            confidence.put(field, FOUND_CONFIDENCE);
        }
    }

    private String airport(String value, List<String> warnings) {
        String code = upper(value);
        if (code == null) {
            return null;
        }
        if (!AIRPORT.matcher(code).matches() || !airports.isValidAirportCode(code)) {
            warnings.add("Discarded airport code '" + code + "': not in the airport dataset");
            return null;
        }
        return code;
    }

    private static LocalTime time(String label, String value, List<String> warnings) {
        if (value == null) {
            return null;
        }
        try {
            return LocalTime.parse(value.trim(), TIME);
        } catch (DateTimeParseException e) {
            warnings.add("Discarded AI " + label + " '" + value + "': not a 24h time");
            return null;
        }
    }

    /**
     * Trimmed value with whitespace runs collapsed to one space, or null for blank and not-found
     * markers. Internal spaces are never removed.
     */
    static String text(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || !value.isTextual()) {
            return null;
        }
        String text = value.asText().trim().replaceAll("\\s+", " ");
        if (text.isEmpty() || BoardingPassPrompts.NOT_FOUND.equalsIgnoreCase(text)) {
            return null;
        }
        return text;
    }

    private static String upper(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }
}
