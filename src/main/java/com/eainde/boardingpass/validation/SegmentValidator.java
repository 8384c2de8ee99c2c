package com.eainde.boardingpass.validation;

import com.eainde.boardingpass.airport.AirportDirectory;
import com.eainde.boardingpass.model.ExtractionField;
import com.eainde.boardingpass.model.FlightSegment;
import com.eainde.boardingpass.ocr.parse.ParsingRules;
import com.eainde.boardingpass.pipeline.Candidate;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Sanity rules applied to every candidate and again after merging: airports must be in the
 * dataset, an arrival must be at least the minimum flight time after departure unless marked as
 * next day, and a missing airline name is filled from the carrier code.
 */
@Slf4j
public class SegmentValidator {

    private final AirportDirectory airports;
    private final ParsingRules rules;

    public SegmentValidator(AirportDirectory airports, ParsingRules rules) {
        this.airports = airports;
        this.rules = rules;
    }

    public Candidate validate(Candidate candidate) {
        Map<ExtractionField, Double> confidence = candidate.fieldConfidence();
        List<String> warnings = new ArrayList<>(candidate.warnings());
        List<FlightSegment> segments = new ArrayList<>();

        for (int i = 0; i < candidate.segments().size(); i++) {
            boolean primary = i == 0;
            FlightSegment segment = candidate.segments().get(i);
            FlightSegment.FlightSegmentBuilder fixed = segment.toBuilder();

            if (segment.departureAirport() != null && !airports.isValidAirportCode(segment.departureAirport())) {
                warnings.add("Discarded airport code '" + segment.departureAirport() + "': not in the airport dataset");
                fixed.departureAirport(null);
                if (primary) confidence.remove(ExtractionField.DEPARTURE_AIRPORT);
            }
            if (segment.arrivalAirport() != null && !airports.isValidAirportCode(segment.arrivalAirport())) {
                warnings.add("Discarded airport code '" + segment.arrivalAirport() + "': not in the airport dataset");
                fixed.arrivalAirport(null);
                if (primary) confidence.remove(ExtractionField.ARRIVAL_AIRPORT);
            }

            if (arrivesTooEarly(segment)) {
                warnings.add("Discarded arrival time " + segment.arrivalTime() + ": less than "
                        + rules.minFlightMinutes() + " minutes after departure " + segment.departureTime());
                log.debug("Arrival {} rejected against departure {}", segment.arrivalTime(), segment.departureTime());
                fixed.arrivalTime(null).arrivalNextDay(false);
                if (primary) confidence.remove(ExtractionField.ARRIVAL_TIME);
            }

            if (segment.airline() == null) {
                rules.airlineName(segment.carrierCode()).ifPresent(name -> {
                    fixed.airline(name);
                    if (primary) {
                        confidence.put(ExtractionField.AIRLINE, candidate.confidence(ExtractionField.FLIGHT_NUMBER));
                    }
                });
            }
            segments.add(fixed.build());
        }

        return candidate.toBuilder()
                .clearSegments()
                .segments(segments)
                .fieldConfidence(confidence)
                .clearWarnings()
                .warnings(warnings)
                .build();
    }

    private boolean arrivesTooEarly(FlightSegment segment) {
        if (segment.departureTime() == null || segment.arrivalTime() == null || segment.arrivalNextDay()) {
            return false;
        }
        int departure = segment.departureTime().toSecondOfDay() / 60;
        int arrival = segment.arrivalTime().toSecondOfDay() / 60;
        return arrival < departure + rules.minFlightMinutes();
    }
}
