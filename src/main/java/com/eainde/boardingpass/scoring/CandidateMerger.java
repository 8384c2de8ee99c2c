package com.eainde.boardingpass.scoring;

import com.eainde.boardingpass.model.ExtractionField;
import com.eainde.boardingpass.model.FlightSegment;
import com.eainde.boardingpass.pipeline.Candidate;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Field-level merge of two candidates. Every field takes the value of whichever candidate is more
 * confident about it; ties keep the winner's value. The passenger list moves as one field.
 */
public class CandidateMerger {

    public Candidate merge(Candidate winner, Candidate other) {
        Map<ExtractionField, Double> confidence = new EnumMap<>(ExtractionField.class);
        FlightSegment w = winner.primarySegment();
        FlightSegment o = other.primarySegment();
        FlightSegment.FlightSegmentBuilder primary = FlightSegment.builder();

        primary.flightNumber(pick(ExtractionField.FLIGHT_NUMBER, winner, other, w.flightNumber(), o.flightNumber(), confidence));
        primary.airline(pick(ExtractionField.AIRLINE, winner, other, w.airline(), o.airline(), confidence));
        primary.departureAirport(pick(ExtractionField.DEPARTURE_AIRPORT, winner, other,
                w.departureAirport(), o.departureAirport(), confidence));
        primary.arrivalAirport(pick(ExtractionField.ARRIVAL_AIRPORT, winner, other,
                w.arrivalAirport(), o.arrivalAirport(), confidence));
        primary.flightDate(pick(ExtractionField.FLIGHT_DATE, winner, other, w.flightDate(), o.flightDate(), confidence));
        primary.departureTime(pick(ExtractionField.DEPARTURE_TIME, winner, other,
                w.departureTime(), o.departureTime(), confidence));
        primary.boardingTime(pick(ExtractionField.BOARDING_TIME, winner, other,
                w.boardingTime(), o.boardingTime(), confidence));
        primary.gateClosingTime(pick(ExtractionField.GATE_CLOSING_TIME, winner, other,
                w.gateClosingTime(), o.gateClosingTime(), confidence));
        primary.seat(pick(ExtractionField.SEAT, winner, other, w.seat(), o.seat(), confidence));

        // the next-day marker belongs to the arrival time it qualifies
        boolean arrivalFromOther = takesOther(ExtractionField.ARRIVAL_TIME, winner, other);
        FlightSegment arrivalSource = arrivalFromOther ? o : w;
        primary.arrivalTime(arrivalSource.arrivalTime()).arrivalNextDay(arrivalSource.arrivalNextDay());
        record(ExtractionField.ARRIVAL_TIME, arrivalFromOther ? other : winner, confidence);

        Candidate.CandidateBuilder merged = Candidate.builder()
                .method(winner.method())
                .segment(primary.build());

        Candidate longer = other.segments().size() > winner.segments().size() ? other : winner;
        for (int i = 1; i < longer.segments().size(); i++) {
            merged.segment(longer.segments().get(i));
        }

        Candidate passengers = takesOther(ExtractionField.PASSENGER_NAME, winner, other) ? other : winner;
        merged.passengers(passengers.passengers());
        record(ExtractionField.PASSENGER_NAME, passengers, confidence);

        merged.bookingReference(pick(ExtractionField.BOOKING_REFERENCE, winner, other,
                winner.bookingReference(), other.bookingReference(), confidence));

        Set<String> warnings = new LinkedHashSet<>(winner.warnings());
        warnings.addAll(other.warnings());
        return merged.fieldConfidence(confidence).warnings(new ArrayList<>(warnings)).build();
    }

    public Candidate mergeAll(List<Candidate> rankedCandidates) {
        if (rankedCandidates.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge");
        }
        Candidate result = rankedCandidates.get(0);
        for (int i = 1; i < rankedCandidates.size(); i++) {
            result = merge(result, rankedCandidates.get(i));
        }
        return result;
    }

    private static <T> T pick(ExtractionField field, Candidate winner, Candidate other, T winnerValue, T otherValue,
                              Map<ExtractionField, Double> confidence) {
        boolean fromOther = takesOther(field, winner, other);
        record(field, fromOther ? other : winner, confidence);
        return fromOther ? otherValue : winnerValue;
    }

    private static boolean takesOther(ExtractionField field, Candidate winner, Candidate other) {
        return other.has(field) && (!winner.has(field) || other.confidence(field) > winner.confidence(field));
    }

    private static void record(ExtractionField field, Candidate source, Map<ExtractionField, Double> confidence) {
        if (source.has(field)) {
            confidence.put(field, source.confidence(field));
        }
    }
}
