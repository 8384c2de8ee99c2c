package com.eainde.boardingpass.barcode;

import com.eainde.boardingpass.model.FlightSegment;
import com.eainde.boardingpass.model.Passenger;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Year;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Parses the fixed-offset IATA Bar Coded Boarding Pass (Resolution 792) "M" format.
 *
 * <p>Layout of the mandatory items:
 * <pre>
 *  0      format code 'M'
 *  1      number of legs encoded (1-9)
 *  2-21   passenger name, LAST/FIRST
 *  22     electronic ticket indicator
 *  per leg, 37 characters followed by a conditional section:
 *   +0  PNR (7)        +7  from (3)     +10 to (3)        +13 operating carrier (3)
 *   +16 flight (5)     +21 julian date (3)  +24 compartment (1)  +25 seat (4)
 *   +29 sequence (5)   +34 passenger status (1)  +35 conditional section size, hex (2)
 * </pre>
 * The payload is all-or-nothing: any malformed mandatory item rejects it.
 */
@Slf4j
public class BcbpParser {

    private static final int HEADER_LENGTH = 23;
    private static final int LEG_LENGTH = 37;

    private static final Pattern AIRPORT = Pattern.compile("[A-Z]{3}");
    private static final Pattern CARRIER = Pattern.compile("[A-Z0-9]{2,3}");
    private static final Pattern FLIGHT = Pattern.compile("0*(\\d{1,4})([A-Z]?)");
    private static final Pattern PNR = Pattern.compile("[A-Z0-9]{5,7}");
    private static final Pattern JULIAN = Pattern.compile("\\d{3}");
    private static final Pattern SEAT = Pattern.compile("0*(\\d{1,3}[A-Z])");
    private static final Pattern HEX_SIZE = Pattern.compile("[0-9A-Fa-f]{2}");

    private static final Set<String> TITLES = Set.of("MR", "MRS", "MS", "MSTR", "MISS", "DR", "PROF");

    private final Clock clock;

    public BcbpParser(Clock clock) {
        this.clock = clock;
    }

    public Optional<BcbpRecord> parse(String payload) {
        if (payload == null || payload.length() < HEADER_LENGTH + LEG_LENGTH || payload.charAt(0) != 'M') {
            return Optional.empty();
        }
        char legCountChar = payload.charAt(1);
        if (legCountChar < '1' || legCountChar > '9') {
            return Optional.empty();
        }
        int legCount = legCountChar - '0';

        Optional<Passenger> passenger = parseName(payload.substring(2, 22));
        if (passenger.isEmpty()) {
            return Optional.empty();
        }

        List<RawLeg> rawLegs = new ArrayList<>();
        int offset = HEADER_LENGTH;
        for (int i = 0; i < legCount; i++) {
            if (payload.length() < offset + LEG_LENGTH) {
                log.debug("BCBP payload truncated in leg {}", i + 1);
                return Optional.empty();
            }
            Optional<RawLeg> leg = parseLeg(payload, offset);
            if (leg.isEmpty()) {
                return Optional.empty();
            }
            int conditionalStart = offset + LEG_LENGTH;
            int conditionalEnd = conditionalStart + leg.get().conditionalSize();
            if (conditionalEnd > payload.length()) {
                log.debug("BCBP conditional section of leg {} exceeds payload", i + 1);
                return Optional.empty();
            }
            rawLegs.add(leg.get().withConditional(payload.substring(conditionalStart, conditionalEnd)));
            offset = conditionalEnd;
        }

        Optional<LocalDate> issueDate = issueDate(rawLegs.get(0).conditional());
        List<FlightSegment> segments = new ArrayList<>();
        for (RawLeg leg : rawLegs) {
            Optional<LocalDate> flightDate = resolveFlightDate(leg.julianDay(), issueDate);
            if (flightDate.isEmpty()) {
                return Optional.empty();
            }
            segments.add(FlightSegment.builder()
                    .flightNumber(leg.carrier() + leg.flightNumber())
                    .departureAirport(leg.from())
                    .arrivalAirport(leg.to())
                    .flightDate(flightDate.get())
                    .seat(leg.seat())
                    .build());
        }
        return Optional.of(new BcbpRecord(passenger.get(), rawLegs.get(0).pnr(), segments));
    }

    static Optional<Passenger> parseName(String field) {
        String name = field.trim();
        int slash = name.indexOf('/');
        String last = slash < 0 ? name : name.substring(0, slash);
        String first = slash < 0 ? "" : name.substring(slash + 1);
        last = collapse(last);
        first = stripTitle(collapse(first));
        if (last.isEmpty() || !last.chars().anyMatch(Character::isLetter)
                || last.chars().anyMatch(Character::isDigit)) {
            return Optional.empty();
        }
        return Optional.of(new Passenger(first, last));
    }

    private static String stripTitle(String first) {
        String[] words = first.split(" ");
        if (words.length > 1 && TITLES.contains(words[words.length - 1])) {
            return String.join(" ", List.of(words).subList(0, words.length - 1));
        }
        return first;
    }

    private static String collapse(String value) {
        return value.trim().replaceAll("\\s+", " ");
    }

    private Optional<RawLeg> parseLeg(String payload, int offset) {
        String pnr = payload.substring(offset, offset + 7).trim();
        String from = payload.substring(offset + 7, offset + 10);
        String to = payload.substring(offset + 10, offset + 13);
        String carrier = payload.substring(offset + 13, offset + 16).trim();
        String flight = payload.substring(offset + 16, offset + 21).trim();
        String julian = payload.substring(offset + 21, offset + 24);
        String seat = payload.substring(offset + 25, offset + 29).trim();
        String size = payload.substring(offset + 35, offset + 37);

        Matcher flightMatcher = FLIGHT.matcher(flight);
        if (!PNR.matcher(pnr).matches()
                || !AIRPORT.matcher(from).matches()
                || !AIRPORT.matcher(to).matches()
                || !CARRIER.matcher(carrier).matches()
                || !flightMatcher.matches()
                || !JULIAN.matcher(julian).matches()
                || !HEX_SIZE.matcher(size).matches()) {
            log.debug("BCBP leg at offset {} has a malformed mandatory item", offset);
            return Optional.empty();
        }
        int julianDay = Integer.parseInt(julian);
        if (julianDay < 1 || julianDay > 366) {
            return Optional.empty();
        }

        Matcher seatMatcher = SEAT.matcher(seat);
        String normalizedSeat = seatMatcher.matches() ? seatMatcher.group(1) : null;
        String flightNumber = flightMatcher.group(1) + flightMatcher.group(2);
        return Optional.of(new RawLeg(pnr, from, to, carrier, flightNumber, julianDay, normalizedSeat,
                Integer.parseInt(size, 16), ""));
    }

    /**
     * Date of issue from the unique conditional items of the first leg: '>' version(1) size(2)
     * passenger description(1) check-in source(1) issuance source(1) then year digit + julian day.
     */
    private Optional<LocalDate> issueDate(String conditional) {
        if (conditional.length() < 11 || conditional.charAt(0) != '>') {
            return Optional.empty();
        }
        String raw = conditional.substring(7, 11);
        if (!raw.matches("\\d{4}")) {
            return Optional.empty();
        }
        int yearDigit = raw.charAt(0) - '0';
        int julianDay = Integer.parseInt(raw.substring(1));
        LocalDate today = LocalDate.now(clock);
        int year = today.getYear() - Math.floorMod(today.getYear() - yearDigit, 10);
        try {
            return Optional.of(LocalDate.ofYearDay(year, julianDay));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    /**
     * The flight is never before the issue date, so a julian day earlier than the issue day rolls
     * into the following year. Without an issue date the candidate closest to today wins.
     */
    Optional<LocalDate> resolveFlightDate(int julianDay, Optional<LocalDate> issueDate) {
        if (issueDate.isPresent()) {
            LocalDate issued = issueDate.get();
            int year = julianDay >= issued.getDayOfYear() ? issued.getYear() : issued.getYear() + 1;
            return ofYearDay(year, julianDay);
        }
        LocalDate today = LocalDate.now(clock);
        return Stream.of(today.getYear() - 1, today.getYear(), today.getYear() + 1)
                .map(year -> ofYearDay(year, julianDay))
                .flatMap(Optional::stream)
                .min(Comparator.comparingLong(date -> Math.abs(ChronoUnit.DAYS.between(today, date))));
    }

    private static Optional<LocalDate> ofYearDay(int year, int julianDay) {
        if (julianDay == 366 && !Year.isLeap(year)) {
            return Optional.empty();
        }
        return Optional.of(LocalDate.ofYearDay(year, julianDay));
    }

    private record RawLeg(String pnr, String from, String to, String carrier, String flightNumber,
                          int julianDay, String seat, int conditionalSize, String conditional) {

        RawLeg withConditional(String section) {
            return new RawLeg(pnr, from, to, carrier, flightNumber, julianDay, seat, conditionalSize, section);
        }
    }
}
