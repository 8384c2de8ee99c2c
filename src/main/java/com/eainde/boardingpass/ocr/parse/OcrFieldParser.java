package com.eainde.boardingpass.ocr.parse;

import com.eainde.boardingpass.airport.AirportDirectory;
import com.eainde.boardingpass.model.ExtractionField;
import com.eainde.boardingpass.model.ExtractionMethod;
import com.eainde.boardingpass.model.FlightSegment;
import com.eainde.boardingpass.model.Passenger;
import com.eainde.boardingpass.pipeline.Candidate;

import java.time.Clock;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns recognised boarding pass text into a {@link Candidate} using keyword proximity: a value on,
 * or within {@link ParsingRules#proximityLines()} lines below, a matching label is preferred over one
 * found anywhere else in the text.
 *
 * <p>The parser is stateless and safe to share between threads.
 */
public class OcrFieldParser {

    static final double KNOWN_CARRIER_CONFIDENCE = 0.9;
    static final double UNKNOWN_CARRIER_CONFIDENCE = 0.7;
    static final double KEYWORD_AIRPORT_CONFIDENCE = 0.85;
    static final double FALLBACK_AIRPORT_CONFIDENCE = 0.6;
    static final double DATE_PROXIMITY_BONUS = 0.1;
    static final double KEYWORD_NAME_CONFIDENCE = 0.85;
    static final double GLOBAL_NAME_CONFIDENCE = 0.75;
    static final double PLAIN_NAME_CONFIDENCE = 0.7;
    static final double KEYWORD_BOOKING_CONFIDENCE = 0.8;
    static final double GLOBAL_BOOKING_CONFIDENCE = 0.5;
    static final double KEYWORD_SEAT_CONFIDENCE = 0.9;
    static final double GLOBAL_SEAT_CONFIDENCE = 0.6;
    static final double AIRLINE_FROM_CARRIER_CONFIDENCE = 0.9;
    static final double AIRLINE_FROM_TEXT_CONFIDENCE = 0.7;

    private static final Pattern FLIGHT = Pattern.compile(
            "(?<![A-Z0-9])([A-Z]{2}|[A-Z]\\d|\\d[A-Z]) ?0*(\\d{1,4}[A-Z]?)(?![A-Z0-9])");
    private static final Pattern CODE = Pattern.compile("(?<![A-Z0-9])([A-Z]{3})(?![A-Z0-9])");
    private static final Pattern ROUTE = Pattern.compile(
            "(?<![A-Z0-9])([A-Z]{3}) *(?:-|–|>|→|/| TO ) *([A-Z]{3})(?![A-Z0-9])");
    private static final Pattern TIME = Pattern.compile(
            "(?<![\\d:.])([01]?\\d|2[0-3]):([0-5]\\d)(?![\\d:])( ?\\(?\\+1\\)?)?");
    private static final Pattern NAME_SLASH = Pattern.compile(
            "([A-Z][A-Z'\\-]*(?: [A-Z][A-Z'\\-]*)*) ?/ ?([A-Z][A-Z'\\-]*(?: [A-Z][A-Z'\\-]*)*)");
    private static final Pattern NAME_COMMA = Pattern.compile(
            "([A-Z][A-Z'\\-]+(?: [A-Z][A-Z'\\-]+)*), ?([A-Z][A-Z'\\-]+(?: [A-Z][A-Z'\\-]+)*)");
    private static final Pattern PLAIN_NAME = Pattern.compile("[A-Z][A-Z'\\-]+(?: [A-Z][A-Z'\\-]+){1,4}");
    private static final Pattern BOOKING = Pattern.compile("(?<![A-Z0-9])([A-Z0-9]{5,7})(?![A-Z0-9])");
    private static final Pattern SEAT_NEAR_LABEL = Pattern.compile("(?<![A-Z0-9:])0*(\\d{1,2}) ?([A-K])(?![A-Z0-9])");
    private static final Pattern SEAT_ANYWHERE = Pattern.compile("(?<![A-Z0-9:])0*(\\d{1,2})([A-K])(?![A-Z0-9])");

    private enum TimeKind { DEPARTURE, ARRIVAL, BOARDING, GATE_CLOSING }

    private static final Map<TimeKind, String> TIME_GROUPS = Map.of(
            TimeKind.DEPARTURE, "departureTime",
            TimeKind.ARRIVAL, "arrivalTime",
            TimeKind.BOARDING, "boarding",
            TimeKind.GATE_CLOSING, "gateClosing");

    private final ParsingRules rules;
    private final AirportDirectory airports;
    private final DateTokenParser dateParser;
    private final Map<String, Pattern> keywordPatterns = new HashMap<>();
    private final Set<String> nonAirportWords;
    private final Set<String> nameStopWords;

    public OcrFieldParser(ParsingRules rules, AirportDirectory airports, Clock clock) {
        this.rules = rules;
        this.airports = airports;
        this.dateParser = new DateTokenParser(clock);
        rules.keywords().forEach((group, words) -> keywordPatterns.put(group, keywordPattern(words)));
        this.nonAirportWords = rules.nonAirportWords();
        Set<String> stopWords = new HashSet<>(rules.nameBlocklist());
        stopWords.addAll(rules.keywords("passenger"));
        this.nameStopWords = stopWords;
    }

    public Candidate parse(String rawText) {
        List<String> lines = normalize(rawText);
        Map<ExtractionField, Double> confidence = new EnumMap<>(ExtractionField.class);
        FlightSegment.FlightSegmentBuilder segment = FlightSegment.builder();
        List<String> warnings = new ArrayList<>();

        Optional<String> flightNumber = findFlightNumber(lines, confidence);
        flightNumber.ifPresent(segment::flightNumber);
        findAirline(lines, flightNumber, confidence).ifPresent(segment::airline);
        findAirports(lines, segment, confidence, warnings);
        findDate(lines, segment, confidence, warnings);
        findTimes(lines, segment, confidence);
        Optional<Passenger> passenger = findPassenger(lines, confidence);
        Optional<String> bookingReference = findBookingReference(lines, flightNumber, passenger, confidence);
        findSeat(lines, segment, confidence);

        if (flightNumber.isEmpty()) {
            warnings.add("OCR could not extract a flight number");
        }
        if (!confidence.containsKey(ExtractionField.FLIGHT_DATE)) {
            warnings.add("OCR could not extract the flight date");
        }

        Candidate.CandidateBuilder candidate = Candidate.builder()
                .method(ExtractionMethod.ocr())
                .segment(segment.build())
                .bookingReference(bookingReference.orElse(null))
                .fieldConfidence(confidence)
                .warnings(warnings);
        passenger.ifPresent(candidate::passenger);
        return candidate.build();
    }

    // =========================================================================
    //  Text helpers
    // =========================================================================

    private List<String> normalize(String rawText) {
        if (rawText == null) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        for (String line : rawText.toUpperCase(Locale.ROOT).split("\\R")) {
            String cleaned = line.replace('\t', ' ').trim();
            for (String title : rules.titlePhrases()) {
                cleaned = cleaned.replace(title, " ").trim();
            }
            if (!cleaned.isEmpty()) {
                lines.add(cleaned);
            }
        }
        return lines;
    }

    private static Pattern keywordPattern(List<String> words) {
        String alternation = words.stream()
                .map(w -> w.toUpperCase(Locale.ROOT))
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(w -> Arrays.stream(w.split(" ")).map(Pattern::quote).collect(Collectors.joining(" +")))
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?<![A-Z0-9])(?:" + alternation + ")(?![A-Z0-9])");
    }

    private boolean hasKeyword(String line, String group) {
        return keywordPatterns.get(group).matcher(line).find();
    }

    /** End offset of the first keyword of the group in the line, or -1. */
    private int keywordEnd(String line, String group) {
        Matcher m = keywordPatterns.get(group).matcher(line);
        return m.find() ? m.end() : -1;
    }

    /** True when the line or one of the proximity lines above it carries a keyword of the group. */
    private boolean nearKeyword(List<String> lines, int index, String group) {
        for (int i = Math.max(0, index - rules.proximityLines()); i <= index; i++) {
            if (hasKeyword(lines.get(i), group)) {
                return true;
            }
        }
        return false;
    }

    // =========================================================================
    //  Flight number and airline
    // =========================================================================

    private Optional<String> findFlightNumber(List<String> lines, Map<ExtractionField, Double> confidence) {
        String knownNearLabel = null;
        String knownAnywhere = null;
        String unknownNearLabel = null;
        String unknownAnywhere = null;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            boolean nearLabel = nearKeyword(lines, i, "flight");
            boolean gateLine = hasKeyword(line, "gate");
            Matcher m = FLIGHT.matcher(line);
            while (m.find()) {
                String designator = m.group(1);
                String number = designator + m.group(2);
                if (rules.isKnownCarrier(designator)) {
                    if (nearLabel && knownNearLabel == null) knownNearLabel = number;
                    if (knownAnywhere == null) knownAnywhere = number;
                } else if (!gateLine && designator.chars().allMatch(Character::isLetter)) {
                    if (nearLabel && unknownNearLabel == null) unknownNearLabel = number;
                    if (unknownAnywhere == null) unknownAnywhere = number;
                }
            }
        }

        if (knownNearLabel != null || knownAnywhere != null) {
            confidence.put(ExtractionField.FLIGHT_NUMBER, KNOWN_CARRIER_CONFIDENCE);
            return Optional.of(knownNearLabel != null ? knownNearLabel : knownAnywhere);
        }
        String unknown = unknownNearLabel != null ? unknownNearLabel : unknownAnywhere;
        if (unknown != null) {
            confidence.put(ExtractionField.FLIGHT_NUMBER, UNKNOWN_CARRIER_CONFIDENCE);
        }
        return Optional.ofNullable(unknown);
    }

    private Optional<String> findAirline(List<String> lines, Optional<String> flightNumber,
                                         Map<ExtractionField, Double> confidence) {
        Optional<String> fromCarrier = flightNumber.flatMap(f -> rules.airlineName(f.substring(0, 2)));
        if (fromCarrier.isPresent()) {
            confidence.put(ExtractionField.AIRLINE, AIRLINE_FROM_CARRIER_CONFIDENCE);
            return fromCarrier;
        }
        for (String line : lines) {
            for (String name : rules.knownAirlines().values()) {
                if (name.length() > 3 && Pattern.compile("(?<![A-Z])" + Pattern.quote(name.toUpperCase(Locale.ROOT))
                        + "(?![A-Z])").matcher(line).find()) {
                    confidence.put(ExtractionField.AIRLINE, AIRLINE_FROM_TEXT_CONFIDENCE);
                    return Optional.of(name);
                }
            }
        }
        return Optional.empty();
    }

    // =========================================================================
    //  Airports
    // =========================================================================

    private boolean isAirport(String code) {
        return !nonAirportWords.contains(code) && airports.isValidAirportCode(code);
    }

    private List<String> airportCodes(String text) {
        List<String> codes = new ArrayList<>();
        Matcher m = CODE.matcher(text);
        while (m.find()) {
            if (isAirport(m.group(1))) {
                codes.add(m.group(1));
            }
        }
        return codes;
    }

    private void findAirports(List<String> lines, FlightSegment.FlightSegmentBuilder segment,
                              Map<ExtractionField, Double> confidence, List<String> warnings) {
        String departure = null;
        String arrival = null;

        for (String line : lines) {
            Matcher route = ROUTE.matcher(line);
            while (route.find()) {
                String from = route.group(1);
                String to = route.group(2);
                if (!from.equals(to) && isAirport(from) && isAirport(to)) {
                    departure = from;
                    arrival = to;
                    break;
                }
            }
            if (departure != null) {
                break;
            }
        }

        if (departure == null) {
            Set<String> rejected = new LinkedHashSet<>();
            for (int i = 0; i < lines.size() && (departure == null || arrival == null); i++) {
                String line = lines.get(i);
                int fromEnd = keywordEnd(line, "from");
                int toEnd = keywordEnd(line, "to");
                if (departure == null && fromEnd >= 0) {
                    List<String> codes = codesAfterLabel(lines, i, fromEnd, rejected);
                    departure = first(codes, arrival);
                }
                if (arrival == null && toEnd >= 0) {
                    List<String> codes = codesAfterLabel(lines, i, toEnd, rejected);
                    // "TO" on the label line itself means the code follows it; a header row means the last column
                    String candidate = codes.isEmpty() ? null
                            : airportCodes(line.substring(toEnd)).isEmpty() ? codes.get(codes.size() - 1) : codes.get(0);
                    if (candidate != null && !candidate.equals(departure)) {
                        arrival = candidate;
                    }
                }
            }
            rejected.stream()
                    .filter(code -> !nonAirportWords.contains(code))
                    .forEach(code -> warnings.add("Discarded airport code '" + code + "': not in the airport dataset"));
        }

        if (departure != null) confidence.put(ExtractionField.DEPARTURE_AIRPORT, KEYWORD_AIRPORT_CONFIDENCE);
        if (arrival != null) confidence.put(ExtractionField.ARRIVAL_AIRPORT, KEYWORD_AIRPORT_CONFIDENCE);

        if (departure == null || arrival == null) {
            List<String> all = new ArrayList<>(new LinkedHashSet<>(lines.stream()
                    .flatMap(l -> airportCodes(l).stream())
                    .collect(Collectors.toList())));
            if (departure == null) {
                departure = first(all, arrival);
                if (departure != null) confidence.put(ExtractionField.DEPARTURE_AIRPORT, FALLBACK_AIRPORT_CONFIDENCE);
            }
            if (arrival == null) {
                int from = departure == null ? 0 : all.indexOf(departure) + 1;
                arrival = first(all.subList(Math.min(from, all.size()), all.size()), departure);
                if (arrival != null) confidence.put(ExtractionField.ARRIVAL_AIRPORT, FALLBACK_AIRPORT_CONFIDENCE);
            }
        }

        segment.departureAirport(departure);
        segment.arrivalAirport(arrival);
    }

    private static String first(List<String> codes, String excluded) {
        return codes.stream().filter(c -> !c.equals(excluded)).findFirst().orElse(null);
    }

    /**
     * Valid codes after the label on its own line, else on the first proximity line below that has any.
     * Three-letter words that look like codes but are unknown are collected into {@code rejected}.
     */
    private List<String> codesAfterLabel(List<String> lines, int index, int labelEnd, Set<String> rejected) {
        List<String> sameLine = collectCodes(lines.get(index).substring(labelEnd), rejected);
        if (!sameLine.isEmpty()) {
            return sameLine;
        }
        for (int i = index + 1; i <= Math.min(lines.size() - 1, index + rules.proximityLines()); i++) {
            List<String> codes = collectCodes(lines.get(i), rejected);
            if (!codes.isEmpty()) {
                return codes;
            }
        }
        return List.of();
    }

    private List<String> collectCodes(String text, Set<String> rejected) {
        List<String> codes = new ArrayList<>();
        Matcher m = CODE.matcher(text);
        while (m.find()) {
            String code = m.group(1);
            if (isAirport(code)) {
                codes.add(code);
            } else if (!nonAirportWords.contains(code) && !isKeyword(code)) {
                rejected.add(code);
            }
        }
        return codes;
    }

    private boolean isKeyword(String word) {
        return keywordPatterns.values().stream().anyMatch(p -> p.matcher(word).matches());
    }

    // =========================================================================
    //  Date
    // =========================================================================

    private void findDate(List<String> lines, FlightSegment.FlightSegmentBuilder segment,
                          Map<ExtractionField, Double> confidence, List<String> warnings) {
        DateToken best = null;
        double bestScore = -1;
        for (int i = 0; i < lines.size(); i++) {
            boolean near = nearKeyword(lines, i, "date") || nearKeyword(lines, i, "from");
            for (DateToken token : dateParser.findDates(lines.get(i))) {
                double score = token.confidence() + (near ? DATE_PROXIMITY_BONUS : 0);
                if (score > bestScore) {
                    best = token;
                    bestScore = score;
                }
            }
        }
        if (best == null) {
            return;
        }
        segment.flightDate(best.date());
        confidence.put(ExtractionField.FLIGHT_DATE, Math.min(1.0, bestScore));
        if (best.yearInferred()) {
            warnings.add("Flight date carried no year; assumed " + best.date().getYear());
        }
    }

    // =========================================================================
    //  Times
    // =========================================================================

    private record TimeMatch(LocalTime time, boolean nextDay, int start) {
    }

    private record Label(TimeKind kind, int start, int end) {
    }

    private static List<TimeMatch> times(String line) {
        List<TimeMatch> times = new ArrayList<>();
        Matcher m = TIME.matcher(line);
        while (m.find()) {
            times.add(new TimeMatch(LocalTime.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))),
                    m.group(3) != null, m.start()));
        }
        return times;
    }

    private List<Label> labels(String line) {
        List<Label> labels = new ArrayList<>();
        // Gate-closing and boarding labels first so "GATE CLOSES" never counts as a departure label
        for (TimeKind kind : List.of(TimeKind.GATE_CLOSING, TimeKind.BOARDING, TimeKind.ARRIVAL, TimeKind.DEPARTURE)) {
            Matcher m = keywordPatterns.get(TIME_GROUPS.get(kind)).matcher(line);
            while (m.find()) {
                int start = m.start();
                int end = m.end();
                boolean overlaps = labels.stream().anyMatch(l -> start < l.end() && l.start() < end);
                if (!overlaps) {
                    labels.add(new Label(kind, start, end));
                }
            }
        }
        labels.sort(Comparator.comparingInt(Label::start));
        return labels;
    }

    private void findTimes(List<String> lines, FlightSegment.FlightSegmentBuilder segment,
                           Map<ExtractionField, Double> confidence) {
        Map<TimeKind, TimeMatch> labeled = new EnumMap<>(TimeKind.class);
        Set<String> claimed = new HashSet<>();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            List<Label> labels = labels(line);
            if (labels.isEmpty()) {
                continue;
            }
            List<TimeMatch> times = times(line);
            if (!times.isEmpty()) {
                for (TimeMatch time : times) {
                    Label owner = labels.get(0);
                    for (Label label : labels) {
                        if (label.start() < time.start()) {
                            owner = label;
                        }
                    }
                    if (labeled.putIfAbsent(owner.kind(), time) == null) {
                        claimed.add(i + ":" + time.start());
                    }
                }
            } else if (line.chars().noneMatch(Character::isDigit)) {
                // Header row: labels on this line, values in the same order on the next line with times
                for (int j = i + 1; j <= Math.min(lines.size() - 1, i + rules.proximityLines()); j++) {
                    if (!labels(lines.get(j)).isEmpty()) {
                        break;
                    }
                    List<TimeMatch> below = times(lines.get(j));
                    if (!below.isEmpty()) {
                        for (int k = 0; k < Math.min(labels.size(), below.size()); k++) {
                            if (labeled.putIfAbsent(labels.get(k).kind(), below.get(k)) == null) {
                                claimed.add(j + ":" + below.get(k).start());
                            }
                        }
                        break;
                    }
                }
            }
        }

        apply(labeled.get(TimeKind.DEPARTURE), 0.8, ExtractionField.DEPARTURE_TIME, confidence, segment);
        apply(labeled.get(TimeKind.ARRIVAL), 0.75, ExtractionField.ARRIVAL_TIME, confidence, segment);
        apply(labeled.get(TimeKind.BOARDING), 0.75, ExtractionField.BOARDING_TIME, confidence, segment);
        apply(labeled.get(TimeKind.GATE_CLOSING), 0.75, ExtractionField.GATE_CLOSING_TIME, confidence, segment);

        if (labeled.containsKey(TimeKind.DEPARTURE) && labeled.containsKey(TimeKind.ARRIVAL)) {
            return;
        }

        // Unlabelled times, skipping the phone status bar and boarding/gate lines
        List<TimeMatch> unlabeled = new ArrayList<>();
        for (int i = rules.statusBarLines(); i < lines.size(); i++) {
            String line = lines.get(i);
            if (hasKeyword(line, "boarding") || hasKeyword(line, "gateClosing") || hasKeyword(line, "gate")) {
                continue;
            }
            for (TimeMatch time : times(line)) {
                if (!claimed.contains(i + ":" + time.start())) {
                    unlabeled.add(time);
                }
            }
        }
        int next = 0;
        if (!labeled.containsKey(TimeKind.DEPARTURE) && next < unlabeled.size()) {
            apply(unlabeled.get(next++), 0.6, ExtractionField.DEPARTURE_TIME, confidence, segment);
        }
        if (!labeled.containsKey(TimeKind.ARRIVAL) && next < unlabeled.size()) {
            apply(unlabeled.get(next), 0.5, ExtractionField.ARRIVAL_TIME, confidence, segment);
        }
    }

    private static void apply(TimeMatch time, double value, ExtractionField field,
                              Map<ExtractionField, Double> confidence, FlightSegment.FlightSegmentBuilder segment) {
        if (time == null) {
            return;
        }
        switch (field) {
            case DEPARTURE_TIME -> segment.departureTime(time.time());
            case ARRIVAL_TIME -> segment.arrivalTime(time.time()).arrivalNextDay(time.nextDay());
            case BOARDING_TIME -> segment.boardingTime(time.time());
            case GATE_CLOSING_TIME -> segment.gateClosingTime(time.time());
            default -> throw new IllegalArgumentException("Not a time field: " + field);
        }
        confidence.put(field, value);
    }

    // =========================================================================
    //  Passenger
    // =========================================================================

    private Optional<Passenger> findPassenger(List<String> lines, Map<ExtractionField, Double> confidence) {
        // 1. Near a passenger label: slash, comma, then a bare multi-word line
        for (int i = 0; i < lines.size(); i++) {
            int labelEnd = keywordEnd(lines.get(i), "passenger");
            if (labelEnd < 0) {
                continue;
            }
            for (int j = i; j <= Math.min(lines.size() - 1, i + rules.proximityLines()); j++) {
                String text = j == i ? lines.get(i).substring(labelEnd) : lines.get(j);
                Optional<Passenger> found = matchName(NAME_SLASH, text).or(() -> matchName(NAME_COMMA, text));
                if (found.isPresent()) {
                    confidence.put(ExtractionField.PASSENGER_NAME, KEYWORD_NAME_CONFIDENCE);
                    return found;
                }
                Optional<Passenger> plain = plainName(text);
                if (plain.isPresent()) {
                    confidence.put(ExtractionField.PASSENGER_NAME, PLAIN_NAME_CONFIDENCE);
                    return plain;
                }
            }
        }
        // 2. Anywhere, slash notation only
        for (String line : lines) {
            Optional<Passenger> found = matchName(NAME_SLASH, line);
            if (found.isPresent()) {
                confidence.put(ExtractionField.PASSENGER_NAME, GLOBAL_NAME_CONFIDENCE);
                return found;
            }
        }
        return Optional.empty();
    }

    private Optional<Passenger> matchName(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            Optional<Passenger> valid = validateName(dropLeadingStopWords(m.group(1)), truncateAtStopWord(m.group(2)));
            if (valid.isPresent()) {
                return valid;
            }
        }
        return Optional.empty();
    }

    /** A bare line of two to five words is read as given name(s) then surname(s). */
    private Optional<Passenger> plainName(String text) {
        String trimmed = text.trim();
        if (!PLAIN_NAME.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        List<String> words = new ArrayList<>(List.of(trimmed.split(" ")));
        words.removeIf(rules.titles()::contains);
        if (words.size() < 2 || words.stream().anyMatch(w -> nameStopWords.contains(w) || isAirport(w))) {
            return Optional.empty();
        }
        return validateName(String.join(" ", words.subList(1, words.size())), words.get(0));
    }

    private String dropLeadingStopWords(String part) {
        List<String> words = new ArrayList<>(List.of(part.trim().split(" ")));
        int lastStop = -1;
        for (int i = 0; i < words.size(); i++) {
            if (nameStopWords.contains(words.get(i))) {
                lastStop = i;
            }
        }
        return String.join(" ", words.subList(lastStop + 1, words.size()));
    }

    private String truncateAtStopWord(String part) {
        List<String> kept = new ArrayList<>();
        for (String word : part.trim().split(" ")) {
            if (nameStopWords.contains(word)) {
                break;
            }
            kept.add(word);
        }
        return String.join(" ", kept);
    }

    private Optional<Passenger> validateName(String lastName, String firstName) {
        String last = stripTitles(lastName);
        String first = stripTitles(firstName);
        if (last.length() < 2 || first.length() < 2) {
            return Optional.empty();
        }
        String full = last + " " + first;
        if (full.chars().anyMatch(Character::isDigit)) {
            return Optional.empty();
        }
        for (String word : full.split(" ")) {
            if (rules.carrierNameMarkers().contains(word) || nameStopWords.contains(word)) {
                return Optional.empty();
            }
        }
        if (last.length() == 3 && first.length() == 3 && isAirport(last) && isAirport(first)) {
            return Optional.empty();
        }
        return Optional.of(new Passenger(first, last));
    }

    private String stripTitles(String name) {
        List<String> words = new ArrayList<>(List.of(name.trim().split(" +")));
        words.removeIf(rules.titles()::contains);
        return String.join(" ", words).trim();
    }

    // =========================================================================
    //  Booking reference and seat
    // =========================================================================

    private Optional<String> findBookingReference(List<String> lines, Optional<String> flightNumber,
                                                  Optional<Passenger> passenger,
                                                  Map<ExtractionField, Double> confidence) {
        Set<String> nameWords = passenger
                .map(p -> Set.of((p.lastName() + " " + p.firstName()).split(" ")))
                .orElse(Set.of());

        for (int i = 0; i < lines.size(); i++) {
            int labelEnd = keywordEnd(lines.get(i), "booking");
            if (labelEnd < 0) {
                continue;
            }
            for (int j = i; j <= Math.min(lines.size() - 1, i + rules.proximityLines()); j++) {
                String text = j == i ? lines.get(i).substring(labelEnd) : lines.get(j);
                Matcher m = BOOKING.matcher(text);
                while (m.find()) {
                    String token = m.group(1);
                    if (isBookingCandidate(token, flightNumber, nameWords) && token.chars().anyMatch(Character::isLetter)) {
                        confidence.put(ExtractionField.BOOKING_REFERENCE, KEYWORD_BOOKING_CONFIDENCE);
                        return Optional.of(token);
                    }
                }
            }
        }

        for (String line : lines) {
            Matcher m = BOOKING.matcher(line);
            while (m.find()) {
                String token = m.group(1);
                boolean mixed = token.chars().anyMatch(Character::isLetter) && token.chars().anyMatch(Character::isDigit);
                if (token.length() == 6 && mixed && token.chars().distinct().count() > 2
                        && isBookingCandidate(token, flightNumber, nameWords)) {
                    confidence.put(ExtractionField.BOOKING_REFERENCE, GLOBAL_BOOKING_CONFIDENCE);
                    return Optional.of(token);
                }
            }
        }
        return Optional.empty();
    }

    private boolean isBookingCandidate(String token, Optional<String> flightNumber, Set<String> nameWords) {
        if (rules.bookingIgnoreWords().contains(token) || rules.labelBlocklist().contains(token)
                || nameWords.contains(token) || isKeyword(token)) {
            return false;
        }
        if (flightNumber.isPresent()) {
            Matcher flight = FLIGHT.matcher(token);
            if (flight.matches() && (flight.group(1) + flight.group(2)).equals(flightNumber.get())) {
                return false;
            }
        }
        return dateParser.findDates(token).isEmpty();
    }

    private void findSeat(List<String> lines, FlightSegment.FlightSegmentBuilder segment,
                          Map<ExtractionField, Double> confidence) {
        for (int i = 0; i < lines.size(); i++) {
            int labelEnd = keywordEnd(lines.get(i), "seat");
            if (labelEnd < 0) {
                continue;
            }
            for (int j = i; j <= Math.min(lines.size() - 1, i + rules.proximityLines()); j++) {
                String text = j == i ? lines.get(i).substring(labelEnd) : lines.get(j);
                Matcher m = SEAT_NEAR_LABEL.matcher(text);
                if (m.find()) {
                    segment.seat(m.group(1) + m.group(2));
                    confidence.put(ExtractionField.SEAT, KEYWORD_SEAT_CONFIDENCE);
                    return;
                }
            }
        }
        for (String line : lines) {
            if (hasKeyword(line, "gate")) {
                continue;
            }
            Matcher m = SEAT_ANYWHERE.matcher(line);
            if (m.find()) {
                segment.seat(m.group(1) + m.group(2));
                confidence.put(ExtractionField.SEAT, GLOBAL_SEAT_CONFIDENCE);
                return;
            }
        }
    }
}
