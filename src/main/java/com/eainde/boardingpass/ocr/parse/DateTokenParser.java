package com.eainde.boardingpass.ocr.parse;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Finds dates in a line of upper-cased OCR text.
 *
 * <p>Accepted notations: ISO {@code 2026-01-14}, day-first numeric {@code 14/01/2026} with a
 * four-digit year, and compact {@code 14JAN26} / {@code 14 JAN 2026}. Numeric dates with a
 * two-digit year are rejected as ambiguous. A compact date without a year ({@code 14JAN}) takes the
 * year closest to the reference clock and a lower confidence.
 */
public class DateTokenParser {

    static final double ISO_CONFIDENCE = 0.85;
    static final double NUMERIC_CONFIDENCE = 0.8;
    static final double COMPACT_CONFIDENCE = 0.85;
    static final double YEARLESS_CONFIDENCE = 0.6;

    private static final Pattern ISO = Pattern.compile("(?<![\\d.])(\\d{4})[-/.](\\d{1,2})[-/.](\\d{1,2})(?![\\d.])");
    private static final Pattern DAY_FIRST = Pattern.compile("(?<![\\d./-])(\\d{1,2})[-/.](\\d{1,2})[-/.](\\d{2,4})(?![\\d./-])");
    // the year must end the token: in "14JAN 12A" the 12 is a seat row
    private static final Pattern COMPACT = Pattern.compile(
            "(?<![\\dA-Z])(\\d{1,2})\\s?[-/.]?\\s?(JAN|FEB|MAR|APR|MAY|JUN|JUL|AUG|SEP|OCT|NOV|DEC)[A-Z]*"
                    + "(?:\\s?[-/.]?\\s?(\\d{4}|\\d{2})(?![\\dA-Z:]))?");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("JAN", 1), Map.entry("FEB", 2), Map.entry("MAR", 3), Map.entry("APR", 4),
            Map.entry("MAY", 5), Map.entry("JUN", 6), Map.entry("JUL", 7), Map.entry("AUG", 8),
            Map.entry("SEP", 9), Map.entry("OCT", 10), Map.entry("NOV", 11), Map.entry("DEC", 12));

    private final Clock clock;

    public DateTokenParser(Clock clock) {
        this.clock = clock;
    }

    public List<DateToken> findDates(String line) {
        List<DateToken> tokens = new ArrayList<>();

        Matcher iso = ISO.matcher(line);
        while (iso.find()) {
            of(iso.group(1), iso.group(2), iso.group(3))
                    .ifPresent(d -> tokens.add(new DateToken(d, ISO_CONFIDENCE, false, iso.start(), iso.end())));
        }

        Matcher dayFirst = DAY_FIRST.matcher(line);
        while (dayFirst.find()) {
            String year = dayFirst.group(3);
            if (year.length() != 4) {
                continue;
            }
            of(year, dayFirst.group(2), dayFirst.group(1))
                    .ifPresent(d -> tokens.add(new DateToken(d, NUMERIC_CONFIDENCE, false, dayFirst.start(), dayFirst.end())));
        }

        Matcher compact = COMPACT.matcher(line);
        while (compact.find()) {
            int day = Integer.parseInt(compact.group(1));
            int month = MONTHS.get(compact.group(2));
            String year = compact.group(3);
            if (year == null) {
                closestYear(month, day).ifPresent(d ->
                        tokens.add(new DateToken(d, YEARLESS_CONFIDENCE, true, compact.start(), compact.end())));
            } else {
                int fullYear = year.length() == 2 ? 2000 + Integer.parseInt(year) : Integer.parseInt(year);
                of(fullYear, month, day).ifPresent(d ->
                        tokens.add(new DateToken(d, COMPACT_CONFIDENCE, false, compact.start(), compact.end())));
            }
        }

        tokens.sort(Comparator.comparingInt(DateToken::start));
        return tokens;
    }

    private Optional<LocalDate> closestYear(int month, int day) {
        LocalDate today = LocalDate.now(clock);
        return Stream.of(today.getYear() - 1, today.getYear(), today.getYear() + 1)
                .map(year -> of(year, month, day))
                .flatMap(Optional::stream)
                .min(Comparator.comparingLong(d -> Math.abs(ChronoUnit.DAYS.between(today, d))));
    }

    private static Optional<LocalDate> of(String year, String month, String day) {
        return of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
    }

    private static Optional<LocalDate> of(int year, int month, int day) {
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
