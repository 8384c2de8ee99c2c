package com.eainde.boardingpass.barcode;

import com.eainde.boardingpass.model.FlightSegment;
import com.eainde.boardingpass.model.Passenger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class BcbpParserTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-18T10:00:00Z"), ZoneOffset.UTC);

    private final BcbpParser parser = new BcbpParser(CLOCK);

    @Nested
    @DisplayName("Valid payloads")
    class ValidPayloads {

        @Test
        @DisplayName("should parse the IATA sample payload")
        void iataSample() {
            BcbpRecord record = parser.parse(BcbpFixtures.IATA_SAMPLE).orElseThrow();

            assertThat(record.passenger()).isEqualTo(new Passenger("LUC", "DESMARAIS"));
            assertThat(record.bookingReference()).isEqualTo("ABC123");
            assertThat(record.legs()).hasSize(1);

            FlightSegment leg = record.legs().get(0);
            assertThat(leg.flightNumber()).isEqualTo("AC834");
            assertThat(leg.departureAirport()).isEqualTo("YUL");
            assertThat(leg.arrivalAirport()).isEqualTo("FRA");
            assertThat(leg.seat()).isEqualTo("1A");
            // day 226 lies 65 days before the clock, closer than next year's
            assertThat(leg.flightDate()).isEqualTo(LocalDate.of(2026, 8, 14));
        }

        @Test
        @DisplayName("should keep multi-word surnames and strip a trailing title")
        void multiWordName() {
            String payload = BcbpFixtures.singleLeg("VAN DER BERG/JAN MR", "XYZ789", "AMS", "CDG", "KL",
                    "1227", 290, "014C");

            BcbpRecord record = parser.parse(payload).orElseThrow();

            assertThat(record.passenger()).isEqualTo(new Passenger("JAN", "VAN DER BERG"));
            assertThat(record.legs().get(0).flightNumber()).isEqualTo("KL1227");
            assertThat(record.legs().get(0).seat()).isEqualTo("14C");
        }

        @Test
        @DisplayName("should resolve the flight year from the issue date in the conditional section")
        void issueDateRollsIntoNextYear() {
            // issued on day 365 of a year ending in 5, flight on day 2 of the following year
            String conditional = ">60B1WW5365";
            String payload = BcbpFixtures.header("SMITH/ANNA", 1)
                    + BcbpFixtures.leg("PNR001", "LHR", "JFK", "BA", "117", 2, "021K", conditional);

            BcbpRecord record = parser.parse(payload).orElseThrow();

            assertThat(record.legs().get(0).flightDate()).isEqualTo(LocalDate.of(2026, 1, 2));
        }

        @Test
        @DisplayName("should parse every leg of a multi-leg payload")
        void multiLeg() {
            String payload = BcbpFixtures.header("DOE/JOHN", 2)
                    + BcbpFixtures.leg("ABC123", "FRA", "MUC", "LH", "100", 290, "003A", "")
                    + BcbpFixtures.leg("ABC123", "MUC", "JFK", "LH", "410", 290, "045D", "");

            BcbpRecord record = parser.parse(payload).orElseThrow();

            assertThat(record.legs()).extracting(FlightSegment::flightNumber).containsExactly("LH100", "LH410");
            assertThat(record.legs()).extracting(FlightSegment::arrivalAirport).containsExactly("MUC", "JFK");
        }
    }

    @Nested
    @DisplayName("Rejected payloads")
    class RejectedPayloads {

        @Test
        @DisplayName("should reject a wrong format code")
        void wrongFormatCode() {
            assertThat(parser.parse("X" + BcbpFixtures.IATA_SAMPLE.substring(1))).isEmpty();
        }

        @Test
        @DisplayName("should reject truncated data")
        void truncated() {
            assertThat(parser.parse(BcbpFixtures.IATA_SAMPLE.substring(0, 40))).isEmpty();
            assertThat(parser.parse(null)).isEmpty();
        }

        @Test
        @DisplayName("should reject a non-numeric julian date")
        void nonNumericDate() {
            String payload = BcbpFixtures.IATA_SAMPLE.replace(" 226F", " 2X6F");
            assertThat(parser.parse(payload)).isEmpty();
        }

        @Test
        @DisplayName("should reject a conditional size that runs past the payload")
        void badHexSize() {
            String payload = BcbpFixtures.IATA_SAMPLE.substring(0, BcbpFixtures.IATA_SAMPLE.length() - 2) + "7F";
            assertThat(parser.parse(payload)).isEmpty();
        }

        @Test
        @DisplayName("should reject a leg count of zero")
        void zeroLegs() {
            assertThat(parser.parse("M0" + BcbpFixtures.IATA_SAMPLE.substring(2))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Flight date resolution")
    class FlightDateResolution {

        @Test
        @DisplayName("day 366 is only valid in a leap year")
        void leapDay() {
            assertThat(parser.resolveFlightDate(366, Optional.empty())).isEmpty();
            assertThat(parser.resolveFlightDate(366, Optional.of(LocalDate.of(2028, 1, 10))))
                    .contains(LocalDate.of(2028, 12, 31));
        }

        @Test
        @DisplayName("without issue date the year closest to today wins")
        void closestYear() {
            assertThat(parser.resolveFlightDate(5, Optional.empty())).contains(LocalDate.of(2027, 1, 5));
            assertThat(parser.resolveFlightDate(280, Optional.empty())).contains(LocalDate.of(2026, 10, 7));
        }
    }

    @Test
    @DisplayName("parseName should reject digits in the surname")
    void nameWithDigits() {
        assertThat(BcbpParser.parseName("SM1TH/ANNA")).isEmpty();
        assertThat(BcbpParser.parseName("GARCIA LOPEZ/MARIA JOSE"))
                .contains(new Passenger("MARIA JOSE", "GARCIA LOPEZ"));
    }
}
