package com.eainde.boardingpass;

import com.eainde.boardingpass.airport.AirportDirectory;
import com.eainde.boardingpass.airport.JsonAirportDirectory;
import com.eainde.boardingpass.barcode.BarcodeDecoder;
import com.eainde.boardingpass.barcode.BarcodeExtractionStrategy;
import com.eainde.boardingpass.barcode.BcbpFixtures;
import com.eainde.boardingpass.barcode.BcbpParser;
import com.eainde.boardingpass.document.DocumentLoader;
import com.eainde.boardingpass.document.LoadedDocument;
import com.eainde.boardingpass.exception.FatalInputException;
import com.eainde.boardingpass.image.ImagePreprocessor;
import com.eainde.boardingpass.model.ExtractionField;
import com.eainde.boardingpass.model.ExtractionMethod;
import com.eainde.boardingpass.model.ExtractionRequest;
import com.eainde.boardingpass.model.ExtractionResult;
import com.eainde.boardingpass.model.FlightSegment;
import com.eainde.boardingpass.model.Passenger;
import com.eainde.boardingpass.model.StrategyAttempt;
import com.eainde.boardingpass.ocr.OcrConfiguration;
import com.eainde.boardingpass.ocr.OcrExtractionStrategy;
import com.eainde.boardingpass.ocr.parse.OcrFieldParser;
import com.eainde.boardingpass.ocr.parse.ParsingRules;
import com.eainde.boardingpass.pipeline.Candidate;
import com.eainde.boardingpass.pipeline.Deadline;
import com.eainde.boardingpass.pipeline.ExtractionSettings;
import com.eainde.boardingpass.pipeline.ExtractionStrategy;
import com.eainde.boardingpass.pipeline.StrategyFailure;
import com.eainde.boardingpass.pipeline.StrategyOutcome;
import com.eainde.boardingpass.scoring.CandidateMerger;
import com.eainde.boardingpass.scoring.ConfidenceScorer;
import com.eainde.boardingpass.thread.MdcAwareExecutor;
import com.eainde.boardingpass.validation.SegmentValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoardingPassExtractionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-18T10:00:00Z"), ZoneOffset.UTC);
    private static final ExtractionSettings SETTINGS = ExtractionSettings.builder().aiEnabled(true).build();

    private static AirportDirectory airports;
    private static ParsingRules rules;

    private final MdcAwareExecutor executor = new MdcAwareExecutor(2);

    @BeforeAll
    static void loadReferenceData() {
        ObjectMapper mapper = new ObjectMapper();
        airports = JsonAirportDirectory.fromClasspath(mapper, JsonAirportDirectory.DEFAULT_RESOURCE);
        rules = ParsingRules.fromClasspath(mapper, ParsingRules.DEFAULT_RESOURCE);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    // =========================================================================
    //  Fixtures
    // =========================================================================

    /** Strategy double returning a canned outcome and counting its invocations. */
    private static final class StubStrategy implements ExtractionStrategy {
        private final String name;
        private final ExtractionMethod.Kind kind;
        private final Supplier<StrategyOutcome> outcome;
        private final AtomicInteger calls = new AtomicInteger();

        StubStrategy(String name, ExtractionMethod.Kind kind, Supplier<StrategyOutcome> outcome) {
            this.name = name;
            this.kind = kind;
            this.outcome = outcome;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public ExtractionMethod.Kind kind() {
            return kind;
        }

        @Override
        public StrategyOutcome attempt(LoadedDocument document, Deadline deadline) {
            calls.incrementAndGet();
            return outcome.get();
        }
    }

    private static StubStrategy ai(Supplier<StrategyOutcome> outcome) {
        return new StubStrategy("ai", ExtractionMethod.Kind.AI_STRUCTURED, outcome);
    }

    private static StubStrategy ocr(Supplier<StrategyOutcome> outcome) {
        return new StubStrategy("ocr", ExtractionMethod.Kind.OCR, outcome);
    }

    private static StrategyOutcome fails(String strategy, StrategyFailure.Reason reason, String message) {
        return StrategyOutcome.failure(new StrategyFailure(strategy, reason, message));
    }

    private static final Candidate AI_COMPLETE = Candidate.builder()
            .method(ExtractionMethod.aiStructured())
            .segment(FlightSegment.builder()
                    .flightNumber("LH400").departureAirport("FRA").arrivalAirport("JFK")
                    .flightDate(LocalDate.of(2026, 11, 2)).build())
            .passenger(new Passenger("ANNA", "MUELLER"))
            .fieldConfidence(Map.of(
                    ExtractionField.FLIGHT_NUMBER, 0.9,
                    ExtractionField.DEPARTURE_AIRPORT, 0.9,
                    ExtractionField.ARRIVAL_AIRPORT, 0.9,
                    ExtractionField.FLIGHT_DATE, 0.9,
                    ExtractionField.PASSENGER_NAME, 0.9))
            .build();

    private static final Candidate AI_PARTIAL = Candidate.builder()
            .method(ExtractionMethod.aiStructured())
            .segment(FlightSegment.builder().flightNumber("LH400").flightDate(LocalDate.of(2026, 11, 2)).build())
            .fieldConfidence(Map.of(ExtractionField.FLIGHT_NUMBER, 0.9, ExtractionField.FLIGHT_DATE, 0.9))
            .build();

    private static final Candidate OCR_RESULT = Candidate.builder()
            .method(ExtractionMethod.ocr())
            .segment(FlightSegment.builder().flightNumber("LH409").departureAirport("FRA").arrivalAirport("JFK").build())
            .passenger(new Passenger("ANNA", "MUELLER"))
            .fieldConfidence(Map.of(
                    ExtractionField.FLIGHT_NUMBER, 0.7,
                    ExtractionField.DEPARTURE_AIRPORT, 0.85,
                    ExtractionField.ARRIVAL_AIRPORT, 0.85,
                    ExtractionField.PASSENGER_NAME, 0.7))
            .warning("OCR could not extract the flight date")
            .build();

    private BoardingPassExtractionService service(ExtractionSettings settings, ExtractionStrategy... extra) {
        List<ExtractionStrategy> strategies = new ArrayList<>();
        strategies.add(new BarcodeExtractionStrategy(new BarcodeDecoder(), new BcbpParser(CLOCK), executor, settings));
        strategies.addAll(List.of(extra));
        return new BoardingPassExtractionService(new DocumentLoader(settings), strategies,
                new SegmentValidator(airports, rules), new ConfidenceScorer(settings), new CandidateMerger(), settings);
    }

    private static ExtractionRequest png(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", out);
            return ExtractionRequest.of(out.toByteArray(), "image/png");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static ExtractionRequest blankPage() {
        BufferedImage page = new BufferedImage(600, 400, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = page.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, 600, 400);
        g.dispose();
        return png(page);
    }

    // =========================================================================
    //  Tests
    // =========================================================================

    @Nested
    @DisplayName("barcode path")
    class BarcodePath {

        @Test
        @DisplayName("a decodable BCBP barcode is authoritative and skips AI and OCR")
        void barcodeWins() {
            StubStrategy ai = ai(() -> StrategyOutcome.success(AI_COMPLETE));
            StubStrategy ocr = ocr(() -> StrategyOutcome.success(OCR_RESULT));
            String payload = BcbpFixtures.singleLeg("MUELLER/ANNA", "ABC123", "FRA", "JFK", "LH", "1234", 290, "012A");

            ExtractionResult result = service(SETTINGS, ai, ocr)
                    .extract(png(BcbpFixtures.onPage(BcbpFixtures.qrCode(payload))));

            assertThat(result.success()).isTrue();
            assertThat(result.method()).isEqualTo(ExtractionMethod.barcode("QR_CODE"));
            FlightSegment segment = result.primarySegment();
            assertThat(segment.flightNumber()).isEqualTo("LH1234");
            assertThat(segment.airline()).isEqualTo("Lufthansa");
            assertThat(segment.departureAirport()).isEqualTo("FRA");
            assertThat(segment.arrivalAirport()).isEqualTo("JFK");
            assertThat(segment.seat()).isEqualTo("12A");
            assertThat(segment.flightDate()).isEqualTo(LocalDate.of(2026, 10, 17));
            assertThat(result.bookingReference()).isEqualTo("ABC123");
            assertThat(result.passengers()).containsExactly(new Passenger("ANNA", "MUELLER"));
            assertThat(result.overallConfidence()).isGreaterThanOrEqualTo(0.9);
            assertThat(result.fieldConfidence()).containsEntry("airline", 0.95);
            assertThat(result.errors()).isEmpty();
            assertThat(result.attempts()).extracting(StrategyAttempt::strategy).containsExactly("barcode");
            assertThat(ai.calls).hasValue(0);
            assertThat(ocr.calls).hasValue(0);
        }
    }

    @Nested
    @DisplayName("fallback chain")
    class FallbackChain {

        @Test
        @DisplayName("a confident AI result makes OCR unnecessary")
        void confidentAi() {
            StubStrategy ocr = ocr(() -> StrategyOutcome.success(OCR_RESULT));

            ExtractionResult result = service(SETTINGS, ai(() -> StrategyOutcome.success(AI_COMPLETE)), ocr)
                    .extract(blankPage());

            assertThat(result.success()).isTrue();
            assertThat(result.method()).isEqualTo(ExtractionMethod.aiStructured());
            assertThat(result.overallConfidence()).isEqualTo(0.9, org.assertj.core.api.Assertions.within(1e-9));
            assertThat(ocr.calls).hasValue(0);
            assertThat(result.warnings()).containsExactly("barcode: no barcode detected");
        }

        @Test
        @DisplayName("a weak AI result is merged with OCR field by field")
        void weakAiMergedWithOcr() {
            StubStrategy ocr = ocr(() -> StrategyOutcome.success(OCR_RESULT));

            ExtractionResult result = service(SETTINGS, ai(() -> StrategyOutcome.success(AI_PARTIAL)), ocr)
                    .extract(blankPage());

            assertThat(ocr.calls).hasValue(1);
            assertThat(result.method()).isEqualTo(ExtractionMethod.ocr());
            assertThat(result.primarySegment().flightNumber()).isEqualTo("LH400");
            assertThat(result.primarySegment().flightDate()).isEqualTo(LocalDate.of(2026, 11, 2));
            assertThat(result.primarySegment().departureAirport()).isEqualTo("FRA");
            assertThat(result.warnings())
                    .anyMatch(w -> w.startsWith("AI extraction confidence 0.44 is below the threshold 0.60"))
                    .contains("OCR could not extract the flight date");
            assertThat(result.attempts()).extracting(StrategyAttempt::succeeded).containsExactly(false, true, true);
        }

        @Test
        @DisplayName("an AI timeout falls back to OCR")
        void aiTimeout() {
            ExtractionResult result = service(SETTINGS,
                    ai(() -> fails("ai", StrategyFailure.Reason.TIMEOUT, "AI extraction timed out after 30000 ms")),
                    ocr(() -> StrategyOutcome.success(OCR_RESULT)))
                    .extract(blankPage());

            assertThat(result.success()).isTrue();
            assertThat(result.method()).isEqualTo(ExtractionMethod.ocr());
            assertThat(result.warnings()).contains("ai: AI extraction timed out after 30000 ms");
            assertThat(result.attempts().get(1).detail()).isEqualTo("TIMEOUT: AI extraction timed out after 30000 ms");
        }

        @Test
        @DisplayName("an exhausted quota is reported and OCR still runs")
        void quotaExceeded() {
            StubStrategy ai = ai(() -> StrategyOutcome.failure(
                    new StrategyFailure("ai", StrategyFailure.Reason.QUOTA_EXCEEDED, "monthly AI extraction quota exhausted (1000 requests)"),
                    List.of("AI extraction quota exceeded; fell back to OCR")));

            ExtractionResult result = service(SETTINGS, ai, ocr(() -> StrategyOutcome.success(OCR_RESULT)))
                    .extract(blankPage());

            assertThat(result.success()).isTrue();
            assertThat(result.warnings()).contains(
                    "AI extraction quota exceeded; fell back to OCR",
                    "ai: monthly AI extraction quota exhausted (1000 requests)");
        }

        @Test
        @DisplayName("an enabled AI path without an extractor is recorded as not configured")
        void aiNotConfigured() {
            ExtractionResult result = service(SETTINGS, ocr(() -> StrategyOutcome.success(OCR_RESULT)))
                    .extract(blankPage());

            assertThat(result.attempts()).extracting(StrategyAttempt::strategy).containsExactly("barcode", "ai", "ocr");
            assertThat(result.attempts().get(1).detail()).startsWith("NOT_CONFIGURED");
        }

        @Test
        @DisplayName("a disabled AI path is not attempted at all")
        void aiDisabled() {
            StubStrategy ai = ai(() -> StrategyOutcome.success(AI_COMPLETE));

            ExtractionResult result = service(ExtractionSettings.defaults(), ai, ocr(() -> StrategyOutcome.success(OCR_RESULT)))
                    .extract(blankPage());

            assertThat(ai.calls).hasValue(0);
            assertThat(result.attempts()).extracting(StrategyAttempt::strategy).containsExactly("barcode", "ocr");
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("when every strategy fails the result says so and lists each failure")
        void allFail() {
            ExtractionResult result = service(SETTINGS,
                    ai(() -> fails("ai", StrategyFailure.Reason.SCHEMA_MISMATCH, "response is not valid JSON")),
                    ocr(() -> fails("ocr", StrategyFailure.Reason.INSUFFICIENT_FIELDS,
                            "insufficient fields recognized: found 1, minimum 3")))
                    .extract(blankPage());

            assertThat(result.success()).isFalse();
            assertThat(result.method()).isNull();
            assertThat(result.flightSegments()).isEmpty();
            assertThat(result.overallConfidence()).isZero();
            assertThat(result.errors()).containsExactly(
                    BoardingPassExtractionService.ALL_FAILED,
                    "barcode: no barcode detected",
                    "ai: response is not valid JSON",
                    "ocr: insufficient fields recognized: found 1, minimum 3");
            assertThat(result.warnings()).containsExactly(
                    "barcode: no barcode detected",
                    "ai: response is not valid JSON",
                    "ocr: insufficient fields recognized: found 1, minimum 3");
            assertThat(result.attempts()).noneMatch(StrategyAttempt::succeeded);
        }

        @Test
        @DisplayName("no barcode, AI disabled and too little OCR text give an empty result explaining the shortfall")
        void ocrBelowMinimumFields() {
            // Arrange
            OcrFieldParser parser = new OcrFieldParser(rules, airports, CLOCK);
            ExtractionSettings settings = ExtractionSettings.defaults();
            OcrExtractionStrategy ocr = new OcrExtractionStrategy(new ImagePreprocessor(settings.getUpscaleBelowWidth()),
                    (image, configuration) -> "FLIGHT LH 400", parser,
                    List.of(OcrConfiguration.AUTO, OcrConfiguration.SPARSE), executor, settings);

            // Act
            ExtractionResult result = service(settings, ocr).extract(blankPage());

            // Assert
            assertThat(result.success()).isFalse();
            assertThat(result.overallConfidence()).isZero();
            assertThat(result.flightSegments()).isEmpty();
            assertThat(result.passengers()).isEmpty();
            assertThat(result.attempts()).extracting(StrategyAttempt::strategy).containsExactly("barcode", "ocr");
            assertThat(result.attempts().get(1).detail())
                    .isEqualTo("INSUFFICIENT_FIELDS: insufficient fields recognized: found 2, minimum 3");
            assertThat(result.errors()).containsExactly(
                    BoardingPassExtractionService.ALL_FAILED,
                    "barcode: no barcode detected",
                    "ocr: insufficient fields recognized: found 2, minimum 3");
            assertThat(result.warnings())
                    .contains("OCR could not extract the flight date",
                            "ocr: insufficient fields recognized: found 2, minimum 3");
        }

        @Test
        @DisplayName("an unexpected exception inside a strategy becomes an upstream error")
        void strategyThrows() {
            ExtractionResult result = service(SETTINGS,
                    ai(() -> {
                        throw new IllegalStateException("boom");
                    }),
                    ocr(() -> StrategyOutcome.success(OCR_RESULT)))
                    .extract(blankPage());

            assertThat(result.success()).isTrue();
            assertThat(result.warnings()).contains("ai: unexpected error: boom");
        }

        @Test
        @DisplayName("malformed input throws and leaves the caller's MDC untouched")
        void fatalInput() {
            MDC.put(BoardingPassExtractionService.MDC_KEY, "outer");
            try {
                assertThatThrownBy(() -> service(SETTINGS).extract(ExtractionRequest.of(new byte[0], "image/png")))
                        .isInstanceOfSatisfying(FatalInputException.class,
                                e -> assertThat(e.getReason()).isEqualTo(FatalInputException.Reason.EMPTY));
                assertThat(MDC.get(BoardingPassExtractionService.MDC_KEY)).isEqualTo("outer");
            } finally {
                MDC.remove(BoardingPassExtractionService.MDC_KEY);
            }
        }

        @Test
        @DisplayName("two strategies of the same kind are rejected")
        void duplicateStrategies() {
            assertThatThrownBy(() -> service(SETTINGS,
                    ocr(() -> StrategyOutcome.success(OCR_RESULT)), ocr(() -> StrategyOutcome.success(OCR_RESULT))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("OCR");
        }
    }

    @Test
    @DisplayName("a result without a passenger name gets a placeholder passenger at zero confidence")
    void passengerPlaceholder() {
        Candidate noName = OCR_RESULT.toBuilder()
                .clearPassengers()
                .fieldConfidence(Map.of(
                        ExtractionField.FLIGHT_NUMBER, 0.7,
                        ExtractionField.DEPARTURE_AIRPORT, 0.85,
                        ExtractionField.ARRIVAL_AIRPORT, 0.85))
                .build();

        ExtractionResult result = service(ExtractionSettings.defaults(), ocr(() -> StrategyOutcome.success(noName)))
                .extract(blankPage());

        assertThat(result.passengers()).containsExactly(new Passenger(null, null));
        assertThat(result.fieldConfidence()).containsEntry("passengerName", 0.0);
        assertThat(result.warnings()).contains("No passenger name could be extracted");
    }
}
