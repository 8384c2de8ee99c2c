package com.eainde.boardingpass.ocr;

import com.eainde.boardingpass.airport.JsonAirportDirectory;
import com.eainde.boardingpass.document.LoadedDocument;
import com.eainde.boardingpass.image.ImagePreprocessor;
import com.eainde.boardingpass.ocr.parse.OcrFieldParser;
import com.eainde.boardingpass.ocr.parse.ParsingRules;
import com.eainde.boardingpass.pipeline.Deadline;
import com.eainde.boardingpass.pipeline.ExtractionSettings;
import com.eainde.boardingpass.pipeline.StrategyFailure;
import com.eainde.boardingpass.pipeline.StrategyOutcome;
import com.eainde.boardingpass.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OcrExtractionStrategyTest {

    private static final String FULL_TEXT = """
            LUFTHANSA
            NAME MUELLER/ANNA MS
            FLIGHT LH 1234
            FROM FRA TO JFK
            DATE 14JAN2026
            SEAT 12A
            """;

    private static final LoadedDocument DOCUMENT = new LoadedDocument("image/png", new byte[0],
            List.of(new BufferedImage(600, 300, BufferedImage.TYPE_INT_RGB)));

    private static OcrFieldParser parser;

    private final MdcAwareExecutor executor = new MdcAwareExecutor(2);

    @BeforeAll
    static void loadParser() {
        ObjectMapper mapper = new ObjectMapper();
        parser = new OcrFieldParser(
                ParsingRules.fromClasspath(mapper, ParsingRules.DEFAULT_RESOURCE),
                JsonAirportDirectory.fromClasspath(mapper, JsonAirportDirectory.DEFAULT_RESOURCE),
                Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    private OcrExtractionStrategy strategy(OcrEngine engine, ExtractionSettings settings) {
        return new OcrExtractionStrategy(new ImagePreprocessor(1000), engine, parser,
                List.of(OcrConfiguration.AUTO, OcrConfiguration.SPARSE), executor, settings);
    }

    private static StrategyOutcome run(OcrExtractionStrategy strategy) {
        return strategy.attempt(DOCUMENT, Deadline.after(Duration.ofSeconds(30)));
    }

    @Test
    @DisplayName("every variant runs under every configuration and the richest text wins")
    void bestAttemptWins() {
        AtomicInteger calls = new AtomicInteger();
        OcrEngine engine = (image, configuration) -> {
            calls.incrementAndGet();
            return configuration.equals(OcrConfiguration.SPARSE) ? FULL_TEXT : "LH 1234";
        };

        StrategyOutcome outcome = run(strategy(engine, ExtractionSettings.defaults()));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getCandidate().primarySegment().flightNumber()).isEqualTo("LH1234");
        assertThat(outcome.getCandidate().primarySegment().arrivalAirport()).isEqualTo("JFK");
        // five variants for an image narrower than the upscale width, two configurations each
        assertThat(calls).hasValue(10);
    }

    @Test
    @DisplayName("too few fields fail with the parser warnings attached")
    void insufficientFields() {
        StrategyOutcome outcome = run(strategy((image, configuration) -> "FLIGHT LH 400", ExtractionSettings.defaults()));

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getFailure().reason()).isEqualTo(StrategyFailure.Reason.INSUFFICIENT_FIELDS);
        assertThat(outcome.getFailure().message()).isEqualTo("insufficient fields recognized: found 2, minimum 3");
        assertThat(outcome.getWarnings()).contains("OCR could not extract the flight date");
    }

    @Test
    @DisplayName("an engine failing on every attempt is an upstream error")
    void engineFailure() {
        OcrEngine broken = (image, configuration) -> {
            throw new OcrException("tesseract crashed", null);
        };

        StrategyOutcome outcome = run(strategy(broken, ExtractionSettings.defaults()));

        assertThat(outcome.getFailure().reason()).isEqualTo(StrategyFailure.Reason.UPSTREAM_ERROR);
        assertThat(outcome.getFailure().message()).isEqualTo("all 10 OCR attempts failed: tesseract crashed");
    }

    @Test
    @DisplayName("attempts still running at the end of the budget are interrupted and free the pool")
    void budgetExceeded_shouldInterruptRunningAttempts() throws Exception {
        // Arrange
        CountDownLatch never = new CountDownLatch(1);
        AtomicInteger started = new AtomicInteger();
        AtomicInteger interrupted = new AtomicInteger();
        OcrEngine stuck = (image, configuration) -> {
            started.incrementAndGet();
            try {
                never.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                interrupted.incrementAndGet();
                Thread.currentThread().interrupt();
                throw new OcrException("recognition interrupted", e);
            }
            return FULL_TEXT;
        };
        ExtractionSettings settings = ExtractionSettings.builder().ocrBudget(Duration.ofMillis(100)).build();

        // Act
        StrategyOutcome outcome = run(strategy(stuck, settings));
        // both workers must be free for the two follow-up tasks to meet
        CountDownLatch bothFree = new CountDownLatch(2);
        Callable<Boolean> followUp = () -> {
            bothFree.countDown();
            return bothFree.await(1, TimeUnit.SECONDS);
        };
        Future<Boolean> first = executor.submit(followUp);
        Future<Boolean> second = executor.submit(followUp);

        // Assert
        assertThat(outcome.getFailure().reason()).isEqualTo(StrategyFailure.Reason.TIMEOUT);
        assertThat(outcome.getFailure().message()).isEqualTo("no OCR attempt finished within 100 ms");
        assertThat(first.get(2, TimeUnit.SECONDS)).isTrue();
        assertThat(second.get(2, TimeUnit.SECONDS)).isTrue();
        assertThat(started.get()).isPositive();
        assertThat(interrupted.get()).isEqualTo(started.get());
    }

    @Test
    @DisplayName("at least one configuration is required")
    void noConfigurations() {
        assertThatThrownBy(() -> new OcrExtractionStrategy(new ImagePreprocessor(1000),
                (image, configuration) -> "", parser, List.of(), executor, ExtractionSettings.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
