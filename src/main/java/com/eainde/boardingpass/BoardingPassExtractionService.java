package com.eainde.boardingpass;

import com.eainde.boardingpass.document.DocumentLoader;
import com.eainde.boardingpass.document.LoadedDocument;
import com.eainde.boardingpass.exception.FatalInputException;
import com.eainde.boardingpass.model.ExtractionField;
import com.eainde.boardingpass.model.ExtractionMethod;
import com.eainde.boardingpass.model.ExtractionRequest;
import com.eainde.boardingpass.model.ExtractionResult;
import com.eainde.boardingpass.model.FlightSegment;
import com.eainde.boardingpass.model.Passenger;
import com.eainde.boardingpass.model.StrategyAttempt;
import com.eainde.boardingpass.pipeline.Candidate;
import com.eainde.boardingpass.pipeline.Deadline;
import com.eainde.boardingpass.pipeline.ExtractionSettings;
import com.eainde.boardingpass.pipeline.ExtractionStrategy;
import com.eainde.boardingpass.pipeline.StrategyFailure;
import com.eainde.boardingpass.pipeline.StrategyOutcome;
import com.eainde.boardingpass.scoring.CandidateMerger;
import com.eainde.boardingpass.scoring.ConfidenceScorer;
import com.eainde.boardingpass.validation.SegmentValidator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point of the pipeline. Runs the strategies in priority order:
 * <ol>
 *   <li>barcode: an IATA BCBP payload is authoritative and ends the call</li>
 *   <li>AI structured extraction, when enabled and the quota admits it</li>
 *   <li>OCR, when the AI path is unavailable, failed or scored below the configured threshold</li>
 * </ol>
 * Successful candidates are ranked by overall confidence (ties: barcode, AI, OCR) and merged field
 * by field. Recoverable problems end up in the result's warnings; only malformed input throws.
 */
@Slf4j
public class BoardingPassExtractionService {

    static final String ALL_FAILED = "No extraction strategy produced usable boarding pass data";
    static final String MDC_KEY = "extractionId";

    private final DocumentLoader documentLoader;
    private final Map<ExtractionMethod.Kind, ExtractionStrategy> strategies;
    private final SegmentValidator segmentValidator;
    private final ConfidenceScorer scorer;
    private final CandidateMerger merger;
    private final ExtractionSettings settings;

    public BoardingPassExtractionService(DocumentLoader documentLoader,
                                         List<ExtractionStrategy> strategies,
                                         SegmentValidator segmentValidator,
                                         ConfidenceScorer scorer,
                                         CandidateMerger merger,
                                         ExtractionSettings settings) {
        this.documentLoader = documentLoader;
        this.strategies = new EnumMap<>(ExtractionMethod.Kind.class);
        for (ExtractionStrategy strategy : strategies) {
            if (this.strategies.putIfAbsent(strategy.kind(), strategy) != null) {
                throw new IllegalArgumentException("Duplicate strategy for " + strategy.kind());
            }
        }
        this.segmentValidator = segmentValidator;
        this.scorer = scorer;
        this.merger = merger;
        this.settings = settings;
    }

    /**
     * @throws FatalInputException when the upload is empty, unreadable, too large or of an unsupported type
     */
    public ExtractionResult extract(ExtractionRequest request) {
        long started = System.nanoTime();
        String previousId = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, UUID.randomUUID().toString().substring(0, 8));
        try {
            log.info("Starting boarding pass extraction: mediaType={}, bytes={}", request.getMediaType(), request.size());
            LoadedDocument document = documentLoader.load(request);
            Duration timeout = request.getTimeout() != null ? request.getTimeout() : settings.getDefaultTimeout();
            Run run = new Run(document, Deadline.after(timeout));

            ExtractionResult result = run.execute();
            log.info("Extraction finished: success={}, method={}, confidence={}, warnings={}",
                    result.success(), result.method(), String.format(Locale.ROOT, "%.2f", result.overallConfidence()),
                    result.warnings().size());
            return result.withProcessingTime(elapsedMs(started));
        } finally {
            if (previousId == null) {
                MDC.remove(MDC_KEY);
            } else {
                MDC.put(MDC_KEY, previousId);
            }
        }
    }

    private static long elapsedMs(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }

    /** State of one call. */
    private final class Run {

        private final LoadedDocument document;
        private final Deadline deadline;
        private final List<StrategyAttempt> attempts = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<String> failures = new ArrayList<>();
        private final List<Candidate> candidates = new ArrayList<>();

        Run(LoadedDocument document, Deadline deadline) {
            this.document = document;
            this.deadline = deadline;
        }

        ExtractionResult execute() {
            if (settings.isBarcodeEnabled() && strategies.containsKey(ExtractionMethod.Kind.BARCODE)) {
                Candidate barcode = run(strategies.get(ExtractionMethod.Kind.BARCODE));
                if (barcode != null && barcode.has(ExtractionField.FLIGHT_NUMBER)) {
                    log.info("Barcode is authoritative; skipping AI and OCR");
                    return build(List.of(barcode));
                }
            }

            boolean needOcr = true;
            if (settings.isAiEnabled()) {
                ExtractionStrategy ai = strategies.get(ExtractionMethod.Kind.AI_STRUCTURED);
                if (ai == null) {
                    recordFailure(new StrategyFailure("ai", StrategyFailure.Reason.NOT_CONFIGURED,
                            "AI extraction is enabled but no extractor is configured"), 0);
                } else {
                    Candidate candidate = run(ai);
                    if (candidate != null) {
                        double score = scorer.score(candidate.fieldConfidence());
                        if (score >= settings.getAiConfidenceThreshold()) {
                            needOcr = false;
                        } else {
                            warnings.add(String.format(Locale.ROOT,
                                    "AI extraction confidence %.2f is below the threshold %.2f; running OCR",
                                    score, settings.getAiConfidenceThreshold()));
                        }
                    }
                }
            }

            if (needOcr && settings.isOcrEnabled() && strategies.containsKey(ExtractionMethod.Kind.OCR)) {
                run(strategies.get(ExtractionMethod.Kind.OCR));
            }

            if (candidates.isEmpty()) {
                log.warn("All strategies failed after {} attempt(s)", attempts.size());
                List<String> errors = new ArrayList<>();
                errors.add(ALL_FAILED);
                errors.addAll(failures);
                return ExtractionResult.failure(warnings, errors, attempts, 0);
            }
            return build(candidates);
        }

        /** Runs one strategy, records the attempt and returns its validated candidate, or null. */
        private Candidate run(ExtractionStrategy strategy) {
            if (deadline.isExpired()) {
                recordFailure(new StrategyFailure(strategy.name(), StrategyFailure.Reason.TIMEOUT,
                        "extraction deadline expired before the strategy started"), 0);
                return null;
            }
            log.info("Running strategy '{}'", strategy.name());
            long started = System.nanoTime();
            StrategyOutcome outcome;
            try {
                outcome = strategy.attempt(document, deadline);
            } catch (RuntimeException e) {
                log.error("Strategy '{}' failed unexpectedly", strategy.name(), e);
                outcome = StrategyOutcome.failure(new StrategyFailure(strategy.name(),
                        StrategyFailure.Reason.UPSTREAM_ERROR, "unexpected error: " + e.getMessage()));
            }
            long durationMs = elapsedMs(started);

            if (!outcome.isSuccess()) {
                warnings.addAll(outcome.getWarnings());
                recordFailure(outcome.getFailure(), durationMs);
                return null;
            }

            Candidate candidate = segmentValidator.validate(outcome.getCandidate());
            warnings.addAll(candidate.warnings());
            candidates.add(candidate.toBuilder().clearWarnings().build());
            attempts.add(new StrategyAttempt(strategy.name(), true, String.format(Locale.ROOT,
                    "%d field(s), confidence %.2f", candidate.fieldCount(), scorer.score(candidate.fieldConfidence())),
                    durationMs));
            log.info("Strategy '{}' produced {} field(s) in {} ms", strategy.name(), candidate.fieldCount(), durationMs);
            return candidate;
        }

        private void recordFailure(StrategyFailure failure, long durationMs) {
            log.warn("Strategy '{}' failed ({}): {}", failure.strategy(), failure.reason(), failure.message());
            warnings.add(failure.describe());
            failures.add(failure.describe());
            attempts.add(new StrategyAttempt(failure.strategy(), false,
                    failure.reason() + ": " + failure.message(), durationMs));
        }

        private ExtractionResult build(List<Candidate> successful) {
            List<Candidate> ranked = new ArrayList<>(successful);
            ranked.sort(Comparator
                    .comparingDouble((Candidate c) -> scorer.score(c.fieldConfidence()))
                    .thenComparingInt(c -> c.method().kind().priority())
                    .reversed());

            Candidate merged = segmentValidator.validate(merger.mergeAll(ranked));
            for (String warning : merged.warnings()) {
                if (!warnings.contains(warning)) {
                    warnings.add(warning);
                }
            }

            Map<ExtractionField, Double> confidence = merged.fieldConfidence();
            List<Passenger> passengers = merged.passengers();
            if (passengers.isEmpty()) {
                passengers = List.of(new Passenger(null, null));
                confidence.put(ExtractionField.PASSENGER_NAME, 0.0);
                warnings.add("No passenger name could be extracted");
            }
            List<FlightSegment> segments = merged.segments().isEmpty() ? List.of(FlightSegment.empty()) : merged.segments();

            Map<String, Double> byKey = new LinkedHashMap<>();
            confidence.forEach((field, value) -> byKey.put(field.key(), value));

            return new ExtractionResult(true, ranked.get(0).method(), segments, passengers,
                    merged.bookingReference(), byKey, scorer.score(confidence), warnings, List.of(), attempts, 0);
        }
    }
}
