package com.eainde.boardingpass.ocr;

import com.eainde.boardingpass.document.LoadedDocument;
import com.eainde.boardingpass.image.ImagePreprocessor;
import com.eainde.boardingpass.image.NamedVariant;
import com.eainde.boardingpass.model.ExtractionMethod;
import com.eainde.boardingpass.ocr.parse.OcrFieldParser;
import com.eainde.boardingpass.pipeline.Candidate;
import com.eainde.boardingpass.pipeline.Deadline;
import com.eainde.boardingpass.pipeline.ExtractionSettings;
import com.eainde.boardingpass.pipeline.ExtractionStrategy;
import com.eainde.boardingpass.pipeline.StrategyFailure;
import com.eainde.boardingpass.pipeline.StrategyOutcome;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs the recognizer over every preprocessed variant under every page-segmentation configuration in
 * parallel, parses each text, and keeps the attempt with the most fields (ties: highest average
 * field confidence). Attempts still running when the OCR budget expires are cancelled and their
 * workers interrupted.
 */
@Slf4j
public class OcrExtractionStrategy implements ExtractionStrategy {

    private final ImagePreprocessor preprocessor;
    private final OcrEngine engine;
    private final OcrFieldParser parser;
    private final List<OcrConfiguration> configurations;
    private final ExecutorService executor;
    private final ExtractionSettings settings;

    public OcrExtractionStrategy(ImagePreprocessor preprocessor, OcrEngine engine, OcrFieldParser parser,
                                 List<OcrConfiguration> configurations, ExecutorService executor,
                                 ExtractionSettings settings) {
        if (configurations.isEmpty()) {
            throw new IllegalArgumentException("At least one OCR configuration is required");
        }
        this.preprocessor = preprocessor;
        this.engine = engine;
        this.parser = parser;
        this.configurations = List.copyOf(configurations);
        this.executor = executor;
        this.settings = settings;
    }

    @Override
    public String name() {
        return "ocr";
    }

    @Override
    public ExtractionMethod.Kind kind() {
        return ExtractionMethod.Kind.OCR;
    }

    private record Attempt(String variant, String configuration, Candidate candidate) {
    }

    @Override
    public StrategyOutcome attempt(LoadedDocument document, Deadline deadline) {
        List<NamedVariant> variants = preprocessor.preprocess(document.firstPage());
        List<Callable<Attempt>> tasks = new ArrayList<>();
        for (NamedVariant variant : variants) {
            for (OcrConfiguration configuration : configurations) {
                tasks.add(() -> new Attempt(variant.name(), configuration.name(),
                        parser.parse(engine.recognize(variant.image(), configuration))));
            }
        }

        // invokeAll cancels (and interrupts) every attempt still running when the budget expires
        Duration budget = deadline.budget(settings.getOcrBudget());
        List<Future<Attempt>> futures;
        try {
            futures = executor.invokeAll(tasks, budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StrategyOutcome.failure(new StrategyFailure(name(), StrategyFailure.Reason.TIMEOUT,
                    "OCR interrupted"));
        }

        List<Attempt> finished = new ArrayList<>();
        boolean timedOut = false;
        String firstError = null;
        for (Future<Attempt> future : futures) {
            if (future.isCancelled()) {
                timedOut = true;
                continue;
            }
            try {
                finished.add(future.get());
            } catch (ExecutionException e) {
                if (firstError == null) {
                    firstError = e.getCause() == null ? e.getMessage() : e.getCause().getMessage();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (timedOut) {
            log.warn("OCR exceeded its {} ms budget; reducing over finished attempts", budget.toMillis());
        }

        if (finished.isEmpty()) {
            if (timedOut) {
                return StrategyOutcome.failure(new StrategyFailure(name(), StrategyFailure.Reason.TIMEOUT,
                        "no OCR attempt finished within " + budget.toMillis() + " ms"));
            }
            return StrategyOutcome.failure(new StrategyFailure(name(), StrategyFailure.Reason.UPSTREAM_ERROR,
                    "all " + futures.size() + " OCR attempts failed: " + firstError));
        }

        Optional<Attempt> best = finished.stream().max(Comparator
                .comparingInt((Attempt a) -> a.candidate().fieldCount())
                .thenComparingDouble(a -> a.candidate().averageConfidence()));
        Attempt winner = best.get();
        int found = winner.candidate().fieldCount();
        log.info("Best OCR attempt: variant={}, config={}, fields={} ({} of {} attempts finished)",
                winner.variant(), winner.configuration(), found, finished.size(), futures.size());

        if (found < settings.getOcrMinFields()) {
            return StrategyOutcome.failure(new StrategyFailure(name(), StrategyFailure.Reason.INSUFFICIENT_FIELDS,
                    "insufficient fields recognized: found " + found + ", minimum " + settings.getOcrMinFields()),
                    winner.candidate().warnings());
        }
        return StrategyOutcome.success(winner.candidate());
    }
}
