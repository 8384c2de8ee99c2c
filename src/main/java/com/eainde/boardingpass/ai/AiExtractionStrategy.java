package com.eainde.boardingpass.ai;

import com.eainde.boardingpass.document.EncodedImage;
import com.eainde.boardingpass.document.LoadedDocument;
import com.eainde.boardingpass.model.ExtractionMethod;
import com.eainde.boardingpass.pipeline.Candidate;
import com.eainde.boardingpass.pipeline.Deadline;
import com.eainde.boardingpass.pipeline.ExtractionSettings;
import com.eainde.boardingpass.pipeline.ExtractionStrategy;
import com.eainde.boardingpass.pipeline.StrategyFailure;
import com.eainde.boardingpass.pipeline.StrategyOutcome;
import com.eainde.boardingpass.quota.QuotaDecision;
import com.eainde.boardingpass.quota.QuotaGuard;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * Sends the first page to the structured extractor once the monthly quota admits it, then trusts
 * the answer only after it passed the strict schema check.
 */
@Slf4j
public class AiExtractionStrategy implements ExtractionStrategy {

    private static final int MAX_REPORTED_VIOLATIONS = 3;

    private final StructuredExtractor extractor;
    private final JsonSchema schema;
    private final StructuredResponseValidator validator;
    private final AiResponseMapper mapper;
    private final QuotaGuard quotaGuard;
    private final ObjectMapper objectMapper;
    private final ExtractionSettings settings;

    public AiExtractionStrategy(StructuredExtractor extractor, JsonSchema schema, StructuredResponseValidator validator,
                                AiResponseMapper mapper, QuotaGuard quotaGuard, ObjectMapper objectMapper,
                                ExtractionSettings settings) {
        this.extractor = extractor;
        this.schema = schema;
        this.validator = validator;
        this.mapper = mapper;
        this.quotaGuard = quotaGuard;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    @Override
    public String name() {
        return "ai";
    }

    @Override
    public ExtractionMethod.Kind kind() {
        return ExtractionMethod.Kind.AI_STRUCTURED;
    }

    @Override
    public StrategyOutcome attempt(LoadedDocument document, Deadline deadline) {
        Duration timeout = deadline.budget(settings.getAiTimeout());
        if (timeout.isZero()) {
            return failure(StrategyFailure.Reason.TIMEOUT, "no time left for AI extraction");
        }

        QuotaDecision quota = quotaGuard.tryAcquire();
        if (!quota.allowed()) {
            return StrategyOutcome.failure(
                    new StrategyFailure(name(), StrategyFailure.Reason.QUOTA_EXCEEDED,
                            "monthly AI extraction quota exhausted (" + quota.currentCount() + " requests)"),
                    List.of("AI extraction quota exceeded; fell back to OCR"));
        }

        EncodedImage image = document.firstPageEncoded();
        String raw;
        try {
            raw = extractor.extractStructured(image, schema, timeout);
        } catch (StructuredExtractionException e) {
            if (e.isTimeout()) {
                log.warn("AI extraction timed out after {} ms", timeout.toMillis());
                return failure(StrategyFailure.Reason.TIMEOUT, e.getMessage());
            }
            log.error("AI extraction call failed", e);
            return failure(StrategyFailure.Reason.UPSTREAM_ERROR, e.getMessage());
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(raw));
        } catch (JsonProcessingException e) {
            log.warn("AI response is not JSON: {}", e.getOriginalMessage());
            return failure(StrategyFailure.Reason.SCHEMA_MISMATCH, "response is not valid JSON");
        }

        List<String> violations = validator.validate(root, schema.rootElement());
        if (!violations.isEmpty()) {
            log.warn("AI response violates the schema: {}", violations);
            List<String> reported = violations.subList(0, Math.min(MAX_REPORTED_VIOLATIONS, violations.size()));
            return failure(StrategyFailure.Reason.SCHEMA_MISMATCH,
                    "response does not match the schema: " + String.join("; ", reported));
        }

        Candidate candidate = mapper.map(root);
        if (candidate.fieldCount() == 0) {
            return StrategyOutcome.failure(
                    new StrategyFailure(name(), StrategyFailure.Reason.NOT_FOUND, "no boarding pass fields in the response"),
                    candidate.warnings());
        }
        return StrategyOutcome.success(candidate);
    }

    private StrategyOutcome failure(StrategyFailure.Reason reason, String message) {
        return StrategyOutcome.failure(new StrategyFailure(name(), reason, message));
    }

    /** Some models wrap JSON in a markdown fence even when asked for a JSON response. */
    static String stripCodeFence(String raw) {
        String text = raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            int lastFence = text.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return text.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return text;
    }
}
