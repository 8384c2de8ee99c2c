package com.eainde.boardingpass.config;

import com.eainde.boardingpass.BoardingPassExtractionService;
import com.eainde.boardingpass.ai.AiExtractionStrategy;
import com.eainde.boardingpass.ai.AiResponseMapper;
import com.eainde.boardingpass.ai.JsonSchemaConverter;
import com.eainde.boardingpass.ai.LlmStructuredExtractor;
import com.eainde.boardingpass.ai.StructuredExtractor;
import com.eainde.boardingpass.ai.StructuredResponseValidator;
import com.eainde.boardingpass.ai.gemini.GeminiChatModel;
import com.eainde.boardingpass.airport.AirportDirectory;
import com.eainde.boardingpass.airport.JsonAirportDirectory;
import com.eainde.boardingpass.barcode.BarcodeDecoder;
import com.eainde.boardingpass.barcode.BarcodeExtractionStrategy;
import com.eainde.boardingpass.barcode.BcbpParser;
import com.eainde.boardingpass.document.DocumentLoader;
import com.eainde.boardingpass.image.ImagePreprocessor;
import com.eainde.boardingpass.model.ExtractionField;
import com.eainde.boardingpass.ocr.OcrConfiguration;
import com.eainde.boardingpass.ocr.OcrEngine;
import com.eainde.boardingpass.ocr.OcrExtractionStrategy;
import com.eainde.boardingpass.ocr.TesseractOcrEngine;
import com.eainde.boardingpass.ocr.parse.OcrFieldParser;
import com.eainde.boardingpass.ocr.parse.ParsingRules;
import com.eainde.boardingpass.pipeline.ExtractionSettings;
import com.eainde.boardingpass.pipeline.ExtractionStrategy;
import com.eainde.boardingpass.quota.AdminNotifier;
import com.eainde.boardingpass.quota.InMemoryUsageQuotaCounter;
import com.eainde.boardingpass.quota.LoggingAdminNotifier;
import com.eainde.boardingpass.quota.QuotaGuard;
import com.eainde.boardingpass.quota.UsageQuotaCounter;
import com.eainde.boardingpass.scoring.CandidateMerger;
import com.eainde.boardingpass.scoring.ConfidenceScorer;
import com.eainde.boardingpass.thread.MdcAwareExecutor;
import com.eainde.boardingpass.validation.SegmentValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Wires the extraction pipeline from {@code boarding-pass.*} properties. Pure-logic classes only
 * see the immutable {@link ExtractionSettings}; Spring stays in this package.
 *
 * <p>The Gemini-backed AI path exists only with {@code boarding-pass.ai.enabled=true}. Collaborators
 * (airport dataset, OCR engine, quota counter, admin notifier, structured extractor, chat model) can
 * be replaced by declaring a bean of the same type.
 */
@Slf4j
@Configuration
public class ExtractionConfiguration {

    private static final String WEIGHT_PREFIX = "boarding-pass.scoring.weights.";

    // =========================================================================
    //  Settings
    // =========================================================================

    @Bean
    public ExtractionSettings extractionSettings(
            Environment environment,
            @Value("${boarding-pass.max-upload-bytes:10485760}") long maxUploadBytes,
            @Value("${boarding-pass.max-pages:1}") int maxPages,
            @Value("${boarding-pass.render-dpi:200}") int renderDpi,
            @Value("${boarding-pass.default-timeout:60s}") String defaultTimeout,
            @Value("${boarding-pass.barcode.enabled:true}") boolean barcodeEnabled,
            @Value("${boarding-pass.barcode.budget:5s}") String barcodeBudget,
            @Value("${boarding-pass.ai.enabled:false}") boolean aiEnabled,
            @Value("${boarding-pass.ai.timeout:30s}") String aiTimeout,
            @Value("${boarding-pass.ai.confidence-threshold:0.6}") double aiConfidenceThreshold,
            @Value("${boarding-pass.ocr.enabled:true}") boolean ocrEnabled,
            @Value("${boarding-pass.ocr.budget:20s}") String ocrBudget,
            @Value("${boarding-pass.ocr.min-fields:3}") int ocrMinFields,
            @Value("${boarding-pass.ocr.upscale-below-width:1000}") int upscaleBelowWidth) {

        ExtractionSettings.Builder builder = ExtractionSettings.builder()
                .maxUploadBytes(maxUploadBytes)
                .maxPages(maxPages)
                .renderDpi(renderDpi)
                .defaultTimeout(DurationStyle.detectAndParse(defaultTimeout))
                .barcodeEnabled(barcodeEnabled)
                .barcodeBudget(DurationStyle.detectAndParse(barcodeBudget))
                .aiEnabled(aiEnabled)
                .aiTimeout(DurationStyle.detectAndParse(aiTimeout))
                .aiConfidenceThreshold(aiConfidenceThreshold)
                .ocrEnabled(ocrEnabled)
                .ocrBudget(DurationStyle.detectAndParse(ocrBudget))
                .ocrMinFields(ocrMinFields)
                .upscaleBelowWidth(upscaleBelowWidth);

        for (ExtractionField field : ExtractionField.values()) {
            Double weight = environment.getProperty(WEIGHT_PREFIX + field.key(), Double.class);
            if (weight != null) {
                builder.fieldWeight(field, weight);
            }
        }
        ExtractionSettings settings = builder.build();
        log.info("Boarding pass extraction configured: barcode={}, ai={}, ocr={}, timeout={}",
                barcodeEnabled, aiEnabled, ocrEnabled, settings.getDefaultTimeout());
        return settings;
    }

    // =========================================================================
    //  Shared infrastructure
    // =========================================================================

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor extractionExecutor(@Value("${boarding-pass.executor.threads:0}") int threads) {
        int size = threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
        return new MdcAwareExecutor(size);
    }

    @Bean
    @ConditionalOnMissingBean
    public AirportDirectory airportDirectory(ObjectMapper objectMapper,
                                             @Value("${boarding-pass.airports-resource:airports.json}") String resource) {
        return JsonAirportDirectory.fromClasspath(objectMapper, resource);
    }

    @Bean
    public ParsingRules parsingRules(ObjectMapper objectMapper,
                                     @Value("${boarding-pass.parsing-rules-resource:parsing-rules.json}") String resource) {
        return ParsingRules.fromClasspath(objectMapper, resource);
    }

    // =========================================================================
    //  Strategies
    // =========================================================================

    @Bean
    public BarcodeExtractionStrategy barcodeExtractionStrategy(Clock clock, MdcAwareExecutor extractionExecutor,
                                                               ExtractionSettings settings) {
        return new BarcodeExtractionStrategy(new BarcodeDecoder(), new BcbpParser(clock), extractionExecutor, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public OcrEngine ocrEngine(@Value("${boarding-pass.ocr.tessdata-path:}") String tessdataPath,
                               @Value("${boarding-pass.ocr.language:eng}") String language) {
        return new TesseractOcrEngine(tessdataPath, language);
    }

    @Bean
    public OcrExtractionStrategy ocrExtractionStrategy(
            OcrEngine ocrEngine, ParsingRules parsingRules, AirportDirectory airportDirectory, Clock clock,
            MdcAwareExecutor extractionExecutor, ExtractionSettings settings,
            @Value("${boarding-pass.ocr.configurations:auto,auto_osd,block,sparse}") String configurations) {
        List<OcrConfiguration> parsed = Arrays.stream(configurations.split(","))
                .filter(name -> !name.isBlank())
                .map(OcrConfiguration::named)
                .collect(Collectors.toList());
        return new OcrExtractionStrategy(new ImagePreprocessor(settings.getUpscaleBelowWidth()), ocrEngine,
                new OcrFieldParser(parsingRules, airportDirectory, clock), parsed, extractionExecutor, settings);
    }

    // =========================================================================
    //  AI path
    // =========================================================================

    @Bean
    @ConditionalOnMissingBean
    public UsageQuotaCounter usageQuotaCounter(@Value("${boarding-pass.ai.monthly-limit:999}") long monthlyLimit) {
        return new InMemoryUsageQuotaCounter(monthlyLimit);
    }

    @Bean
    @ConditionalOnMissingBean
    public AdminNotifier adminNotifier() {
        return new LoggingAdminNotifier();
    }

    @Bean
    public QuotaGuard quotaGuard(UsageQuotaCounter usageQuotaCounter, AdminNotifier adminNotifier, Clock clock,
                                 @Value("${boarding-pass.ai.monthly-limit:999}") long monthlyLimit,
                                 @Value("${boarding-pass.ai.warning-threshold:900}") long warningThreshold) {
        return new QuotaGuard(usageQuotaCounter, adminNotifier, clock, monthlyLimit, warningThreshold);
    }

    @Bean
    @ConditionalOnProperty(prefix = "boarding-pass.ai", name = "enabled", havingValue = "true")
    @ConditionalOnMissingBean
    public ChatModel geminiChatModel(
            @Value("${boarding-pass.ai.model:gemini-2.5-flash}") String model,
            @Value("${boarding-pass.ai.api-key:}") String apiKey,
            @Value("${boarding-pass.ai.project-id:}") String projectId,
            @Value("${boarding-pass.ai.location:us-central1}") String location,
            @Value("${boarding-pass.ai.temperature:0.1}") double temperature,
            @Value("${boarding-pass.ai.max-retries:2}") int maxRetries,
            @Value("${boarding-pass.ai.timeout:30s}") String timeout) {
        log.info("Creating Gemini chat model '{}' ({})", model, apiKey.isBlank() ? "Vertex AI" : "API key");
        return GeminiChatModel.builder()
                .modelName(model)
                .apiKey(apiKey)
                .projectId(projectId.isBlank() ? null : projectId)
                .location(location)
                .temperature(temperature)
                .maxRetries(maxRetries)
                .timeout(DurationStyle.detectAndParse(timeout))
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "boarding-pass.ai", name = "enabled", havingValue = "true")
    @ConditionalOnMissingBean
    public StructuredExtractor structuredExtractor(ChatModel chatModel, MdcAwareExecutor extractionExecutor) {
        return new LlmStructuredExtractor(chatModel, extractionExecutor);
    }

    @Bean
    @ConditionalOnProperty(prefix = "boarding-pass.ai", name = "enabled", havingValue = "true")
    public AiExtractionStrategy aiExtractionStrategy(StructuredExtractor structuredExtractor, QuotaGuard quotaGuard,
                                                     AirportDirectory airportDirectory, ObjectMapper objectMapper,
                                                     ExtractionSettings settings) {
        return new AiExtractionStrategy(structuredExtractor,
                JsonSchemaConverter.fromClasspath("BoardingPass", JsonSchemaConverter.BOARDING_PASS_SCHEMA),
                new StructuredResponseValidator(), new AiResponseMapper(airportDirectory), quotaGuard,
                objectMapper, settings);
    }

    // =========================================================================
    //  Orchestrator
    // =========================================================================

    @Bean
    public BoardingPassExtractionService boardingPassExtractionService(
            List<ExtractionStrategy> strategies, AirportDirectory airportDirectory, ParsingRules parsingRules,
            ExtractionSettings settings) {
        return new BoardingPassExtractionService(new DocumentLoader(settings), strategies,
                new SegmentValidator(airportDirectory, parsingRules), new ConfidenceScorer(settings),
                new CandidateMerger(), settings);
    }
}
