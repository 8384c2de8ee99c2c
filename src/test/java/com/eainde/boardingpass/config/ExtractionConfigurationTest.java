package com.eainde.boardingpass.config;

import com.eainde.boardingpass.BoardingPassExtractionService;
import com.eainde.boardingpass.ai.AiExtractionStrategy;
import com.eainde.boardingpass.ai.StructuredExtractor;
import com.eainde.boardingpass.model.ExtractionField;
import com.eainde.boardingpass.ocr.OcrEngine;
import com.eainde.boardingpass.pipeline.ExtractionSettings;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ExtractionConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withBean(OcrEngine.class, () -> (image, configuration) -> "")
            .withUserConfiguration(ExtractionConfiguration.class);

    @Test
    @DisplayName("without the AI flag only barcode and OCR strategies are wired")
    void aiDisabledByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(BoardingPassExtractionService.class);
            assertThat(context).doesNotHaveBean(AiExtractionStrategy.class);
            assertThat(context).doesNotHaveBean(ChatModel.class);
            assertThat(context).doesNotHaveBean(StructuredExtractor.class);
            assertThat(context.getBean(ExtractionSettings.class).isAiEnabled()).isFalse();
        });
    }

    @Test
    @DisplayName("the AI flag wires the AI strategy around an existing chat model")
    void aiEnabled() {
        contextRunner
                .withBean(ChatModel.class, () -> mock(ChatModel.class))
                .withPropertyValues("boarding-pass.ai.enabled=true")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(AiExtractionStrategy.class);
                    assertThat(context).hasSingleBean(StructuredExtractor.class);
                    assertThat(context.getBean(ExtractionSettings.class).isAiEnabled()).isTrue();
                });
    }

    @Test
    @DisplayName("properties override durations and field weights")
    void propertyOverrides() {
        contextRunner
                .withPropertyValues(
                        "boarding-pass.default-timeout=45s",
                        "boarding-pass.ocr.min-fields=4",
                        "boarding-pass.scoring.weights.seat=2.0")
                .run(context -> {
                    ExtractionSettings settings = context.getBean(ExtractionSettings.class);

                    assertThat(settings.getDefaultTimeout()).isEqualTo(Duration.ofSeconds(45));
                    assertThat(settings.getOcrMinFields()).isEqualTo(4);
                    assertThat(settings.weight(ExtractionField.SEAT)).isEqualTo(2.0);
                    assertThat(settings.weight(ExtractionField.FLIGHT_NUMBER))
                            .isEqualTo(ExtractionField.FLIGHT_NUMBER.defaultWeight());
                });
    }

    @Test
    @DisplayName("a non-positive weight fails the context")
    void invalidWeight() {
        contextRunner
                .withPropertyValues("boarding-pass.scoring.weights.seat=0")
                .run(context -> assertThat(context).hasFailed());
    }
}
