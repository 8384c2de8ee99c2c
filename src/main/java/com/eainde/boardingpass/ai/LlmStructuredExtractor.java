package com.eainde.boardingpass.ai;

import com.eainde.boardingpass.document.EncodedImage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link StructuredExtractor} backed by a multimodal LangChain4j {@link ChatModel}. The call runs on
 * the extraction executor so that the caller's timeout holds even when the HTTP client's does not; on
 * timeout the worker is interrupted, which also stops any pending retry.
 */
@Slf4j
public class LlmStructuredExtractor implements StructuredExtractor {

    private final ChatModel chatModel;
    private final ExecutorService executor;

    public LlmStructuredExtractor(ChatModel chatModel, ExecutorService executor) {
        this.chatModel = chatModel;
        this.executor = executor;
    }

    @Override
    public String extractStructured(EncodedImage image, JsonSchema schema, Duration timeout) {
        ChatRequest request = ChatRequest.builder()
                .messages(
                        SystemMessage.from(BoardingPassPrompts.SYSTEM_PROMPT),
                        UserMessage.from(
                                TextContent.from(BoardingPassPrompts.USER_INSTRUCTION),
                                ImageContent.from(image.base64(), image.mediaType())))
                .responseFormat(ResponseFormat.builder()
                        .type(ResponseFormatType.JSON)
                        .jsonSchema(schema)
                        .build())
                .build();

        Future<ChatResponse> call = executor.submit(() -> chatModel.chat(request));
        ChatResponse response;
        try {
            response = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new StructuredExtractionException("AI extraction timed out after " + timeout.toMillis() + " ms", true, e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new StructuredExtractionException("AI extraction interrupted", false, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new StructuredExtractionException("AI extraction failed: " + cause.getMessage(), false, cause);
        }

        if (response.tokenUsage() != null) {
            log.info("AI extraction finished: tokenUsage={}, finishReason={}", response.tokenUsage(), response.finishReason());
        }
        String text = response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new StructuredExtractionException("AI extraction returned an empty response", false);
        }
        return text;
    }
}
