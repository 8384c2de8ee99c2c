package com.eainde.boardingpass.ai.gemini;

import com.eainde.boardingpass.exception.ExtractionException;
import com.google.genai.Client;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.HttpOptions;
import com.google.genai.types.Part;
import dev.langchain4j.data.image.Image;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.Capability;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Set;

import static dev.langchain4j.internal.ValidationUtils.ensureNotBlank;
import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;

/**
 * A LangChain4j ChatModel over the Google Gen AI SDK (com.google.genai), for either the Gemini
 * Developer API (API key) or Vertex AI (project + location, application default credentials).
 * Supports multimodal user messages and JSON-schema constrained responses.
 */
public class GeminiChatModel implements ChatModel {

    private static final Logger log = LoggerFactory.getLogger(GeminiChatModel.class);

    private final Client client;
    private final String modelName;
    private final Float temperature;
    private final Integer maxOutputTokens;
    private final int maxRetries;
    private final Duration retryBackoff;
    private final boolean logRequests;
    private final boolean logResponses;
    private final List<ChatModelListener> listeners;

    private GeminiChatModel(Builder builder) {
        this.modelName = ensureNotBlank(builder.modelName, "modelName");
        this.temperature = builder.temperature == null ? null : builder.temperature.floatValue();
        this.maxOutputTokens = builder.maxOutputTokens;
        this.maxRetries = builder.maxRetries == null ? 3 : builder.maxRetries;
        this.retryBackoff = builder.retryBackoff == null ? Duration.ofSeconds(1) : builder.retryBackoff;
        this.logRequests = builder.logRequests != null && builder.logRequests;
        this.logResponses = builder.logResponses != null && builder.logResponses;
        this.listeners = builder.listeners == null ? emptyList() : List.copyOf(builder.listeners);

        if (builder.client != null) {
            this.client = builder.client;
        } else {
            HttpOptions.Builder httpOptions = HttpOptions.builder();
            if (builder.timeout != null) {
                httpOptions.timeout((int) builder.timeout.toMillis());
            }
            Client.Builder clientBuilder = Client.builder().httpOptions(httpOptions.build());
            if (builder.apiKey != null && !builder.apiKey.isBlank()) {
                clientBuilder.apiKey(builder.apiKey);
            } else {
                clientBuilder.vertexAI(true);
                if (builder.projectId != null) clientBuilder.project(builder.projectId);
                if (builder.location != null) clientBuilder.location(builder.location);
            }
            this.client = clientBuilder.build();
        }
    }

    @Override
    public ChatResponse doChat(ChatRequest chatRequest) {
        List<Content> contents = new ArrayList<>();
        StringBuilder systemInstruction = new StringBuilder();

        for (ChatMessage message : chatRequest.messages()) {
            if (message instanceof SystemMessage) {
                if (systemInstruction.length() > 0) systemInstruction.append("\n");
                systemInstruction.append(((SystemMessage) message).text());
            } else {
                contents.add(toContent(message));
            }
        }

        GenerateContentConfig.Builder configBuilder = GenerateContentConfig.builder();
        if (temperature != null) configBuilder.temperature(temperature);
        if (maxOutputTokens != null) configBuilder.maxOutputTokens(maxOutputTokens);
        if (systemInstruction.length() > 0) {
            configBuilder.systemInstruction(Content.builder()
                    .parts(singletonList(Part.fromText(systemInstruction.toString())))
                    .build());
        }

        ResponseFormat responseFormat = chatRequest.responseFormat();
        if (responseFormat != null && responseFormat.type() == ResponseFormatType.JSON) {
            configBuilder.responseMimeType("application/json");
            if (responseFormat.jsonSchema() != null) {
                configBuilder.responseSchema(GeminiSchemaMapper.toGeminiSchema(responseFormat.jsonSchema().rootElement()));
            }
        }
        GenerateContentConfig config = configBuilder.build();

        if (logRequests) {
            log.info("Gemini request: model={}, msgCount={}, jsonSchema={}", modelName, chatRequest.messages().size(),
                    responseFormat != null && responseFormat.jsonSchema() != null);
        }

        GenerateContentResponse result = null;
        RuntimeException lastException = null;
        for (int i = 0; i <= maxRetries; i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ExtractionException("Gemini call interrupted after " + i + " attempts", lastException);
            }
            try {
                result = client.models.generateContent(modelName, contents, config);
                break;
            } catch (RuntimeException e) {
                lastException = e;
                log.warn("Gemini attempt {}/{} failed: {}", i + 1, maxRetries + 1, e.getMessage());
                if (i < maxRetries) {
                    sleepBeforeRetry(i);
                }
            }
        }
        if (result == null) {
            throw new ExtractionException("Gemini call failed after " + (maxRetries + 1) + " attempts", lastException);
        }

        ChatResponse response = toChatResponse(result);
        if (logResponses) {
            log.info("Gemini response: tokenUsage={}, finishReason={}", response.tokenUsage(), response.finishReason());
        }
        return response;
    }

    private void sleepBeforeRetry(int attempt) {
        try {
            Thread.sleep(retryBackoff.toMillis() * (1L << attempt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException("Interrupted while waiting to retry the Gemini call", e);
        }
    }

    private static Content toContent(ChatMessage message) {
        if (message instanceof UserMessage) {
            List<Part> parts = new ArrayList<>();
            for (dev.langchain4j.data.message.Content content : ((UserMessage) message).contents()) {
                if (content instanceof TextContent) {
                    parts.add(Part.fromText(((TextContent) content).text()));
                } else if (content instanceof ImageContent) {
                    parts.add(toPart(((ImageContent) content).image()));
                } else {
                    throw new IllegalArgumentException("Unsupported user content: " + content.type());
                }
            }
            return Content.builder().role("user").parts(parts).build();
        }
        if (message instanceof AiMessage) {
            return Content.builder().role("model")
                    .parts(singletonList(Part.fromText(((AiMessage) message).text())))
                    .build();
        }
        throw new IllegalArgumentException("Unsupported message type: " + message.type());
    }

    private static Part toPart(Image image) {
        if (image.base64Data() != null) {
            return Part.fromBytes(Base64.getDecoder().decode(image.base64Data()), image.mimeType());
        }
        if (image.url() != null) {
            return Part.fromUri(image.url().toString(), image.mimeType());
        }
        throw new IllegalArgumentException("Image carries neither data nor URL");
    }

    private ChatResponse toChatResponse(GenerateContentResponse result) {
        String text = result.text();
        TokenUsage usage = result.usageMetadata()
                .map(u -> new TokenUsage(u.promptTokenCount().orElse(0), u.candidatesTokenCount().orElse(0)))
                .orElse(null);
        FinishReason finishReason = result.candidates()
                .filter(candidates -> !candidates.isEmpty())
                .flatMap(candidates -> candidates.get(0).finishReason())
                .map(reason -> toFinishReason(reason.toString()))
                .orElse(FinishReason.STOP);
        return ChatResponse.builder()
                .aiMessage(AiMessage.from(text == null ? "" : text))
                .tokenUsage(usage)
                .finishReason(finishReason)
                .modelName(modelName)
                .build();
    }

    static FinishReason toFinishReason(String reason) {
        switch (reason) {
            case "STOP":
                return FinishReason.STOP;
            case "MAX_TOKENS":
                return FinishReason.LENGTH;
            case "SAFETY":
            case "RECITATION":
            case "BLOCKLIST":
            case "PROHIBITED_CONTENT":
                return FinishReason.CONTENT_FILTER;
            default:
                return FinishReason.OTHER;
        }
    }

    @Override
    public Set<Capability> supportedCapabilities() {
        return Set.of(Capability.RESPONSE_FORMAT_JSON_SCHEMA);
    }

    @Override
    public List<ChatModelListener> listeners() {
        return listeners;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Client client;
        private String apiKey;
        private String projectId;
        private String location;
        private String modelName;
        private Double temperature;
        private Integer maxOutputTokens;
        private Duration timeout;
        private Integer maxRetries = 3;
        private Duration retryBackoff;
        private Boolean logRequests;
        private Boolean logResponses;
        private List<ChatModelListener> listeners;

        public Builder client(Client client) { this.client = client; return this; }
        public Builder apiKey(String apiKey) { this.apiKey = apiKey; return this; }
        public Builder projectId(String projectId) { this.projectId = projectId; return this; }
        public Builder location(String location) { this.location = location; return this; }
        public Builder modelName(String modelName) { this.modelName = modelName; return this; }
        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Builder temperature(Double temperature) { this.temperature = temperature; return this; }
        public Builder maxOutputTokens(Integer maxOutputTokens) { this.maxOutputTokens = maxOutputTokens; return this; }
        public Builder maxRetries(Integer maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder retryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; return this; }
        public Builder logRequests(Boolean logRequests) { this.logRequests = logRequests; return this; }
        public Builder logResponses(Boolean logResponses) { this.logResponses = logResponses; return this; }
        public Builder listeners(List<ChatModelListener> listeners) { this.listeners = listeners; return this; }

        public GeminiChatModel build() {
            return new GeminiChatModel(this);
        }
    }
}
