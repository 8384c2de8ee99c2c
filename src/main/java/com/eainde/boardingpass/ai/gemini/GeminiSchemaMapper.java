package com.eainde.boardingpass.ai.gemini;

import com.google.genai.types.Schema;
import com.google.genai.types.Type;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts LangChain4j schema elements into the Gen AI SDK's {@link Schema} used as response schema.
 */
public final class GeminiSchemaMapper {

    private GeminiSchemaMapper() {
    }

    public static Schema toGeminiSchema(JsonSchemaElement element) {
        if (element == null) {
            return null;
        }

        if (element instanceof JsonObjectSchema) {
            JsonObjectSchema objectSchema = (JsonObjectSchema) element;
            Map<String, Schema> properties = new LinkedHashMap<>();
            if (objectSchema.properties() != null) {
                objectSchema.properties().forEach((key, value) -> properties.put(key, toGeminiSchema(value)));
            }
            Schema.Builder builder = Schema.builder()
                    .type(Type.Known.OBJECT)
                    .properties(properties)
                    // keeps the model's output in schema order
                    .propertyOrdering(new ArrayList<>(properties.keySet()));
            if (objectSchema.required() != null && !objectSchema.required().isEmpty()) {
                builder.required(objectSchema.required());
            }
            if (objectSchema.description() != null) {
                builder.description(objectSchema.description());
            }
            return builder.build();
        }

        if (element instanceof JsonEnumSchema) {
            JsonEnumSchema enumSchema = (JsonEnumSchema) element;
            return withDescription(Schema.builder()
                    .type(Type.Known.STRING)
                    .format("enum")
                    .enum_(enumSchema.enumValues()), enumSchema.description());
        }

        if (element instanceof JsonStringSchema) {
            return withDescription(Schema.builder().type(Type.Known.STRING), ((JsonStringSchema) element).description());
        }

        if (element instanceof JsonIntegerSchema) {
            return withDescription(Schema.builder().type(Type.Known.INTEGER), ((JsonIntegerSchema) element).description());
        }

        if (element instanceof JsonNumberSchema) {
            return withDescription(Schema.builder().type(Type.Known.NUMBER), ((JsonNumberSchema) element).description());
        }

        if (element instanceof JsonBooleanSchema) {
            return withDescription(Schema.builder().type(Type.Known.BOOLEAN), ((JsonBooleanSchema) element).description());
        }

        if (element instanceof JsonArraySchema) {
            JsonArraySchema arraySchema = (JsonArraySchema) element;
            return withDescription(Schema.builder()
                    .type(Type.Known.ARRAY)
                    .items(toGeminiSchema(arraySchema.items())), arraySchema.description());
        }

        throw new IllegalArgumentException("Unknown schema type: " + element.getClass());
    }

    private static Schema withDescription(Schema.Builder builder, String description) {
        if (description != null) {
            builder.description(description);
        }
        return builder.build();
    }
}
