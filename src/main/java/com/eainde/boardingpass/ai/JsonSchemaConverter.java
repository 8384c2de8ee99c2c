package com.eainde.boardingpass.ai;

import com.eainde.boardingpass.exception.ExtractionException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the boarding-pass answer schema ({@value #BOARDING_PASS_SCHEMA}: a {@code flightSegments}
 * array of leg objects, a {@code passengers} array of first/last name objects and a
 * {@code bookingReference} string) and converts it into the LangChain4j schema that the AI request
 * sends as its response format and that {@link StructuredResponseValidator} checks answers against.
 * <p>
 * Only the JSON Schema subset that file uses is understood: {@code type}, {@code properties},
 * {@code required}, {@code additionalProperties}, {@code items}, {@code enum} and {@code description}.
 * Anything else fails loudly with the location of the offending node.
 */
public class JsonSchemaConverter {

    public static final String BOARDING_PASS_SCHEMA = "schema/boarding-pass.schema.json";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonSchemaConverter() {
    }

    public static JsonSchema fromClasspath(String name, String resource) {
        try (InputStream in = JsonSchemaConverter.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ExtractionException("Schema resource not found: " + resource);
            }
            return toLangChainSchema(name, new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ExtractionException("Failed to read schema resource " + resource, e);
        }
    }

    public static JsonSchema toLangChainSchema(String name, String jsonSchemaString) {
        JsonNode root;
        try {
            root = objectMapper.readTree(jsonSchemaString);
        } catch (IOException e) {
            throw new ExtractionException("Failed to parse JSON Schema string", e);
        }
        return JsonSchema.builder()
                .name(name != null ? name : "Schema")
                .rootElement(convert(root, "$"))
                .build();
    }

    /** An untyped node is an object when it declares properties, otherwise a free-form string. */
    private static JsonSchemaElement convert(JsonNode node, String path) {
        String type = node.path("type").asText(node.has("properties") ? "object" : "string");
        String description = node.has("description") ? node.get("description").asText() : null;

        switch (type) {
            case "object":
                return objectSchema(node, description, path);
            case "array":
                JsonArraySchema.Builder array = JsonArraySchema.builder().description(description);
                if (node.has("items")) {
                    array.items(convert(node.get("items"), path + "[]"));
                }
                return array.build();
            case "string":
                if (node.has("enum")) {
                    return JsonEnumSchema.builder()
                            .description(description)
                            .enumValues(texts(node.get("enum")))
                            .build();
                }
                return JsonStringSchema.builder().description(description).build();
            case "integer":
                return JsonIntegerSchema.builder().description(description).build();
            case "number":
                return JsonNumberSchema.builder().description(description).build();
            case "boolean":
                return JsonBooleanSchema.builder().description(description).build();
            default:
                throw new ExtractionException("Unsupported schema type: " + type + " at " + path);
        }
    }

    private static JsonObjectSchema objectSchema(JsonNode node, String description, String path) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
        // field order is kept: Gemini answers in propertyOrdering order
        node.path("properties").fields().forEachRemaining(field ->
                builder.addProperty(field.getKey(), convert(field.getValue(), path + "." + field.getKey())));
        if (node.path("required").isArray()) {
            builder.required(texts(node.get("required")));
        }
        if (node.path("additionalProperties").isBoolean()) {
            builder.additionalProperties(node.get("additionalProperties").asBoolean());
        }
        return builder.build();
    }

    private static List<String> texts(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(n -> values.add(n.asText()));
        return values;
    }
}
