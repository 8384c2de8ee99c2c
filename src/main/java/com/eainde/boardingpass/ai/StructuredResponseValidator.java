package com.eainde.boardingpass.ai;

import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Strict structural check of a model answer against the schema it was asked to follow: value
 * types, required keys, enum membership, and no keys the schema does not declare.
 */
public class StructuredResponseValidator {

    /**
     * @return human readable violations with a JSON-pointer-like path; empty when the answer conforms
     */
    public List<String> validate(JsonNode node, JsonSchemaElement schema) {
        List<String> violations = new ArrayList<>();
        check(node, schema, "$", violations);
        return violations;
    }

    private void check(JsonNode node, JsonSchemaElement schema, String path, List<String> violations) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            violations.add(path + ": null value");
            return;
        }
        if (schema instanceof JsonObjectSchema) {
            checkObject(node, (JsonObjectSchema) schema, path, violations);
        } else if (schema instanceof JsonArraySchema) {
            if (!node.isArray()) {
                violations.add(path + ": expected array");
                return;
            }
            JsonSchemaElement items = ((JsonArraySchema) schema).items();
            for (int i = 0; i < node.size(); i++) {
                check(node.get(i), items, path + "[" + i + "]", violations);
            }
        } else if (schema instanceof JsonEnumSchema) {
            if (!node.isTextual() || !((JsonEnumSchema) schema).enumValues().contains(node.asText())) {
                violations.add(path + ": not one of " + ((JsonEnumSchema) schema).enumValues());
            }
        } else if (schema instanceof JsonStringSchema) {
            if (!node.isTextual()) {
                violations.add(path + ": expected string");
            }
        } else if (schema instanceof JsonIntegerSchema) {
            if (!node.isIntegralNumber()) {
                violations.add(path + ": expected integer");
            }
        } else if (schema instanceof JsonNumberSchema) {
            if (!node.isNumber()) {
                violations.add(path + ": expected number");
            }
        } else if (schema instanceof JsonBooleanSchema) {
            if (!node.isBoolean()) {
                violations.add(path + ": expected boolean");
            }
        } else {
            violations.add(path + ": unsupported schema element " + schema.getClass().getSimpleName());
        }
    }

    private void checkObject(JsonNode node, JsonObjectSchema schema, String path, List<String> violations) {
        if (!node.isObject()) {
            violations.add(path + ": expected object");
            return;
        }
        Map<String, JsonSchemaElement> properties = schema.properties();
        if (schema.required() != null) {
            for (String key : schema.required()) {
                if (!node.has(key)) {
                    violations.add(path + "." + key + ": missing required key");
                }
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonSchemaElement property = properties == null ? null : properties.get(field.getKey());
            if (property == null) {
                if (!Boolean.TRUE.equals(schema.additionalProperties())) {
                    violations.add(path + "." + field.getKey() + ": unknown key");
                }
                continue;
            }
            check(field.getValue(), property, path + "." + field.getKey(), violations);
        }
    }
}
