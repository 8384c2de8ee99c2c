package com.eainde.boardingpass.ai;

import com.eainde.boardingpass.exception.ExtractionException;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSchemaConverterTest {

    // --- Tests for toLangChainSchema ---

    @Test
    void toLangChainSchema_shouldParseObjectWithRequiredAndClosedProperties() {
        // Arrange
        String json = """
                {
                  "type": "object",
                  "properties": {
                    "seat": { "type": "string", "description": "Row and letter" },
                    "cabin": { "type": "string", "enum": ["ECONOMY", "BUSINESS"] }
                  },
                  "required": ["seat"],
                  "additionalProperties": false
                }
                """;

        // Act
        JsonSchema result = JsonSchemaConverter.toLangChainSchema("Seat", json);

        // Assert
        assertThat(result.name()).isEqualTo("Seat");
        JsonObjectSchema root = (JsonObjectSchema) result.rootElement();
        assertThat(root.properties()).containsOnlyKeys("seat", "cabin");
        assertThat(root.properties().get("seat").description()).isEqualTo("Row and letter");
        assertThat(root.properties().get("cabin")).isInstanceOf(JsonEnumSchema.class);
        assertThat(((JsonEnumSchema) root.properties().get("cabin")).enumValues()).containsExactly("ECONOMY", "BUSINESS");
        assertThat(root.required()).containsExactly("seat");
        assertThat(root.additionalProperties()).isFalse();
    }

    @Test
    void toLangChainSchema_shouldDefaultNameAndUntypedLeaves() {
        // Act
        JsonSchema result = JsonSchemaConverter.toLangChainSchema(null, "{\"properties\": {\"note\": {}}}");

        // Assert
        assertThat(result.name()).isEqualTo("Schema");
        JsonObjectSchema root = (JsonObjectSchema) result.rootElement();
        assertThat(root.properties().get("note")).isInstanceOf(JsonStringSchema.class);
    }

    @Test
    void toLangChainSchema_shouldRejectUnsupportedTypes() {
        assertThatThrownBy(() -> JsonSchemaConverter.toLangChainSchema("Bad", "{\"type\": \"null\"}"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Unsupported schema type: null");
    }

    @Test
    void toLangChainSchema_shouldReportWhereAnUnsupportedTypeSits() {
        String json = """
                {"type": "object", "properties": {
                  "flightSegments": {"type": "array", "items": {"type": "object", "properties": {
                    "seat": {"type": "null"}}}}}}
                """;

        assertThatThrownBy(() -> JsonSchemaConverter.toLangChainSchema("Bad", json))
                .isInstanceOf(ExtractionException.class)
                .hasMessage("Unsupported schema type: null at $.flightSegments[].seat");
    }

    @Test
    void toLangChainSchema_shouldRejectMalformedJson() {
        assertThatThrownBy(() -> JsonSchemaConverter.toLangChainSchema("Bad", "{ not json"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Failed to parse JSON Schema string");
    }

    // --- Tests for fromClasspath ---

    @Test
    void fromClasspath_shouldLoadBoardingPassSchema() {
        // Act
        JsonSchema schema = JsonSchemaConverter.fromClasspath("boarding_pass", JsonSchemaConverter.BOARDING_PASS_SCHEMA);

        // Assert
        JsonObjectSchema root = (JsonObjectSchema) schema.rootElement();
        assertThat(root.required()).containsExactlyInAnyOrder("flightSegments", "passengers", "bookingReference");

        JsonSchemaElement segments = root.properties().get("flightSegments");
        assertThat(segments).isInstanceOf(JsonArraySchema.class);
        JsonObjectSchema segment = (JsonObjectSchema) ((JsonArraySchema) segments).items();
        assertThat(segment.properties()).containsKeys("flightNumber", "departureAirport", "arrivalTime", "seat");
        assertThat(segment.required()).hasSize(segment.properties().size());
    }

    @Test
    void fromClasspath_shouldFailForMissingResource() {
        assertThatThrownBy(() -> JsonSchemaConverter.fromClasspath("x", "schema/missing.json"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("schema/missing.json");
    }
}
