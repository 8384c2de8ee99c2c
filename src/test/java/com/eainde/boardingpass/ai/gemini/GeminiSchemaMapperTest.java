package com.eainde.boardingpass.ai.gemini;

import com.eainde.boardingpass.ai.JsonSchemaConverter;
import com.google.genai.types.Schema;
import com.google.genai.types.Type;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GeminiSchemaMapperTest {

    @Test
    void toGeminiSchema_shouldKeepStructureOrderAndRequiredKeys() {
        Schema root = GeminiSchemaMapper.toGeminiSchema(JsonSchemaConverter
                .fromClasspath("boarding_pass", JsonSchemaConverter.BOARDING_PASS_SCHEMA)
                .rootElement());

        assertThat(root.type().orElseThrow().knownEnum()).isEqualTo(Type.Known.OBJECT);
        assertThat(root.required().orElseThrow())
                .containsExactlyInAnyOrder("flightSegments", "passengers", "bookingReference");

        Schema segments = root.properties().orElseThrow().get("flightSegments");
        assertThat(segments.type().orElseThrow().knownEnum()).isEqualTo(Type.Known.ARRAY);
        Schema segment = segments.items().orElseThrow();
        assertThat(segment.propertyOrdering().orElseThrow()).startsWith("flightNumber", "airline", "departureAirport");
        assertThat(segment.properties().orElseThrow().get("seat").description()).isPresent();
    }

    @Test
    void toGeminiSchema_shouldMapEnumsAsFormattedStrings() {
        Schema schema = GeminiSchemaMapper.toGeminiSchema(
                JsonEnumSchema.builder().enumValues("ECONOMY", "BUSINESS").build());

        assertThat(schema.type().orElseThrow().knownEnum()).isEqualTo(Type.Known.STRING);
        assertThat(schema.format()).contains("enum");
        assertThat(schema.enum_().orElseThrow()).containsExactly("ECONOMY", "BUSINESS");
    }

    @Test
    void toGeminiSchema_shouldMapScalarsAndNull() {
        Schema integer = GeminiSchemaMapper.toGeminiSchema(
                JsonIntegerSchema.builder().description("Row number").build());

        assertThat(integer.type().orElseThrow().knownEnum()).isEqualTo(Type.Known.INTEGER);
        assertThat(integer.description()).contains("Row number");
        assertThat(GeminiSchemaMapper.toGeminiSchema(null)).isNull();
    }
}
