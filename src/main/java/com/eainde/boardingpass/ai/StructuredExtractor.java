package com.eainde.boardingpass.ai;

import com.eainde.boardingpass.document.EncodedImage;
import dev.langchain4j.model.chat.request.json.JsonSchema;

import java.time.Duration;

/**
 * Reads structured data out of an image according to a JSON schema.
 */
public interface StructuredExtractor {

    /**
     * @return the raw JSON text of the answer, not yet validated against {@code schema}
     * @throws StructuredExtractionException on upstream error, empty answer or timeout
     */
    String extractStructured(EncodedImage image, JsonSchema schema, Duration timeout);
}
