package com.eainde.boardingpass.ocr.parse;

import com.eainde.boardingpass.exception.ExtractionException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Tuning data for the OCR field parser: keyword lists, blocklists and the carrier table. Loaded from
 * {@code parsing-rules.json} so it can be adjusted without touching the parser.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParsingRules(
        @JsonProperty("proximityLines") int proximityLines,
        @JsonProperty("minFlightMinutes") int minFlightMinutes,
        @JsonProperty("statusBarLines") int statusBarLines,
        @JsonProperty("keywords") Map<String, List<String>> keywords,
        @JsonProperty("titlePhrases") List<String> titlePhrases,
        @JsonProperty("labelBlocklist") Set<String> labelBlocklist,
        @JsonProperty("months") Set<String> months,
        @JsonProperty("commonNames") Set<String> commonNames,
        @JsonProperty("nameBlocklist") Set<String> nameBlocklist,
        @JsonProperty("titles") Set<String> titles,
        @JsonProperty("carrierNameMarkers") Set<String> carrierNameMarkers,
        @JsonProperty("bookingIgnoreWords") Set<String> bookingIgnoreWords,
        @JsonProperty("knownAirlines") Map<String, String> knownAirlines
) {

    public static final String DEFAULT_RESOURCE = "parsing-rules.json";

    public static ParsingRules fromClasspath(ObjectMapper objectMapper, String resource) {
        try (InputStream in = ParsingRules.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ExtractionException("Parsing rules not found on classpath: " + resource);
            }
            return objectMapper.readValue(in, ParsingRules.class);
        } catch (IOException e) {
            throw new ExtractionException("Parsing rules could not be parsed: " + resource, e);
        }
    }

    public List<String> keywords(String group) {
        List<String> words = keywords.get(group);
        if (words == null) {
            throw new IllegalArgumentException("No keyword group '" + group + "' in parsing rules");
        }
        return words;
    }

    public Optional<String> airlineName(String carrierCode) {
        return Optional.ofNullable(carrierCode).map(knownAirlines::get);
    }

    public boolean isKnownCarrier(String carrierCode) {
        return carrierCode != null && knownAirlines.containsKey(carrierCode);
    }

    /** Words that can never be an airport code: labels, month abbreviations and short first names. */
    public Set<String> nonAirportWords() {
        return Stream.of(labelBlocklist, months, commonNames)
                .flatMap(Set::stream)
                .collect(Collectors.toSet());
    }
}
