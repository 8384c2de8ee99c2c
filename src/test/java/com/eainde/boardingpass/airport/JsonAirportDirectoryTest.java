package com.eainde.boardingpass.airport;

import com.eainde.boardingpass.exception.ExtractionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonAirportDirectoryTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("the bundled dataset knows the major hubs")
    void bundledDataset() {
        JsonAirportDirectory directory = JsonAirportDirectory.fromClasspath(mapper, JsonAirportDirectory.DEFAULT_RESOURCE);

        assertThat(directory.size()).isGreaterThan(300);
        assertThat(directory.isValidAirportCode("FRA")).isTrue();
        // regional and secondary airports as well as hubs
        assertThat(directory.isValidAirportCode("BGY")).isTrue();
        assertThat(directory.isValidAirportCode("DEN")).isTrue();
        assertThat(directory.lookup("KRK")).get().extracting(AirportInfo::icao).isEqualTo("EPKK");
        assertThat(directory.lookup("jfk")).get().extracting(AirportInfo::city).isEqualTo("New York");
    }

    @Test
    @DisplayName("lookups are case-insensitive and tolerate surrounding blanks")
    void normalizesCodes() {
        JsonAirportDirectory directory = new JsonAirportDirectory(
                List.of(new AirportInfo("muc", "EDDM", "Munich Airport", "Munich", "Germany")));

        assertThat(directory.isValidAirportCode(" MUC ")).isTrue();
        assertThat(directory.isValidAirportCode("XXX")).isFalse();
        assertThat(directory.isValidAirportCode(null)).isFalse();
        assertThat(directory.lookup(null)).isEmpty();
    }

    @Test
    @DisplayName("entries without a three-letter code are skipped")
    void skipsInvalidEntries() {
        JsonAirportDirectory directory = new JsonAirportDirectory(List.of(
                new AirportInfo(null, "XXXX", "Nowhere", null, null),
                new AirportInfo("TOOLONG", null, "Bad", null, null)));

        assertThat(directory.size()).isZero();
    }

    @Test
    @DisplayName("a missing resource fails loudly")
    void missingResource() {
        assertThatThrownBy(() -> JsonAirportDirectory.fromClasspath(mapper, "no-such-airports.json"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("no-such-airports.json");
    }
}
