package com.eainde.boardingpass.airport;

import com.eainde.boardingpass.exception.ExtractionException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link AirportDirectory} backed by a JSON array of airports on the classpath.
 */
@Slf4j
public class JsonAirportDirectory implements AirportDirectory {

    public static final String DEFAULT_RESOURCE = "airports.json";

    private final Map<String, AirportInfo> byIata;

    public JsonAirportDirectory(List<AirportInfo> airports) {
        Map<String, AirportInfo> index = new HashMap<>();
        for (AirportInfo airport : airports) {
            if (airport.iata() != null && airport.iata().length() == 3) {
                index.put(airport.iata().toUpperCase(Locale.ROOT), airport);
            }
        }
        this.byIata = Collections.unmodifiableMap(index);
    }

    public static JsonAirportDirectory fromClasspath(ObjectMapper objectMapper, String resource) {
        try (InputStream in = JsonAirportDirectory.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ExtractionException("Airport dataset not found on classpath: " + resource);
            }
            List<AirportInfo> airports = objectMapper.readValue(in, new TypeReference<List<AirportInfo>>() {});
            log.info("Loaded {} airports from {}", airports.size(), resource);
            return new JsonAirportDirectory(airports);
        } catch (IOException e) {
            throw new ExtractionException("Airport dataset could not be parsed: " + resource, e);
        }
    }

    @Override
    public boolean isValidAirportCode(String iataCode) {
        return iataCode != null && byIata.containsKey(iataCode.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public Optional<AirportInfo> lookup(String iataCode) {
        if (iataCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byIata.get(iataCode.trim().toUpperCase(Locale.ROOT)));
    }

    public int size() {
        return byIata.size();
    }
}
