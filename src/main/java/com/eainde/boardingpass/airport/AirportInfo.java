package com.eainde.boardingpass.airport;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AirportInfo(
        @JsonProperty("iata") String iata,
        @JsonProperty("icao") String icao,
        @JsonProperty("name") String name,
        @JsonProperty("city") String city,
        @JsonProperty("country") String country
) {
}
