package com.eainde.boardingpass.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A traveler named on the document. Multi-word names keep their internal spaces.
 */
public record Passenger(
        @JsonProperty("firstName") String firstName,
        @JsonProperty("lastName") String lastName
) {

    public String displayName() {
        if (firstName == null || firstName.isBlank()) {
            return lastName;
        }
        return lastName + "/" + firstName;
    }
}
