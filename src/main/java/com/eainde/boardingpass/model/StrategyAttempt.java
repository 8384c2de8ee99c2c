package com.eainde.boardingpass.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Diagnostic entry describing one strategy that ran during an extraction call.
 */
public record StrategyAttempt(
        @JsonProperty("strategy") String strategy,
        @JsonProperty("succeeded") boolean succeeded,
        @JsonProperty("detail") String detail,
        @JsonProperty("durationMs") long durationMs
) {
}
