package com.eainde.boardingpass.pipeline;

/**
 * Why a strategy produced no usable candidate. Never escapes the orchestrator.
 */
public record StrategyFailure(String strategy, Reason reason, String message) {

    public enum Reason {
        NOT_FOUND,
        UNPARSEABLE,
        NOT_CONFIGURED,
        QUOTA_EXCEEDED,
        TIMEOUT,
        SCHEMA_MISMATCH,
        UPSTREAM_ERROR,
        INSUFFICIENT_FIELDS
    }

    public String describe() {
        return strategy + ": " + message;
    }
}
