package com.eainde.boardingpass.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable input of one extraction call: the uploaded bytes and how to treat them.
 */
public final class ExtractionRequest {

    private final byte[] content;
    private final String mediaType;
    private final Integer pageLimit;
    private final Duration timeout;

    private ExtractionRequest(byte[] content, String mediaType, Integer pageLimit, Duration timeout) {
        this.content = content;
        this.mediaType = mediaType;
        this.pageLimit = pageLimit;
        this.timeout = timeout;
    }

    public static ExtractionRequest of(byte[] content, String mediaType) {
        return new ExtractionRequest(content == null ? null : content.clone(), mediaType, null, null);
    }

    public ExtractionRequest withPageLimit(int pageLimit) {
        if (pageLimit < 1) {
            throw new IllegalArgumentException("pageLimit must be at least 1");
        }
        return new ExtractionRequest(content, mediaType, pageLimit, timeout);
    }

    public ExtractionRequest withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        return new ExtractionRequest(content, mediaType, pageLimit, timeout);
    }

    /** A copy of the uploaded bytes; null when none were given. */
    public byte[] getContent() {
        return content == null ? null : content.clone();
    }

    public String getMediaType() {
        return mediaType;
    }

    /** Null when the caller did not limit the pages scanned. */
    public Integer getPageLimit() {
        return pageLimit;
    }

    /** Null when the configured default applies. */
    public Duration getTimeout() {
        return timeout;
    }

    public int size() {
        return content == null ? 0 : content.length;
    }
}
