package com.tokenmetadata.ingestion.fetch;

/**
 * Fetch failure taxonomy. Retryable kinds are retried by the pipeline with backoff; the rest quarantine the
 * event on first occurrence.
 */
public enum FetchErrorKind {
    TIMEOUT(true),
    GATEWAY_EXHAUSTED(true),
    TOO_LARGE(true),
    /** Direct HTTP transient failure: connection error, 5xx, 429, local rate limit. */
    UNAVAILABLE(true),
    NOT_FOUND(false),
    MALFORMED_URI(false);

    private final boolean retryable;

    FetchErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
