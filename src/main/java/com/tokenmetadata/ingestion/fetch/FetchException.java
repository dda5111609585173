package com.tokenmetadata.ingestion.fetch;

/**
 * Thrown when metadata content cannot be obtained.
 */
public class FetchException extends RuntimeException {

    private final FetchErrorKind kind;

    public FetchException(FetchErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FetchException(FetchErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FetchErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
