package com.tokenmetadata.ingestion.store;

/**
 * Token metadata could not be written.
 */
public class SinkException extends RuntimeException {

    private final SinkErrorKind kind;

    public SinkException(SinkErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public SinkErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
