package com.tokenmetadata.ingestion.store;

public enum SinkErrorKind {
    /** Datastore unreachable or timing out; retry. */
    TRANSIENT,
    /** Write rejected by the datastore; retrying will not help. */
    CONSTRAINT_VIOLATION;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
