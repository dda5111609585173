package com.tokenmetadata.domain;

/**
 * Why an event left the pipeline without being persisted.
 */
public enum QuarantineReason {
    /** Non-retryable error on first occurrence (bad URI, 4xx, constraint violation). */
    FATAL_ERROR,
    /** Retryable errors up to the attempt bound. */
    RETRIES_EXHAUSTED,
    /** The next retry would start after the per-event deadline. */
    DEADLINE_EXCEEDED
}
