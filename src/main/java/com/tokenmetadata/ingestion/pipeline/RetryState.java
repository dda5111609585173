package com.tokenmetadata.ingestion.pipeline;

import java.time.Instant;

/**
 * Attempt bookkeeping for one event. Only touched by the worker running the event's current attempt, one
 * attempt at a time; fields are volatile so the health snapshot and the next worker see them.
 */
public class RetryState {

    private volatile int attemptCount;
    private volatile Instant firstAttemptAt;
    private volatile Instant nextEligibleAt;
    private volatile String lastErrorKind;
    private volatile String lastErrorMessage;

    void beginAttempt(Instant now) {
        if (firstAttemptAt == null) {
            firstAttemptAt = now;
        }
        attemptCount++;
        nextEligibleAt = null;
    }

    void recordFailure(String errorKind, String errorMessage) {
        this.lastErrorKind = errorKind;
        this.lastErrorMessage = errorMessage;
    }

    void scheduleNext(Instant at) {
        this.nextEligibleAt = at;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public Instant getFirstAttemptAt() {
        return firstAttemptAt;
    }

    public Instant getNextEligibleAt() {
        return nextEligibleAt;
    }

    public String getLastErrorKind() {
        return lastErrorKind;
    }

    public String getLastErrorMessage() {
        return lastErrorMessage;
    }
}
