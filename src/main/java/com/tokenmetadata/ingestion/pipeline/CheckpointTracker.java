package com.tokenmetadata.ingestion.pipeline;

import org.springframework.stereotype.Component;

import java.util.TreeSet;

/**
 * Tracks dispatched sequences and computes the checkpoint watermark: the highest sequence such that every
 * dispatched event at or below it reached a handled outcome. Events finish out of order, so the watermark
 * stops just below the oldest one still in flight. An abandoned event caps the watermark below itself until
 * the next {@link #reset}.
 */
@Component
public class CheckpointTracker {

    private final TreeSet<Long> inFlight = new TreeSet<>();
    private long base;
    private long maxDispatched;
    private long lowestAbandoned = Long.MAX_VALUE;

    public synchronized void reset(long checkpoint) {
        inFlight.clear();
        base = checkpoint;
        maxDispatched = checkpoint;
        lowestAbandoned = Long.MAX_VALUE;
    }

    public synchronized void dispatched(long sequence) {
        inFlight.add(sequence);
        maxDispatched = Math.max(maxDispatched, sequence);
    }

    public synchronized void completed(long sequence, EventOutcome outcome) {
        inFlight.remove(sequence);
        if (!outcome.isHandled()) {
            lowestAbandoned = Math.min(lowestAbandoned, sequence);
        }
    }

    public synchronized long watermark() {
        long watermark = inFlight.isEmpty() ? maxDispatched : inFlight.first() - 1;
        if (lowestAbandoned != Long.MAX_VALUE) {
            watermark = Math.min(watermark, lowestAbandoned - 1);
        }
        return Math.max(base, watermark);
    }

    public synchronized long maxDispatched() {
        return maxDispatched;
    }

    synchronized int inFlightCount() {
        return inFlight.size();
    }
}
