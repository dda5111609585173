package com.tokenmetadata.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Worker pool, polling, retry and shutdown settings for the metadata pipeline.
 */
@ConfigurationProperties(prefix = "tokenmetadata.pipeline")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class PipelineProperties {

    /** Whether the poll job starts with the application context. */
    private boolean enabled = true;

    /** Worker threads; each drives one event through the pipeline at a time. */
    @Min(1)
    private int workers = 4;

    /** Events queued or running are kept at or below workers * queueFactor. */
    @Min(1)
    private int queueFactor = 2;

    /** Delay between polls of the event source. */
    @Min(1)
    private long pollIntervalMs = 1_000;

    /** Source checkpoint id; one per independent consumer. */
    private String checkpointId = "metadata-events";

    /** Upper bound for one event across all retries; the event is quarantined once a retry would pass it. */
    @Min(1)
    private long eventDeadlineMs = 1_800_000;

    /** How long shutdown waits for in-flight events to finish. */
    private long shutdownDrainTimeoutMs = 30_000;

    private Retry retry = new Retry();

    /**
     * Per-event retry policy (exponential backoff ± jitter, capped).
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {

        /** Base delay for the first retry; doubles each attempt. */
        private long baseDelayMs = 10_000;

        /** Jitter factor 0..1 (0.2 = ±20%). */
        private double jitterFactor = 0.2;

        /** Total attempts, including the first, before quarantine. */
        @Min(1)
        private int maxAttempts = 5;

        /** Backoff ceiling. */
        private long maxDelayMs = 300_000;
    }
}
