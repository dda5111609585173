package com.tokenmetadata.ingestion.job;

import com.tokenmetadata.domain.MetadataEvent;
import com.tokenmetadata.ingestion.config.PipelineProperties;
import com.tokenmetadata.ingestion.pipeline.CheckpointTracker;
import com.tokenmetadata.ingestion.pipeline.PipelineCoordinator;
import com.tokenmetadata.ingestion.source.MetadataEventSource;
import com.tokenmetadata.ingestion.store.CheckpointStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Polls metadata_events and feeds the coordinator. Resumes after the stored checkpoint, keeps at most
 * {@code workers * queueFactor} events queued or running, and saves the checkpoint watermark after each poll.
 * The checkpoint is loaded on the first successful poll, so an unreachable datastore at boot only delays
 * ingestion until the next interval. On context shutdown it stops polling, drains the coordinator and saves
 * the final checkpoint.
 */
@Component
@ConditionalOnProperty(prefix = "tokenmetadata.pipeline", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class MetadataPipelineJob implements SmartLifecycle {

    private final MetadataEventSource eventSource;
    private final PipelineCoordinator coordinator;
    private final CheckpointTracker checkpointTracker;
    private final CheckpointStore checkpointStore;
    private final PipelineProperties pipelineProperties;

    private volatile boolean running;
    private boolean checkpointLoaded;
    private long cursor;
    private long lastSavedCheckpoint;

    public MetadataPipelineJob(MetadataEventSource eventSource,
                               PipelineCoordinator coordinator,
                               CheckpointTracker checkpointTracker,
                               CheckpointStore checkpointStore,
                               PipelineProperties pipelineProperties) {
        this.eventSource = eventSource;
        this.coordinator = coordinator;
        this.checkpointTracker = checkpointTracker;
        this.checkpointStore = checkpointStore;
        this.pipelineProperties = pipelineProperties;
    }

    @Override
    public synchronized void start() {
        checkpointLoaded = false;
        coordinator.open();
        running = true;
        log.info("Metadata pipeline started: workers={}, maxQueued={}", pipelineProperties.getWorkers(), maxQueued());
    }

    private void loadCheckpoint() {
        long checkpoint = checkpointStore.load(pipelineProperties.getCheckpointId());
        checkpointTracker.reset(checkpoint);
        cursor = checkpoint;
        lastSavedCheckpoint = checkpoint;
        checkpointLoaded = true;
        log.info("Resuming after checkpoint {}", checkpoint);
    }

    @Scheduled(fixedDelayString = "${tokenmetadata.pipeline.poll-interval-ms:1000}")
    public void poll() {
        if (!running) {
            return;
        }
        try {
            pollOnce();
        } catch (DataAccessException e) {
            log.warn("Datastore unavailable, retrying next interval: {}", e.getMessage());
        }
    }

    /**
     * One poll: fetch up to the free capacity, dispatch, then persist the checkpoint.
     *
     * @return number of events dispatched
     */
    synchronized int pollOnce() {
        if (!running) {
            return 0;
        }
        if (!checkpointLoaded) {
            loadCheckpoint();
        }
        int capacity = maxQueued() - coordinator.queuedOrRunning();
        int dispatched = 0;
        if (capacity > 0) {
            List<MetadataEvent> events = eventSource.poll(cursor, capacity);
            for (MetadataEvent event : events) {
                long sequence = event.getSequence();
                checkpointTracker.dispatched(sequence);
                cursor = Math.max(cursor, sequence);
                coordinator.submit(event, outcome -> checkpointTracker.completed(sequence, outcome));
                dispatched++;
            }
            if (dispatched > 0) {
                log.debug("Dispatched {} event(s), cursor={}", dispatched, cursor);
            }
        }
        saveCheckpoint();
        return dispatched;
    }

    private synchronized void saveCheckpoint() {
        if (!checkpointLoaded) {
            return;
        }
        long watermark = checkpointTracker.watermark();
        if (watermark <= lastSavedCheckpoint) {
            return;
        }
        checkpointStore.save(pipelineProperties.getCheckpointId(), watermark);
        lastSavedCheckpoint = watermark;
    }

    private int maxQueued() {
        return Math.max(1, pipelineProperties.getWorkers() * pipelineProperties.getQueueFactor());
    }

    @Override
    public void stop() {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
        }
        log.info("Metadata pipeline draining (timeout {} ms)", pipelineProperties.getShutdownDrainTimeoutMs());
        coordinator.beginDrain();
        boolean drained = coordinator.awaitDrained(Duration.ofMillis(pipelineProperties.getShutdownDrainTimeoutMs()));
        try {
            saveCheckpoint();
        } catch (DataAccessException e) {
            log.warn("Could not save final checkpoint: {}", e.getMessage());
        }
        if (drained) {
            log.info("Metadata pipeline stopped, checkpoint={}", lastSavedCheckpoint);
        } else {
            log.warn("Metadata pipeline stopped with {} event(s) still in flight, checkpoint={}",
                    coordinator.stats().inFlight(), lastSavedCheckpoint);
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
