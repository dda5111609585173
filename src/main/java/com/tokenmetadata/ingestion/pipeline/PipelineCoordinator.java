package com.tokenmetadata.ingestion.pipeline;

import com.tokenmetadata.common.RetryPolicy;
import com.tokenmetadata.config.AsyncConfig;
import com.tokenmetadata.config.SchedulerConfig;
import com.tokenmetadata.domain.MetadataEvent;
import com.tokenmetadata.domain.QuarantineReason;
import com.tokenmetadata.domain.ResolvedMetadata;
import com.tokenmetadata.domain.TokenId;
import com.tokenmetadata.domain.Validity;
import com.tokenmetadata.ingestion.config.IngestionAdapterConfig;
import com.tokenmetadata.ingestion.config.PipelineProperties;
import com.tokenmetadata.ingestion.fetch.FetchErrorKind;
import com.tokenmetadata.ingestion.fetch.FetchException;
import com.tokenmetadata.ingestion.fetch.MetadataSource;
import com.tokenmetadata.ingestion.store.QuarantineStore;
import com.tokenmetadata.ingestion.store.SinkException;
import com.tokenmetadata.ingestion.store.SinkResult;
import com.tokenmetadata.ingestion.store.TokenMetadataSink;
import com.tokenmetadata.ingestion.store.WriteProvenance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Drives each event through fetch, validate, cache and persist on the worker pool.
 *
 * <p>A retryable failure releases the worker: the event is parked on a retry timer and handed back to the
 * pool when its backoff elapses, so a failing event never delays others. Quarantine happens on a fatal
 * error, when attempts reach {@code maxAttempts}, or when the next retry would start after the per-event
 * deadline. Every submitted event reports exactly one {@link EventOutcome}.
 *
 * <p>Drain: new work is refused, parked retries are cancelled and abandoned, queued events that have not
 * started fetching are abandoned, events already running finish.
 */
@Component
@Slf4j
public class PipelineCoordinator {

    private final MetadataResolutionService resolutionService;
    private final TokenMetadataSink sink;
    private final QuarantineStore quarantineStore;
    private final RetryPolicy retryPolicy;
    private final PipelineProperties pipelineProperties;
    private final Executor workerExecutor;
    private final TaskScheduler retryScheduler;

    private final Set<EventContext> inFlight = ConcurrentHashMap.newKeySet();
    private final Set<EventContext> awaitingRetry = ConcurrentHashMap.newKeySet();
    private final AtomicInteger queued = new AtomicInteger();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicLong persisted = new AtomicLong();
    private final AtomicLong stale = new AtomicLong();
    private final AtomicLong quarantined = new AtomicLong();
    private final AtomicLong abandoned = new AtomicLong();
    private final Object drainMonitor = new Object();
    private volatile PipelineStatus status = PipelineStatus.STOPPED;

    public PipelineCoordinator(MetadataResolutionService resolutionService,
                               TokenMetadataSink sink,
                               QuarantineStore quarantineStore,
                               @Qualifier(IngestionAdapterConfig.PIPELINE_RETRY_POLICY) RetryPolicy retryPolicy,
                               PipelineProperties pipelineProperties,
                               @Qualifier(AsyncConfig.METADATA_WORKER_EXECUTOR) Executor workerExecutor,
                               @Qualifier(SchedulerConfig.PIPELINE_RETRY_SCHEDULER) TaskScheduler retryScheduler) {
        this.resolutionService = resolutionService;
        this.sink = sink;
        this.quarantineStore = quarantineStore;
        this.retryPolicy = retryPolicy;
        this.pipelineProperties = pipelineProperties;
        this.workerExecutor = workerExecutor;
        this.retryScheduler = retryScheduler;
    }

    /** Accept new events. */
    public void open() {
        status = PipelineStatus.RUNNING;
    }

    /**
     * Hands an event to the worker pool. {@code onComplete} runs once with the event's outcome, on whichever
     * thread finishes it. Outside RUNNING the event is reported ABANDONED straight away.
     */
    public void submit(MetadataEvent event, Consumer<EventOutcome> onComplete) {
        EventContext ctx = new EventContext(event, onComplete);
        inFlight.add(ctx);
        if (status != PipelineStatus.RUNNING) {
            abandon(ctx, "pipeline not running");
            return;
        }
        dispatch(ctx);
    }

    private void dispatch(EventContext ctx) {
        queued.incrementAndGet();
        try {
            workerExecutor.execute(() -> {
                queued.decrementAndGet();
                runAttempt(ctx);
            });
        } catch (RejectedExecutionException e) {
            queued.decrementAndGet();
            abandon(ctx, "worker pool rejected the event");
        }
    }

    void runAttempt(EventContext ctx) {
        if (status != PipelineStatus.RUNNING) {
            abandon(ctx, "draining before fetch");
            return;
        }
        active.incrementAndGet();
        try {
            process(ctx);
        } finally {
            active.decrementAndGet();
        }
    }

    private void process(EventContext ctx) {
        MetadataEvent event = ctx.event;
        RetryState retry = ctx.retry;
        retry.beginAttempt(Instant.now());
        try {
            TokenId tokenId = tokenIdOf(event);
            MetadataSource source = MetadataSource.fromEvent(event);

            Optional<Long> lastObservedAt = sink.findLastObservedAt(tokenId);
            if (lastObservedAt.isPresent() && lastObservedAt.get() > event.getObservedAt()) {
                log.info("Dropping stale event {} for {}: observedAt {} < stored {}",
                        event.getId(), tokenId, event.getObservedAt(), lastObservedAt.get());
                ctx.transition(EventState.DONE);
                stale.incrementAndGet();
                finish(ctx, EventOutcome.STALE);
                return;
            }

            ctx.transition(EventState.FETCHING);
            ResolvedMetadata resolved = resolutionService.resolve(source, event.schemaFamilyOrDefault(), ctx::transition);

            ctx.transition(EventState.PERSISTING);
            WriteProvenance provenance = new WriteProvenance(event.getId(), resolved.sourceUri(), resolved.gateway());
            SinkResult result = sink.upsert(tokenId, resolved.record(), event.getObservedAt(), provenance);
            ctx.transition(EventState.DONE);
            if (result == SinkResult.APPLIED) {
                log.info("Persisted {} observedAt={} validity={} fingerprint={} attempt={}",
                        tokenId, event.getObservedAt(), resolved.record().validity(),
                        resolved.record().fingerprint().value(), retry.getAttemptCount());
                if (resolved.record().validity() == Validity.PARTIALLY_VALID) {
                    log.warn("Partially valid metadata for {}: missing={} defects={}", tokenId,
                            resolved.record().missingFields(), resolved.record().defects().size());
                }
                persisted.incrementAndGet();
                finish(ctx, EventOutcome.PERSISTED);
            } else {
                log.info("Skipped stale write for {} observedAt={}", tokenId, event.getObservedAt());
                stale.incrementAndGet();
                finish(ctx, EventOutcome.STALE);
            }
        } catch (FetchException e) {
            handleFailure(ctx, e.getKind().name(), e.isRetryable(), e);
        } catch (SinkException e) {
            handleFailure(ctx, "SINK_" + e.getKind().name(), e.isRetryable(), e);
        } catch (RuntimeException e) {
            log.warn("Unexpected error processing event {}: {}", event.getId(), e.toString(), e);
            handleFailure(ctx, "UNEXPECTED", true, e);
        }
    }

    private static TokenId tokenIdOf(MetadataEvent event) {
        try {
            return event.tokenId();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new FetchException(FetchErrorKind.MALFORMED_URI,
                    "Event " + event.getId() + " has no usable token identity: " + e.getMessage(), e);
        }
    }

    private void handleFailure(EventContext ctx, String errorKind, boolean retryable, RuntimeException error) {
        RetryState retry = ctx.retry;
        retry.recordFailure(errorKind, error.getMessage());
        if (!retryable) {
            quarantine(ctx, QuarantineReason.FATAL_ERROR);
            return;
        }
        if (retry.getAttemptCount() >= retryPolicy.getMaxAttempts()) {
            quarantine(ctx, QuarantineReason.RETRIES_EXHAUSTED);
            return;
        }
        long delayMs = retryPolicy.delayMs(retry.getAttemptCount() - 1);
        Instant nextEligibleAt = Instant.now().plusMillis(delayMs);
        Instant deadline = retry.getFirstAttemptAt().plusMillis(pipelineProperties.getEventDeadlineMs());
        if (nextEligibleAt.isAfter(deadline)) {
            quarantine(ctx, QuarantineReason.DEADLINE_EXCEEDED);
            return;
        }
        if (status != PipelineStatus.RUNNING) {
            abandon(ctx, "draining after " + errorKind);
            return;
        }
        ctx.transition(EventState.FAILED_RETRYABLE);
        retry.scheduleNext(nextEligibleAt);
        log.warn("Retry {}/{} for event {} ({}) in {} ms after {}: {}",
                retry.getAttemptCount() + 1, retryPolicy.getMaxAttempts(), ctx.event.getId(),
                ctx.event.getMetadataUri(), delayMs, errorKind, error.getMessage());
        awaitingRetry.add(ctx);
        try {
            ctx.retryTimer = retryScheduler.schedule(() -> {
                if (awaitingRetry.remove(ctx)) {
                    dispatch(ctx);
                }
            }, nextEligibleAt);
        } catch (TaskRejectedException e) {
            if (awaitingRetry.remove(ctx)) {
                abandon(ctx, "retry scheduler rejected the event");
            }
        }
    }

    private void quarantine(EventContext ctx, QuarantineReason reason) {
        MetadataEvent event = ctx.event;
        RetryState retry = ctx.retry;
        ctx.transition(EventState.QUARANTINED);
        log.error("Quarantined event {} seq={} token={}:{} uri={} reason={} attempts={} lastError={}: {}",
                event.getId(), event.getSequence(), event.getContractAddress(), event.getTokenIndex(),
                event.getMetadataUri() != null ? event.getMetadataUri() : "<inline>", reason,
                retry.getAttemptCount(), retry.getLastErrorKind(), retry.getLastErrorMessage());
        quarantineStore.quarantine(event, reason, retry.getAttemptCount(), retry.getLastErrorKind(),
                retry.getLastErrorMessage(), retry.getFirstAttemptAt());
        quarantined.incrementAndGet();
        finish(ctx, EventOutcome.QUARANTINED);
    }

    private void abandon(EventContext ctx, String why) {
        log.info("Abandoning event {} seq={}: {}", ctx.event.getId(), ctx.event.getSequence(), why);
        abandoned.incrementAndGet();
        finish(ctx, EventOutcome.ABANDONED);
    }

    private void finish(EventContext ctx, EventOutcome outcome) {
        if (!ctx.finished.compareAndSet(false, true)) {
            return;
        }
        inFlight.remove(ctx);
        try {
            ctx.onComplete.accept(outcome);
        } catch (RuntimeException e) {
            log.error("Completion callback failed for event {} ({}): {}", ctx.event.getId(), outcome, e.getMessage(), e);
        } finally {
            if (inFlight.isEmpty()) {
                synchronized (drainMonitor) {
                    drainMonitor.notifyAll();
                }
            }
        }
    }

    /**
     * Stops accepting work and abandons parked retries. Running events keep going; see {@link #awaitDrained}.
     */
    public void beginDrain() {
        if (status == PipelineStatus.RUNNING) {
            status = PipelineStatus.DRAINING;
        }
        for (EventContext ctx : awaitingRetry) {
            if (awaitingRetry.remove(ctx)) {
                ScheduledFuture<?> timer = ctx.retryTimer;
                if (timer != null) {
                    timer.cancel(false);
                }
                abandon(ctx, "retry cancelled by shutdown");
            }
        }
    }

    /**
     * Waits until every submitted event reported an outcome or the timeout passed, then marks the pipeline
     * STOPPED.
     *
     * @return true when nothing was left in flight
     */
    public boolean awaitDrained(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            synchronized (drainMonitor) {
                while (!inFlight.isEmpty()) {
                    long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
                    if (remainingMs <= 0) {
                        break;
                    }
                    drainMonitor.wait(Math.min(remainingMs, 100L));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        status = PipelineStatus.STOPPED;
        return inFlight.isEmpty();
    }

    public PipelineStatus getStatus() {
        return status;
    }

    /** Events waiting for a worker or being worked on; parked retries are not included. */
    public int queuedOrRunning() {
        return queued.get() + active.get();
    }

    public PipelineStats stats() {
        return new PipelineStats(status, queued.get(), active.get(), awaitingRetry.size(), inFlight.size(),
                persisted.get(), stale.get(), quarantined.get(), abandoned.get());
    }

    /**
     * One submitted event and its progress.
     */
    static final class EventContext {
        final MetadataEvent event;
        final Consumer<EventOutcome> onComplete;
        final RetryState retry = new RetryState();
        final AtomicBoolean finished = new AtomicBoolean();
        volatile EventState state = EventState.RECEIVED;
        volatile ScheduledFuture<?> retryTimer;

        EventContext(MetadataEvent event, Consumer<EventOutcome> onComplete) {
            this.event = event;
            this.onComplete = onComplete;
        }

        void transition(EventState next) {
            if (log.isDebugEnabled()) {
                log.debug("Event {} {} -> {}", event.getId(), state, next);
            }
            state = next;
        }
    }
}
