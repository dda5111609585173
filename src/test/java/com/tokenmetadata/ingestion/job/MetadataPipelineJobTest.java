package com.tokenmetadata.ingestion.job;

import com.tokenmetadata.domain.MetadataEvent;
import com.tokenmetadata.ingestion.config.PipelineProperties;
import com.tokenmetadata.ingestion.pipeline.CheckpointTracker;
import com.tokenmetadata.ingestion.pipeline.EventOutcome;
import com.tokenmetadata.ingestion.pipeline.PipelineCoordinator;
import com.tokenmetadata.ingestion.source.MetadataEventSource;
import com.tokenmetadata.ingestion.store.CheckpointStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MetadataPipelineJobTest {

    private MetadataEventSource source;
    private PipelineCoordinator coordinator;
    private CheckpointStore checkpointStore;
    private PipelineProperties properties;
    private MetadataPipelineJob job;

    @BeforeEach
    void setUp() {
        source = mock(MetadataEventSource.class);
        coordinator = mock(PipelineCoordinator.class);
        checkpointStore = mock(CheckpointStore.class);
        properties = new PipelineProperties();
        properties.setWorkers(2);
        properties.setQueueFactor(2);
        job = new MetadataPipelineJob(source, coordinator, new CheckpointTracker(), checkpointStore, properties);
        when(checkpointStore.load(properties.getCheckpointId())).thenReturn(5L);
        when(source.poll(anyLong(), anyInt())).thenReturn(List.of());
    }

    private static MetadataEvent event(long seq) {
        MetadataEvent event = new MetadataEvent();
        event.setId("evt-" + seq);
        event.setSequence(seq);
        event.setContractAddress("KT1Contract");
        event.setMetadataUri("ipfs://Qm" + seq);
        return event;
    }

    @SuppressWarnings("unchecked")
    private List<Consumer<EventOutcome>> submittedCallbacks(int count) {
        ArgumentCaptor<Consumer<EventOutcome>> captor = ArgumentCaptor.forClass(Consumer.class);
        verify(coordinator, times(count)).submit(any(), captor.capture());
        return captor.getAllValues();
    }

    @Test
    void start_resumesAfterStoredCheckpoint() {
        job.start();
        job.pollOnce();

        assertThat(job.isRunning()).isTrue();
        verify(coordinator).open();
        verify(source).poll(5L, 4);
    }

    @Test
    void datastoreDownAtStart_checkpointLoadedOnLaterPoll() {
        when(checkpointStore.load(properties.getCheckpointId()))
                .thenThrow(new DataAccessResourceFailureException("mongo unreachable"))
                .thenReturn(5L);

        job.start();
        assertThat(job.isRunning()).isTrue();

        job.poll();
        verify(source, never()).poll(anyLong(), anyInt());

        job.poll();
        verify(checkpointStore, times(2)).load(properties.getCheckpointId());
        verify(source).poll(5L, 4);
    }

    @Test
    void stopBeforeCheckpointLoaded_savesNothing() {
        when(checkpointStore.load(properties.getCheckpointId()))
                .thenThrow(new DataAccessResourceFailureException("mongo unreachable"));
        when(coordinator.awaitDrained(any())).thenReturn(true);
        job.start();
        job.poll();

        job.stop();

        verify(checkpointStore, never()).save(any(), anyLong());
    }

    @Test
    void pollOnce_boundsByFreeCapacity() {
        when(coordinator.queuedOrRunning()).thenReturn(3);
        job.start();

        job.pollOnce();

        verify(source).poll(5L, 1);
    }

    @Test
    void pollOnce_noCapacity_doesNotPoll() {
        when(coordinator.queuedOrRunning()).thenReturn(4);
        job.start();

        assertThat(job.pollOnce()).isZero();
        verify(source, never()).poll(anyLong(), anyInt());
    }

    @Test
    void checkpointAdvancesOnlyPastContiguousHandledEvents() {
        when(source.poll(5L, 4)).thenReturn(List.of(event(6), event(7), event(8)));
        job.start();

        assertThat(job.pollOnce()).isEqualTo(3);
        List<Consumer<EventOutcome>> callbacks = submittedCallbacks(3);

        callbacks.get(1).accept(EventOutcome.PERSISTED);
        callbacks.get(2).accept(EventOutcome.QUARANTINED);
        job.pollOnce();
        verify(checkpointStore, never()).save(any(), anyLong());

        callbacks.get(0).accept(EventOutcome.STALE);
        job.pollOnce();
        verify(checkpointStore).save(properties.getCheckpointId(), 8L);
        verify(source, atLeastOnce()).poll(8L, 4);
    }

    @Test
    void stop_drainsThenSavesFinalCheckpoint() {
        when(source.poll(5L, 4)).thenReturn(List.of(event(6), event(7)));
        when(coordinator.awaitDrained(any())).thenReturn(true);
        job.start();
        job.pollOnce();
        List<Consumer<EventOutcome>> callbacks = submittedCallbacks(2);
        callbacks.get(0).accept(EventOutcome.PERSISTED);
        callbacks.get(1).accept(EventOutcome.ABANDONED);

        job.stop();

        assertThat(job.isRunning()).isFalse();
        var order = inOrder(coordinator, checkpointStore);
        order.verify(coordinator).beginDrain();
        order.verify(coordinator).awaitDrained(Duration.ofMillis(properties.getShutdownDrainTimeoutMs()));
        order.verify(checkpointStore).save(eq(properties.getCheckpointId()), eq(6L));
        assertThat(job.pollOnce()).isZero();
    }
}
