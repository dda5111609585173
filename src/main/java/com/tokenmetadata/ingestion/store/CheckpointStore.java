package com.tokenmetadata.ingestion.store;

import com.tokenmetadata.domain.PipelineCheckpoint;
import com.tokenmetadata.domain.PipelineCheckpointRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Load/save of the event source resume position in pipeline_checkpoints. Only moves forward.
 */
@Service
@RequiredArgsConstructor
public class CheckpointStore {

    /** Checkpoint value before any event was processed; sequences start above it. */
    public static final long INITIAL = 0L;

    private final PipelineCheckpointRepository repository;

    public long load(String checkpointId) {
        return repository.findById(checkpointId).map(PipelineCheckpoint::getSequence).orElse(INITIAL);
    }

    /**
     * Stores {@code sequence} unless the stored checkpoint is already at or beyond it.
     *
     * @return true when written
     */
    public boolean save(String checkpointId, long sequence) {
        PipelineCheckpoint checkpoint = repository.findById(checkpointId).orElseGet(() -> {
            PipelineCheckpoint c = new PipelineCheckpoint();
            c.setId(checkpointId);
            c.setSequence(INITIAL);
            return c;
        });
        if (checkpoint.getUpdatedAt() != null && checkpoint.getSequence() >= sequence) {
            return false;
        }
        checkpoint.setSequence(sequence);
        checkpoint.setUpdatedAt(Instant.now());
        repository.save(checkpoint);
        return true;
    }
}
