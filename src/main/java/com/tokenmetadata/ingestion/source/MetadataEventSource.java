package com.tokenmetadata.ingestion.source;

import com.tokenmetadata.domain.MetadataEvent;

import java.util.List;

/**
 * Restartable, ordered source of metadata events. Consumers resume by passing the last checkpointed sequence.
 */
public interface MetadataEventSource {

    /**
     * Next events with {@code sequence > afterSequence}, ascending, at most {@code maxEvents}. Empty when caught up.
     */
    List<MetadataEvent> poll(long afterSequence, int maxEvents);

    /** Events not yet polled past {@code afterSequence}; for health reporting. */
    long backlog(long afterSequence);
}
