package com.tokenmetadata.ingestion.source;

import com.tokenmetadata.domain.MetadataEvent;
import com.tokenmetadata.domain.MetadataEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reads the indexer's metadata_events collection in sequence order.
 */
@Component
@RequiredArgsConstructor
public class MongoMetadataEventSource implements MetadataEventSource {

    private final MetadataEventRepository repository;

    @Override
    public List<MetadataEvent> poll(long afterSequence, int maxEvents) {
        if (maxEvents <= 0) {
            return List.of();
        }
        return repository.findBySequenceGreaterThanOrderBySequenceAsc(afterSequence, PageRequest.of(0, maxEvents));
    }

    @Override
    public long backlog(long afterSequence) {
        return repository.countBySequenceGreaterThan(afterSequence);
    }
}
