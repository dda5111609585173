package com.tokenmetadata.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Read access to indexer-produced metadata_events.
 */
public interface MetadataEventRepository extends MongoRepository<MetadataEvent, String> {

    List<MetadataEvent> findBySequenceGreaterThanOrderBySequenceAsc(long sequence, Pageable pageable);

    long countBySequenceGreaterThan(long sequence);
}
