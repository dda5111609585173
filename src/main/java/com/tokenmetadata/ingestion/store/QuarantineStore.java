package com.tokenmetadata.ingestion.store;

import com.tokenmetadata.domain.MetadataEvent;
import com.tokenmetadata.domain.QuarantineReason;
import com.tokenmetadata.domain.QuarantinedEvent;
import com.tokenmetadata.domain.QuarantinedEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Persists terminal failures to quarantined_events, keyed by event id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuarantineStore {

    private final QuarantinedEventRepository repository;

    /**
     * Best effort: the event is already out of the pipeline, so a failed write is logged, not rethrown.
     */
    public void quarantine(MetadataEvent event, QuarantineReason reason, int attempts, String lastErrorKind,
                           String lastErrorMessage, Instant firstAttemptAt) {
        QuarantinedEvent q = new QuarantinedEvent();
        q.setId(event.getId() != null ? event.getId() : "seq-" + event.getSequence());
        q.setSequence(event.getSequence());
        q.setTokenKey(tokenKeyOf(event));
        q.setMetadataUri(event.getMetadataUri());
        q.setObservedAt(event.getObservedAt());
        q.setSchemaFamily(event.getSchemaFamily());
        q.setReason(reason);
        q.setAttempts(attempts);
        q.setLastErrorKind(lastErrorKind);
        q.setLastErrorMessage(lastErrorMessage);
        q.setFirstAttemptAt(firstAttemptAt);
        q.setQuarantinedAt(Instant.now());
        try {
            repository.save(q);
        } catch (DataAccessException e) {
            log.error("Failed to store quarantine record for event {} ({}): {}", q.getId(), reason, e.getMessage());
        }
    }

    public long count() {
        return repository.count();
    }

    private static String tokenKeyOf(MetadataEvent event) {
        try {
            return event.tokenId().key();
        } catch (RuntimeException e) {
            return event.getContractAddress();
        }
    }
}
