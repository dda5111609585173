package com.tokenmetadata.ingestion.store;

import com.tokenmetadata.domain.IpfsMetadataCacheEntry;
import com.tokenmetadata.domain.IpfsMetadataCacheRepository;
import com.tokenmetadata.domain.RawPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistent read-through cache of ipfs:// metadata documents in ipfs_metadata_cache. The in-memory dedup
 * cache forgets on restart and eviction; this one does not, so immutable content is downloaded once.
 *
 * <p>Datastore failures degrade to a cache miss on read and a skipped entry on write: the gateways remain
 * the source of truth.
 */
@Service
@Slf4j
public class IpfsMetadataCacheStore {

    private final IpfsMetadataCacheRepository repository;
    private final boolean enabled;

    public IpfsMetadataCacheStore(IpfsMetadataCacheRepository repository,
                                  @Value("${tokenmetadata.dedup.persistent-ipfs-cache:true}") boolean enabled) {
        this.repository = repository;
        this.enabled = enabled;
    }

    /**
     * @param contentAddress normalized ipfs:// URI
     */
    public Optional<RawPayload> find(String contentAddress) {
        if (!enabled) {
            return Optional.empty();
        }
        try {
            return repository.findById(contentAddress)
                    .filter(entry -> entry.getBody() != null)
                    .map(entry -> new RawPayload(entry.getBody(), entry.getUri(),
                            entry.getCachedAt() != null ? entry.getCachedAt() : Instant.now(), entry.getGateway()));
        } catch (DataAccessException e) {
            log.warn("IPFS metadata cache read failed for {}, fetching from gateways: {}", contentAddress, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(String contentAddress, RawPayload payload) {
        if (!enabled) {
            return;
        }
        IpfsMetadataCacheEntry entry = new IpfsMetadataCacheEntry();
        entry.setUri(contentAddress);
        entry.setBody(payload.bytes());
        entry.setFingerprint(payload.fingerprint().value());
        entry.setGateway(payload.gateway());
        entry.setCachedAt(payload.fetchedAt());
        try {
            repository.save(entry);
            log.debug("Cached IPFS metadata {} ({} bytes)", contentAddress, payload.size());
        } catch (DataAccessException e) {
            log.warn("IPFS metadata cache write failed for {}: {}", contentAddress, e.getMessage());
        }
    }
}
