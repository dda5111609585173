package com.tokenmetadata.ingestion.store;

import com.tokenmetadata.domain.NormalizedRecord;
import com.tokenmetadata.domain.TokenId;
import com.tokenmetadata.domain.TokenMetadata;
import com.tokenmetadata.domain.TokenMetadataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * One token_metadata row per token, written with a single conditional upsert: the filter matches the token
 * only while its stored observedAt is &lt;= the new one. If a newer row exists the filter misses, the upsert
 * tries to insert the same _id and fails with a duplicate key, which means STALE. Equal observedAt re-applies,
 * so redelivery is idempotent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenMetadataSink {

    /** Two concurrent first writes for one token race on insert; the loser re-runs the guarded upsert once. */
    private static final int MAX_WRITE_ROUNDS = 2;

    private final MongoTemplate mongoTemplate;
    private final TokenMetadataRepository repository;

    /**
     * @throws SinkException TRANSIENT on datastore failure, CONSTRAINT_VIOLATION when the write is rejected
     */
    public SinkResult upsert(TokenId tokenId, NormalizedRecord record, long observedAt, WriteProvenance provenance) {
        String key = tokenId.key();
        Query guard = Query.query(Criteria.where("_id").is(key).and("observedAt").lte(observedAt));
        Update update = toUpdate(tokenId, record, observedAt, provenance);
        for (int round = 1; ; round++) {
            try {
                mongoTemplate.upsert(guard, update, TokenMetadata.class);
                return SinkResult.APPLIED;
            } catch (DuplicateKeyException e) {
                Optional<Long> stored = findLastObservedAt(tokenId);
                if (stored.isPresent() && stored.get() > observedAt) {
                    log.debug("Stale write for {}: stored observedAt {} > {}", key, stored.get(), observedAt);
                    return SinkResult.STALE;
                }
                if (round >= MAX_WRITE_ROUNDS) {
                    throw new SinkException(SinkErrorKind.TRANSIENT,
                            "Concurrent insert race for " + key + " did not settle", e);
                }
            } catch (DataIntegrityViolationException e) {
                log.error("Write for {} rejected by datastore: {}", key, e.getMessage());
                throw new SinkException(SinkErrorKind.CONSTRAINT_VIOLATION, "Write for " + key + " rejected", e);
            } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
                throw new SinkException(SinkErrorKind.TRANSIENT, "Datastore unavailable writing " + key, e);
            } catch (DataAccessException e) {
                log.error("Write for {} failed: {}", key, e.getMessage());
                throw new SinkException(SinkErrorKind.CONSTRAINT_VIOLATION, "Write for " + key + " failed", e);
            }
        }
    }

    /**
     * observedAt of the stored row, for the pre-fetch stale check. Empty when the token has no row yet.
     *
     * @throws SinkException TRANSIENT when the datastore cannot be read
     */
    public Optional<Long> findLastObservedAt(TokenId tokenId) {
        try {
            return repository.findById(tokenId.key()).map(TokenMetadata::getObservedAt);
        } catch (DataAccessException e) {
            throw new SinkException(SinkErrorKind.TRANSIENT, "Datastore unavailable reading " + tokenId, e);
        }
    }

    private static Update toUpdate(TokenId tokenId, NormalizedRecord record, long observedAt,
                                   WriteProvenance provenance) {
        return new Update()
                .set("contractAddress", tokenId.contractAddress())
                .set("tokenIndex", tokenId.tokenIndex())
                .set("observedAt", observedAt)
                .set("eventId", provenance.eventId())
                .set("metadataUri", provenance.metadataUri())
                .set("gateway", provenance.gateway())
                .set("fingerprint", record.fingerprint().value())
                .set("schemaFamily", record.schemaFamily())
                .set("schemaVersion", record.schemaVersion())
                .set("validity", record.validity())
                .set("invalidReason", record.invalidReason())
                .set("defects", record.defects())
                .set("fields", record.fields())
                .set("extensions", record.extensions())
                .set("updatedAt", Instant.now());
    }
}
