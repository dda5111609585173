package com.tokenmetadata.ingestion.pipeline;

import com.tokenmetadata.domain.NormalizedRecord;
import com.tokenmetadata.domain.RawPayload;
import com.tokenmetadata.domain.ResolvedMetadata;
import com.tokenmetadata.domain.SchemaFamily;
import com.tokenmetadata.domain.Validity;
import com.tokenmetadata.ingestion.artifact.ItemArtifactVerifier;
import com.tokenmetadata.ingestion.dedup.MetadataDedupCache;
import com.tokenmetadata.ingestion.fetch.MetadataFetcher;
import com.tokenmetadata.ingestion.fetch.MetadataSource;
import com.tokenmetadata.ingestion.store.IpfsMetadataCacheStore;
import com.tokenmetadata.ingestion.validation.MetadataValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Fetch, validate and cache for one metadata source. Content-addressed sources join on their URI before the
 * fetch and are read through the persistent IPFS cache; everything else joins on the fingerprint after the
 * fetch. ITEM records additionally have their artifact verified, once per fingerprint.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MetadataResolutionService {

    private final MetadataFetcher fetcher;
    private final MetadataValidator validator;
    private final MetadataDedupCache dedupCache;
    private final IpfsMetadataCacheStore ipfsCache;
    private final ItemArtifactVerifier artifactVerifier;

    /**
     * @param onState receives VALIDATING and CACHING as the work progresses; FETCHING is set by the caller
     * @throws com.tokenmetadata.ingestion.fetch.FetchException when the bytes (or an item's artifact) cannot
     *                                                          be obtained
     */
    public ResolvedMetadata resolve(MetadataSource source, SchemaFamily family, Consumer<EventState> onState) {
        String contentAddress = source.contentAddress();
        if (contentAddress != null) {
            return dedupCache.resolved(contentAddress, family,
                    () -> resolveContentAddressed(contentAddress, source, family, onState));
        }
        return validate(fetcher.resolve(source), family, onState);
    }

    private ResolvedMetadata resolveContentAddressed(String contentAddress, MetadataSource source,
                                                     SchemaFamily family, Consumer<EventState> onState) {
        Optional<RawPayload> cached = ipfsCache.find(contentAddress);
        if (cached.isPresent()) {
            log.debug("Loaded {} from the IPFS metadata cache", contentAddress);
            return validate(cached.get(), family, onState);
        }
        RawPayload payload = fetcher.resolve(source);
        ResolvedMetadata resolved = validate(payload, family, onState);
        if (!isUnparseable(resolved.record())) {
            ipfsCache.put(contentAddress, payload);
        }
        return resolved;
    }

    private ResolvedMetadata validate(RawPayload payload, SchemaFamily family, Consumer<EventState> onState) {
        onState.accept(EventState.VALIDATING);
        NormalizedRecord record = dedupCache.validated(payload.fingerprint(), family,
                () -> artifactVerifier.verify(validator.validate(payload, family)));
        onState.accept(EventState.CACHING);
        return new ResolvedMetadata(record, payload.sourceUri(), payload.gateway());
    }

    private static boolean isUnparseable(NormalizedRecord record) {
        return record.validity() == Validity.INVALID && MetadataValidator.PARSE_ERROR.equals(record.invalidReason());
    }
}
