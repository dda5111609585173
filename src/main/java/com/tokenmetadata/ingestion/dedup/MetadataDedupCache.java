package com.tokenmetadata.ingestion.dedup;

import com.tokenmetadata.common.SingleFlightCache;
import com.tokenmetadata.config.CaffeineConfig;
import com.tokenmetadata.domain.ContentFingerprint;
import com.tokenmetadata.domain.NormalizedRecord;
import com.tokenmetadata.domain.ResolvedMetadata;
import com.tokenmetadata.domain.SchemaFamily;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Dedup of metadata work. Two single-flight caches:
 * <ul>
 *   <li>by fingerprint: validation of byte-identical content runs once per schema family</li>
 *   <li>by content address: an {@code ipfs://} URI names immutable content, so concurrent events sharing it
 *       join one fetch before any bytes exist</li>
 * </ul>
 */
@Component
public class MetadataDedupCache {

    private final SingleFlightCache<String, NormalizedRecord> byFingerprint;
    private final SingleFlightCache<String, ResolvedMetadata> byContentAddress;

    public MetadataDedupCache(
            @Qualifier(CaffeineConfig.FINGERPRINT_CACHE) SingleFlightCache<String, NormalizedRecord> byFingerprint,
            @Qualifier(CaffeineConfig.CONTENT_ADDRESS_CACHE) SingleFlightCache<String, ResolvedMetadata> byContentAddress) {
        this.byFingerprint = byFingerprint;
        this.byContentAddress = byContentAddress;
    }

    public NormalizedRecord validated(ContentFingerprint fingerprint, SchemaFamily family,
                                      Supplier<NormalizedRecord> validate) {
        return byFingerprint.getOrCompute(key(fingerprint.value(), family), validate);
    }

    public ResolvedMetadata resolved(String contentAddress, SchemaFamily family, Supplier<ResolvedMetadata> resolve) {
        return byContentAddress.getOrCompute(key(contentAddress, family), resolve);
    }

    /** Combined counters of both caches. */
    public SingleFlightCache.Stats stats() {
        SingleFlightCache.Stats a = byFingerprint.stats();
        SingleFlightCache.Stats b = byContentAddress.stats();
        return new SingleFlightCache.Stats(a.hits() + b.hits(), a.misses() + b.misses(), a.joins() + b.joins());
    }

    public long size() {
        return byFingerprint.estimatedSize() + byContentAddress.estimatedSize();
    }

    static String key(String address, SchemaFamily family) {
        return address + "|" + family.name();
    }
}
