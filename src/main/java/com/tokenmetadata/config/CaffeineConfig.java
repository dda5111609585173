package com.tokenmetadata.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.tokenmetadata.common.SingleFlightCache;
import com.tokenmetadata.domain.NormalizedRecord;
import com.tokenmetadata.domain.ResolvedMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine-backed dedup caches. Keys are strings built by the dedup layer:
 * fingerprint cache {@code sha256:<hex>|FAMILY}, content-address cache {@code ipfs://<cid>/<path>|FAMILY}.
 */
@Configuration
public class CaffeineConfig {

    public static final String FINGERPRINT_CACHE = "fingerprintCache";
    public static final String CONTENT_ADDRESS_CACHE = "contentAddressCache";

    @Bean(name = FINGERPRINT_CACHE)
    public SingleFlightCache<String, NormalizedRecord> fingerprintCache(
            @Value("${tokenmetadata.dedup.fingerprint-cache-size:10000}") long maximumSize,
            @Value("${tokenmetadata.dedup.expire-after-write-minutes:1440}") long expireMinutes) {
        return new SingleFlightCache<>(Caffeine.newBuilder()
                .expireAfterWrite(expireMinutes, TimeUnit.MINUTES)
                .maximumSize(maximumSize)
                .build());
    }

    @Bean(name = CONTENT_ADDRESS_CACHE)
    public SingleFlightCache<String, ResolvedMetadata> contentAddressCache(
            @Value("${tokenmetadata.dedup.content-address-cache-size:10000}") long maximumSize,
            @Value("${tokenmetadata.dedup.expire-after-write-minutes:1440}") long expireMinutes) {
        return new SingleFlightCache<>(Caffeine.newBuilder()
                .expireAfterWrite(expireMinutes, TimeUnit.MINUTES)
                .maximumSize(maximumSize)
                .build());
    }
}
