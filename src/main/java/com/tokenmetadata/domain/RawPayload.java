package com.tokenmetadata.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Fetched bytes plus provenance. Transient: handed from fetcher to validator and then dropped.
 *
 * @param bytes     raw document bytes
 * @param sourceUri the metadata URI, or {@code inline} for inline payloads
 * @param fetchedAt when the bytes were obtained
 * @param gateway   gateway base URL that served content-addressed content; null for direct and inline
 */
public record RawPayload(byte[] bytes, String sourceUri, Instant fetchedAt, String gateway) {

    public static final String INLINE_SOURCE = "inline";

    public RawPayload {
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(fetchedAt, "fetchedAt");
    }

    public static RawPayload inline(byte[] bytes) {
        return new RawPayload(bytes, INLINE_SOURCE, Instant.now(), null);
    }

    public ContentFingerprint fingerprint() {
        return ContentFingerprint.of(bytes);
    }

    public int size() {
        return bytes.length;
    }
}
