package com.tokenmetadata.domain;

import java.util.Objects;

/**
 * A normalized record together with where its bytes came from.
 */
public record ResolvedMetadata(NormalizedRecord record, String sourceUri, String gateway) {

    public ResolvedMetadata {
        Objects.requireNonNull(record, "record");
    }
}
