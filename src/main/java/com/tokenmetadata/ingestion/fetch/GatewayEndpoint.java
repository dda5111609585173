package com.tokenmetadata.ingestion.fetch;

import java.time.Duration;
import java.util.Objects;

/**
 * One content-addressed gateway: base URL (no trailing slash) and its own request timeout.
 */
public record GatewayEndpoint(String url, Duration timeout) {

    public GatewayEndpoint {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(timeout, "timeout");
        if (url.isBlank()) {
            throw new IllegalArgumentException("Gateway url must not be blank");
        }
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
    }
}
