package com.tokenmetadata.ingestion.fetch;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * HTTP GET for metadata documents. Errors: {@link GatewayHttpException} for non-2xx,
 * {@link PayloadTooLargeException} above {@code maxBytes}, {@link java.util.concurrent.TimeoutException}
 * after {@code timeout}, transport exceptions otherwise.
 */
public interface GatewayHttpClient {

    Mono<byte[]> get(String url, Duration timeout, long maxBytes);
}
