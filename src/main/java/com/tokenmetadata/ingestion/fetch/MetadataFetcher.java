package com.tokenmetadata.ingestion.fetch;

import com.tokenmetadata.domain.RawPayload;
import com.tokenmetadata.ingestion.config.FetchProperties;
import com.tokenmetadata.ingestion.config.IngestionAdapterConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Resolves a metadata source to raw bytes.
 *
 * <ul>
 *   <li>inline payloads and {@code data:} URIs: decoded locally, no network I/O</li>
 *   <li>{@code ipfs://}: configured gateways in order, each with its own timeout, falling through on
 *       transient failures</li>
 *   <li>{@code http(s)://}: fetched directly with the HTTP timeout</li>
 * </ul>
 * Metadata documents are capped at {@code maxMetadataBytes}; item artifacts are fetched through
 * {@link #resolve(MetadataSource, long)} with their own cap. No caching here.
 */
@Component
@Slf4j
public class MetadataFetcher {

    private final GatewayHttpClient httpClient;
    private final GatewayEndpointRotator gatewayRotator;
    private final RateLimiter rateLimiter;
    private final FetchProperties fetchProperties;

    public MetadataFetcher(GatewayHttpClient httpClient,
                           GatewayEndpointRotator gatewayRotator,
                           @Qualifier(IngestionAdapterConfig.METADATA_FETCH_RATE_LIMITER) RateLimiter rateLimiter,
                           FetchProperties fetchProperties) {
        this.httpClient = httpClient;
        this.gatewayRotator = gatewayRotator;
        this.rateLimiter = rateLimiter;
        this.fetchProperties = fetchProperties;
    }

    public RawPayload resolve(MetadataSource source) {
        return resolve(source, fetchProperties.getMaxMetadataBytes());
    }

    /**
     * Same as {@link #resolve(MetadataSource)} with an explicit response cap.
     *
     * @throws FetchException TOO_LARGE when the body exceeds {@code maxBytes}
     */
    public RawPayload resolve(MetadataSource source, long maxBytes) {
        if (source.isInline()) {
            return RawPayload.inline(source.getInline());
        }
        String uri = source.getUri().strip();
        String scheme = schemeOf(uri);
        switch (scheme) {
            case "data":
                return decodeDataUri(uri, maxBytes);
            case "ipfs":
                return fetchContentAddressed(uri, maxBytes);
            case "http":
            case "https":
                return fetchDirect(uri, maxBytes);
            default:
                throw new FetchException(FetchErrorKind.MALFORMED_URI,
                        "Unsupported URI scheme '" + scheme + "': " + uri);
        }
    }

    private RawPayload decodeDataUri(String uri, long maxBytes) {
        byte[] bytes;
        try {
            bytes = DataUri.decode(uri);
        } catch (IllegalArgumentException e) {
            throw new FetchException(FetchErrorKind.MALFORMED_URI, "Undecodable data URI: " + e.getMessage(), e);
        }
        if (bytes.length > maxBytes) {
            throw new FetchException(FetchErrorKind.TOO_LARGE, "Inline data URI exceeds " + maxBytes + " bytes");
        }
        return new RawPayload(bytes, RawPayload.INLINE_SOURCE, Instant.now(), null);
    }

    private RawPayload fetchContentAddressed(String uri, long maxBytes) {
        IpfsUri ipfs;
        try {
            ipfs = IpfsUri.parse(uri);
        } catch (IllegalArgumentException e) {
            throw new FetchException(FetchErrorKind.MALFORMED_URI, e.getMessage(), e);
        }
        List<GatewayEndpoint> order = gatewayRotator.attemptOrder();
        List<String> failures = new ArrayList<>(order.size());
        Throwable lastCause = null;
        for (GatewayEndpoint gateway : order) {
            String link = ipfs.gatewayUrl(gateway.url());
            log.debug("Fetching {} via {}", ipfs, link);
            try {
                byte[] body = get(link, gateway.timeout(), maxBytes);
                gatewayRotator.markHealthy(gateway);
                return new RawPayload(body, ipfs.normalized(), Instant.now(), gateway.url());
            } catch (PayloadTooLargeException e) {
                throw new FetchException(FetchErrorKind.TOO_LARGE, e.getMessage(), e);
            } catch (GatewayHttpException e) {
                if (e.isPermanent()) {
                    throw new FetchException(FetchErrorKind.NOT_FOUND,
                            ipfs + " rejected by " + gateway.url() + ": HTTP " + e.getStatusCode(), e);
                }
                lastCause = e;
                failures.add(gateway.url() + " -> HTTP " + e.getStatusCode());
                gatewayRotator.markCoolingDown(gateway, "HTTP " + e.getStatusCode());
            } catch (LimiterTimeoutException e) {
                throw new FetchException(FetchErrorKind.UNAVAILABLE, e.getMessage(), e);
            } catch (RuntimeException e) {
                Throwable cause = Exceptions.unwrap(e);
                lastCause = cause;
                String reason = cause instanceof TimeoutException
                        ? "timeout after " + gateway.timeout().toMillis() + " ms"
                        : messageOf(cause);
                failures.add(gateway.url() + " -> " + reason);
                gatewayRotator.markCoolingDown(gateway, reason);
            }
            log.warn("Gateway {} failed for {}: {}", gateway.url(), ipfs, failures.get(failures.size() - 1));
        }
        throw new FetchException(FetchErrorKind.GATEWAY_EXHAUSTED,
                "All " + order.size() + " gateways failed for " + ipfs + ": " + String.join("; ", failures),
                lastCause);
    }

    private RawPayload fetchDirect(String uri, long maxBytes) {
        Duration timeout = Duration.ofMillis(fetchProperties.getHttpTimeoutMs());
        try {
            byte[] body = get(uri, timeout, maxBytes);
            return new RawPayload(body, uri, Instant.now(), null);
        } catch (PayloadTooLargeException e) {
            throw new FetchException(FetchErrorKind.TOO_LARGE, e.getMessage(), e);
        } catch (GatewayHttpException e) {
            FetchErrorKind kind = e.isPermanent() ? FetchErrorKind.NOT_FOUND : FetchErrorKind.UNAVAILABLE;
            throw new FetchException(kind, e.getMessage(), e);
        } catch (LimiterTimeoutException e) {
            throw new FetchException(FetchErrorKind.UNAVAILABLE, e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new FetchException(FetchErrorKind.MALFORMED_URI, "Malformed URI " + uri + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new FetchException(FetchErrorKind.TIMEOUT,
                        "Timed out after " + timeout.toMillis() + " ms fetching " + uri, cause);
            }
            throw new FetchException(FetchErrorKind.UNAVAILABLE, "Fetching " + uri + " failed: " + messageOf(cause), cause);
        }
    }

    private byte[] get(String url, Duration timeout, long maxBytes) {
        long acquireStart = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new LimiterTimeoutException("Local limiter timeout before GET " + url);
        }
        if (waitedMs >= Math.max(1L, fetchProperties.getLimiterLogThresholdMs())) {
            log.info("Local fetch limiter delayed {} ms before GET {}", waitedMs, url);
        }
        byte[] body = httpClient.get(url, timeout, maxBytes).block();
        return body != null ? body : new byte[0];
    }

    private static String schemeOf(String uri) {
        int colon = uri.indexOf(':');
        if (colon <= 0) {
            throw new FetchException(FetchErrorKind.MALFORMED_URI, "URI without scheme: " + uri);
        }
        return uri.substring(0, colon).toLowerCase(Locale.ROOT);
    }

    private static String messageOf(Throwable e) {
        if (e == null || e.getMessage() == null || e.getMessage().isBlank()) {
            return e != null ? e.getClass().getSimpleName() : "unknown";
        }
        return e.getMessage();
    }

    /**
     * No rate-limit permit within the configured wait.
     */
    static class LimiterTimeoutException extends RuntimeException {
        LimiterTimeoutException(String message) {
            super(message);
        }
    }
}
