package com.tokenmetadata.ingestion.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Metadata fetch settings: ordered IPFS gateways with per-gateway timeouts, direct HTTP timeout, size cap,
 * artifact size cap, gateway cool-down and the local request rate limit.
 */
@ConfigurationProperties(prefix = "tokenmetadata.fetch")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class FetchProperties {

    /** Gateways tried in this order for ipfs:// URIs. Base URL without the /ipfs suffix. */
    @Valid
    private List<Gateway> gateways = new ArrayList<>();

    /** Timeout for a gateway entry that does not set its own. */
    @Min(1)
    private long defaultGatewayTimeoutMs = 10_000;

    /** Timeout for direct http(s) metadata URIs. */
    @Min(1)
    private long httpTimeoutMs = 15_000;

    /** Responses larger than this abort with TOO_LARGE. */
    @Min(1)
    private long maxMetadataBytes = 1_048_576;

    /** Cap for item artifacts (models, images) downloaded to check their declared size. */
    @Min(1)
    private long maxArtifactBytes = 67_108_864;

    /** How long a gateway is moved to the back of the order after a transient failure. */
    private long gatewayCooldownMs = 60_000;

    /** Process-wide budget of outgoing metadata requests per second. */
    @Min(1)
    private int maxRequestsPerSecond = 50;

    /** How long a request may wait for a rate-limit permit before the resolution fails as UNAVAILABLE. */
    private long limiterTimeoutMs = 5_000;

    /** Log limiter waits longer than this. */
    private long limiterLogThresholdMs = 250;

    public void setGateways(List<Gateway> gateways) {
        this.gateways = gateways != null ? gateways : new ArrayList<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Gateway {

        @NotBlank
        private String url;
        /** Optional; falls back to defaultGatewayTimeoutMs. */
        private Long timeoutMs;

        public Gateway(String url, Long timeoutMs) {
            this.url = url;
            this.timeoutMs = timeoutMs;
        }
    }
}
