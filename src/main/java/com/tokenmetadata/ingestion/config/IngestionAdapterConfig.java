package com.tokenmetadata.ingestion.config;

import com.tokenmetadata.common.RetryPolicy;
import com.tokenmetadata.ingestion.fetch.GatewayEndpoint;
import com.tokenmetadata.ingestion.fetch.GatewayEndpointRotator;
import com.tokenmetadata.ingestion.fetch.GatewayHttpClient;
import com.tokenmetadata.ingestion.fetch.WebClientGatewayHttpClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;

/**
 * Fetch adapters: ordered gateway rotator, WebClient-backed HTTP client, process-wide request limiter and the
 * pipeline retry policy.
 */
@Configuration
@EnableConfigurationProperties({ FetchProperties.class, PipelineProperties.class, ValidationProperties.class })
public class IngestionAdapterConfig {

    public static final String METADATA_FETCH_RATE_LIMITER = "metadataFetchRateLimiter";
    public static final String PIPELINE_RETRY_POLICY = "pipelineRetryPolicy";

    /** Used when tokenmetadata.fetch.gateways is empty. */
    private static final List<String> DEFAULT_GATEWAYS = List.of(
            "https://ipfs.io", "https://cloudflare-ipfs.com", "https://nftstorage.link", "https://infura-ipfs.io");

    @Bean
    public GatewayEndpointRotator gatewayEndpointRotator(FetchProperties properties) {
        Duration defaultTimeout = Duration.ofMillis(properties.getDefaultGatewayTimeoutMs());
        List<GatewayEndpoint> endpoints = properties.getGateways().isEmpty()
                ? DEFAULT_GATEWAYS.stream().map(url -> new GatewayEndpoint(url, defaultTimeout)).toList()
                : properties.getGateways().stream()
                        .map(g -> new GatewayEndpoint(g.getUrl(), g.getTimeoutMs() != null
                                ? Duration.ofMillis(g.getTimeoutMs())
                                : defaultTimeout))
                        .toList();
        return new GatewayEndpointRotator(endpoints, properties.getGatewayCooldownMs());
    }

    @Bean
    public GatewayHttpClient gatewayHttpClient(WebClient.Builder webClientBuilder,
                                               @Value("${tokenmetadata.version:dev}") String version) {
        HttpClient httpClient = HttpClient.create().followRedirect(true);
        WebClient.Builder builder = webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient));
        return new WebClientGatewayHttpClient(builder, userAgent(version));
    }

    @Bean(name = METADATA_FETCH_RATE_LIMITER)
    public RateLimiter metadataFetchRateLimiter(FetchProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("metadata-fetch", config);
    }

    @Bean(name = PIPELINE_RETRY_POLICY)
    public RetryPolicy pipelineRetryPolicy(PipelineProperties properties) {
        PipelineProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(
                retry.getBaseDelayMs(),
                retry.getJitterFactor(),
                retry.getMaxAttempts(),
                retry.getMaxDelayMs());
    }

    static String userAgent(String version) {
        return "token-metadata-processor/" + version
                + " (" + System.getProperty("os.name") + "; " + System.getProperty("os.arch") + ")";
    }
}
