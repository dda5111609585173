package com.tokenmetadata.ingestion.fetch;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ordered gateway selection with cool-down. Gateways are tried in configured order; a gateway that failed
 * transiently is moved behind the healthy ones until its cool-down expires, so it is still tried as a last
 * resort.
 */
@Slf4j
public class GatewayEndpointRotator {

    private final List<GatewayEndpoint> endpoints;
    private final long cooldownMs;
    private final Clock clock;
    private final Map<String, Long> cooldownUntilMs = new ConcurrentHashMap<>();

    public GatewayEndpointRotator(List<GatewayEndpoint> endpoints, long cooldownMs) {
        this(endpoints, cooldownMs, Clock.systemUTC());
    }

    GatewayEndpointRotator(List<GatewayEndpoint> endpoints, long cooldownMs, Clock clock) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one gateway required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.cooldownMs = Math.max(0L, cooldownMs);
        this.clock = clock;
    }

    /**
     * Every gateway exactly once: healthy ones in configured order, then cooling-down ones, soonest-recovering
     * first.
     */
    public List<GatewayEndpoint> attemptOrder() {
        long nowMs = clock.millis();
        List<GatewayEndpoint> healthy = new ArrayList<>(endpoints.size());
        List<GatewayEndpoint> cooling = new ArrayList<>();
        for (GatewayEndpoint endpoint : endpoints) {
            if (isCoolingDown(endpoint, nowMs)) {
                cooling.add(endpoint);
            } else {
                healthy.add(endpoint);
            }
        }
        if (!cooling.isEmpty()) {
            cooling.sort(Comparator.comparingLong(e -> cooldownUntilMs.getOrDefault(e.url(), 0L)));
            log.debug("Gateways cooling down, tried last: {}", cooling.stream().map(GatewayEndpoint::url).toList());
            healthy.addAll(cooling);
        }
        return healthy;
    }

    public void markCoolingDown(GatewayEndpoint endpoint, String reason) {
        if (cooldownMs == 0L) {
            return;
        }
        long nowMs = clock.millis();
        long until = nowMs + cooldownMs;
        Long prevUntil = cooldownUntilMs.put(endpoint.url(), until);
        if (prevUntil == null || prevUntil <= nowMs) {
            log.warn("Gateway {} cooled down for {} ms due to {}", endpoint.url(), cooldownMs, reason);
        } else {
            log.debug("Gateway {} already in cooldown ({} ms left)", endpoint.url(), prevUntil - nowMs);
        }
    }

    public void markHealthy(GatewayEndpoint endpoint) {
        if (cooldownUntilMs.remove(endpoint.url()) != null) {
            log.info("Gateway {} recovered", endpoint.url());
        }
    }

    public boolean isCoolingDown(GatewayEndpoint endpoint) {
        return isCoolingDown(endpoint, clock.millis());
    }

    private boolean isCoolingDown(GatewayEndpoint endpoint, long nowMs) {
        Long until = cooldownUntilMs.get(endpoint.url());
        return until != null && until > nowMs;
    }

    public List<GatewayEndpoint> getEndpoints() {
        return endpoints;
    }
}
