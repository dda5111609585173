package com.tokenmetadata.ingestion.fetch;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GatewayEndpointRotatorTest {

    private static final GatewayEndpoint A = new GatewayEndpoint("https://a.example/", Duration.ofSeconds(1));
    private static final GatewayEndpoint B = new GatewayEndpoint("https://b.example", Duration.ofSeconds(1));
    private static final GatewayEndpoint C = new GatewayEndpoint("https://c.example", Duration.ofSeconds(1));

    @Test
    void attemptOrder_allHealthy_keepsConfiguredOrder() {
        GatewayEndpointRotator rotator = new GatewayEndpointRotator(List.of(A, B, C), 60_000);

        assertThat(rotator.attemptOrder()).containsExactly(A, B, C);
    }

    @Test
    void coolingGateway_movesBehindHealthyOnes_untilExpiry() {
        MutableClock clock = new MutableClock();
        GatewayEndpointRotator rotator = new GatewayEndpointRotator(List.of(A, B, C), 60_000, clock);

        rotator.markCoolingDown(A, "timeout");
        assertThat(rotator.isCoolingDown(A)).isTrue();
        assertThat(rotator.attemptOrder()).containsExactly(B, C, A);

        clock.advance(Duration.ofSeconds(61));
        assertThat(rotator.isCoolingDown(A)).isFalse();
        assertThat(rotator.attemptOrder()).containsExactly(A, B, C);
    }

    @Test
    void coolingGateways_soonestRecoveringFirst() {
        MutableClock clock = new MutableClock();
        GatewayEndpointRotator rotator = new GatewayEndpointRotator(List.of(A, B, C), 60_000, clock);

        rotator.markCoolingDown(B, "503");
        clock.advance(Duration.ofSeconds(5));
        rotator.markCoolingDown(A, "timeout");

        assertThat(rotator.attemptOrder()).containsExactly(C, B, A);
    }

    @Test
    void markHealthy_clearsCooldown() {
        GatewayEndpointRotator rotator = new GatewayEndpointRotator(List.of(A, B), 60_000);
        rotator.markCoolingDown(A, "timeout");

        rotator.markHealthy(A);

        assertThat(rotator.attemptOrder()).containsExactly(A, B);
    }

    @Test
    void zeroCooldown_neverReorders() {
        GatewayEndpointRotator rotator = new GatewayEndpointRotator(List.of(A, B), 0);
        rotator.markCoolingDown(A, "timeout");

        assertThat(rotator.attemptOrder()).containsExactly(A, B);
    }

    @Test
    void endpointUrl_trailingSlashStripped() {
        assertThat(A.url()).isEqualTo("https://a.example");
    }

    @Test
    void constructor_requiresAtLeastOneGateway() {
        assertThatThrownBy(() -> new GatewayEndpointRotator(List.of(), 1000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("At least one gateway");
    }

    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2025-01-01T00:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
