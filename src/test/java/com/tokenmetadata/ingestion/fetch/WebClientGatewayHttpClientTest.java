package com.tokenmetadata.ingestion.fetch;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientGatewayHttpClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private static WebClientGatewayHttpClient clientReturning(ClientResponse response, AtomicReference<String> userAgent) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            userAgent.set(request.headers().getFirst(HttpHeaders.USER_AGENT));
            return Mono.just(response);
        });
        return new WebClientGatewayHttpClient(builder, "token-metadata-processor/test (linux; amd64)");
    }

    @Test
    void ok_returnsBody_andSendsUserAgent() {
        AtomicReference<String> userAgent = new AtomicReference<>();
        ClientResponse response = ClientResponse.create(HttpStatus.OK).body("{\"name\":\"x\"}").build();

        StepVerifier.create(clientReturning(response, userAgent).get("https://a.example/ipfs/Qm", TIMEOUT, 1024))
                .assertNext(bytes -> assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("{\"name\":\"x\"}"))
                .verifyComplete();
        assertThat(userAgent.get()).startsWith("token-metadata-processor/");
    }

    @Test
    void declaredContentLengthOverCap_rejectedBeforeReading() {
        ClientResponse response = ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_LENGTH, "5000")
                .body("{}")
                .build();

        StepVerifier.create(clientReturning(response, new AtomicReference<>()).get("https://a.example/x", TIMEOUT, 1024))
                .expectError(PayloadTooLargeException.class)
                .verify();
    }

    @Test
    void non2xx_mapsToGatewayHttpException() {
        ClientResponse response = ClientResponse.create(HttpStatus.NOT_FOUND).build();

        StepVerifier.create(clientReturning(response, new AtomicReference<>()).get("https://a.example/x", TIMEOUT, 1024))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(GatewayHttpException.class);
                    assertThat(((GatewayHttpException) e).getStatusCode()).isEqualTo(404);
                    assertThat(((GatewayHttpException) e).isPermanent()).isTrue();
                })
                .verify();
    }

    @Test
    void streamedBodyOverCap_abortsWithoutReadingTheRest() {
        AtomicInteger emitted = new AtomicInteger();
        Flux<DataBuffer> chunks = Flux.range(0, 10)
                .<DataBuffer>map(i -> DefaultDataBufferFactory.sharedInstance.wrap(new byte[100]))
                .doOnNext(b -> emitted.incrementAndGet());

        StepVerifier.create(WebClientGatewayHttpClient.readCapped(chunks, "https://a.example/big", 250))
                .expectError(PayloadTooLargeException.class)
                .verify();
        assertThat(emitted.get()).isEqualTo(3);
    }

    @Test
    void streamedBodyAtCap_accepted() {
        Flux<DataBuffer> chunks = Flux.range(0, 4)
                .<DataBuffer>map(i -> DefaultDataBufferFactory.sharedInstance.wrap(new byte[]{i.byteValue()}));

        StepVerifier.create(WebClientGatewayHttpClient.readCapped(chunks, "https://a.example/ok", 4))
                .assertNext(bytes -> assertThat(bytes).containsExactly(new byte[]{0, 1, 2, 3}))
                .verifyComplete();
    }
}
