package com.tokenmetadata.ingestion.fetch;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metadata GET over WebClient. The body is streamed and counted chunk by chunk so an oversized response is
 * cancelled as soon as it crosses the cap instead of being buffered whole.
 */
public class WebClientGatewayHttpClient implements GatewayHttpClient {

    private final WebClient webClient;
    private final String userAgent;

    public WebClientGatewayHttpClient(WebClient.Builder builder, String userAgent) {
        this.webClient = builder.build();
        this.userAgent = userAgent;
    }

    @Override
    public Mono<byte[]> get(String url, Duration timeout, long maxBytes) {
        return webClient.get()
                .uri(URI.create(url))
                .header(HttpHeaders.USER_AGENT, userAgent)
                .accept(MediaType.APPLICATION_JSON, MediaType.ALL)
                .exchangeToMono(response -> {
                    int status = response.statusCode().value();
                    if (!response.statusCode().is2xxSuccessful()) {
                        return response.releaseBody().then(Mono.error(new GatewayHttpException(url, status)));
                    }
                    long declared = response.headers().contentLength().orElse(-1L);
                    if (declared > maxBytes) {
                        return response.releaseBody()
                                .then(Mono.error(new PayloadTooLargeException(url, declared, maxBytes)));
                    }
                    return readCapped(response.bodyToFlux(DataBuffer.class), url, maxBytes);
                })
                .timeout(timeout);
    }

    static Mono<byte[]> readCapped(Flux<DataBuffer> body, String url, long maxBytes) {
        return Flux.defer(() -> {
                    AtomicLong total = new AtomicLong();
                    return body.<byte[]>handle((buffer, sink) -> {
                        try {
                            int readable = buffer.readableByteCount();
                            long seen = total.addAndGet(readable);
                            if (seen > maxBytes) {
                                sink.error(new PayloadTooLargeException(url, seen, maxBytes));
                                return;
                            }
                            byte[] chunk = new byte[readable];
                            buffer.read(chunk);
                            sink.next(chunk);
                        } finally {
                            DataBufferUtils.release(buffer);
                        }
                    });
                })
                .collect(ByteArrayOutputStream::new, (out, chunk) -> out.write(chunk, 0, chunk.length))
                .map(ByteArrayOutputStream::toByteArray);
    }
}
