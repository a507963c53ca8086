package com.rgbregistry.keepalive;

import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * PingClient over WebClient. Any failure, including a malformed URL, is mapped to PingException.
 */
public class WebClientPingClient implements PingClient {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientPingClient(WebClient.Builder builder, Duration timeout) {
        this.webClient = builder.build();
        this.timeout = timeout;
    }

    @Override
    public Mono<String> ping(String url) {
        return Mono.defer(() -> webClient.get()
                        .uri(url)
                        .retrieve()
                        .bodyToMono(String.class))
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof PingException), e -> new PingException(e.getMessage(), e));
    }
}
