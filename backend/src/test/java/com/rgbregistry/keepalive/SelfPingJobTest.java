package com.rgbregistry.keepalive;

import com.rgbregistry.keepalive.config.KeepaliveProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SelfPingJobTest {

    @Mock
    private PingClient pingClient;

    private KeepaliveProperties properties;
    private SelfPingJob job;

    @BeforeEach
    void setUp() {
        properties = new KeepaliveProperties();
        job = new SelfPingJob(pingClient, properties);
    }

    @Test
    @DisplayName("no origin configured: job does nothing")
    void disabledWithoutOrigin() {
        job.runScheduled();

        properties.setOrigin("  ");
        job.runScheduled();

        verify(pingClient, never()).ping(anyString());
    }

    @Test
    @DisplayName("pings {origin}/ping when origin configured")
    void pingsOrigin() {
        properties.setOrigin("https://registry.example.com/");
        when(pingClient.ping("https://registry.example.com/ping")).thenReturn(Mono.just("Pong!"));

        job.runScheduled();

        verify(pingClient).ping("https://registry.example.com/ping");
    }

    @Test
    @DisplayName("ping failure is logged and not propagated")
    void failureSwallowedIntoLog() {
        properties.setOrigin("https://registry.example.com");
        when(pingClient.ping("https://registry.example.com/ping"))
                .thenReturn(Mono.error(new PingException("503 Service Unavailable", null)));

        assertThatCode(() -> job.runScheduled()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("unexpected client exception is logged and not propagated")
    void unexpectedClientExceptionSwallowed() {
        properties.setOrigin("https://registry.example.com");
        when(pingClient.ping("https://registry.example.com/ping"))
                .thenThrow(new IllegalStateException("connection pool shut down"));

        assertThatCode(() -> job.runScheduled()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("malformed origin with WebClient client is logged and not propagated")
    void malformedOriginSwallowed() {
        properties.setOrigin("http://[bad");
        SelfPingJob realClientJob = new SelfPingJob(
                new WebClientPingClient(WebClient.builder(), Duration.ofSeconds(1)), properties);

        assertThatCode(realClientJob::runScheduled).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("WebClient client maps malformed URL to PingException")
    void webClientMapsMalformedUrl() {
        WebClientPingClient client = new WebClientPingClient(WebClient.builder(), Duration.ofSeconds(1));

        assertThatThrownBy(() -> client.ping("http://[bad/ping").block())
                .isInstanceOf(PingException.class);
    }

    @Test
    @DisplayName("ping URL strips trailing slashes and whitespace")
    void pingUrl() {
        assertThat(SelfPingJob.pingUrl("http://localhost:3001")).isEqualTo("http://localhost:3001/ping");
        assertThat(SelfPingJob.pingUrl(" http://localhost:3001// ")).isEqualTo("http://localhost:3001/ping");
    }
}
