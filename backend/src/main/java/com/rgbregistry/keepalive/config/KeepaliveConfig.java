package com.rgbregistry.keepalive.config;

import com.rgbregistry.keepalive.PingClient;
import com.rgbregistry.keepalive.WebClientPingClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(KeepaliveProperties.class)
public class KeepaliveConfig {

    @Bean
    public PingClient pingClient(WebClient.Builder webClientBuilder, KeepaliveProperties properties) {
        return new WebClientPingClient(webClientBuilder, Duration.ofMillis(properties.getTimeoutMs()));
    }
}
