package com.rgbregistry.config;

import com.rgbregistry.keepalive.config.KeepaliveProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Logs the listen port and public endpoints once the application is ready.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StartupBannerListener {

    private final Environment environment;
    private final KeepaliveProperties keepaliveProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        String port = environment.getProperty("local.server.port",
                environment.getProperty("server.port", "8080"));
        String origin = keepaliveProperties.isEnabled()
                ? keepaliveProperties.getOrigin().trim()
                : "http://localhost:" + port;
        log.info("Registry server running on port {}", port);
        log.info("API endpoint: POST {}/submit", origin);
        log.info("Health check: GET {}/ping", origin);
        if (keepaliveProperties.isEnabled()) {
            log.info("Self-ping enabled every {} ms", keepaliveProperties.getIntervalMs());
        }
    }
}
