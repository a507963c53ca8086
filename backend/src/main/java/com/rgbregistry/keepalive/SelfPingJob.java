package com.rgbregistry.keepalive;

import com.rgbregistry.keepalive.config.KeepaliveProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Pings {origin}/ping on a fixed delay so hosting platforms do not idle the process.
 * Failures are logged and never propagated; the next run tries again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SelfPingJob {

    static final String PING_PATH = "/ping";

    private final PingClient pingClient;
    private final KeepaliveProperties properties;

    @Scheduled(
            fixedDelayString = "${rgbregistry.keepalive.interval-ms:600000}",
            initialDelayString = "${rgbregistry.keepalive.interval-ms:600000}")
    public void runScheduled() {
        if (!properties.isEnabled()) {
            return;
        }
        String url = pingUrl(properties.getOrigin());
        try {
            pingClient.ping(url).block();
            log.info("Self-ping successful");
        } catch (PingException e) {
            log.warn("Self-ping failed: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Self-ping failed unexpectedly for {}", url, e);
        }
    }

    static String pingUrl(String origin) {
        String base = origin.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + PING_PATH;
    }
}
