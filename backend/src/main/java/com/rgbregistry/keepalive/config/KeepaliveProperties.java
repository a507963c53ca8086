package com.rgbregistry.keepalive.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Self keepalive for hosts that idle the process. Disabled while origin is blank.
 */
@ConfigurationProperties(prefix = "rgbregistry.keepalive")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class KeepaliveProperties {

    /** Externally reachable origin, e.g. https://registry.example.com (env ORIGIN). */
    private String origin;

    /** Interval between pings in ms. Default 10 minutes. */
    @Min(1000)
    private long intervalMs = 600_000;

    /** Per-ping timeout in ms. */
    @Min(1)
    private long timeoutMs = 10_000;

    public boolean isEnabled() {
        return origin != null && !origin.isBlank();
    }
}
