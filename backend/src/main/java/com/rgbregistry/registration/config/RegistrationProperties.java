package com.rgbregistry.registration.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;

/**
 * Submission rules for POST /submit. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "rgbregistry.registration")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class RegistrationProperties {

    /** Minimum accepted signature length in characters. Default 100. */
    @Min(1)
    private int minSignatureLength = 100;

    /**
     * Status returned when the (ethAddress, rgbAddress) pair is already registered.
     * CONFLICT by default; INTERNAL_SERVER_ERROR reproduces the legacy service.
     */
    @NotNull
    private HttpStatus conflictStatus = HttpStatus.CONFLICT;
}
