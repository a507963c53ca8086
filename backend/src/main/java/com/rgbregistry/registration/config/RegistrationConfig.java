package com.rgbregistry.registration.config;

import com.rgbregistry.registration.validation.LengthHeuristicSignatureVerifier;
import com.rgbregistry.registration.validation.SignatureVerifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the signature verifier used by RegistrationValidator (length heuristic for now).
 */
@Configuration
@EnableConfigurationProperties(RegistrationProperties.class)
public class RegistrationConfig {

    @Bean
    public SignatureVerifier signatureVerifier(RegistrationProperties properties) {
        return new LengthHeuristicSignatureVerifier(properties.getMinSignatureLength());
    }
}
