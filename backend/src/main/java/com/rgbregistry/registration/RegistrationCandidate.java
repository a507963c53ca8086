package com.rgbregistry.registration;

/**
 * Unvalidated registration as submitted; any field may be null.
 */
public record RegistrationCandidate(
        String ethAddress,
        String rgbAddress,
        String signature,
        String message
) {
}
