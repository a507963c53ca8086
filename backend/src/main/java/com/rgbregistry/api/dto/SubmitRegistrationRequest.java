package com.rgbregistry.api.dto;

import com.rgbregistry.registration.RegistrationCandidate;

/**
 * POST /submit request body. Fields are validated in RegistrationValidator so the check order is fixed.
 */
public record SubmitRegistrationRequest(
        String ethAddress,
        String rgbAddress,
        String signature,
        String message
) {

    public RegistrationCandidate toCandidate() {
        return new RegistrationCandidate(ethAddress, rgbAddress, signature, message);
    }
}
