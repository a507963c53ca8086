package com.rgbregistry.api.dto;

import java.time.Instant;

/**
 * POST /submit 200 body: success flag, message, echoed addresses, acceptance timestamp (ISO 8601).
 */
public record SubmitRegistrationResponse(
        boolean success,
        String message,
        String ethAddress,
        String rgbAddress,
        Instant timestamp
) {
}
