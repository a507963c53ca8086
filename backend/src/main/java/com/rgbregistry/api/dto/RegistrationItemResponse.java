package com.rgbregistry.api.dto;

import java.time.Instant;

public record RegistrationItemResponse(
        long id,
        String ethAddress,
        String rgbAddress,
        String signature,
        String message,
        Instant createdAt,
        Instant updatedAt
) {
}
