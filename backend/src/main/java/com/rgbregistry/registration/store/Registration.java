package com.rgbregistry.registration.store;

import com.rgbregistry.domain.RegistrationRecord;

import java.time.Instant;

/**
 * Immutable snapshot of a stored registration handed to callers of RegistrationStore.
 */
public record Registration(
        long id,
        String ethAddress,
        String rgbAddress,
        String signature,
        String message,
        Instant createdAt,
        Instant updatedAt
) {

    static Registration from(RegistrationRecord record) {
        return new Registration(
                record.getId(),
                record.getEthAddress(),
                record.getRgbAddress(),
                record.getSignature(),
                record.getMessage(),
                record.getCreatedAt(),
                record.getUpdatedAt());
    }
}
