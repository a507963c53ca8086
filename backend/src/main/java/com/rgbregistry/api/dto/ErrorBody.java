package com.rgbregistry.api.dto;

import java.time.Instant;

/**
 * Failure body of POST /submit. error is the registration code (MISSING_FIELDS, INVALID_ETH_ADDRESS,
 * INVALID_RGB_ADDRESS on 400, SIGNATURE_VERIFICATION_FAILED on 401, REGISTRATION_EXISTS on 409,
 * INTERNAL_ERROR on 500, INVALID_REQUEST for an unreadable body); message is the text shown to the user.
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }
}
