package com.rgbregistry.registration.validation;

/**
 * Reason a registration was rejected before reaching the store. Declaration order is check order.
 */
public enum ValidationFailure {

    MISSING_FIELDS("Missing required fields"),
    INVALID_ETH_ADDRESS("Invalid ETH address format"),
    INVALID_RGB_ADDRESS("Invalid RGB address format - must be a Taproot address starting with bc1"),
    SIGNATURE_VERIFICATION_FAILED("Signature verification failed");

    private final String message;

    ValidationFailure(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
