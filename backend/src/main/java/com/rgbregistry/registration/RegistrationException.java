package com.rgbregistry.registration;

import lombok.Getter;

/**
 * Thrown by RegistrationService when a submission is rejected or cannot be stored.
 * API layer (RegistrationExceptionHandler) maps the code to 400/401/409/500.
 */
@Getter
public class RegistrationException extends RuntimeException {

    /** MISSING_FIELDS, INVALID_ETH_ADDRESS, INVALID_RGB_ADDRESS, SIGNATURE_VERIFICATION_FAILED, REGISTRATION_EXISTS, STORE_FAILURE. */
    private final String errorCode;

    public RegistrationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RegistrationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
