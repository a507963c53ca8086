package com.rgbregistry.api.dto;

/**
 * GET /registrations failure body, mirrors RegistrationListResponse with success=false.
 */
public record RegistrationListFailureResponse(boolean success, String error) {

    public static RegistrationListFailureResponse of(String error) {
        return new RegistrationListFailureResponse(false, error);
    }
}
