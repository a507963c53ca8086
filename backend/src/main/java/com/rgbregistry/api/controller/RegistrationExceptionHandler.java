package com.rgbregistry.api.controller;

import com.rgbregistry.api.dto.ErrorBody;
import com.rgbregistry.api.dto.RegistrationListFailureResponse;
import com.rgbregistry.registration.RegistrationException;
import com.rgbregistry.registration.RegistrationService;
import com.rgbregistry.registration.config.RegistrationProperties;
import com.rgbregistry.registration.store.RegistrationStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps submit failures to ErrorBody and list failures to {success:false, error}. Store causes are logged,
 * never returned.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class RegistrationExceptionHandler {

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";
    static final String INVALID_REQUEST = "INVALID_REQUEST";
    static final String FETCH_FAILED = "Failed to fetch registrations";

    private final RegistrationProperties registrationProperties;

    @ExceptionHandler(RegistrationException.class)
    public ResponseEntity<ErrorBody> handleRegistration(RegistrationException ex) {
        if (RegistrationService.STORE_FAILURE.equals(ex.getErrorCode())) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ErrorBody.of(INTERNAL_ERROR, "Internal server error"));
        }
        return ResponseEntity.status(statusFor(ex.getErrorCode()))
                .body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(RegistrationStoreException.class)
    public ResponseEntity<RegistrationListFailureResponse> handleStore(RegistrationStoreException ex) {
        log.error("Error fetching registrations", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(RegistrationListFailureResponse.of(FETCH_FAILED));
    }

    /** Absent or unparseable JSON body. */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        log.debug("Unreadable request: {}", ex.getReason());
        return ResponseEntity.badRequest().body(ErrorBody.of(INVALID_REQUEST, "Malformed request body"));
    }

    private HttpStatusCode statusFor(String errorCode) {
        return switch (errorCode) {
            case "MISSING_FIELDS", "INVALID_ETH_ADDRESS", "INVALID_RGB_ADDRESS" -> HttpStatus.BAD_REQUEST;
            case "SIGNATURE_VERIFICATION_FAILED" -> HttpStatus.UNAUTHORIZED;
            case RegistrationService.REGISTRATION_EXISTS -> registrationProperties.getConflictStatus();
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
