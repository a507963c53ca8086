package com.rgbregistry.api.controller;

import com.rgbregistry.api.dto.RegistrationItemResponse;
import com.rgbregistry.api.dto.RegistrationListResponse;
import com.rgbregistry.api.dto.SubmitRegistrationRequest;
import com.rgbregistry.api.dto.SubmitRegistrationResponse;
import com.rgbregistry.registration.RegistrationReceipt;
import com.rgbregistry.registration.RegistrationService;
import com.rgbregistry.registration.store.Registration;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /submit, GET /registrations. Rejections are mapped by RegistrationExceptionHandler.
 */
@RestController
@RequiredArgsConstructor
public class RegistrationController {

    private final RegistrationService registrationService;

    @PostMapping("/submit")
    public ResponseEntity<SubmitRegistrationResponse> submit(@RequestBody SubmitRegistrationRequest request) {
        RegistrationReceipt receipt = registrationService.submit(request.toCandidate());
        return ResponseEntity.ok(new SubmitRegistrationResponse(
                true,
                "Registration successful",
                receipt.ethAddress(),
                receipt.rgbAddress(),
                receipt.timestamp()));
    }

    @GetMapping("/registrations")
    public ResponseEntity<RegistrationListResponse> listRegistrations() {
        return ResponseEntity.ok(new RegistrationListResponse(
                true,
                registrationService.listRegistrations().stream()
                        .map(RegistrationController::toItem)
                        .toList()));
    }

    private static RegistrationItemResponse toItem(Registration r) {
        return new RegistrationItemResponse(
                r.id(),
                r.ethAddress(),
                r.rgbAddress(),
                r.signature(),
                r.message(),
                r.createdAt(),
                r.updatedAt());
    }
}
