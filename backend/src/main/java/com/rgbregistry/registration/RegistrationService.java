package com.rgbregistry.registration;

import com.rgbregistry.registration.store.InsertResult;
import com.rgbregistry.registration.store.Registration;
import com.rgbregistry.registration.store.RegistrationStore;
import com.rgbregistry.registration.validation.RegistrationValidator;
import com.rgbregistry.registration.validation.ValidationFailure;
import com.rgbregistry.registration.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * POST /submit pipeline: validate (fail fast, no store access), then a single atomic insert.
 * GET /registrations reads the store snapshot.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegistrationService {

    public static final String REGISTRATION_EXISTS = "REGISTRATION_EXISTS";
    public static final String STORE_FAILURE = "STORE_FAILURE";

    private static final int SIGNATURE_LOG_PREFIX = 10;

    private final RegistrationValidator validator;
    private final RegistrationStore store;

    /**
     * @throws RegistrationException with a ValidationFailure name, REGISTRATION_EXISTS or STORE_FAILURE
     */
    public RegistrationReceipt submit(RegistrationCandidate candidate) {
        log.info("Registration request received: ethAddress={}, rgbAddress={}, signature={}, messageLength={}",
                candidate.ethAddress(), candidate.rgbAddress(),
                abbreviate(candidate.signature()), candidate.message() != null ? candidate.message().length() : 0);

        ValidationResult validation = validator.validate(candidate);
        if (!validation.isValid()) {
            ValidationFailure failure = validation.failure();
            log.info("Registration rejected: {}", failure);
            throw new RegistrationException(failure.name(), failure.getMessage());
        }

        InsertResult result = store.insert(
                candidate.ethAddress(), candidate.rgbAddress(), candidate.signature(), candidate.message());
        return switch (result.outcome()) {
            case CREATED -> {
                log.info("Registration saved with id {}", result.id());
                yield new RegistrationReceipt(result.id(), candidate.ethAddress(), candidate.rgbAddress(), Instant.now());
            }
            case CONFLICT -> {
                log.info("Registration already exists for {} / {}", candidate.ethAddress(), candidate.rgbAddress());
                throw new RegistrationException(REGISTRATION_EXISTS,
                        "Registration already exists for this address combination");
            }
            case STORE_FAILURE -> {
                log.error("Failed to save registration for {}", candidate.ethAddress(), result.cause());
                throw new RegistrationException(STORE_FAILURE, "Failed to save registration", result.cause());
            }
        };
    }

    public List<Registration> listRegistrations() {
        return store.listAll();
    }

    private static String abbreviate(String signature) {
        if (signature == null || signature.isEmpty()) {
            return "none";
        }
        return signature.substring(0, Math.min(SIGNATURE_LOG_PREFIX, signature.length())) + "...";
    }
}
