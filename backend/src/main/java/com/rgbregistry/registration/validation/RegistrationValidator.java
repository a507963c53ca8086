package com.rgbregistry.registration.validation;

import com.rgbregistry.registration.RegistrationCandidate;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Structural checks for POST /submit, in fixed order: presence, ETH address, RGB address, signature.
 * The first failing check is the reported reason. No I/O; safe to call concurrently.
 */
@Component
public class RegistrationValidator {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[a-fA-F0-9]{40}$");
    /** Taproot (bech32m) mainnet HRP. Checksum is not verified. */
    private static final String TAPROOT_PREFIX = "bc1";

    private final SignatureVerifier signatureVerifier;

    public RegistrationValidator(SignatureVerifier signatureVerifier) {
        this.signatureVerifier = signatureVerifier;
    }

    public ValidationResult validate(RegistrationCandidate candidate) {
        if (candidate == null
                || isEmpty(candidate.ethAddress())
                || isEmpty(candidate.rgbAddress())
                || isEmpty(candidate.signature())
                || isEmpty(candidate.message())) {
            return ValidationResult.invalid(ValidationFailure.MISSING_FIELDS);
        }
        if (!isValidEthAddress(candidate.ethAddress())) {
            return ValidationResult.invalid(ValidationFailure.INVALID_ETH_ADDRESS);
        }
        if (!isValidRgbAddress(candidate.rgbAddress())) {
            return ValidationResult.invalid(ValidationFailure.INVALID_RGB_ADDRESS);
        }
        if (!signatureVerifier.verify(candidate.message(), candidate.signature(), candidate.ethAddress())) {
            return ValidationResult.invalid(ValidationFailure.SIGNATURE_VERIFICATION_FAILED);
        }
        return ValidationResult.valid();
    }

    public boolean isValidEthAddress(String address) {
        return address != null && EVM_ADDRESS.matcher(address).matches();
    }

    public boolean isValidRgbAddress(String address) {
        return address != null && address.startsWith(TAPROOT_PREFIX);
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
