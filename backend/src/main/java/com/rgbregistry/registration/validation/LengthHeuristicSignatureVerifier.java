package com.rgbregistry.registration.validation;

/**
 * Accepts any signature of at least minLength characters. Does not recover the signer, so the
 * claimed address is not bound to the signature.
 */
public class LengthHeuristicSignatureVerifier implements SignatureVerifier {

    public static final int DEFAULT_MIN_LENGTH = 100;

    private final int minLength;

    public LengthHeuristicSignatureVerifier(int minLength) {
        if (minLength <= 0) {
            throw new IllegalArgumentException("minLength must be positive");
        }
        this.minLength = minLength;
    }

    @Override
    public boolean verify(String message, String signature, String claimedAddress) {
        return signature != null && signature.length() >= minLength;
    }
}
