package com.rgbregistry.registration.validation;

/**
 * Checks that a signature over the message was produced by the claimed EVM address.
 * Called by RegistrationValidator only after the address formats have been accepted.
 */
public interface SignatureVerifier {

    /**
     * @param message        the signed payload, non-empty
     * @param signature      signature as submitted, non-empty
     * @param claimedAddress EVM address the registration claims, already format-checked
     * @return true if the signature is accepted for the claimed address
     */
    boolean verify(String message, String signature, String claimedAddress);
}
