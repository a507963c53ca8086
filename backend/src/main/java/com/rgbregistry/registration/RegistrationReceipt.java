package com.rgbregistry.registration;

import java.time.Instant;

/**
 * Accepted submission: store-assigned id, echoed addresses and acceptance time.
 */
public record RegistrationReceipt(long id, String ethAddress, String rgbAddress, Instant timestamp) {
}
