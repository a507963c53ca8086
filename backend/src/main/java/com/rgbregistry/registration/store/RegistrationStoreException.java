package com.rgbregistry.registration.store;

/**
 * Thrown when the registration store cannot be read (I/O, closed store). The cause is for logs only.
 */
public class RegistrationStoreException extends RuntimeException {

    public RegistrationStoreException(String message) {
        super(message);
    }

    public RegistrationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
