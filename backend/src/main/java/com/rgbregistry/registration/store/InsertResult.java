package com.rgbregistry.registration.store;

/**
 * Outcome of RegistrationStore.insert. id is set only for CREATED, cause only for STORE_FAILURE.
 */
public record InsertResult(Outcome outcome, Long id, Throwable cause) {

    public enum Outcome {
        CREATED,
        CONFLICT,
        STORE_FAILURE
    }

    public static InsertResult created(long id) {
        return new InsertResult(Outcome.CREATED, id, null);
    }

    public static InsertResult conflict() {
        return new InsertResult(Outcome.CONFLICT, null, null);
    }

    public static InsertResult failure(Throwable cause) {
        return new InsertResult(Outcome.STORE_FAILURE, null, cause);
    }
}
