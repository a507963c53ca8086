package com.rgbregistry.registration.validation;

/**
 * Valid when failure is null; otherwise carries the first violated rule.
 */
public record ValidationResult(ValidationFailure failure) {

    private static final ValidationResult VALID = new ValidationResult(null);

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(ValidationFailure failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure must not be null");
        }
        return new ValidationResult(failure);
    }

    public boolean isValid() {
        return failure == null;
    }
}
