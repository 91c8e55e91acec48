package com.example.hostguard.registry;

/**
 * Raised by {@link HostRegistry#require(String)} when a caller insists on a
 * host that the registry does not know.
 */
public class InvalidTargetException extends RuntimeException {

    private final HostValidationResult validation;

    public InvalidTargetException(HostValidationResult validation) {
        super(validation.getSuggestionText());
        this.validation = validation;
    }

    public HostValidationResult getValidation() {
        return validation;
    }
}
