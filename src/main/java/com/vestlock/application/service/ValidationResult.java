package com.vestlock.application.service;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of validating a command: valid, or the list of every problem found
 */
public record ValidationResult(boolean isValid, List<String> errors) {

    public static ValidationResult valid() {
        return new ValidationResult(true, Collections.emptyList());
    }

    public static ValidationResult invalid(List<String> errors) {
        return new ValidationResult(false, Collections.unmodifiableList(errors));
    }

    /**
     * Errors joined into one message, e.g. for an IllegalArgumentException
     */
    public String describe() {
        return String.join("; ", errors);
    }
}
