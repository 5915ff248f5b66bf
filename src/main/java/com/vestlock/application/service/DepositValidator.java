package com.vestlock.application.service;

import com.vestlock.application.port.in.DepositUseCase.DepositCommand;
import com.vestlock.domain.model.AssetRef;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates incoming deposit requests
 */
public class DepositValidator {

    // 1000 years; keeps creationTime + duration far inside the Instant range
    static final long MAX_DURATION_SECONDS = 1000L * 365 * 24 * 60 * 60;

    // Amounts are uint256 quantities
    private static final int MAX_AMOUNT_BITS = 256;

    public ValidationResult validate(DepositCommand command) {
        List<String> errors = new ArrayList<>();

        validateRequiredFields(command, errors);
        validateAsset(command, errors);
        validateAmount(command, errors);
        validateDuration(command, errors);

        if (errors.isEmpty()) {
            return ValidationResult.valid();
        } else {
            return ValidationResult.invalid(errors);
        }
    }

    private void validateRequiredFields(DepositCommand command, List<String> errors) {
        if (isBlank(command.caller())) {
            errors.add("caller is required");
        }
        if (isBlank(command.asset())) {
            errors.add("asset is required");
        }
        if (command.amount() == null) {
            errors.add("amount is required");
        }
        if (command.durationSeconds() == null) {
            errors.add("durationSeconds is required");
        }
    }

    private void validateAsset(DepositCommand command, List<String> errors) {
        if (isBlank(command.asset())) {
            return;
        }
        try {
            AssetRef.parse(command.asset());
        } catch (IllegalArgumentException e) {
            errors.add("asset is invalid: " + e.getMessage());
        }
    }

    private void validateAmount(DepositCommand command, List<String> errors) {
        BigDecimal amount = command.amount();
        if (amount == null) {
            return;
        }
        if (amount.signum() <= 0) {
            errors.add("amount must be greater than zero");
        } else if (!isWholeNumber(amount)) {
            errors.add("amount must be a whole number of base units");
        } else if (amount.toBigIntegerExact().bitLength() > MAX_AMOUNT_BITS) {
            errors.add("amount exceeds " + MAX_AMOUNT_BITS + " bits");
        }
    }

    private void validateDuration(DepositCommand command, List<String> errors) {
        BigDecimal duration = command.durationSeconds();
        if (duration == null) {
            return;
        }
        if (!isWholeNumber(duration)) {
            errors.add("durationSeconds must be a whole number");
        } else if (duration.signum() < 0) {
            errors.add("durationSeconds must not be negative");
        } else if (duration.compareTo(BigDecimal.valueOf(MAX_DURATION_SECONDS)) > 0) {
            errors.add("durationSeconds exceeds maximum of " + MAX_DURATION_SECONDS);
        }
    }

    // 1.0 and 1E+3 are whole, 1.9 is not
    private boolean isWholeNumber(BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
