package com.vestlock.application.service;

import com.vestlock.application.port.in.DepositUseCase.DepositCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DepositValidator
 */
class DepositValidatorTest {

    private DepositValidator validator;

    @BeforeEach
    void setUp() {
        validator = new DepositValidator();
    }

    @Test
    void testValidDeposit() {
        ValidationResult result = validator.validate(command("alice", "native", "1000", "1000"));

        assertTrue(result.isValid(), "Valid deposit should pass validation");
        assertTrue(result.errors().isEmpty(), "No errors expected for valid deposit");
    }

    @Test
    void testValidTokenDepositWithZeroDuration() {
        ValidationResult result = validator.validate(
                command("alice", "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48", "1", "0"));

        assertTrue(result.isValid(), "Zero duration is allowed");
    }

    @Test
    void testWholeNumbersWithScaleAreAccepted() {
        ValidationResult result = validator.validate(command("alice", "native", "1000.00", "1E+3"));

        assertTrue(result.isValid(), "1000.00 and 1E+3 are whole numbers");
    }

    @Test
    void testMissingRequiredFields() {
        ValidationResult result = validator.validate(new DepositCommand(null, null, null, null));

        assertFalse(result.isValid(), "Should fail with missing fields");
        assertEquals(4, result.errors().size(), "Should have 4 errors for missing fields");
    }

    @Test
    void testZeroAmount() {
        ValidationResult result = validator.validate(command("alice", "native", "0", "1000"));

        assertFalse(result.isValid());
        assertTrue(result.errors().contains("amount must be greater than zero"));
    }

    @Test
    void testNegativeAmount() {
        ValidationResult result = validator.validate(command("alice", "native", "-5", "1000"));

        assertFalse(result.isValid());
    }

    @Test
    void testFractionalAmount() {
        ValidationResult result = validator.validate(command("alice", "native", "1.9", "1000"));

        assertFalse(result.isValid(), "Fractional amount must not be truncated");
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().contains("amount must be a whole number of base units"));
    }

    @Test
    void testAmountBeyond256Bits() {
        ValidationResult result = validator.validate(new DepositCommand("alice", "native",
                new BigDecimal(BigInteger.ONE.shiftLeft(256)), BigDecimal.valueOf(1000)));

        assertFalse(result.isValid());
        assertTrue(result.errors().get(0).contains("256 bits"));
    }

    @Test
    void testLargestAmountAccepted() {
        BigInteger maxUint256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

        ValidationResult result = validator.validate(new DepositCommand("alice", "native",
                new BigDecimal(maxUint256), BigDecimal.valueOf(1000)));

        assertTrue(result.isValid());
    }

    @Test
    void testNegativeDuration() {
        ValidationResult result = validator.validate(command("alice", "native", "10", "-1"));

        assertFalse(result.isValid());
        assertTrue(result.errors().contains("durationSeconds must not be negative"));
    }

    @Test
    void testFractionalDuration() {
        ValidationResult result = validator.validate(command("alice", "native", "10", "0.5"));

        assertFalse(result.isValid(), "Fractional duration must not be truncated");
        assertTrue(result.errors().contains("durationSeconds must be a whole number"));
    }

    @Test
    void testDurationAboveMaximum() {
        ValidationResult result = validator.validate(new DepositCommand("alice", "native",
                BigDecimal.TEN, BigDecimal.valueOf(DepositValidator.MAX_DURATION_SECONDS + 1)));

        assertFalse(result.isValid());
    }

    @Test
    void testBlankCaller() {
        ValidationResult result = validator.validate(command("  ", "native", "10", "10"));

        assertFalse(result.isValid());
        assertEquals(1, result.errors().size());
        assertEquals("caller is required", result.errors().get(0));
    }

    private static DepositCommand command(String caller, String asset, String amount, String durationSeconds) {
        return new DepositCommand(caller, asset, new BigDecimal(amount), new BigDecimal(durationSeconds));
    }
}
