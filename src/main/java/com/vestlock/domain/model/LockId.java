package com.vestlock.domain.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Opaque lock identifier: a non-negative integer of at most 256 bits, rendered as 0x-prefixed hex
 */
public record LockId(BigInteger value) implements Comparable<LockId> {

    private static final int MAX_BITS = 256;

    public LockId {
        Objects.requireNonNull(value, "lock id value must not be null");
        if (value.signum() < 0 || value.bitLength() > MAX_BITS) {
            throw new IllegalArgumentException("lock id out of range: " + value);
        }
    }

    public static LockId of(long value) {
        return new LockId(BigInteger.valueOf(value));
    }

    /**
     * Accepts 0x-prefixed hex or plain decimal
     */
    public static LockId parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("lock id is required");
        }
        String trimmed = text.trim();
        try {
            if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
                return new LockId(new BigInteger(trimmed.substring(2), 16));
            }
            return new LockId(new BigInteger(trimmed));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid lock id: " + text, e);
        }
    }

    public String toHex() {
        return "0x" + value.toString(16);
    }

    @Override
    public int compareTo(LockId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
