package com.vestlock.domain.model;

/**
 * Lifecycle state of a lock. A lock never returns to ACTIVE once WITHDRAWN.
 */
public enum LockState {
    ACTIVE("ACTIVE"),
    WITHDRAWN("WITHDRAWN");

    private final String value;

    LockState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static LockState fromValue(String value) {
        for (LockState state : values()) {
            if (state.value.equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown lock state: " + value);
    }
}
