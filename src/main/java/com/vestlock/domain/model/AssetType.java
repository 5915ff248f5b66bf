package com.vestlock.domain.model;

/**
 * Kind of asset a lock is denominated in
 */
public enum AssetType {
    NATIVE("NATIVE"),
    TOKEN("TOKEN");

    private final String value;

    AssetType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static AssetType fromValue(String value) {
        for (AssetType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown asset type: " + value);
    }
}
