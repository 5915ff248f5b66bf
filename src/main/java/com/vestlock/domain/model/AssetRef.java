package com.vestlock.domain.model;

import java.util.Objects;

/**
 * Reference to the fungible asset a lock is denominated in.
 * Either the native chain asset or a token identified by its reference (contract address, symbol...).
 */
public record AssetRef(AssetType type, String reference) {

    private static final String NATIVE_KEY = "native";

    public AssetRef {
        Objects.requireNonNull(type, "asset type must not be null");
        if (type == AssetType.NATIVE) {
            if (reference != null) {
                throw new IllegalArgumentException("native asset carries no reference");
            }
        } else if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("token asset requires a reference");
        } else if (NATIVE_KEY.equalsIgnoreCase(reference.trim())) {
            // The external form of a token is its reference, so "native" would alias the native asset
            throw new IllegalArgumentException("token reference '" + reference + "' is reserved");
        }
    }

    public static AssetRef nativeAsset() {
        return new AssetRef(AssetType.NATIVE, null);
    }

    public static AssetRef token(String reference) {
        return new AssetRef(AssetType.TOKEN, reference.trim());
    }

    /**
     * Parse the external form: "native" or the token reference itself
     */
    public static AssetRef parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("asset is required");
        }
        String trimmed = value.trim();
        return NATIVE_KEY.equalsIgnoreCase(trimmed) ? nativeAsset() : token(trimmed);
    }

    public boolean isNative() {
        return type == AssetType.NATIVE;
    }

    // External form, inverse of parse()
    public String key() {
        return isNative() ? NATIVE_KEY : reference;
    }

    @Override
    public String toString() {
        return key();
    }
}
