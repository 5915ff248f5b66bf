package com.vestlock.infrastructure.config;

import io.vertx.core.json.JsonObject;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable ledger configuration, parsed once from the merged ConfigRetriever output.
 * Nested YAML keys (http: port:) can be overridden by flat keys (-Dhttp.port=9090).
 */
public record LedgerConfig(
        int httpPort,
        IdStrategy idStrategy,
        long idOrigin,
        OwnershipMode ownership,
        StoreType store,
        JsonObject database,
        long auditIntervalMs
) {

    public static final int DEFAULT_PORT = 8080;
    public static final long DEFAULT_AUDIT_INTERVAL_MS = 60_000L;

    /** How new lock ids are produced */
    public enum IdStrategy { SEQUENTIAL, CONTENT_HASH }

    /** Who may withdraw: the owner stored in the lock, or the holder known to the position registry */
    public enum OwnershipMode { RECORD, REGISTRY }

    public enum StoreType { MEMORY, JDBC }

    public LedgerConfig {
        // 0 binds an ephemeral port
        if (httpPort < 0 || httpPort > 65535) {
            throw new IllegalArgumentException("http.port must be 0-65535");
        }
        Objects.requireNonNull(idStrategy, "ledger.idStrategy must not be null");
        Objects.requireNonNull(ownership, "ledger.ownership must not be null");
        Objects.requireNonNull(store, "ledger.store must not be null");
        if (idOrigin < 0) {
            throw new IllegalArgumentException("ledger.idOrigin must not be negative");
        }
        if (auditIntervalMs < 0) {
            throw new IllegalArgumentException("audit.intervalMs must not be negative");
        }
        if (store == StoreType.JDBC && (database == null || database.getString("url") == null)) {
            throw new IllegalArgumentException("database.url is required when ledger.store is JDBC");
        }
    }

    /**
     * Parse and validate configuration from JsonObject
     * @param json Merged configuration
     * @return Validated configuration
     * @throws IllegalArgumentException if validation fails
     */
    public static LedgerConfig from(JsonObject json) {
        return new LedgerConfig(
                intValue(json, "http", "port", DEFAULT_PORT),
                enumValue(json, "ledger", "idStrategy", IdStrategy.class, IdStrategy.CONTENT_HASH),
                longValue(json, "ledger", "idOrigin", 0L),
                enumValue(json, "ledger", "ownership", OwnershipMode.class, OwnershipMode.RECORD),
                enumValue(json, "ledger", "store", StoreType.class, StoreType.MEMORY),
                json.getJsonObject("database", new JsonObject()),
                longValue(json, "audit", "intervalMs", DEFAULT_AUDIT_INTERVAL_MS)
        );
    }

    public static LedgerConfig defaults() {
        return from(new JsonObject());
    }

    public boolean usesRegistry() {
        return ownership == OwnershipMode.REGISTRY;
    }

    private static Object lookup(JsonObject json, String section, String key) {
        Object flat = json.getValue(section + "." + key);
        if (flat != null) {
            return flat;
        }
        JsonObject nested = json.getJsonObject(section);
        return nested == null ? null : nested.getValue(key);
    }

    private static int intValue(JsonObject json, String section, String key, int defaultValue) {
        return (int) longValue(json, section, key, defaultValue);
    }

    private static long longValue(JsonObject json, String section, String key, long defaultValue) {
        Object value = lookup(json, section, key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(section + "." + key + " must be a number: " + value, e);
        }
    }

    private static <E extends Enum<E>> E enumValue(JsonObject json, String section, String key,
                                                   Class<E> type, E defaultValue) {
        Object value = lookup(json, section, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + section + "." + key + ": " + value, e);
        }
    }
}
