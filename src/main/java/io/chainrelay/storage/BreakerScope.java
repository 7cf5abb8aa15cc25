package io.chainrelay.storage;

import io.chainrelay.model.CanonicalIntent;

import java.util.Locale;

/** Granularity at which connector failures trip the circuit breaker. */
public enum BreakerScope {
    CONNECTOR,
    CHAIN,
    GLOBAL;

    public String keyFor(CanonicalIntent intent) {
        return switch (this) {
            case CONNECTOR -> "connector:" + intent.connectorId();
            case CHAIN -> "chain:" + intent.chains().get(0);
            case GLOBAL -> "global";
        };
    }

    public static BreakerScope parse(String raw, BreakerScope fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported breaker scope: " + raw, e);
        }
    }
}
