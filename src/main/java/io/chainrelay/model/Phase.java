package io.chainrelay.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Phase {
    SECURITY,
    POLICY,
    IDEMPOTENCY,
    BREAKER,
    ROUTE,
    DISPATCH,
    RESULT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
