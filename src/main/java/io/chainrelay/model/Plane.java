package io.chainrelay.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Plane {
    CONTROL,
    EXECUTION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
