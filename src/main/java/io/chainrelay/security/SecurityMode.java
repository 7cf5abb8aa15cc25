package io.chainrelay.security;

import com.fasterxml.jackson.annotation.JsonValue;
import io.chainrelay.model.ErrorCode;
import io.chainrelay.model.OperatorException;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * How strictly execution-plane payloads are authenticated.
 * <ul>
 *   <li>{@code DISABLED}: no verification.</li>
 *   <li>{@code PERMISSIVE}: unsigned dry-runs pass; unsigned live requests need an explicit override.</li>
 *   <li>{@code ENFORCE}: every payload must carry a valid signature and a fresh nonce.</li>
 * </ul>
 */
public enum SecurityMode {
    DISABLED,
    PERMISSIVE,
    ENFORCE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SecurityMode parse(String raw, SecurityMode fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SecurityMode mode : values()) {
            if (mode.wireName().equals(normalized)) {
                return mode;
            }
        }
        throw new OperatorException(
                ErrorCode.A2A_CONFIG_INVALID,
                "Invalid A2A security mode: " + raw,
                Map.of("allowed", List.of("disabled", "permissive", "enforce"))
        );
    }
}
