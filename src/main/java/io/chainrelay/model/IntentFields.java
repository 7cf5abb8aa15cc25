package io.chainrelay.model;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;

/**
 * Normalisation shared by the intent records. Every method throws
 * {@link IllegalArgumentException} naming the offending field.
 */
final class IntentFields {
    static final String MAINNET = "mainnet";
    private static final Set<String> SIDES = Set.of("buy", "sell");
    private static final Set<String> MARKET_TYPES = Set.of("spot", "perp");

    private IntentFields() {
    }

    static String id(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    static String idOrDefault(String raw, String fallback) {
        return raw == null || raw.isBlank() ? fallback : raw.trim().toLowerCase(Locale.ROOT);
    }

    static String network(String raw) {
        return idOrDefault(raw, MAINNET);
    }

    static String symbol(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return raw.trim().toUpperCase(Locale.ROOT);
    }

    static String address(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return normalizeAddress(raw);
    }

    static String optionalAddress(String raw) {
        return raw == null || raw.isBlank() ? null : normalizeAddress(raw);
    }

    /** EVM hex addresses compare case-insensitively; base58 and other encodings do not. */
    static String normalizeAddress(String raw) {
        String value = raw.trim();
        if (value.startsWith("0x") || value.startsWith("0X")) {
            return value.toLowerCase(Locale.ROOT);
        }
        return value;
    }

    static String amount(String raw, String field) {
        BigDecimal value = decimal(raw, field);
        if (value.signum() <= 0) {
            throw new IllegalArgumentException(field + " must be greater than zero");
        }
        return value.stripTrailingZeros().toPlainString();
    }

    static String optionalAmount(String raw, String field) {
        return raw == null || raw.isBlank() ? null : amount(raw, field);
    }

    static BigDecimal decimal(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " must be a decimal string: " + raw);
        }
    }

    static Integer bps(Integer raw, String field) {
        if (raw == null) {
            return null;
        }
        if (raw < 0 || raw > 10_000) {
            throw new IllegalArgumentException(field + " must be within 0..10000");
        }
        return raw;
    }

    static String side(String raw) {
        String side = id(raw, "side");
        if (!SIDES.contains(side)) {
            throw new IllegalArgumentException("side must be buy or sell");
        }
        return side;
    }

    static String marketType(String raw) {
        String type = idOrDefault(raw, "perp");
        if (!MARKET_TYPES.contains(type)) {
            throw new IllegalArgumentException("marketType must be spot or perp");
        }
        return type;
    }

    static String optionalText(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }
}
