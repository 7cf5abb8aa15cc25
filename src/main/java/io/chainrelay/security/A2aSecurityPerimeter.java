package io.chainrelay.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chainrelay.model.ErrorCode;
import io.chainrelay.model.OperatorError;
import io.chainrelay.model.OperatorException;
import io.chainrelay.storage.NonceStore;
import io.chainrelay.util.Hashing;
import io.chainrelay.util.Jsons;

import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Authenticates execution-plane payloads signed with HMAC-SHA256.
 *
 * <p>The signed bytes are the canonical JSON of the whole payload with only
 * {@code auth.signature} removed, so the key id, nonce and timestamp are covered by the
 * signature. Checks run in this order: auth shape, key lookup, signature, timestamp
 * window, nonce. A payload that fails any of them never reaches a connector.
 */
public final class A2aSecurityPerimeter {
    public static final String SCHEME = "hmac-sha256-v1";
    private static final int HMAC_BYTES = 32;
    private static final int MIN_NONCE_CHARS = 8;
    private static final int MAX_NONCE_CHARS = 200;
    private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]+$");

    private final A2aKeyring keyring;
    private final NonceStore nonces;
    private final Clock clock;
    private final Settings settings;

    public A2aSecurityPerimeter(A2aKeyring keyring, NonceStore nonces, Clock clock, Settings settings) {
        this.keyring = keyring;
        this.nonces = nonces;
        this.clock = clock;
        this.settings = settings;
    }

    public SecurityMode mode() {
        return settings.mode();
    }

    public AuthResult authenticate(JsonNode payload, boolean dryRun) {
        return authenticate(payload, settings.mode(), dryRun);
    }

    public AuthResult authenticate(JsonNode payload, SecurityMode mode, boolean dryRun) {
        if (mode == SecurityMode.DISABLED) {
            return AuthResult.passed(mode, null, "security_disabled");
        }
        JsonNode auth = payload == null ? null : payload.get("auth");
        if (auth == null || auth.isNull()) {
            return unsigned(mode, dryRun);
        }
        String keyId = auth.path("keyId").asText("").trim();
        try {
            Credentials credentials = credentials(auth);
            Optional<byte[]> secret = keyring.secretFor(credentials.keyId());
            if (secret.isEmpty()) {
                if (mode == SecurityMode.PERMISSIVE && dryRun) {
                    return AuthResult.passed(mode, credentials.keyId(), "unknown_key_dry_run");
                }
                throw new OperatorException(ErrorCode.A2A_KEY_UNKNOWN, "Unknown A2A key id: " + credentials.keyId(),
                        Map.of("keyId", credentials.keyId()));
            }
            verifySignature(payload, credentials, secret.get());
            long timestampMs = checkTimestamps(payload, credentials);
            nonces.register(credentials.keyId(), credentials.nonce(), timestampMs);
            return AuthResult.verified(mode, credentials.keyId());
        } catch (OperatorException e) {
            return AuthResult.rejected(mode, keyId.isEmpty() ? null : keyId, e.error());
        }
    }

    /** The exact string a sender signs for {@code payload}. */
    public static String signingInput(JsonNode payload) {
        JsonNode copy = payload.deepCopy();
        JsonNode auth = copy.get("auth");
        if (auth instanceof ObjectNode authObject) {
            authObject.remove("signature");
        }
        return Jsons.canonical(copy);
    }

    /** Hex signature for {@code payload} under {@code secret}; used by senders and tooling. */
    public static String sign(JsonNode payload, byte[] secret) {
        return Hashing.toHex(Hashing.hmacSha256(secret, signingInput(payload)));
    }

    private AuthResult unsigned(SecurityMode mode, boolean dryRun) {
        if (mode == SecurityMode.PERMISSIVE) {
            if (dryRun) {
                return AuthResult.passed(mode, null, "unsigned_dry_run");
            }
            if (settings.allowUnsignedLive()) {
                return AuthResult.passed(mode, null, "unsigned_live_override");
            }
        }
        return AuthResult.rejected(mode, null, OperatorError.of(
                ErrorCode.A2A_AUTH_REQUIRED,
                mode == SecurityMode.ENFORCE
                        ? "Signed auth is required in enforce mode"
                        : "Signed auth is required for live execution",
                Map.of("mode", mode.wireName(), "dryRun", dryRun)
        ));
    }

    private Credentials credentials(JsonNode auth) {
        if (!auth.isObject()) {
            throw new OperatorException(ErrorCode.A2A_AUTH_INVALID, "auth must be an object");
        }
        List<String> missing = new ArrayList<>();
        String keyId = text(auth, "keyId", missing);
        String nonce = text(auth, "nonce", missing);
        String timestamp = text(auth, "timestamp", missing);
        String signature = text(auth, "signature", missing);
        if (!missing.isEmpty()) {
            throw new OperatorException(ErrorCode.A2A_AUTH_INVALID, "auth is incomplete",
                    Map.of("missing", missing));
        }
        JsonNode scheme = auth.get("scheme");
        if (scheme != null && !scheme.isNull() && !SCHEME.equals(scheme.asText())) {
            throw new OperatorException(ErrorCode.A2A_AUTH_SCHEME_UNSUPPORTED, "Unsupported auth scheme: " + scheme.asText(),
                    Map.of("scheme", scheme.asText(), "supported", SCHEME));
        }
        if (nonce.length() < MIN_NONCE_CHARS || nonce.length() > MAX_NONCE_CHARS) {
            throw new OperatorException(ErrorCode.A2A_AUTH_INVALID, "nonce length must be within "
                    + MIN_NONCE_CHARS + ".." + MAX_NONCE_CHARS);
        }
        return new Credentials(keyId, nonce, timestamp, signature);
    }

    private void verifySignature(JsonNode payload, Credentials credentials, byte[] secret) {
        byte[] expected = Hashing.hmacSha256(secret, signingInput(payload));
        byte[] provided = decodeSignature(credentials.signature());
        if (provided == null || !MessageDigest.isEqual(expected, provided)) {
            throw new OperatorException(ErrorCode.A2A_SIGNATURE_INVALID, "Signature does not match payload",
                    Map.of("keyId", credentials.keyId()));
        }
    }

    private long checkTimestamps(JsonNode payload, Credentials credentials) {
        long authMs = parseTimestamp(credentials.timestamp(), "auth.timestamp");
        long now = clock.millis();
        long skew = Math.abs(now - authMs);
        if (skew > settings.maxSkewMs()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("timestamp", credentials.timestamp());
            details.put("now", Instant.ofEpochMilli(now).toString());
            details.put("skewMs", skew);
            details.put("maxSkewMs", settings.maxSkewMs());
            throw new OperatorException(ErrorCode.A2A_TIMESTAMP_WINDOW_EXCEEDED, "auth.timestamp is outside the accepted window", details);
        }
        JsonNode metaTimestamp = payload.path("meta").path("timestamp");
        if (metaTimestamp.isTextual() && !metaTimestamp.asText().isBlank()) {
            long metaMs = parseTimestamp(metaTimestamp.asText(), "meta.timestamp");
            long drift = Math.abs(metaMs - authMs);
            if (drift > settings.maxSkewMs()) {
                throw new OperatorException(ErrorCode.A2A_TIMESTAMP_DRIFT_EXCEEDED,
                        "auth.timestamp and meta.timestamp disagree",
                        Map.of("driftMs", drift, "maxSkewMs", settings.maxSkewMs()));
            }
        }
        return authMs;
    }

    private static long parseTimestamp(String raw, String field) {
        try {
            return Instant.parse(raw.trim()).toEpochMilli();
        } catch (DateTimeParseException e) {
            throw new OperatorException(
                    OperatorError.of(ErrorCode.A2A_TIMESTAMP_INVALID, field + " is not an ISO-8601 instant",
                            Map.of("field", field, "value", raw)),
                    e
            );
        }
    }

    /** Accepts hex (optionally 0x-prefixed) or base64; returns null when neither yields 32 bytes. */
    static byte[] decodeSignature(String raw) {
        String trimmed = raw.trim();
        String hex = trimmed.startsWith("0x") || trimmed.startsWith("0X") ? trimmed.substring(2) : trimmed;
        if (hex.length() == HMAC_BYTES * 2 && HEX.matcher(hex).matches()) {
            return HexFormat.of().parseHex(hex);
        }
        for (Base64.Decoder decoder : List.of(Base64.getDecoder(), Base64.getUrlDecoder())) {
            try {
                byte[] decoded = decoder.decode(trimmed);
                if (decoded.length == HMAC_BYTES) {
                    return decoded;
                }
            } catch (IllegalArgumentException ignored) {
                // not this alphabet
            }
        }
        return null;
    }

    private static String text(JsonNode auth, String field, List<String> missing) {
        JsonNode node = auth.get(field);
        String value = node == null || node.isNull() ? "" : node.asText("").trim();
        if (value.isEmpty()) {
            missing.add(field);
        }
        return value;
    }

    private record Credentials(String keyId, String nonce, String timestamp, String signature) {
    }

    public record Settings(SecurityMode mode, boolean allowUnsignedLive, long maxSkewMs) {
    }
}
