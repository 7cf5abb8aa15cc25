package io.chainrelay.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chainrelay.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks secret-looking members before anything reaches the audit trail. Identifiers the
 * audit trail exists to record (key ids, idempotency keys, hashes, addresses, nonces)
 * pass through.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key",
            "privatekey", "private_key", "mnemonic", "seed", "credential", "signature"
    );
    private static final Set<String> PASS_THROUGH_KEYS = Set.of(
            "keyid", "idempotencykey", "idempotency_key", "hash", "prev_hash", "nonce",
            "recipient", "target", "txhash", "tx_hash", "runid", "run_id"
    );

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String key = entry.getKey();
                if (isPassThrough(key)) {
                    out.set(key, entry.getValue());
                } else if (isSensitiveKey(key)) {
                    out.put(key, MASK);
                } else {
                    out.set(key, masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual() && likelySecretValue(input.asText(""))) {
            return Jsons.mapper().valueToTree(MASK);
        }
        return input;
    }

    private static boolean isPassThrough(String rawKey) {
        return rawKey != null && PASS_THROUGH_KEYS.contains(rawKey.toLowerCase(Locale.ROOT));
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        String v = value.trim();
        // 64-byte hex private keys and long base64 blobs; hex addresses and hashes stay readable.
        if (v.matches("^(0x)?[0-9a-fA-F]{128}$")) {
            return true;
        }
        return v.length() >= 88 && v.matches("^[A-Za-z0-9+/=_\\-]+$");
    }
}
