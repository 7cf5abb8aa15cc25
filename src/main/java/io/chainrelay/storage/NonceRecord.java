package io.chainrelay.storage;

public record NonceRecord(String keyId, String nonce, long timestampMs, long seenAtMs, long expiresAtMs) {
}
