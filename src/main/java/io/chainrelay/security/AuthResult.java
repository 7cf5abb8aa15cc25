package io.chainrelay.security;

import io.chainrelay.model.OperatorError;

/**
 * Outcome of authenticating one execution payload. {@code verified} is true only when a
 * signature was checked and its nonce consumed; {@code ok} may be true without it in the
 * relaxed modes.
 */
public record AuthResult(
        boolean ok,
        boolean verified,
        SecurityMode mode,
        String keyId,
        String reason,
        OperatorError error
) {
    static AuthResult verified(SecurityMode mode, String keyId) {
        return new AuthResult(true, true, mode, keyId, "signature_verified", null);
    }

    static AuthResult passed(SecurityMode mode, String keyId, String reason) {
        return new AuthResult(true, false, mode, keyId, reason, null);
    }

    static AuthResult rejected(SecurityMode mode, String keyId, OperatorError error) {
        return new AuthResult(false, false, mode, keyId, "rejected", error);
    }
}
