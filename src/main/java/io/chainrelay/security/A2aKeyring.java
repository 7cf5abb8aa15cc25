package io.chainrelay.security;

import java.util.Optional;

/** Resolves the shared HMAC secret for an A2A key id. Secrets never leave this boundary. */
public interface A2aKeyring {
    Optional<byte[]> secretFor(String keyId);
}
