package io.chainrelay.storage;

import io.chainrelay.model.ErrorCode;
import io.chainrelay.model.OperatorException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Consumed {@code (keyId, nonce)} pairs. A pair is refused while its record has not
 * expired; registration for one key id is serialised by that key's lock.
 */
public final class NonceStore {
    private final Database database;
    private final ScopedLocks locks;
    private final Clock clock;
    private final long ttlMs;

    public NonceStore(Database database, ScopedLocks locks, Clock clock, long ttlMs) {
        this.database = database;
        this.locks = locks;
        this.clock = clock;
        this.ttlMs = Math.max(1L, ttlMs);
    }

    /**
     * Records the nonce or fails with {@code A2A_NONCE_REPLAY} when the same pair is
     * still live. Expired pairs for the key are pruned first.
     */
    public NonceRecord register(String keyId, String nonce, long timestampMs) {
        try (ScopedLock ignored = locks.acquire(keyId)) {
            long now = clock.millis();
            try (Connection c = database.openConnection()) {
                try (PreparedStatement prune = c.prepareStatement(
                        "DELETE FROM a2a_nonces WHERE key_id=? AND expires_at_ms<=?")) {
                    prune.setString(1, keyId);
                    prune.setLong(2, now);
                    prune.executeUpdate();
                }
                Optional<NonceRecord> seen = find(c, keyId, nonce);
                if (seen.isPresent()) {
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("keyId", keyId);
                    details.put("nonce", nonce);
                    details.put("firstSeenAt", Instant.ofEpochMilli(seen.get().seenAtMs()).toString());
                    details.put("expiresAt", Instant.ofEpochMilli(seen.get().expiresAtMs()).toString());
                    throw new OperatorException(ErrorCode.A2A_NONCE_REPLAY, "Nonce already used for key " + keyId, details);
                }
                NonceRecord record = new NonceRecord(keyId, nonce, timestampMs, now, now + ttlMs);
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO a2a_nonces(key_id,nonce,timestamp_ms,seen_at_ms,expires_at_ms) VALUES(?,?,?,?,?)")) {
                    ps.setString(1, record.keyId());
                    ps.setString(2, record.nonce());
                    ps.setLong(3, record.timestampMs());
                    ps.setLong(4, record.seenAtMs());
                    ps.setLong(5, record.expiresAtMs());
                    ps.executeUpdate();
                }
                return record;
            } catch (SQLException e) {
                throw new RuntimeException("Failed to register nonce for key " + keyId, e);
            }
        }
    }

    public Optional<NonceRecord> find(String keyId, String nonce) {
        try (Connection c = database.openConnection()) {
            return find(c, keyId, nonce);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read nonce for key " + keyId, e);
        }
    }

    /** Deletes every expired record across all keys; returns how many were removed. */
    public int purgeExpired() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM a2a_nonces WHERE expires_at_ms<=?")) {
            ps.setLong(1, clock.millis());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to purge expired nonces", e);
        }
    }

    private Optional<NonceRecord> find(Connection c, String keyId, String nonce) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT key_id,nonce,timestamp_ms,seen_at_ms,expires_at_ms FROM a2a_nonces WHERE key_id=? AND nonce=?")) {
            ps.setString(1, keyId);
            ps.setString(2, nonce);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new NonceRecord(
                        rs.getString("key_id"),
                        rs.getString("nonce"),
                        rs.getLong("timestamp_ms"),
                        rs.getLong("seen_at_ms"),
                        rs.getLong("expires_at_ms")
                ));
            }
        }
    }
}
