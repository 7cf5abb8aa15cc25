package io.chainrelay.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.chainrelay.model.OperatorError;
import io.chainrelay.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Optional;

/**
 * Fingerprint-keyed record of every live execution attempt.
 *
 * <p>{@link #begin} runs under the exclusive lock for its key, so across every thread
 * and process sharing the root at most one caller sees {@code isNew=true} for a key.
 * A pending record settles exactly once through {@link #complete} or {@link #fail}.
 */
public final class IdempotencyStore {
    private final Database database;
    private final ScopedLocks locks;
    private final Clock clock;
    private final String namespace;

    public IdempotencyStore(Database database, ScopedLocks locks, Clock clock) {
        this.database = database;
        this.locks = locks;
        this.clock = clock;
        this.namespace = database.namespace();
    }

    public BeginResult begin(String key, String runId) {
        try (ScopedLock ignored = locks.acquire(key)) {
            Optional<IdempotencyRecord> existing = find(key);
            if (existing.isPresent()) {
                return new BeginResult(false, existing.get());
            }
            long now = clock.millis();
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "INSERT INTO idempotency(idempotency_key,namespace,status,run_id,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?)")) {
                ps.setString(1, key);
                ps.setString(2, namespace);
                ps.setString(3, IdempotencyRecord.Status.PENDING.name());
                ps.setString(4, runId);
                ps.setLong(5, now);
                ps.setLong(6, now);
                ps.executeUpdate();
                return new BeginResult(true, null);
            } catch (SQLException e) {
                Optional<IdempotencyRecord> afterRace = find(key);
                if (afterRace.isPresent()) {
                    return new BeginResult(false, afterRace.get());
                }
                throw new RuntimeException("Failed to begin idempotency record", e);
            }
        }
    }

    public IdempotencyRecord complete(String key, JsonNode result) {
        return settle(key, IdempotencyRecord.Status.COMPLETED, result, null);
    }

    public IdempotencyRecord fail(String key, OperatorError error) {
        return settle(key, IdempotencyRecord.Status.FAILED, null, error);
    }

    /**
     * Drops a pending record whose attempt ended before any connector was invoked, so a
     * later retry is not pinned to a failure that never reached a network.
     */
    public boolean release(String key) {
        try (ScopedLock ignored = locks.acquire(key);
             Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "DELETE FROM idempotency WHERE idempotency_key=? AND status=?")) {
            ps.setString(1, key);
            ps.setString(2, IdempotencyRecord.Status.PENDING.name());
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release idempotency record", e);
        }
    }

    public Optional<IdempotencyRecord> find(String key) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT idempotency_key,status,run_id,result_json,error_json,created_at_ms,completed_at_ms FROM idempotency WHERE idempotency_key=?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(map(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read idempotency record", e);
        }
    }

    private IdempotencyRecord settle(String key, IdempotencyRecord.Status status, JsonNode result, OperatorError error) {
        try (ScopedLock ignored = locks.acquire(key)) {
            long now = clock.millis();
            int updated;
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "UPDATE idempotency SET status=?,result_json=?,error_json=?,completed_at_ms=?,updated_at_ms=? WHERE idempotency_key=? AND status=?")) {
                ps.setString(1, status.name());
                ps.setString(2, result == null ? null : Jsons.toCompactJson(result));
                ps.setString(3, error == null ? null : Jsons.toCompactJson(error.toJson()));
                ps.setLong(4, now);
                ps.setLong(5, now);
                ps.setString(6, key);
                ps.setString(7, IdempotencyRecord.Status.PENDING.name());
                updated = ps.executeUpdate();
            } catch (SQLException e) {
                throw new RuntimeException("Failed to settle idempotency record", e);
            }
            if (updated == 0) {
                throw new IllegalStateException("Idempotency record is not pending: " + key);
            }
            return find(key).orElseThrow();
        }
    }

    private IdempotencyRecord map(ResultSet rs) throws SQLException {
        String resultJson = rs.getString("result_json");
        String errorJson = rs.getString("error_json");
        long completedAt = rs.getLong("completed_at_ms");
        Long completedAtMs = rs.wasNull() ? null : completedAt;
        return new IdempotencyRecord(
                rs.getString("idempotency_key"),
                IdempotencyRecord.Status.valueOf(rs.getString("status")),
                rs.getString("run_id"),
                resultJson == null ? null : Jsons.readTree(resultJson),
                errorJson == null ? null : OperatorError.fromJson(Jsons.readTree(errorJson)),
                rs.getLong("created_at_ms"),
                completedAtMs
        );
    }

    public record BeginResult(boolean isNew, IdempotencyRecord existing) {
    }
}
