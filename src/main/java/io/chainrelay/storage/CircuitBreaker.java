package io.chainrelay.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.chainrelay.util.Hashing;
import io.chainrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rolling-window failure breaker, one independent state per scope.
 *
 * <p>Every read-modify-write of a scope happens under that scope's exclusive lock. This
 * is what makes the half-open trial single: the first caller after cooldown flips the
 * scope to {@code HALF_OPEN} and records its claim before the lock is released, and
 * everyone after it sees the claim.
 */
public final class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);
    private static final int MAX_ERROR_CHARS = 512;
    private static final TypeReference<List<Long>> FAILURES_TYPE = new TypeReference<>() {
    };

    private final Database database;
    private final ScopedLocks locks;
    private final Clock clock;
    private final Settings settings;

    public CircuitBreaker(Database database, ScopedLocks locks, Clock clock, Settings settings) {
        this.database = database;
        this.locks = locks;
        this.clock = clock;
        this.settings = settings;
    }

    /**
     * Admits or refuses an attempt. An admission that claimed the half-open trial carries
     * the claim token; only that token can later close the scope or give the trial back.
     */
    public Admission canAttempt(String scope) {
        try (ScopedLock ignored = locks.acquire(scope)) {
            long now = clock.millis();
            BreakerState state = load(scope).orElse(BreakerState.closed(scope, now));
            if (state.status() == BreakerState.Status.CLOSED) {
                return Admission.ADMITTED;
            }
            if (state.status() == BreakerState.Status.OPEN) {
                if (state.cooldownUntilMs() != null && now < state.cooldownUntilMs()) {
                    return Admission.REFUSED;
                }
                return claimTrial(state, now);
            }
            Long claimedAt = state.trialClaimedAtMs();
            if (claimedAt != null && now - claimedAt < settings.trialStaleMs()) {
                return Admission.REFUSED;
            }
            if (claimedAt != null) {
                log.warn("Reclaiming abandoned half-open trial for scope {}", scope);
            }
            return claimTrial(state, now);
        }
    }

    /**
     * Gives back a half-open trial whose attempt ended before reaching a connector, so the
     * next caller can claim it without waiting for the claim to go stale. A token that no
     * longer matches the stored claim is ignored.
     */
    public void releaseTrial(String scope, String trialToken) {
        if (trialToken == null) {
            return;
        }
        try (ScopedLock ignored = locks.acquire(scope)) {
            Optional<BreakerState> current = load(scope);
            if (current.isEmpty() || !holdsTrial(current.get(), trialToken)) {
                return;
            }
            BreakerState state = current.get();
            save(new BreakerState(scope, BreakerState.Status.HALF_OPEN, state.failureTimestampsMs(),
                    state.windowStartMs(), state.cooldownUntilMs(), null, null, state.lastError(), clock.millis()));
        }
    }

    /**
     * Records a successful attempt. Only the trial holder closes a half-open scope; a late
     * success from an attempt admitted before the scope opened leaves it as it is.
     */
    public BreakerState recordSuccess(String scope, String trialToken) {
        try (ScopedLock ignored = locks.acquire(scope)) {
            long now = clock.millis();
            BreakerState state = load(scope).orElse(BreakerState.closed(scope, now));
            BreakerState next;
            if (state.status() == BreakerState.Status.CLOSED) {
                List<Long> failures = pruned(state.failureTimestampsMs(), now);
                next = new BreakerState(scope, BreakerState.Status.CLOSED, failures, windowStart(failures),
                        null, null, null, state.lastError(), now);
            } else if (holdsTrial(state, trialToken)) {
                next = new BreakerState(scope, BreakerState.Status.CLOSED, List.of(), null,
                        null, null, null, state.lastError(), now);
                log.info("Circuit closed for scope {} after a successful trial", scope);
            } else {
                return state;
            }
            save(next);
            return next;
        }
    }

    /**
     * Records a failed attempt. A failed trial reopens the scope with a fresh cooldown; a
     * failure from any other attempt only adds to the window.
     */
    public BreakerState recordFailure(String scope, String error, String trialToken) {
        try (ScopedLock ignored = locks.acquire(scope)) {
            long now = clock.millis();
            BreakerState state = load(scope).orElse(BreakerState.closed(scope, now));
            String lastError = truncate(error);
            List<Long> failures = append(pruned(state.failureTimestampsMs(), now), now);
            BreakerState next;
            switch (state.status()) {
                case HALF_OPEN -> next = holdsTrial(state, trialToken)
                        ? opened(scope, List.of(now), now, lastError)
                        : new BreakerState(scope, BreakerState.Status.HALF_OPEN, failures, windowStart(failures),
                        state.cooldownUntilMs(), state.trialClaimedAtMs(), state.trialToken(), lastError, now);
                case OPEN -> next = new BreakerState(scope, BreakerState.Status.OPEN, failures, windowStart(failures),
                        state.cooldownUntilMs(), null, null, lastError, now);
                default -> next = failures.size() >= settings.maxFailures()
                        ? opened(scope, failures, now, lastError)
                        : new BreakerState(scope, BreakerState.Status.CLOSED, failures, windowStart(failures),
                        null, null, null, lastError, now);
            }
            if (next.status() == BreakerState.Status.OPEN && state.status() != BreakerState.Status.OPEN) {
                log.warn("Circuit opened for scope {} after {} failure(s): {}", scope, next.failureCount(), lastError);
            }
            save(next);
            return next;
        }
    }

    public BreakerState state(String scope) {
        return load(scope).orElse(BreakerState.closed(scope, clock.millis()));
    }

    private BreakerState opened(String scope, List<Long> failures, long now, String lastError) {
        return new BreakerState(scope, BreakerState.Status.OPEN, failures, windowStart(failures),
                now + settings.cooldownMs(), null, null, lastError, now);
    }

    private Admission claimTrial(BreakerState state, long now) {
        String token = Hashing.randomHex(12);
        save(new BreakerState(state.scope(), BreakerState.Status.HALF_OPEN, state.failureTimestampsMs(),
                state.windowStartMs(), state.cooldownUntilMs(), now, token, state.lastError(), now));
        return new Admission(true, token);
    }

    private static boolean holdsTrial(BreakerState state, String trialToken) {
        return state.status() == BreakerState.Status.HALF_OPEN
                && trialToken != null
                && trialToken.equals(state.trialToken());
    }

    private List<Long> pruned(List<Long> failures, long now) {
        long from = now - settings.windowMs();
        List<Long> out = new ArrayList<>();
        for (Long ts : failures) {
            if (ts != null && ts > from) {
                out.add(ts);
            }
        }
        return out;
    }

    private static List<Long> append(List<Long> failures, long now) {
        List<Long> out = new ArrayList<>(failures);
        out.add(now);
        return out;
    }

    private static Long windowStart(List<Long> failures) {
        return failures.isEmpty() ? null : failures.get(0);
    }

    private Optional<BreakerState> load(String scope) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT scope,state,failures_json,window_start_ms,cooldown_until_ms,trial_claimed_at_ms,trial_token,last_error,updated_at_ms FROM breaker_state WHERE scope=?")) {
            ps.setString(1, scope);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                List<Long> failures = Jsons.mapper().readValue(rs.getString("failures_json"), FAILURES_TYPE);
                return Optional.of(new BreakerState(
                        rs.getString("scope"),
                        BreakerState.Status.valueOf(rs.getString("state")),
                        failures,
                        nullableLong(rs, "window_start_ms"),
                        nullableLong(rs, "cooldown_until_ms"),
                        nullableLong(rs, "trial_claimed_at_ms"),
                        rs.getString("trial_token"),
                        rs.getString("last_error"),
                        rs.getLong("updated_at_ms")
                ));
            }
        } catch (SQLException | IOException e) {
            throw new RuntimeException("Failed to load breaker state: " + scope, e);
        }
    }

    private void save(BreakerState state) {
        String sql = """
                INSERT INTO breaker_state(scope,state,failures_json,window_start_ms,cooldown_until_ms,trial_claimed_at_ms,trial_token,last_error,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?)
                ON CONFLICT(scope) DO UPDATE SET
                    state=excluded.state,
                    failures_json=excluded.failures_json,
                    window_start_ms=excluded.window_start_ms,
                    cooldown_until_ms=excluded.cooldown_until_ms,
                    trial_claimed_at_ms=excluded.trial_claimed_at_ms,
                    trial_token=excluded.trial_token,
                    last_error=excluded.last_error,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, state.scope());
            ps.setString(2, state.status().name());
            ps.setString(3, Jsons.toCompactJson(state.failureTimestampsMs()));
            setNullableLong(ps, 4, state.windowStartMs());
            setNullableLong(ps, 5, state.cooldownUntilMs());
            setNullableLong(ps, 6, state.trialClaimedAtMs());
            ps.setString(7, state.trialToken());
            ps.setString(8, state.lastError());
            ps.setLong(9, state.updatedAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save breaker state: " + state.scope(), e);
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        return normalized.length() <= MAX_ERROR_CHARS ? normalized : normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }

    /** Outcome of {@link #canAttempt}; {@code trialToken} is set only for the half-open trial holder. */
    public record Admission(boolean allowed, String trialToken) {
        static final Admission ADMITTED = new Admission(true, null);
        static final Admission REFUSED = new Admission(false, null);

        public boolean holdsTrial() {
            return trialToken != null;
        }
    }

    public record Settings(int maxFailures, long windowMs, long cooldownMs, long trialStaleMs) {
        public Settings {
            if (maxFailures < 1) {
                throw new IllegalArgumentException("maxFailures must be >= 1");
            }
        }
    }
}
