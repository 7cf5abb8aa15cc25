package io.chainrelay.storage;

import io.chainrelay.config.ChainRelayConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * SQLite file shared by every operator process under one root. Each store opens a
 * short-lived connection per operation; cross-process exclusion for check-and-mutate
 * sections comes from {@link FileLockManager}, not from SQLite transactions alone.
 */
public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "chainrelay.schema.migration.v1";
    private static final int BUSY_TIMEOUT_MS = 5_000;
    private final ChainRelayConfig config;
    private final String jdbcUrl;

    public Database(ChainRelayConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public String namespace() {
        return config.namespace();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", Integer.toString(BUSY_TIMEOUT_MS));
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.idempotencyLocks());
            Files.createDirectories(config.breakerLocks());
            Files.createDirectories(config.nonceLocks());
            Files.createDirectories(config.securityRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS idempotency (
                        idempotency_key TEXT PRIMARY KEY,
                        namespace TEXT NOT NULL DEFAULT 'default',
                        status TEXT NOT NULL,
                        run_id TEXT NOT NULL,
                        result_json TEXT,
                        error_json TEXT,
                        created_at_ms INTEGER NOT NULL,
                        completed_at_ms INTEGER,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS breaker_state (
                        scope TEXT PRIMARY KEY,
                        state TEXT NOT NULL,
                        failures_json TEXT NOT NULL DEFAULT '[]',
                        window_start_ms INTEGER,
                        cooldown_until_ms INTEGER,
                        trial_claimed_at_ms INTEGER,
                        last_error TEXT,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS a2a_nonces (
                        key_id TEXT NOT NULL,
                        nonce TEXT NOT NULL,
                        timestamp_ms INTEGER NOT NULL,
                        seen_at_ms INTEGER NOT NULL,
                        expires_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(key_id, nonce)
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_idempotency_status ON idempotency(status, updated_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_a2a_nonces_expiry ON a2a_nonces(expires_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = List.of(
                new MigrationStep(
                        "20261001_001_idempotency_run_lookup",
                        "Index idempotency records by run id for replay lookups",
                        List.of("CREATE INDEX IF NOT EXISTS idx_idempotency_run ON idempotency(run_id)")
                ),
                new MigrationStep(
                        "20261001_002_nonce_key_expiry",
                        "Index nonces per key for scoped expiry sweeps",
                        List.of("CREATE INDEX IF NOT EXISTS idx_a2a_nonces_key_expiry ON a2a_nonces(key_id, expires_at_ms)")
                ),
                new MigrationStep(
                        "20261020_003_breaker_trial_token",
                        "Record which caller holds the half-open trial",
                        List.of("ALTER TABLE breaker_state ADD COLUMN trial_token TEXT")
                )
        );
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                try {
                    st.execute(sql);
                } catch (SQLException e) {
                    // another process applied the same ALTER first
                    String message = String.valueOf(e.getMessage()).toLowerCase(Locale.ROOT);
                    if (!message.contains("duplicate column name")) {
                        throw e;
                    }
                }
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
