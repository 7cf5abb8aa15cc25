package io.chainrelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class ChainRelayConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_NAMESPACES_DIR = "namespaces";
    public static final String SETTINGS_FILE = "chainrelay-settings.json";
    public static final String POLICY_FILE = "policy.json";

    public static final long DEFAULT_LOCK_TIMEOUT_MS = 3_000L;
    public static final long DEFAULT_LOCK_STALE_MS = 10_000L;
    public static final long DEFAULT_CONNECTOR_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_BREAKER_MAX_FAILURES = 3;
    public static final long DEFAULT_BREAKER_WINDOW_MS = 60_000L;
    public static final long DEFAULT_BREAKER_COOLDOWN_MS = 120_000L;
    public static final long DEFAULT_A2A_MAX_SKEW_MS = 120_000L;
    public static final long DEFAULT_A2A_NONCE_TTL_MS = 300_000L;

    private final Path rootDir;
    private final Path rootBaseDir;
    private final String namespace;

    public ChainRelayConfig(Path rootDir, Path rootBaseDir, String namespace) {
        this.rootDir = rootDir;
        this.rootBaseDir = rootBaseDir;
        this.namespace = namespace;
    }

    public static ChainRelayConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static ChainRelayConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeNamespace = sanitizeNamespace(namespace);
        Path scoped = DEFAULT_NAMESPACE.equals(safeNamespace)
                ? base
                : base.resolve(DEFAULT_NAMESPACES_DIR).resolve(safeNamespace);
        return new ChainRelayConfig(scoped, base, safeNamespace);
    }

    static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.isBlank() || "-".equals(value)) {
            return DEFAULT_NAMESPACE;
        }
        if (value.startsWith(".")) {
            value = "ns" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path rootBaseDir() {
        return rootBaseDir;
    }

    public String namespace() {
        return namespace;
    }

    public Path dbFile() {
        return rootDir.resolve("chainrelay.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path defaultPolicyFile() {
        return rootDir.resolve(POLICY_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.jsonl");
    }

    public Path locksRoot() {
        return rootDir.resolve("locks");
    }

    public Path idempotencyLocks() {
        return locksRoot().resolve("idempotency");
    }

    public Path breakerLocks() {
        return locksRoot().resolve("breaker");
    }

    public Path nonceLocks() {
        return locksRoot().resolve("nonce");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path a2aKeysFile() {
        return securityRoot().resolve("a2a-keys.json");
    }

    public Path auditSigningKeyFile() {
        return securityRoot().resolve("audit-signing.key");
    }
}
