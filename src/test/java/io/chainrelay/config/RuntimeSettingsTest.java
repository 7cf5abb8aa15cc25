package io.chainrelay.config;

import io.chainrelay.model.ErrorCode;
import io.chainrelay.model.OperatorException;
import io.chainrelay.security.SecurityMode;
import io.chainrelay.storage.BreakerScope;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

final class RuntimeSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-settings-");
        try {
            RuntimeSettings settings = RuntimeSettings.load(ChainRelayConfig.fromRoot(root.toString()));

            Assertions.assertEquals(RuntimeSettings.defaults(), settings);
            Assertions.assertEquals(SecurityMode.PERMISSIVE, settings.a2aSecurityMode());
            Assertions.assertEquals(BreakerScope.CONNECTOR, settings.breakerScope());
            Assertions.assertEquals(3, settings.breakerMaxFailures());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileValuesAreNormalizedAndClamped() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-settings-file-");
        try {
            ChainRelayConfig config = ChainRelayConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), """
                    {
                      "a2aSecurityMode": "ENFORCE",
                      "breakerScope": "chain",
                      "breakerMaxFailures": 0,
                      "lockTimeoutMs": 5,
                      "connectorTimeoutMs": 20,
                      "breakerCooldownMs": 90000,
                      "signerIdentities": {" Base ": " base-ops ", "solana": ""},
                      "connectors": {"Jupiter": {"command": ["bin/jupiter-binding"], "timeoutMs": 10}}
                    }
                    """, StandardCharsets.UTF_8);

            RuntimeSettings settings = RuntimeSettings.load(config);

            Assertions.assertEquals(SecurityMode.ENFORCE, settings.a2aSecurityMode());
            Assertions.assertEquals(BreakerScope.CHAIN, settings.breakerScope());
            Assertions.assertEquals(1, settings.breakerMaxFailures());
            Assertions.assertEquals(50L, settings.lockTimeoutMs());
            Assertions.assertEquals(100L, settings.connectorTimeoutMs());
            Assertions.assertEquals(90_000L, settings.breakerTrialStaleMs());
            Assertions.assertEquals(Map.of("base", "base-ops"), settings.signerIdentities());
            RuntimeSettings.ConnectorBinding binding = settings.connectors().get("jupiter");
            Assertions.assertEquals(List.of("bin/jupiter-binding"), binding.command());
            Assertions.assertEquals(100L, binding.timeoutMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void nonceTtlCoversTheWholeSkewWindow() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-settings-ttl-");
        try {
            ChainRelayConfig config = ChainRelayConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), "{\"a2aMaxSkewMs\": 120000, \"a2aNonceTtlMs\": 1000}", StandardCharsets.UTF_8);
            Assertions.assertEquals(240_000L, RuntimeSettings.load(config).a2aNonceTtlMs());

            Files.writeString(config.settingsFile(), "{\"a2aMaxSkewMs\": 200000}", StandardCharsets.UTF_8);
            Assertions.assertEquals(400_000L, RuntimeSettings.load(config).a2aNonceTtlMs());

            Files.writeString(config.settingsFile(), "{\"a2aNonceTtlMs\": 600000}", StandardCharsets.UTF_8);
            Assertions.assertEquals(600_000L, RuntimeSettings.load(config).a2aNonceTtlMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownSecurityModeIsConfigError() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-settings-mode-");
        try {
            ChainRelayConfig config = ChainRelayConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), "{\"a2aSecurityMode\": \"strict\"}", StandardCharsets.UTF_8);

            OperatorException ex = Assertions.assertThrows(OperatorException.class, () -> RuntimeSettings.load(config));

            Assertions.assertEquals(ErrorCode.A2A_CONFIG_INVALID, ex.code());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void namespacesGetTheirOwnRoot() {
        ChainRelayConfig scoped = ChainRelayConfig.fromRoot("/tmp/chainrelay-data", "Desk A/1");
        ChainRelayConfig plain = ChainRelayConfig.fromRoot("/tmp/chainrelay-data", null);

        Assertions.assertEquals("desk-a-1", scoped.namespace());
        Assertions.assertTrue(scoped.rootDir().endsWith(Path.of("namespaces", "desk-a-1")));
        Assertions.assertEquals(plain.rootBaseDir(), plain.rootDir());
        Assertions.assertTrue(plain.auditFile().endsWith(Path.of("audit", "audit.jsonl")));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (var walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
