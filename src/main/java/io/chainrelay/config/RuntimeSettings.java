package io.chainrelay.config;

import io.chainrelay.security.SecurityMode;
import io.chainrelay.storage.BreakerScope;
import io.chainrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Operator settings resolved from {@code chainrelay-settings.json}. Missing members fall
 * back to the defaults in {@link ChainRelayConfig}; numeric members are clamped to sane minimums.
 */
public record RuntimeSettings(
        SecurityMode a2aSecurityMode,
        boolean a2aAllowUnsignedLive,
        long a2aMaxSkewMs,
        long a2aNonceTtlMs,
        long lockTimeoutMs,
        long lockStaleMs,
        long connectorTimeoutMs,
        BreakerScope breakerScope,
        int breakerMaxFailures,
        long breakerWindowMs,
        long breakerCooldownMs,
        long breakerTrialStaleMs,
        String auditSigningSecret,
        Map<String, String> signerIdentities,
        Map<String, ConnectorBinding> connectors
) {
    public RuntimeSettings {
        signerIdentities = Map.copyOf(signerIdentities);
        connectors = Map.copyOf(connectors);
    }

    public static RuntimeSettings defaults() {
        return new RuntimeSettings(
                SecurityMode.PERMISSIVE,
                false,
                ChainRelayConfig.DEFAULT_A2A_MAX_SKEW_MS,
                ChainRelayConfig.DEFAULT_A2A_NONCE_TTL_MS,
                ChainRelayConfig.DEFAULT_LOCK_TIMEOUT_MS,
                ChainRelayConfig.DEFAULT_LOCK_STALE_MS,
                ChainRelayConfig.DEFAULT_CONNECTOR_TIMEOUT_MS,
                BreakerScope.CONNECTOR,
                ChainRelayConfig.DEFAULT_BREAKER_MAX_FAILURES,
                ChainRelayConfig.DEFAULT_BREAKER_WINDOW_MS,
                ChainRelayConfig.DEFAULT_BREAKER_COOLDOWN_MS,
                ChainRelayConfig.DEFAULT_BREAKER_COOLDOWN_MS,
                "",
                Map.of(),
                Map.of()
        );
    }

    public static RuntimeSettings load(ChainRelayConfig config) {
        Path file = config.settingsFile();
        RuntimeSettings defaults = defaults();
        if (!Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            RuntimeSettingsFile raw = Jsons.mapper().readValue(file.toFile(), RuntimeSettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load runtime settings: " + file, e);
        }
    }

    static RuntimeSettings fromFile(RuntimeSettingsFile file, RuntimeSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long cooldown = sanitizeLong(file.breakerCooldownMs(), defaults.breakerCooldownMs(), 0L);
        long lockTimeout = sanitizeLong(file.lockTimeoutMs(), defaults.lockTimeoutMs(), 50L);
        long maxSkew = sanitizeLong(file.a2aMaxSkewMs(), defaults.a2aMaxSkewMs(), 1_000L);
        // a nonce must outlive every timestamp the skew window still accepts
        long nonceTtl = Math.max(2 * maxSkew, sanitizeLong(file.a2aNonceTtlMs(), defaults.a2aNonceTtlMs(), 1_000L));
        return new RuntimeSettings(
                SecurityMode.parse(file.a2aSecurityMode(), defaults.a2aSecurityMode()),
                sanitizeBoolean(file.a2aAllowUnsignedLive(), defaults.a2aAllowUnsignedLive()),
                maxSkew,
                nonceTtl,
                lockTimeout,
                sanitizeLong(file.lockStaleMs(), defaults.lockStaleMs(), lockTimeout),
                sanitizeLong(file.connectorTimeoutMs(), defaults.connectorTimeoutMs(), 100L),
                BreakerScope.parse(file.breakerScope(), defaults.breakerScope()),
                sanitizeInt(file.breakerMaxFailures(), defaults.breakerMaxFailures(), 1),
                sanitizeLong(file.breakerWindowMs(), defaults.breakerWindowMs(), 1_000L),
                cooldown,
                sanitizeLong(file.breakerTrialStaleMs(), Math.max(cooldown, 1_000L), 1_000L),
                sanitizeSecret(file.auditSigningSecret(), defaults.auditSigningSecret()),
                sanitizeIdentities(file.signerIdentities(), defaults.signerIdentities()),
                sanitizeConnectors(file.connectors(), defaults.connectors())
        );
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeSecret(String raw, String fallback) {
        if (raw == null) {
            return fallback == null ? "" : fallback;
        }
        return raw.trim();
    }

    private static Map<String, String> sanitizeIdentities(Map<String, String> raw, Map<String, String> fallback) {
        if (raw == null) {
            return fallback;
        }
        Map<String, String> out = new LinkedHashMap<>();
        raw.forEach((chain, identity) -> {
            if (chain != null && !chain.isBlank() && identity != null && !identity.isBlank()) {
                out.put(chain.trim().toLowerCase(Locale.ROOT), identity.trim());
            }
        });
        return out;
    }

    private static Map<String, ConnectorBinding> sanitizeConnectors(
            Map<String, ConnectorBindingFile> raw,
            Map<String, ConnectorBinding> fallback
    ) {
        if (raw == null) {
            return fallback;
        }
        Map<String, ConnectorBinding> out = new LinkedHashMap<>();
        raw.forEach((id, binding) -> {
            if (id == null || id.isBlank() || binding == null || binding.command() == null || binding.command().isEmpty()) {
                throw new IllegalArgumentException("connector binding requires a non-empty command: " + id);
            }
            out.put(id.trim().toLowerCase(Locale.ROOT), new ConnectorBinding(
                    List.copyOf(binding.command()),
                    binding.timeoutMs() == null ? null : Math.max(100L, binding.timeoutMs())
            ));
        });
        return out;
    }

    /** External command that executes intents for one connector id. */
    public record ConnectorBinding(List<String> command, Long timeoutMs) {
    }

    record RuntimeSettingsFile(
            String a2aSecurityMode,
            Boolean a2aAllowUnsignedLive,
            Long a2aMaxSkewMs,
            Long a2aNonceTtlMs,
            Long lockTimeoutMs,
            Long lockStaleMs,
            Long connectorTimeoutMs,
            String breakerScope,
            Integer breakerMaxFailures,
            Long breakerWindowMs,
            Long breakerCooldownMs,
            Long breakerTrialStaleMs,
            String auditSigningSecret,
            Map<String, String> signerIdentities,
            Map<String, ConnectorBindingFile> connectors
    ) {
    }

    record ConnectorBindingFile(List<String> command, Long timeoutMs) {
    }
}
