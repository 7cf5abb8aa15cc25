package io.chainrelay.policy;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Versioned, read-only policy the operator evaluates every intent against. The version
 * participates in idempotency fingerprints, so editing limits without bumping it keeps
 * earlier outcomes replayable.
 */
public record PolicyDocument(
        String version,
        boolean allowMainnetOnly,
        boolean requireKeySegregation,
        boolean requireSimulation,
        boolean defaultDryRun,
        Allowlists allowlists,
        Limits limits,
        Set<String> stableAssets,
        Map<String, BigDecimal> referencePricesUsd
) {
    public static final Set<String> DEFAULT_STABLE_ASSETS = Set.of("USDC", "USDT", "DAI");

    public PolicyDocument {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("policy version is required");
        }
        allowlists = allowlists == null ? Allowlists.empty() : allowlists;
        limits = limits == null ? Limits.none() : limits;
        stableAssets = stableAssets == null ? DEFAULT_STABLE_ASSETS : Set.copyOf(stableAssets);
        referencePricesUsd = referencePricesUsd == null ? Map.of() : Map.copyOf(referencePricesUsd);
    }

    /** USD value of {@code amount} units of {@code asset}, when the policy can price it. */
    public Optional<BigDecimal> usdValue(String asset, BigDecimal amount) {
        if (stableAssets.contains(asset)) {
            return Optional.of(amount);
        }
        BigDecimal price = referencePricesUsd.get(asset);
        return price == null ? Optional.empty() : Optional.of(amount.multiply(price));
    }

    /** Empty sets admit nothing. */
    public record Allowlists(
            Set<String> chains,
            Set<String> assets,
            Set<String> recipients,
            Set<String> bridgeRoutes,
            Set<String> symbols
    ) {
        public Allowlists {
            chains = chains == null ? Set.of() : Set.copyOf(chains);
            assets = assets == null ? Set.of() : Set.copyOf(assets);
            recipients = recipients == null ? Set.of() : Set.copyOf(recipients);
            bridgeRoutes = bridgeRoutes == null ? Set.of() : Set.copyOf(bridgeRoutes);
            symbols = symbols == null ? Set.of() : Set.copyOf(symbols);
        }

        public static Allowlists empty() {
            return new Allowlists(Set.of(), Set.of(), Set.of(), Set.of(), Set.of());
        }
    }

    /** Absent limits are not enforced. */
    public record Limits(
            BigDecimal maxNotionalUsdPerTx,
            BigDecimal maxOrderSize,
            Integer maxSlippageBps,
            BigDecimal maxLeverage
    ) {
        public static Limits none() {
            return new Limits(null, null, null, null);
        }
    }
}
