package io.chainrelay.routing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static table of which {@code (source, destination, provider)} transfers a provider can
 * carry directly. Unknown tuples are unsupported: the table never guesses.
 *
 * <p>Settlement-layer routes go through the layer's native bridge on {@code arbitrum};
 * aggregator routes that would touch the settlement layer directly are answered with the
 * two-leg pipeline that gets there.
 */
public final class RouteFeasibilityTable {
    public static final String DEBRIDGE = "debridge";
    public static final String HYPERLIQUID_NATIVE = "hyperliquid_native";
    public static final String HYPERLIQUID = "hyperliquid";
    public static final String ARBITRUM = "arbitrum";
    private static final List<String> AGGREGATOR_CHAINS = List.of("base", "solana", ARBITRUM);

    private final Map<RouteKey, Entry> entries;

    public RouteFeasibilityTable() {
        this(defaultEntries());
    }

    RouteFeasibilityTable(Map<RouteKey, Entry> entries) {
        this.entries = Map.copyOf(entries);
    }

    public RouteCheck checkRoute(String source, String destination, String provider) {
        String from = normalize(source);
        String to = normalize(destination);
        String via = normalize(provider);
        Entry entry = entries.get(new RouteKey(from, to, via));
        if (entry == null) {
            return new RouteCheck(from, to, via, false, List.of());
        }
        return new RouteCheck(from, to, via, entry.supported(), entry.pipeline());
    }

    public Optional<String> operationFor(String source, String destination, String provider) {
        Entry entry = entries.get(new RouteKey(normalize(source), normalize(destination), normalize(provider)));
        return entry == null || !entry.supported() ? Optional.empty() : Optional.of(entry.operation());
    }

    static Map<RouteKey, Entry> defaultEntries() {
        Map<RouteKey, Entry> out = new LinkedHashMap<>();
        for (String from : AGGREGATOR_CHAINS) {
            for (String to : AGGREGATOR_CHAINS) {
                if (!from.equals(to)) {
                    out.put(new RouteKey(from, to, DEBRIDGE), Entry.direct("bridge"));
                }
            }
        }
        out.put(new RouteKey(ARBITRUM, HYPERLIQUID, HYPERLIQUID_NATIVE), Entry.direct("deposit"));
        out.put(new RouteKey(HYPERLIQUID, ARBITRUM, HYPERLIQUID_NATIVE), Entry.direct("withdraw"));

        PipelineHop nativeDeposit = new PipelineHop(0, ARBITRUM, HYPERLIQUID, HYPERLIQUID_NATIVE, "deposit");
        PipelineHop nativeWithdraw = new PipelineHop(0, HYPERLIQUID, ARBITRUM, HYPERLIQUID_NATIVE, "withdraw");
        for (String chain : AGGREGATOR_CHAINS) {
            if (ARBITRUM.equals(chain)) {
                out.put(new RouteKey(chain, HYPERLIQUID, DEBRIDGE), Entry.decomposed(List.of(nativeDeposit)));
                out.put(new RouteKey(HYPERLIQUID, chain, DEBRIDGE), Entry.decomposed(List.of(nativeWithdraw)));
                continue;
            }
            out.put(new RouteKey(chain, HYPERLIQUID, DEBRIDGE), Entry.decomposed(List.of(
                    new PipelineHop(0, chain, ARBITRUM, DEBRIDGE, "bridge"),
                    nativeDeposit
            )));
            out.put(new RouteKey(HYPERLIQUID, chain, DEBRIDGE), Entry.decomposed(List.of(
                    nativeWithdraw,
                    new PipelineHop(0, ARBITRUM, chain, DEBRIDGE, "bridge")
            )));
        }
        return out;
    }

    private static String normalize(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }

    record RouteKey(String source, String destination, String provider) {
    }

    record Entry(boolean supported, String operation, List<PipelineHop> pipeline) {
        static Entry direct(String operation) {
            return new Entry(true, operation, List.of());
        }

        static Entry decomposed(List<PipelineHop> hops) {
            List<PipelineHop> numbered = new ArrayList<>();
            for (int i = 0; i < hops.size(); i++) {
                PipelineHop hop = hops.get(i);
                numbered.add(new PipelineHop(i + 1, hop.source(), hop.destination(), hop.provider(), hop.operation()));
            }
            return new Entry(false, null, List.copyOf(numbered));
        }
    }
}
