package io.chainrelay.plane;

import io.chainrelay.model.Action;
import io.chainrelay.routing.RouteFeasibilityTable;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Operations accepted on the execution plane and the intent each one builds. Pinned
 * params are forced onto the intent and must not be contradicted by the caller; default
 * params only fill gaps.
 */
public enum PlaneOperation {
    TRANSFER_SEND("transfer.send", Action.TRANSFER, Map.of(), Map.of()),
    SWAP_JUPITER("swap.jupiter", Action.SWAP, Map.of("venue", "jupiter"), Map.of("chain", "solana")),
    SWAP_RAYDIUM("swap.raydium", Action.SWAP, Map.of("venue", "raydium"), Map.of("chain", "solana")),
    SWAP_PUMPFUN("swap.pumpfun", Action.SWAP, Map.of("venue", "pumpfun"), Map.of("chain", "solana")),
    BRIDGE_TRANSFER("bridge.transfer", Action.BRIDGE, Map.of(), Map.of()),
    HYPERLIQUID_DEPOSIT("hyperliquid.deposit", Action.BRIDGE,
            Map.of("toChain", RouteFeasibilityTable.HYPERLIQUID, "provider", RouteFeasibilityTable.HYPERLIQUID_NATIVE),
            Map.of("fromChain", RouteFeasibilityTable.ARBITRUM)),
    HYPERLIQUID_SPOT_ORDER("hyperliquid.spot.order", Action.ORDER,
            Map.of("chain", RouteFeasibilityTable.HYPERLIQUID, "marketType", "spot"), Map.of()),
    HYPERLIQUID_PERP_ORDER("hyperliquid.perp.order", Action.ORDER,
            Map.of("chain", RouteFeasibilityTable.HYPERLIQUID, "marketType", "perp"), Map.of()),
    HYPERLIQUID_CANCEL("hyperliquid.cancel", Action.CANCEL_ORDER,
            Map.of("chain", RouteFeasibilityTable.HYPERLIQUID), Map.of()),
    DEFI_DEPOSIT("defi.deposit", Action.PROTOCOL_DEPOSIT, Map.of(), Map.of()),
    DEFI_WITHDRAW("defi.withdraw", Action.PROTOCOL_WITHDRAW, Map.of(), Map.of());

    private final String wireName;
    private final Action action;
    private final Map<String, String> pinned;
    private final Map<String, String> defaults;

    PlaneOperation(String wireName, Action action, Map<String, String> pinned, Map<String, String> defaults) {
        this.wireName = wireName;
        this.action = action;
        this.pinned = pinned;
        this.defaults = defaults;
    }

    public String wireName() {
        return wireName;
    }

    public Action action() {
        return action;
    }

    public Map<String, String> pinned() {
        return pinned;
    }

    public Map<String, String> defaults() {
        return defaults;
    }

    public static Optional<PlaneOperation> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (PlaneOperation op : values()) {
            if (op.wireName.equals(normalized)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
