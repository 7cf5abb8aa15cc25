package io.chainrelay.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Action {
    TRANSFER("transfer", TransferIntent.class),
    SWAP("swap", SwapIntent.class),
    BRIDGE("bridge", BridgeIntent.class),
    ORDER("order", OrderIntent.class),
    CANCEL_ORDER("cancel_order", CancelOrderIntent.class),
    PROTOCOL_DEPOSIT("protocol_deposit", ProtocolDepositIntent.class),
    PROTOCOL_WITHDRAW("protocol_withdraw", ProtocolWithdrawIntent.class);

    private final String wireName;
    private final Class<? extends CanonicalIntent> intentType;

    Action(String wireName, Class<? extends CanonicalIntent> intentType) {
        this.wireName = wireName;
        this.intentType = intentType;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Class<? extends CanonicalIntent> intentType() {
        return intentType;
    }

    public static Optional<Action> fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (Action action : values()) {
            if (action.wireName.equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
