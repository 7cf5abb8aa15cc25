package io.chainrelay.model;

import java.util.List;
import java.util.Optional;

/**
 * A normalised, action-specific description of one financial operation. Each action
 * has its own record; anything reading an intent can switch over {@link #action()} or
 * pattern-match on the record type and the compiler checks that every variant is handled.
 *
 * <p>Intents carry no secrets and are safe to log and to fingerprint.
 */
public sealed interface CanonicalIntent permits
        TransferIntent,
        SwapIntent,
        BridgeIntent,
        OrderIntent,
        CancelOrderIntent,
        ProtocolDepositIntent,
        ProtocolWithdrawIntent {

    Action action();

    String network();

    /** Chains whose signing keys the operation needs, source first. */
    List<String> chains();

    List<String> assets();

    Optional<String> recipientAddress();

    Optional<String> marketSymbol();

    /** Registry id of the connector that executes this intent. */
    String connectorId();

    default Optional<CrossDomainLeg> crossDomainLeg() {
        return Optional.empty();
    }
}
