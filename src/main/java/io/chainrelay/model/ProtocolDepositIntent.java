package io.chainrelay.model;

import java.util.List;
import java.util.Optional;

public record ProtocolDepositIntent(
        String chain,
        String protocol,
        String target,
        String asset,
        String amount,
        String recipient,
        String network
) implements CanonicalIntent {
    public ProtocolDepositIntent {
        chain = IntentFields.id(chain, "chain");
        protocol = IntentFields.id(protocol, "protocol");
        target = IntentFields.address(target, "target");
        asset = IntentFields.symbol(asset, "asset");
        amount = IntentFields.amount(amount, "amount");
        recipient = IntentFields.optionalAddress(recipient);
        network = IntentFields.network(network);
    }

    @Override
    public Action action() {
        return Action.PROTOCOL_DEPOSIT;
    }

    @Override
    public List<String> chains() {
        return List.of(chain);
    }

    @Override
    public List<String> assets() {
        return List.of(asset);
    }

    @Override
    public Optional<String> recipientAddress() {
        return Optional.ofNullable(recipient);
    }

    @Override
    public Optional<String> marketSymbol() {
        return Optional.empty();
    }

    @Override
    public String connectorId() {
        return protocol;
    }
}
