package io.chainrelay.model;

import java.util.List;
import java.util.Optional;

public record BridgeIntent(
        String fromChain,
        String toChain,
        String asset,
        String amount,
        String provider,
        String recipient,
        String network
) implements CanonicalIntent {
    public static final String DEFAULT_PROVIDER = "debridge";

    public BridgeIntent {
        fromChain = IntentFields.id(fromChain, "fromChain");
        toChain = IntentFields.id(toChain, "toChain");
        if (fromChain.equals(toChain)) {
            throw new IllegalArgumentException("fromChain and toChain must differ");
        }
        asset = IntentFields.symbol(asset, "asset");
        amount = IntentFields.amount(amount, "amount");
        provider = IntentFields.idOrDefault(provider, DEFAULT_PROVIDER);
        recipient = IntentFields.optionalAddress(recipient);
        network = IntentFields.network(network);
    }

    @Override
    public Action action() {
        return Action.BRIDGE;
    }

    @Override
    public List<String> chains() {
        return List.of(fromChain, toChain);
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
        return provider;
    }

    @Override
    public Optional<CrossDomainLeg> crossDomainLeg() {
        return Optional.of(new CrossDomainLeg(fromChain, toChain, provider));
    }

    public String routeName() {
        return fromChain + "->" + toChain;
    }
}
