package io.chainrelay.model;

import java.util.List;
import java.util.Optional;

public record TransferIntent(
        String chain,
        String asset,
        String amount,
        String recipient,
        String network,
        String memo
) implements CanonicalIntent {
    public TransferIntent {
        chain = IntentFields.id(chain, "chain");
        asset = IntentFields.symbol(asset, "asset");
        amount = IntentFields.amount(amount, "amount");
        recipient = IntentFields.address(recipient, "recipient");
        network = IntentFields.network(network);
        memo = IntentFields.optionalText(memo);
    }

    @Override
    public Action action() {
        return Action.TRANSFER;
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
        return Optional.of(recipient);
    }

    @Override
    public Optional<String> marketSymbol() {
        return Optional.empty();
    }

    @Override
    public String connectorId() {
        return chain;
    }
}
