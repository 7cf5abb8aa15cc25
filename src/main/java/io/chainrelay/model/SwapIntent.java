package io.chainrelay.model;

import java.util.List;
import java.util.Optional;

public record SwapIntent(
        String chain,
        String venue,
        String assetIn,
        String assetOut,
        String amount,
        Integer slippageBps,
        String recipient,
        String network
) implements CanonicalIntent {
    public SwapIntent {
        chain = IntentFields.id(chain, "chain");
        venue = IntentFields.id(venue, "venue");
        assetIn = IntentFields.symbol(assetIn, "assetIn");
        assetOut = IntentFields.symbol(assetOut, "assetOut");
        if (assetIn.equals(assetOut)) {
            throw new IllegalArgumentException("assetIn and assetOut must differ");
        }
        amount = IntentFields.amount(amount, "amount");
        slippageBps = IntentFields.bps(slippageBps, "slippageBps");
        recipient = IntentFields.optionalAddress(recipient);
        network = IntentFields.network(network);
    }

    @Override
    public Action action() {
        return Action.SWAP;
    }

    @Override
    public List<String> chains() {
        return List.of(chain);
    }

    @Override
    public List<String> assets() {
        return List.of(assetIn, assetOut);
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
        return venue;
    }
}
