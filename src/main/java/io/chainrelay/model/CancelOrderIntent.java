package io.chainrelay.model;

import java.util.List;
import java.util.Optional;

public record CancelOrderIntent(
        String chain,
        String market,
        String marketType,
        String orderRef,
        String network
) implements CanonicalIntent {
    public CancelOrderIntent {
        chain = IntentFields.idOrDefault(chain, OrderIntent.DEFAULT_VENUE);
        market = IntentFields.symbol(market, "market");
        marketType = IntentFields.marketType(marketType);
        orderRef = IntentFields.optionalText(orderRef);
        if (orderRef == null) {
            throw new IllegalArgumentException("orderRef is required");
        }
        network = IntentFields.network(network);
    }

    @Override
    public Action action() {
        return Action.CANCEL_ORDER;
    }

    @Override
    public List<String> chains() {
        return List.of(chain);
    }

    @Override
    public List<String> assets() {
        return List.of();
    }

    @Override
    public Optional<String> recipientAddress() {
        return Optional.empty();
    }

    @Override
    public Optional<String> marketSymbol() {
        return Optional.of(market);
    }

    @Override
    public String connectorId() {
        return chain;
    }
}
