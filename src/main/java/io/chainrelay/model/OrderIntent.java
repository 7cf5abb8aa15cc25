package io.chainrelay.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Spot or perpetual order on an order-book venue. {@code price} is either a decimal
 * limit price or the literal {@code market}.
 */
public record OrderIntent(
        String chain,
        String market,
        String marketType,
        String side,
        String size,
        String price,
        String referencePrice,
        String leverage,
        Integer slippageBps,
        Boolean reduceOnly,
        String network
) implements CanonicalIntent {
    public static final String DEFAULT_VENUE = "hyperliquid";
    public static final String MARKET_PRICE = "market";

    public OrderIntent {
        chain = IntentFields.idOrDefault(chain, DEFAULT_VENUE);
        market = IntentFields.symbol(market, "market");
        marketType = IntentFields.marketType(marketType);
        side = IntentFields.side(side);
        size = IntentFields.amount(size, "size");
        price = price == null || price.isBlank() || MARKET_PRICE.equals(price.trim().toLowerCase(Locale.ROOT))
                ? MARKET_PRICE
                : IntentFields.amount(price, "price");
        referencePrice = IntentFields.optionalAmount(referencePrice, "referencePrice");
        leverage = IntentFields.optionalAmount(leverage, "leverage");
        if (leverage != null && "spot".equals(marketType)) {
            throw new IllegalArgumentException("leverage is only valid for perp orders");
        }
        slippageBps = IntentFields.bps(slippageBps, "slippageBps");
        reduceOnly = reduceOnly != null && reduceOnly;
        network = IntentFields.network(network);
    }

    @Override
    public Action action() {
        return Action.ORDER;
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

    public boolean marketOrder() {
        return MARKET_PRICE.equals(price);
    }

    public boolean perp() {
        return "perp".equals(marketType);
    }

    /** Limit price, or the reference price for market orders; empty when neither is known. */
    public Optional<BigDecimal> effectivePrice() {
        if (!marketOrder()) {
            return Optional.of(new BigDecimal(price));
        }
        return Optional.ofNullable(referencePrice).map(BigDecimal::new);
    }
}
