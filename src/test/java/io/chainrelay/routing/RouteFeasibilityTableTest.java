package io.chainrelay.routing;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

final class RouteFeasibilityTableTest {
    private final RouteFeasibilityTable table = new RouteFeasibilityTable();

    @Test
    void aggregatorRoutesBetweenEvmAndSolanaAreDirect() {
        RouteCheck check = table.checkRoute("Base", " SOLANA ", "deBridge");

        Assertions.assertTrue(check.supported());
        Assertions.assertFalse(check.decomposable());
        Assertions.assertEquals("base", check.source());
        Assertions.assertEquals("solana", check.destination());
        Assertions.assertEquals(Optional.of("bridge"), table.operationFor("base", "solana", "debridge"));
    }

    @Test
    void settlementLayerIsReachedThroughNativeBridgeOnly() {
        Assertions.assertTrue(table.checkRoute("arbitrum", "hyperliquid", "hyperliquid_native").supported());
        Assertions.assertEquals(Optional.of("deposit"), table.operationFor("arbitrum", "hyperliquid", "hyperliquid_native"));
        Assertions.assertEquals(Optional.of("withdraw"), table.operationFor("hyperliquid", "arbitrum", "hyperliquid_native"));
        Assertions.assertFalse(table.checkRoute("base", "hyperliquid", "hyperliquid_native").supported());
    }

    @Test
    void aggregatorIntoSettlementLayerIsDecomposed() {
        RouteCheck check = table.checkRoute("base", "hyperliquid", "debridge");

        Assertions.assertFalse(check.supported());
        Assertions.assertTrue(check.decomposable());
        Assertions.assertEquals(List.of(
                new PipelineHop(1, "base", "arbitrum", "debridge", "bridge"),
                new PipelineHop(2, "arbitrum", "hyperliquid", "hyperliquid_native", "deposit")
        ), check.recommendedPipeline());
        Assertions.assertTrue(table.operationFor("base", "hyperliquid", "debridge").isEmpty());
    }

    @Test
    void withdrawalFromSettlementLayerStartsWithNativeLeg() {
        RouteCheck check = table.checkRoute("hyperliquid", "solana", "debridge");

        Assertions.assertEquals(List.of(
                new PipelineHop(1, "hyperliquid", "arbitrum", "hyperliquid_native", "withdraw"),
                new PipelineHop(2, "arbitrum", "solana", "debridge", "bridge")
        ), check.recommendedPipeline());

        RouteCheck fromArbitrum = table.checkRoute("arbitrum", "hyperliquid", "debridge");
        Assertions.assertEquals(1, fromArbitrum.recommendedPipeline().size());
    }

    @Test
    void unknownTuplesAreUnsupportedWithoutPipeline() {
        RouteCheck unknownProvider = table.checkRoute("base", "solana", "wormhole");
        RouteCheck sameChain = table.checkRoute("base", "base", "debridge");
        RouteCheck blank = table.checkRoute(null, "solana", "debridge");

        for (RouteCheck check : List.of(unknownProvider, sameChain, blank)) {
            Assertions.assertFalse(check.supported());
            Assertions.assertFalse(check.decomposable());
            Assertions.assertTrue(check.recommendedPipeline().isEmpty());
        }
    }
}
