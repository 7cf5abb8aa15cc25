package io.chainrelay.policy;

import io.chainrelay.model.BridgeIntent;
import io.chainrelay.model.CancelOrderIntent;
import io.chainrelay.model.OrderIntent;
import io.chainrelay.model.ProtocolWithdrawIntent;
import io.chainrelay.model.SwapIntent;
import io.chainrelay.model.TransferIntent;
import io.chainrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

final class PolicyEngineTest {
    private static final String RECIPIENT = "0x00000000000000000000000000000000000000aa";

    private final PolicyEngine engine = new PolicyEngine();

    @Test
    void allowedTransferReportsStableNotional() {
        PolicyDocument policy = policy("""
                {
                  "version": "p1",
                  "requireKeySegregation": false,
                  "allowlists": {"chains": ["base"], "assets": ["USDC"], "recipients": ["0x00000000000000000000000000000000000000AA"]},
                  "limits": {"maxNotionalUsdPerTx": "1000"}
                }
                """);
        TransferIntent intent = new TransferIntent("base", "usdc", "250.50", RECIPIENT, null, null);

        PolicyEvaluationResult result = engine.evaluate(intent, policy, EvaluationContext.of(false, Map.of()));

        Assertions.assertTrue(result.allowed());
        Assertions.assertTrue(result.violations().isEmpty());
        Assertions.assertEquals(0, new BigDecimal("250.5").compareTo(result.notionalUsd()));
        Assertions.assertFalse(result.requiresSimulationFirst());
    }

    @Test
    void violationsAreCollectedInCheckOrder() {
        PolicyDocument policy = policy("""
                {
                  "version": "p1",
                  "requireKeySegregation": false,
                  "allowlists": {"chains": ["base"], "assets": ["USDC"], "recipients": []}
                }
                """);
        TransferIntent intent = new TransferIntent("solana", "SOL", "1", RECIPIENT, "devnet", null);

        PolicyEvaluationResult result = engine.evaluate(intent, policy, EvaluationContext.of(false, Map.of()));

        Assertions.assertFalse(result.allowed());
        Assertions.assertEquals(
                List.of(PolicyEngine.NETWORK_NOT_MAINNET, PolicyEngine.CHAIN_DENIED,
                        PolicyEngine.ASSET_DENIED, PolicyEngine.RECIPIENT_DENIED),
                codes(result)
        );
    }

    @Test
    void missingAllowlistsAdmitNothing() {
        PolicyDocument policy = policy("""
                {"version": "p1", "requireKeySegregation": false}
                """);
        BridgeIntent intent = new BridgeIntent("base", "solana", "USDC", "10", null, null, null);

        PolicyEvaluationResult result = engine.evaluate(intent, policy, EvaluationContext.of(true, Map.of()));

        Assertions.assertEquals(
                List.of(PolicyEngine.CHAIN_DENIED, PolicyEngine.CHAIN_DENIED,
                        PolicyEngine.ASSET_DENIED, PolicyEngine.BRIDGE_ROUTE_DENIED),
                codes(result)
        );
    }

    @Test
    void notionalCapUsesExactDecimalComparison() {
        PolicyDocument policy = policy("""
                {
                  "version": "p1",
                  "requireKeySegregation": false,
                  "allowlists": {"chains": ["base"], "assets": ["USDC"], "recipients": ["%s"]},
                  "limits": {"maxNotionalUsdPerTx": "1000"}
                }
                """.formatted(RECIPIENT));
        EvaluationContext ctx = EvaluationContext.of(false, Map.of());

        Assertions.assertTrue(engine.evaluate(
                new TransferIntent("base", "USDC", "1000.000", RECIPIENT, null, null), policy, ctx).allowed());

        PolicyEvaluationResult over = engine.evaluate(
                new TransferIntent("base", "USDC", "1000.0000000001", RECIPIENT, null, null), policy, ctx);
        Assertions.assertEquals(List.of(PolicyEngine.NOTIONAL_EXCEEDED), codes(over));
    }

    @Test
    void unpricedAssetUnderNotionalCapIsRejected() {
        PolicyDocument policy = policy("""
                {
                  "version": "p1",
                  "requireKeySegregation": false,
                  "allowlists": {"chains": ["solana"], "assets": ["BONK"], "recipients": ["%s"]},
                  "limits": {"maxNotionalUsdPerTx": "1000"}
                }
                """.formatted(RECIPIENT));

        PolicyEvaluationResult result = engine.evaluate(
                new TransferIntent("solana", "BONK", "5", RECIPIENT, null, null), policy, EvaluationContext.of(false, Map.of()));

        Assertions.assertEquals(List.of(PolicyEngine.NOTIONAL_UNKNOWN), codes(result));
        Assertions.assertNull(result.notionalUsd());
    }

    @Test
    void keySegregationRequiresDistinctSignersPerLeg() {
        PolicyDocument policy = policy("""
                {
                  "version": "p1",
                  "allowlists": {"chains": ["base", "solana"], "assets": ["USDC"], "bridgeRoutes": ["base->solana"]}
                }
                """);
        BridgeIntent intent = new BridgeIntent("base", "solana", "USDC", "10", "debridge", null, null);

        PolicyEvaluationResult shared = engine.evaluate(intent, policy,
                EvaluationContext.of(false, Map.of("base", "ops-key", "solana", "ops-key")));
        Assertions.assertEquals(List.of(PolicyEngine.KEY_SEGREGATION), codes(shared));

        PolicyEvaluationResult missing = engine.evaluate(intent, policy,
                EvaluationContext.of(false, Map.of("base", "base-key")));
        Assertions.assertEquals(List.of(PolicyEngine.SIGNER_MISSING), codes(missing));
        Assertions.assertEquals("solana", missing.violations().get(0).detail());

        Assertions.assertTrue(engine.evaluate(intent, policy,
                EvaluationContext.of(false, Map.of("base", "base-key", "solana", "sol-key"))).allowed());
    }

    @Test
    void orderLimitsCoverSizeSlippageAndLeverage() {
        PolicyDocument policy = policy("""
                {
                  "version": "p1",
                  "requireKeySegregation": false,
                  "allowlists": {"chains": ["hyperliquid"], "symbols": ["BTC"]},
                  "limits": {"maxOrderSize": "0.5", "maxSlippageBps": 50, "maxLeverage": "3", "maxNotionalUsdPerTx": "100000"}
                }
                """);
        OrderIntent order = new OrderIntent(null, "btc", "perp", "buy", "0.75", "market", "60000", "5",
                null, null, null);

        PolicyEvaluationResult result = engine.evaluate(order, policy, EvaluationContext.of(false, Map.of()));

        Assertions.assertEquals(
                List.of(PolicyEngine.ORDER_SIZE_EXCEEDED, PolicyEngine.SLIPPAGE_REQUIRED, PolicyEngine.LEVERAGE_EXCEEDED),
                codes(result)
        );
        Assertions.assertEquals(0, new BigDecimal("45000").compareTo(result.notionalUsd()));
    }

    @Test
    void swapSlippageAboveCapIsRejected() {
        PolicyDocument policy = policy("""
                {
                  "version": "p1",
                  "requireKeySegregation": false,
                  "allowlists": {"chains": ["solana"], "assets": ["USDC", "SOL"]},
                  "limits": {"maxSlippageBps": 50}
                }
                """);
        SwapIntent swap = new SwapIntent("solana", "jupiter", "USDC", "SOL", "10", 80, null, null);

        PolicyEvaluationResult result = engine.evaluate(swap, policy, EvaluationContext.of(false, Map.of()));

        Assertions.assertEquals(List.of(PolicyEngine.SLIPPAGE_EXCEEDED), codes(result));
    }

    @Test
    void cancellationsAreNotNotionalCapped() {
        PolicyDocument policy = policy("""
                {
                  "version": "p1",
                  "requireKeySegregation": false,
                  "allowlists": {"chains": ["hyperliquid"], "symbols": ["ETH"]},
                  "limits": {"maxNotionalUsdPerTx": "1"}
                }
                """);
        CancelOrderIntent cancel = new CancelOrderIntent(null, "ETH", "perp", "0xorder1", null);

        Assertions.assertTrue(engine.evaluate(cancel, policy, EvaluationContext.of(false, Map.of())).allowed());
    }

    @Test
    void withdrawalWithoutRecipientIsFlagged() {
        PolicyDocument policy = policy("""
                {
                  "version": "p1",
                  "requireKeySegregation": false,
                  "allowlists": {"chains": ["base"], "assets": ["USDC"]}
                }
                """);
        ProtocolWithdrawIntent withdraw = new ProtocolWithdrawIntent("base", "aave", "0xpool", "USDC", "5", null, null);

        PolicyEvaluationResult result = engine.evaluate(withdraw, policy, EvaluationContext.of(false, Map.of()));

        Assertions.assertEquals(List.of(PolicyEngine.RECIPIENT_REQUIRED), codes(result));
    }

    @Test
    void simulationFirstAppliesToLiveNonTransfers() {
        PolicyDocument policy = policy("""
                {
                  "version": "p1",
                  "requireKeySegregation": false,
                  "requireSimulation": true,
                  "allowlists": {"chains": ["solana"], "assets": ["USDC", "SOL"], "recipients": ["%s"]}
                }
                """.formatted(RECIPIENT));
        SwapIntent swap = new SwapIntent("solana", "jupiter", "USDC", "SOL", "10", null, null, null);
        TransferIntent transfer = new TransferIntent("solana", "USDC", "10", RECIPIENT, null, null);

        Assertions.assertTrue(engine.evaluate(swap, policy, EvaluationContext.of(false, Map.of())).requiresSimulationFirst());
        Assertions.assertFalse(engine.evaluate(swap, policy, EvaluationContext.of(true, Map.of())).requiresSimulationFirst());
        Assertions.assertFalse(engine.evaluate(transfer, policy, EvaluationContext.of(false, Map.of())).requiresSimulationFirst());
    }

    private static PolicyDocument policy(String json) {
        return PolicyLoader.parse(Jsons.readTree(json));
    }

    private static List<String> codes(PolicyEvaluationResult result) {
        return result.violations().stream().map(PolicyViolation::code).toList();
    }
}
