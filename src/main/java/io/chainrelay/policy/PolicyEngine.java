package io.chainrelay.policy;

import io.chainrelay.model.Action;
import io.chainrelay.model.BridgeIntent;
import io.chainrelay.model.CancelOrderIntent;
import io.chainrelay.model.CanonicalIntent;
import io.chainrelay.model.OrderIntent;
import io.chainrelay.model.ProtocolDepositIntent;
import io.chainrelay.model.ProtocolWithdrawIntent;
import io.chainrelay.model.SwapIntent;
import io.chainrelay.model.TransferIntent;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates a canonical intent against a {@link PolicyDocument}.
 *
 * <p>Evaluation is pure: no I/O, no clock, no shared state. Every check runs and every
 * violation is reported, in this order: network, allowlists, key segregation, limits.
 * Limits are compared as exact decimals.
 */
public final class PolicyEngine {
    public static final String NETWORK_NOT_MAINNET = "POLICY_NETWORK_NOT_MAINNET";
    public static final String CHAIN_DENIED = "POLICY_CHAIN_DENIED";
    public static final String ASSET_DENIED = "POLICY_ASSET_DENIED";
    public static final String RECIPIENT_DENIED = "POLICY_RECIPIENT_DENIED";
    public static final String RECIPIENT_REQUIRED = "POLICY_RECIPIENT_REQUIRED";
    public static final String BRIDGE_ROUTE_DENIED = "POLICY_BRIDGE_ROUTE_DENIED";
    public static final String SYMBOL_DENIED = "POLICY_SYMBOL_DENIED";
    public static final String SIGNER_MISSING = "KEY_SEGREGATION_SIGNER_MISSING";
    public static final String KEY_SEGREGATION = "KEY_SEGREGATION_VIOLATION";
    public static final String ORDER_SIZE_EXCEEDED = "POLICY_ORDER_SIZE_EXCEEDED";
    public static final String SLIPPAGE_REQUIRED = "POLICY_SLIPPAGE_REQUIRED";
    public static final String SLIPPAGE_EXCEEDED = "POLICY_SLIPPAGE_EXCEEDED";
    public static final String LEVERAGE_EXCEEDED = "POLICY_LEVERAGE_EXCEEDED";
    public static final String NOTIONAL_UNKNOWN = "POLICY_NOTIONAL_UNKNOWN";
    public static final String NOTIONAL_EXCEEDED = "POLICY_NOTIONAL_EXCEEDED";

    private static final Set<String> PRODUCTION_NETWORKS = Set.of("mainnet", "mainnet-beta");

    public PolicyEvaluationResult evaluate(CanonicalIntent intent, PolicyDocument policy, EvaluationContext context) {
        List<PolicyViolation> violations = new ArrayList<>();
        checkNetwork(intent, policy, violations);
        checkAllowlists(intent, policy.allowlists(), violations);
        if (policy.requireKeySegregation()) {
            checkKeySegregation(intent, context, violations);
        }
        BigDecimal notional = checkLimits(intent, policy, violations);
        boolean simulationFirst = policy.requireSimulation()
                && !context.dryRun()
                && intent.action() != Action.TRANSFER;
        return PolicyEvaluationResult.of(violations, simulationFirst, notional);
    }

    private void checkNetwork(CanonicalIntent intent, PolicyDocument policy, List<PolicyViolation> out) {
        if (policy.allowMainnetOnly() && !PRODUCTION_NETWORKS.contains(intent.network())) {
            out.add(new PolicyViolation(NETWORK_NOT_MAINNET, "network", intent.network()));
        }
    }

    private void checkAllowlists(CanonicalIntent intent, PolicyDocument.Allowlists lists, List<PolicyViolation> out) {
        for (String chain : intent.chains()) {
            if (!lists.chains().contains(chain)) {
                out.add(new PolicyViolation(CHAIN_DENIED, "chain", chain));
            }
        }
        for (String asset : intent.assets()) {
            if (!lists.assets().contains(asset)) {
                out.add(new PolicyViolation(ASSET_DENIED, "asset", asset));
            }
        }
        intent.recipientAddress().ifPresent(recipient -> {
            if (!lists.recipients().contains(recipient)) {
                out.add(new PolicyViolation(RECIPIENT_DENIED, "recipient", recipient));
            }
        });
        if (intent instanceof ProtocolWithdrawIntent withdraw && withdraw.recipient() == null) {
            out.add(new PolicyViolation(RECIPIENT_REQUIRED, "recipient", "withdrawals must name a recipient"));
        }
        if (intent instanceof BridgeIntent bridge && !lists.bridgeRoutes().contains(bridge.routeName())) {
            out.add(new PolicyViolation(BRIDGE_ROUTE_DENIED, "route", bridge.routeName()));
        }
        intent.marketSymbol().ifPresent(symbol -> {
            if (!lists.symbols().contains(symbol)) {
                out.add(new PolicyViolation(SYMBOL_DENIED, "market", symbol));
            }
        });
    }

    private void checkKeySegregation(CanonicalIntent intent, EvaluationContext context, List<PolicyViolation> out) {
        for (String chain : intent.chains()) {
            if (context.signerFor(chain).isEmpty()) {
                out.add(new PolicyViolation(SIGNER_MISSING, "chain", chain));
            }
        }
        intent.crossDomainLeg().ifPresent(leg -> {
            Optional<String> source = context.signerFor(leg.source());
            Optional<String> destination = context.signerFor(leg.destination());
            if (source.isPresent() && source.equals(destination)) {
                out.add(new PolicyViolation(
                        KEY_SEGREGATION,
                        "signer",
                        leg.source() + " and " + leg.destination() + " share signer " + source.get()
                ));
            }
        });
    }

    /** Returns the notional in USD when it could be estimated. */
    private BigDecimal checkLimits(CanonicalIntent intent, PolicyDocument policy, List<PolicyViolation> out) {
        PolicyDocument.Limits limits = policy.limits();
        if (intent instanceof OrderIntent order) {
            checkOrder(order, limits, out);
        }
        if (intent instanceof SwapIntent swap) {
            checkSlippage(swap.slippageBps(), true, limits, out);
        }
        Optional<BigDecimal> notional = notionalUsd(intent, policy);
        if (limits.maxNotionalUsdPerTx() != null && notionalCapped(intent)) {
            if (notional.isEmpty()) {
                out.add(new PolicyViolation(NOTIONAL_UNKNOWN, "amount",
                        "no stable asset, reference price or limit price to value the operation"));
            } else if (notional.get().compareTo(limits.maxNotionalUsdPerTx()) > 0) {
                out.add(new PolicyViolation(NOTIONAL_EXCEEDED, "amount",
                        notional.get().toPlainString() + " > " + limits.maxNotionalUsdPerTx().toPlainString()));
            }
        }
        return notional.orElse(null);
    }

    private void checkOrder(OrderIntent order, PolicyDocument.Limits limits, List<PolicyViolation> out) {
        BigDecimal size = new BigDecimal(order.size());
        if (limits.maxOrderSize() != null && size.compareTo(limits.maxOrderSize()) > 0) {
            out.add(new PolicyViolation(ORDER_SIZE_EXCEEDED, "size",
                    order.size() + " > " + limits.maxOrderSize().toPlainString()));
        }
        checkSlippage(order.slippageBps(), order.marketOrder(), limits, out);
        if (order.perp() && order.leverage() != null && limits.maxLeverage() != null
                && new BigDecimal(order.leverage()).compareTo(limits.maxLeverage()) > 0) {
            out.add(new PolicyViolation(LEVERAGE_EXCEEDED, "leverage",
                    order.leverage() + " > " + limits.maxLeverage().toPlainString()));
        }
    }

    private void checkSlippage(Integer slippageBps, boolean required, PolicyDocument.Limits limits, List<PolicyViolation> out) {
        if (limits.maxSlippageBps() == null) {
            return;
        }
        if (slippageBps == null) {
            if (required) {
                out.add(new PolicyViolation(SLIPPAGE_REQUIRED, "slippageBps",
                        "a slippage bound is required when the policy caps slippage"));
            }
            return;
        }
        if (slippageBps > limits.maxSlippageBps()) {
            out.add(new PolicyViolation(SLIPPAGE_EXCEEDED, "slippageBps",
                    slippageBps + " > " + limits.maxSlippageBps()));
        }
    }

    private boolean notionalCapped(CanonicalIntent intent) {
        return !(intent instanceof CancelOrderIntent);
    }

    private Optional<BigDecimal> notionalUsd(CanonicalIntent intent, PolicyDocument policy) {
        if (intent instanceof TransferIntent transfer) {
            return policy.usdValue(transfer.asset(), new BigDecimal(transfer.amount()));
        }
        if (intent instanceof SwapIntent swap) {
            return policy.usdValue(swap.assetIn(), new BigDecimal(swap.amount()));
        }
        if (intent instanceof BridgeIntent bridge) {
            return policy.usdValue(bridge.asset(), new BigDecimal(bridge.amount()));
        }
        if (intent instanceof OrderIntent order) {
            return order.effectivePrice().map(price -> price.multiply(new BigDecimal(order.size())));
        }
        if (intent instanceof ProtocolDepositIntent deposit) {
            return policy.usdValue(deposit.asset(), new BigDecimal(deposit.amount()));
        }
        if (intent instanceof ProtocolWithdrawIntent withdraw) {
            return policy.usdValue(withdraw.asset(), new BigDecimal(withdraw.amount()));
        }
        return Optional.empty();
    }
}
