package io.chainrelay.runtime;

import io.chainrelay.connector.ConnectorRegistry;
import io.chainrelay.model.CanonicalIntent;
import io.chainrelay.model.CrossDomainLeg;
import io.chainrelay.model.IntentCodec;
import io.chainrelay.policy.EvaluationContext;
import io.chainrelay.policy.PolicyDocument;
import io.chainrelay.policy.PolicyEngine;
import io.chainrelay.policy.PolicyEvaluationResult;
import io.chainrelay.routing.PipelineHop;
import io.chainrelay.routing.RouteCheck;
import io.chainrelay.routing.RouteFeasibilityTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only preview of an execution. A route the table can only reach through a
 * pipeline is reported hop by hop; the hops are never executed from here.
 */
public final class ExecutionPlanner {
    private final PolicyEngine policyEngine;
    private final RouteFeasibilityTable routes;
    private final ConnectorRegistry connectors;
    private final Map<String, String> signerIdentities;

    public ExecutionPlanner(
            PolicyEngine policyEngine,
            RouteFeasibilityTable routes,
            ConnectorRegistry connectors,
            Map<String, String> signerIdentities
    ) {
        this.policyEngine = policyEngine;
        this.routes = routes;
        this.connectors = connectors;
        this.signerIdentities = Map.copyOf(signerIdentities);
    }

    public PlanOutcome plan(CanonicalIntent intent, PolicyDocument policy, boolean dryRun) {
        PolicyEvaluationResult evaluation = policyEngine.evaluate(intent, policy, EvaluationContext.of(dryRun, signerIdentities));
        String connectorId = intent.connectorId();
        Optional<CrossDomainLeg> leg = intent.crossDomainLeg();
        RouteCheck route = leg.map(l -> routes.checkRoute(l.source(), l.destination(), l.provider())).orElse(null);

        List<PlanStep> steps = new ArrayList<>();
        steps.add(new PlanStep(1, "validate-policy", evaluation.allowed()
                ? "policy " + policy.version() + " allows the intent"
                : evaluation.violations().size() + " policy violation(s)"));
        if (route != null && route.decomposable()) {
            for (PipelineHop hop : route.recommendedPipeline()) {
                steps.add(new PlanStep(steps.size() + 1, "bridge-hop-" + hop.sequence(),
                        hop.operation() + " " + hop.source() + "->" + hop.destination() + " via " + hop.provider()));
            }
        } else {
            String operation = leg.flatMap(l -> routes.operationFor(l.source(), l.destination(), l.provider()))
                    .orElse(intent.action().wireName());
            steps.add(new PlanStep(steps.size() + 1, "preflight-" + connectorId, operation + " dry-run on " + connectorId));
            if (!dryRun) {
                steps.add(new PlanStep(steps.size() + 1, "execute-" + connectorId, operation + " on " + connectorId));
            }
        }

        boolean routable = route == null || route.supported() || route.decomposable();
        return new PlanOutcome(
                evaluation.allowed() && routable,
                dryRun,
                ExecutionOrchestrator.idempotencyKeyFor(intent, policy),
                connectorId,
                connectors.findById(connectorId).isPresent(),
                IntentCodec.toJson(intent),
                evaluation,
                route,
                steps
        );
    }
}
