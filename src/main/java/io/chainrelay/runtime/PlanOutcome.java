package io.chainrelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.chainrelay.policy.PolicyEvaluationResult;
import io.chainrelay.routing.RouteCheck;

import java.util.List;

/**
 * What an execution of the intent would do, computed without touching any store.
 * {@code route} is null for intents that stay inside one settlement domain.
 */
public record PlanOutcome(
        boolean ok,
        boolean dryRun,
        String idempotencyKey,
        String connectorId,
        boolean connectorRegistered,
        JsonNode intent,
        PolicyEvaluationResult policy,
        RouteCheck route,
        List<PlanStep> steps
) {
    public PlanOutcome {
        steps = List.copyOf(steps);
    }
}
