package io.chainrelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.chainrelay.model.ExecutionState;
import io.chainrelay.model.OperatorError;
import io.chainrelay.model.Plane;
import io.chainrelay.policy.PolicyEvaluationResult;
import io.chainrelay.security.AuthResult;

/**
 * Terminal result of one orchestrator invocation. {@code ok} holds exactly when
 * {@code state} is {@link ExecutionState#COMPLETED}.
 */
public record ExecutionOutcome(
        boolean ok,
        String runId,
        Plane plane,
        boolean dryRun,
        ExecutionState state,
        String idempotencyKey,
        boolean replayed,
        String replayedFromRunId,
        JsonNode intent,
        JsonNode result,
        OperatorError error,
        PolicyEvaluationResult policy,
        AuthResult security
) {
}
