package io.chainrelay.policy;

import java.math.BigDecimal;
import java.util.List;

public record PolicyEvaluationResult(
        boolean allowed,
        List<PolicyViolation> violations,
        boolean requiresSimulationFirst,
        BigDecimal notionalUsd
) {
    public PolicyEvaluationResult {
        violations = List.copyOf(violations);
        if (allowed != violations.isEmpty()) {
            throw new IllegalArgumentException("allowed must hold exactly when there are no violations");
        }
    }

    public static PolicyEvaluationResult of(List<PolicyViolation> violations, boolean requiresSimulationFirst, BigDecimal notionalUsd) {
        return new PolicyEvaluationResult(violations.isEmpty(), violations, requiresSimulationFirst, notionalUsd);
    }
}
