package io.chainrelay.policy;

import java.util.Map;
import java.util.Optional;

/**
 * Caller-side facts the policy needs but the intent does not carry: whether the run is
 * a dry-run, and which signing identity backs each chain.
 */
public record EvaluationContext(boolean dryRun, Map<String, String> signerIdentities) {
    public EvaluationContext {
        signerIdentities = signerIdentities == null ? Map.of() : Map.copyOf(signerIdentities);
    }

    public static EvaluationContext of(boolean dryRun, Map<String, String> signerIdentities) {
        return new EvaluationContext(dryRun, signerIdentities);
    }

    public Optional<String> signerFor(String chain) {
        return Optional.ofNullable(signerIdentities.get(chain));
    }
}
