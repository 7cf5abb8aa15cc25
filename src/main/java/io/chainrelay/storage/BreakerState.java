package io.chainrelay.storage;

import java.util.List;

public record BreakerState(
        String scope,
        Status status,
        List<Long> failureTimestampsMs,
        Long windowStartMs,
        Long cooldownUntilMs,
        Long trialClaimedAtMs,
        String trialToken,
        String lastError,
        long updatedAtMs
) {
    public enum Status {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    public BreakerState {
        failureTimestampsMs = List.copyOf(failureTimestampsMs);
    }

    public static BreakerState closed(String scope, long nowMs) {
        return new BreakerState(scope, Status.CLOSED, List.of(), null, null, null, null, null, nowMs);
    }

    public int failureCount() {
        return failureTimestampsMs.size();
    }
}
