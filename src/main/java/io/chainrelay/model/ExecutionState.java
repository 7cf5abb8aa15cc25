package io.chainrelay.model;

public enum ExecutionState {
    RECEIVED,
    POLICY_CHECKED,
    IDEMPOTENCY_CHECKED,
    BREAKER_CHECKED,
    ROUTE_CHECKED,
    DISPATCHED,
    COMPLETED,
    FAILED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED;
    }
}
