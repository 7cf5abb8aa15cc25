/**
 * Execution orchestration package.
 *
 * <p>{@link io.chainrelay.runtime.ExecutionOrchestrator} owns the per-run state machine:
 * policy gating, idempotency reservation, breaker admission, route feasibility and
 * connector dispatch. {@link io.chainrelay.runtime.ExecutionPlanner} is its read-only twin.
 */
package io.chainrelay.runtime;
