package io.chainrelay.observability;

import io.chainrelay.model.ExecutionState;
import io.chainrelay.model.Phase;
import io.chainrelay.model.Plane;

import java.util.Map;

public record AuditEvent(
        String runId,
        Plane plane,
        Phase phase,
        String event,
        ExecutionState state,
        Map<String, Object> payload
) {
    public AuditEvent {
        payload = payload == null ? Map.of() : payload;
    }

    public static AuditEvent of(String runId, Plane plane, Phase phase, String event, ExecutionState state) {
        return new AuditEvent(runId, plane, phase, event, state, Map.of());
    }

    public static AuditEvent of(
            String runId,
            Plane plane,
            Phase phase,
            String event,
            ExecutionState state,
            Map<String, Object> payload
    ) {
        return new AuditEvent(runId, plane, phase, event, state, payload);
    }
}
