package io.chainrelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record ReplayOutcome(
        String runId,
        boolean found,
        int eventCount,
        List<JsonNode> events
) {
    public ReplayOutcome {
        events = List.copyOf(events);
    }

    public static ReplayOutcome of(String runId, List<JsonNode> events) {
        return new ReplayOutcome(runId, !events.isEmpty(), events.size(), events);
    }
}
