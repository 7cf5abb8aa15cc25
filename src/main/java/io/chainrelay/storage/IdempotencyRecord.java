package io.chainrelay.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.chainrelay.model.OperatorError;

public record IdempotencyRecord(
        String key,
        Status status,
        String runId,
        JsonNode result,
        OperatorError error,
        long createdAtMs,
        Long completedAtMs
) {
    public enum Status {
        PENDING,
        COMPLETED,
        FAILED
    }

    public boolean settled() {
        return status != Status.PENDING;
    }
}
