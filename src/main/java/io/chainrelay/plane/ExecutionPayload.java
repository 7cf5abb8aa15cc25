package io.chainrelay.plane;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A parsed A2A v1 envelope. {@code raw} is the payload exactly as received; signatures
 * are verified against it, never against a re-serialisation of the parsed fields.
 */
public record ExecutionPayload(
        String version,
        PlaneOperation operation,
        JsonNode params,
        boolean signed,
        Meta meta,
        JsonNode raw
) {
    public record Meta(String requestId, String correlationId, String timestamp, boolean dryRun) {
        public static Meta empty() {
            return new Meta(null, null, null, false);
        }
    }
}
