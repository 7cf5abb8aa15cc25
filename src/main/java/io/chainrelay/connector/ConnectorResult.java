package io.chainrelay.connector;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record ConnectorResult(
        boolean success,
        JsonNode output,
        Failure failure
) {
    public static ConnectorResult ok(JsonNode output) {
        return new ConnectorResult(true, output, null);
    }

    public static ConnectorResult fail(String code, String message) {
        return new ConnectorResult(false, null, new Failure(code, message, Map.of()));
    }

    public static ConnectorResult fail(String code, String message, Map<String, Object> details) {
        return new ConnectorResult(false, null, new Failure(code, message, details == null ? Map.of() : details));
    }

    /** Connector-specific failure; {@code code} belongs to the binding, not to the operator. */
    public record Failure(String code, String message, Map<String, Object> details) {
    }
}
