package io.chainrelay.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.chainrelay.util.Jsons;

import java.util.LinkedHashMap;
import java.util.Map;

public record OperatorError(
        ErrorCode code,
        String message,
        Map<String, Object> details
) {
    public OperatorError {
        if (code == null) {
            throw new IllegalArgumentException("error code is required");
        }
        message = message == null ? code.name() : message;
        details = details == null ? Map.of() : Map.copyOf(withoutNulls(details));
    }

    public static OperatorError of(ErrorCode code, String message) {
        return new OperatorError(code, message, Map.of());
    }

    public static OperatorError of(ErrorCode code, String message, Map<String, Object> details) {
        return new OperatorError(code, message, details);
    }

    @SuppressWarnings("unchecked")
    public static OperatorError fromJson(JsonNode node) {
        ErrorCode code = ErrorCode.valueOf(node.path("code").asText());
        Map<String, Object> details = node.path("details").isObject()
                ? Jsons.mapper().convertValue(node.get("details"), Map.class)
                : Map.of();
        return new OperatorError(code, node.path("message").asText(code.name()), details);
    }

    public JsonNode toJson() {
        return Jsons.mapper().valueToTree(this);
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            if (k != null && v != null) {
                out.put(k, v);
            }
        });
        return out;
    }
}
