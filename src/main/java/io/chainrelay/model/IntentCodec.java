package io.chainrelay.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chainrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads and writes canonical intents as JSON objects discriminated by {@code action}.
 * Unknown members are rejected so that a misspelt limit-relevant field never slips through.
 */
public final class IntentCodec {
    public static final String ACTION_FIELD = "action";

    private IntentCodec() {
    }

    public static CanonicalIntent fromFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new OperatorException(ErrorCode.INTENT_INVALID, "Intent file not found: " + file);
        }
        try {
            return fromJson(Jsons.mapper().readTree(file.toFile()));
        } catch (IOException e) {
            throw new OperatorException(
                    OperatorError.of(ErrorCode.INTENT_INVALID, "Intent file is not valid JSON: " + file),
                    e
            );
        }
    }

    public static CanonicalIntent fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new OperatorException(ErrorCode.INTENT_INVALID, "Intent must be a JSON object");
        }
        String rawAction = node.path(ACTION_FIELD).asText("");
        Action action = Action.fromWire(rawAction).orElseThrow(() -> new OperatorException(
                ErrorCode.INTENT_INVALID,
                "Unsupported intent action: " + rawAction,
                Map.of("action", rawAction)
        ));
        return fromJson(action, node);
    }

    public static CanonicalIntent fromJson(Action action, JsonNode fields) {
        ObjectNode body = fields.deepCopy();
        body.remove(ACTION_FIELD);
        try {
            return Jsons.mapper().treeToValue(body, action.intentType());
        } catch (UnrecognizedPropertyException e) {
            throw new OperatorException(
                    OperatorError.of(
                            ErrorCode.INTENT_INVALID,
                            "Unknown field for " + action.wireName() + " intent: " + e.getPropertyName(),
                            Map.of("action", action.wireName(), "field", e.getPropertyName())
                    ),
                    e
            );
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new OperatorException(
                    OperatorError.of(
                            ErrorCode.INTENT_INVALID,
                            "Invalid " + action.wireName() + " intent: " + rootMessage(e),
                            Map.of("action", action.wireName())
                    ),
                    e
            );
        }
    }

    public static ObjectNode toJson(CanonicalIntent intent) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put(ACTION_FIELD, intent.action().wireName());
        ObjectNode fields = Jsons.mapper().valueToTree(intent);
        fields.fields().forEachRemaining(entry -> {
            if (!entry.getValue().isNull()) {
                out.set(entry.getKey(), entry.getValue());
            }
        });
        return out;
    }

    private static String rootMessage(Throwable e) {
        Throwable cursor = e;
        while (cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        if (cursor instanceof JsonProcessingException jpe) {
            return jpe.getOriginalMessage();
        }
        return cursor.getMessage();
    }
}
