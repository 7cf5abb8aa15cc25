package io.chainrelay.plane;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chainrelay.model.CanonicalIntent;
import io.chainrelay.model.ErrorCode;
import io.chainrelay.model.IntentCodec;
import io.chainrelay.model.OperatorError;
import io.chainrelay.model.OperatorException;
import io.chainrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Validates A2A v1 envelopes and turns their params into canonical intents.
 */
public final class ExecutionPayloadParser {
    public static final String SUPPORTED_VERSION = "1";
    private static final Set<String> ENVELOPE_FIELDS = Set.of("version", "operation", "params", "auth", "meta");
    private static final Set<String> META_FIELDS = Set.of("requestId", "correlationId", "timestamp", "dryRun");

    private ExecutionPayloadParser() {
    }

    public static JsonNode readFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new OperatorException(ErrorCode.EXECUTION_PAYLOAD_INVALID, "Payload file not found: " + file);
        }
        try {
            return Jsons.mapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new OperatorException(
                    OperatorError.of(ErrorCode.EXECUTION_PAYLOAD_INVALID, "Payload file is not valid JSON: " + file),
                    e
            );
        }
    }

    public static ExecutionPayload parse(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw invalid(List.of("payload must be a JSON object"));
        }
        List<String> errors = new ArrayList<>();
        Iterator<String> names = raw.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!ENVELOPE_FIELDS.contains(name)) {
                errors.add("unknown envelope field: " + name);
            }
        }
        String version = raw.path("version").asText("");
        if (!SUPPORTED_VERSION.equals(version)) {
            errors.add("version must be \"" + SUPPORTED_VERSION + "\"");
        }
        JsonNode params = raw.path("params");
        if (!params.isObject()) {
            errors.add("params must be an object");
        }
        JsonNode auth = raw.get("auth");
        boolean signed = auth != null && !auth.isNull();
        ExecutionPayload.Meta meta = meta(raw.path("meta"), errors);
        String rawOperation = raw.path("operation").asText("");
        if (rawOperation.isBlank()) {
            errors.add("operation is required");
        }
        if (!errors.isEmpty()) {
            throw invalid(errors);
        }
        PlaneOperation operation = PlaneOperation.fromWire(rawOperation).orElseThrow(() -> new OperatorException(
                ErrorCode.EXECUTION_OPERATION_UNKNOWN,
                "Unsupported execution operation: " + rawOperation,
                Map.of("operation", rawOperation,
                        "supported", Arrays.stream(PlaneOperation.values()).map(PlaneOperation::wireName).toList())
        ));
        return new ExecutionPayload(version, operation, params, signed, meta, raw);
    }

    /** Builds the intent the envelope asks for, applying the operation's pinned and default params. */
    public static CanonicalIntent toIntent(ExecutionPayload payload) {
        PlaneOperation operation = payload.operation();
        ObjectNode fields = payload.params().deepCopy();
        List<String> conflicts = new ArrayList<>();
        operation.pinned().forEach((field, value) -> {
            JsonNode given = fields.get(field);
            if (given != null && !given.isNull() && !value.equals(given.asText().trim().toLowerCase(Locale.ROOT))) {
                conflicts.add(field + " must be " + value + " for " + operation.wireName());
            }
            fields.put(field, value);
        });
        if (!conflicts.isEmpty()) {
            throw invalid(conflicts);
        }
        operation.defaults().forEach((field, value) -> {
            if (!fields.hasNonNull(field)) {
                fields.put(field, value);
            }
        });
        return IntentCodec.fromJson(operation.action(), fields);
    }

    private static ExecutionPayload.Meta meta(JsonNode node, List<String> errors) {
        if (node.isMissingNode() || node.isNull()) {
            return ExecutionPayload.Meta.empty();
        }
        if (!node.isObject()) {
            errors.add("meta must be an object");
            return ExecutionPayload.Meta.empty();
        }
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!META_FIELDS.contains(name)) {
                errors.add("unknown meta field: " + name);
            }
        }
        JsonNode dryRun = node.path("dryRun");
        if (!dryRun.isMissingNode() && !dryRun.isNull() && !dryRun.isBoolean()) {
            errors.add("meta.dryRun must be a boolean");
        }
        return new ExecutionPayload.Meta(
                textOrNull(node, "requestId"),
                textOrNull(node, "correlationId"),
                textOrNull(node, "timestamp"),
                dryRun.isBoolean() && dryRun.booleanValue()
        );
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || value.asText().isBlank() ? null : value.asText().trim();
    }

    private static OperatorException invalid(List<String> errors) {
        return new OperatorException(
                ErrorCode.EXECUTION_PAYLOAD_INVALID,
                "Execution payload failed validation",
                Map.of("errors", List.copyOf(errors))
        );
    }
}
