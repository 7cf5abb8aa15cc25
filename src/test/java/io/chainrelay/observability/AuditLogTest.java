package io.chainrelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.chainrelay.MutableClock;
import io.chainrelay.model.ExecutionState;
import io.chainrelay.model.Phase;
import io.chainrelay.model.Plane;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class AuditLogTest {

    @Test
    void readRunReturnsOnlyThatRunInAppendOrder() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-audit-");
        try {
            AuditLog log = new AuditLog(root.resolve("audit/audit.log"), "desk-a", null, MutableClock.at("2026-10-01T00:00:00Z"));
            log.append(AuditEvent.of("run_a", Plane.CONTROL, Phase.POLICY, "policy_checked", ExecutionState.POLICY_CHECKED));
            log.append(AuditEvent.of("run_b", Plane.CONTROL, Phase.POLICY, "policy_denied", ExecutionState.FAILED));
            log.append(AuditEvent.of("run_a", Plane.CONTROL, Phase.RESULT, "completed", ExecutionState.COMPLETED,
                    Map.of("connectorId", "jupiter")));

            List<JsonNode> events = log.readRun("run_a");

            Assertions.assertEquals(List.of("policy_checked", "completed"), eventNames(events));
            Assertions.assertEquals("desk-a", events.get(0).path("namespace").asText());
            Assertions.assertEquals("control", events.get(0).path("plane").asText());
            Assertions.assertEquals("policy", events.get(0).path("phase").asText());
            Assertions.assertEquals("COMPLETED", events.get(1).path("state").asText());
            Assertions.assertEquals("", events.get(0).path("prev_hash").asText());
            Assertions.assertEquals(eventNames(events), eventNames(log.readRun("run_a")));
            Assertions.assertTrue(log.readRun("run_missing").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void chainSurvivesSeparateWritersAndDecimalPayloads() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-audit-chain-");
        try {
            Path file = root.resolve("audit/audit.log");
            MutableClock clock = MutableClock.at("2026-10-01T00:00:00Z");
            AuditLog first = new AuditLog(file, "default", "", clock);
            AuditLog second = new AuditLog(file, "default", "", clock);

            first.append(AuditEvent.of("run_1", Plane.CONTROL, Phase.POLICY, "policy_checked", ExecutionState.POLICY_CHECKED,
                    Map.of("notionalUsd", new BigDecimal("250.10"), "ratio", 0.1d)));
            second.append(AuditEvent.of("run_1", Plane.CONTROL, Phase.RESULT, "completed", ExecutionState.COMPLETED));
            first.append(AuditEvent.of("run_2", Plane.EXECUTION, Phase.SECURITY, "auth_accepted", ExecutionState.RECEIVED));

            AuditIntegrityOutcome outcome = first.verify();

            Assertions.assertTrue(outcome.ok(), outcome.reason());
            Assertions.assertEquals(3, outcome.totalRows());
            Assertions.assertEquals(3, outcome.checkedRows());
            List<JsonNode> run = first.readRun("run_1");
            Assertions.assertEquals(run.get(0).path("hash").asText(), run.get(1).path("prev_hash").asText());
            Assertions.assertEquals(run.get(1).path("hash").asText(), first.readRun("run_2").get(0).path("prev_hash").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedOrDroppedLinesBreakTheChain() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-audit-tamper-");
        try {
            Path file = root.resolve("audit/audit.log");
            AuditLog log = new AuditLog(file, "default", null, MutableClock.at("2026-10-01T00:00:00Z"));
            for (String event : List.of("policy_checked", "dispatched", "completed")) {
                log.append(AuditEvent.of("run_1", Plane.CONTROL, Phase.RESULT, event, ExecutionState.COMPLETED));
            }
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);

            List<String> edited = new ArrayList<>(lines);
            edited.set(1, edited.get(1).replace("\"dispatched\"", "\"failed\""));
            Files.write(file, edited, StandardCharsets.UTF_8);
            AuditIntegrityOutcome editedOutcome = log.verify();
            Assertions.assertFalse(editedOutcome.ok());
            Assertions.assertEquals("hash_mismatch", editedOutcome.reason());
            Assertions.assertEquals(2, editedOutcome.brokenLine());

            List<String> dropped = new ArrayList<>(lines);
            dropped.remove(1);
            Files.write(file, dropped, StandardCharsets.UTF_8);
            AuditIntegrityOutcome droppedOutcome = log.verify();
            Assertions.assertEquals("prev_hash_mismatch", droppedOutcome.reason());
            Assertions.assertEquals(2, droppedOutcome.brokenLine());

            List<String> garbage = new ArrayList<>(lines);
            garbage.add("{not json");
            Files.write(file, garbage, StandardCharsets.UTF_8);
            AuditIntegrityOutcome garbageOutcome = log.verify();
            Assertions.assertEquals("invalid_json", garbageOutcome.reason());
            Assertions.assertEquals(4, garbageOutcome.brokenLine());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void signedRowsFailUnderDifferentSecret() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-audit-signed-");
        try {
            Path file = root.resolve("audit/audit.log");
            MutableClock clock = MutableClock.at("2026-10-01T00:00:00Z");
            AuditLog signed = new AuditLog(file, "default", "audit-secret-one", clock);
            signed.append(AuditEvent.of("run_1", Plane.CONTROL, Phase.POLICY, "policy_checked", ExecutionState.POLICY_CHECKED));

            Assertions.assertTrue(signed.verify().ok());
            Assertions.assertFalse(signed.readRun("run_1").get(0).path("signature").asText().isBlank());

            AuditIntegrityOutcome other = new AuditLog(file, "default", "audit-secret-two", clock).verify();
            Assertions.assertFalse(other.ok());
            Assertions.assertEquals("signature_mismatch", other.reason());
            Assertions.assertEquals(1, other.brokenLine());

            Assertions.assertTrue(new AuditLog(file, "default", null, clock).verify().ok());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void secretsInPayloadAreMasked() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-audit-mask-");
        try {
            AuditLog log = new AuditLog(root.resolve("audit/audit.log"), "default", null, MutableClock.at("2026-10-01T00:00:00Z"));
            log.append(AuditEvent.of("run_1", Plane.EXECUTION, Phase.SECURITY, "auth_accepted", ExecutionState.RECEIVED,
                    Map.of("keyId", "agent-alpha", "apiKey", "live-api-key", "details", Map.of("privateKey", "0xabc"))));

            JsonNode payload = log.readRun("run_1").get(0).path("payload");

            Assertions.assertEquals("agent-alpha", payload.path("keyId").asText());
            Assertions.assertEquals("***", payload.path("apiKey").asText());
            Assertions.assertEquals("***", payload.path("details").path("privateKey").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void appendFailureIsDroppedWithoutThrowing() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-audit-drop-");
        try {
            Path dir = root.resolve("audit");
            AuditLog log = new AuditLog(dir.resolve("audit.log"), "default", null, MutableClock.at("2026-10-01T00:00:00Z"));
            deleteRecursively(dir);

            Assertions.assertDoesNotThrow(() -> log.append(
                    AuditEvent.of("run_1", Plane.CONTROL, Phase.POLICY, "policy_checked", ExecutionState.POLICY_CHECKED)));
            Assertions.assertFalse(Files.exists(dir));
        } finally {
            deleteRecursively(root);
        }
    }

    private static List<String> eventNames(List<JsonNode> events) {
        return events.stream().map(e -> e.path("event").asText()).toList();
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (var walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
