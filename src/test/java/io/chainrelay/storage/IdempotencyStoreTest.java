package io.chainrelay.storage;

import io.chainrelay.MutableClock;
import io.chainrelay.config.ChainRelayConfig;
import io.chainrelay.model.ErrorCode;
import io.chainrelay.model.OperatorError;
import io.chainrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class IdempotencyStoreTest {

    @Test
    void beginCompleteAndReplayStoredResult() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-idempotency-");
        try {
            IdempotencyStore store = store(root, MutableClock.at("2026-10-01T00:00:00Z"));

            IdempotencyStore.BeginResult first = store.begin("key-1", "run_a");
            Assertions.assertTrue(first.isNew());
            Assertions.assertNull(first.existing());

            IdempotencyStore.BeginResult pending = store.begin("key-1", "run_b");
            Assertions.assertFalse(pending.isNew());
            Assertions.assertEquals(IdempotencyRecord.Status.PENDING, pending.existing().status());
            Assertions.assertEquals("run_a", pending.existing().runId());

            IdempotencyRecord completed = store.complete("key-1", Jsons.readTree("{\"txHash\":\"0xabc\"}"));
            Assertions.assertEquals(IdempotencyRecord.Status.COMPLETED, completed.status());
            Assertions.assertTrue(completed.settled());
            Assertions.assertNotNull(completed.completedAtMs());

            IdempotencyStore.BeginResult replay = store.begin("key-1", "run_c");
            Assertions.assertFalse(replay.isNew());
            Assertions.assertEquals("0xabc", replay.existing().result().path("txHash").asText());

            Assertions.assertThrows(IllegalStateException.class, () -> store.fail("key-1",
                    OperatorError.of(ErrorCode.CONNECTOR_FAILURE, "late")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedRecordKeepsStructuredError() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-idempotency-fail-");
        try {
            IdempotencyStore store = store(root, MutableClock.at("2026-10-01T00:00:00Z"));
            store.begin("key-2", "run_a");

            store.fail("key-2", OperatorError.of(ErrorCode.CONNECTOR_FAILURE, "rpc down",
                    Map.of("connectorId", "base")));

            IdempotencyRecord record = store.find("key-2").orElseThrow();
            Assertions.assertEquals(IdempotencyRecord.Status.FAILED, record.status());
            Assertions.assertEquals(ErrorCode.CONNECTOR_FAILURE, record.error().code());
            Assertions.assertEquals("base", record.error().details().get("connectorId"));
            Assertions.assertThrows(IllegalStateException.class, () -> store.complete("key-2", Jsons.readTree("{}")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void releaseOnlyDropsPendingRecords() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-idempotency-release-");
        try {
            IdempotencyStore store = store(root, MutableClock.at("2026-10-01T00:00:00Z"));
            store.begin("pending", "run_a");
            store.begin("done", "run_b");
            store.complete("done", Jsons.readTree("{}"));

            Assertions.assertTrue(store.release("pending"));
            Assertions.assertTrue(store.find("pending").isEmpty());
            Assertions.assertFalse(store.release("done"));
            Assertions.assertTrue(store.find("done").isPresent());
            Assertions.assertTrue(store.begin("pending", "run_c").isNew());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentBeginAdmitsExactlyOneCaller() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-idempotency-race-");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            IdempotencyStore store = store(root, MutableClock.at("2026-10-01T00:00:00Z"));
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String runId = "run_" + i;
                Callable<Boolean> task = () -> {
                    start.await();
                    return store.begin("shared-key", runId).isNew();
                };
                results.add(pool.submit(task));
            }
            start.countDown();
            int admitted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            Assertions.assertEquals(1, admitted);
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    private static IdempotencyStore store(Path root, MutableClock clock) {
        ChainRelayConfig config = ChainRelayConfig.fromRoot(root.toString());
        Database db = new Database(config);
        db.init();
        return new IdempotencyStore(db, new FileLockManager(config.idempotencyLocks(), 10_000L, 30_000L), clock);
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
