package io.chainrelay.storage;

import io.chainrelay.MutableClock;
import io.chainrelay.config.ChainRelayConfig;
import io.chainrelay.model.ErrorCode;
import io.chainrelay.model.OperatorException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

final class NonceStoreTest {
    private static final long TTL_MS = 300_000L;

    @Test
    void repeatWithinTtlIsReplayAndAcceptedAfterExpiry() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-nonce-");
        try {
            MutableClock clock = MutableClock.at("2026-10-01T00:00:00Z");
            NonceStore store = store(root, clock);

            NonceRecord first = store.register("agent-a", "nonce-0001", clock.millis());
            Assertions.assertEquals(clock.millis() + TTL_MS, first.expiresAtMs());

            OperatorException replay = Assertions.assertThrows(OperatorException.class,
                    () -> store.register("agent-a", "nonce-0001", clock.millis()));
            Assertions.assertEquals(ErrorCode.A2A_NONCE_REPLAY, replay.code());
            Assertions.assertEquals("agent-a", replay.error().details().get("keyId"));

            store.register("agent-b", "nonce-0001", clock.millis());

            clock.advance(Duration.ofMillis(TTL_MS));
            NonceRecord again = store.register("agent-a", "nonce-0001", clock.millis());
            Assertions.assertEquals(clock.millis(), again.seenAtMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void purgeRemovesOnlyExpiredRecords() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-nonce-gc-");
        try {
            MutableClock clock = MutableClock.at("2026-10-01T00:00:00Z");
            NonceStore store = store(root, clock);
            store.register("agent-a", "old-nonce-1", clock.millis());
            store.register("agent-b", "old-nonce-2", clock.millis());
            clock.advance(Duration.ofMinutes(4));
            store.register("agent-a", "new-nonce-1", clock.millis());
            clock.advance(Duration.ofMinutes(2));

            Assertions.assertEquals(2, store.purgeExpired());
            Assertions.assertTrue(store.find("agent-a", "old-nonce-1").isEmpty());
            Assertions.assertTrue(store.find("agent-a", "new-nonce-1").isPresent());
            Assertions.assertEquals(0, store.purgeExpired());
        } finally {
            deleteRecursively(root);
        }
    }

    private static NonceStore store(Path root, MutableClock clock) {
        ChainRelayConfig config = ChainRelayConfig.fromRoot(root.toString());
        Database db = new Database(config);
        db.init();
        return new NonceStore(db, new FileLockManager(config.nonceLocks(), 5_000L, 30_000L), clock, TTL_MS);
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
