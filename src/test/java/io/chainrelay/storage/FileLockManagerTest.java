package io.chainrelay.storage;

import io.chainrelay.model.ErrorCode;
import io.chainrelay.model.OperatorException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

final class FileLockManagerTest {

    @Test
    void heldScopeTimesOutOtherScopesDoNot() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-locks-");
        try {
            FileLockManager locks = new FileLockManager(root.resolve("locks"), 150L, 60_000L);
            try (ScopedLock held = locks.acquire("key-a")) {
                Assertions.assertEquals("key-a", held.scope());
                Assertions.assertTrue(Files.exists(locks.lockFileFor("key-a")));

                OperatorException timeout = Assertions.assertThrows(OperatorException.class, () -> locks.acquire("key-a"));
                Assertions.assertEquals(ErrorCode.LOCK_TIMEOUT, timeout.code());

                try (ScopedLock other = locks.acquire("key-b")) {
                    Assertions.assertEquals("key-b", other.scope());
                }
            }
            Assertions.assertFalse(Files.exists(locks.lockFileFor("key-a")));
            try (ScopedLock again = locks.acquire("key-a")) {
                Assertions.assertNotNull(again);
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void staleLockFileIsTakenOver() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-locks-stale-");
        try {
            FileLockManager locks = new FileLockManager(root.resolve("locks"), 500L, 1_000L);
            Path leftover = locks.lockFileFor("key-a");
            Files.writeString(leftover, "{\"token\":\"dead\"}", StandardCharsets.UTF_8);
            Files.setLastModifiedTime(leftover, FileTime.from(Instant.now().minusSeconds(60)));

            try (ScopedLock lock = locks.acquire("key-a")) {
                Assertions.assertFalse(Files.readString(leftover, StandardCharsets.UTF_8).contains("\"dead\""));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void releaseLeavesForeignLockInPlace() throws Exception {
        Path root = Files.createTempDirectory("chainrelay-test-locks-owner-");
        try {
            FileLockManager locks = new FileLockManager(root.resolve("locks"), 500L, 60_000L);
            ScopedLock lock = locks.acquire("key-a");
            Path file = locks.lockFileFor("key-a");
            Files.writeString(file, "{\"token\":\"someone-else\"}", StandardCharsets.UTF_8);

            lock.close();
            lock.close();

            Assertions.assertTrue(Files.exists(file));
        } finally {
            deleteRecursively(root);
        }
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
