package io.chainrelay.storage;

import io.chainrelay.model.ErrorCode;
import io.chainrelay.model.OperatorException;
import io.chainrelay.util.Hashing;
import io.chainrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Lock files created with {@code CREATE_NEW} under one directory, one file per scope.
 * Waiters back off with jitter until the timeout; a file older than the stale threshold
 * is treated as left behind by a dead holder and removed.
 */
public final class FileLockManager implements ScopedLocks {
    private static final Logger log = LoggerFactory.getLogger(FileLockManager.class);
    private static final int MIN_BACKOFF_MS = 10;
    private static final int MAX_BACKOFF_MS = 40;

    private final Path dir;
    private final long timeoutMs;
    private final long staleMs;

    public FileLockManager(Path dir, long timeoutMs, long staleMs) {
        this.dir = dir;
        this.timeoutMs = Math.max(1L, timeoutMs);
        this.staleMs = Math.max(this.timeoutMs, staleMs);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Failed to create lock directory: " + dir, e);
        }
    }

    @Override
    public ScopedLock acquire(String scope) {
        Path lockFile = lockFileFor(scope);
        String token = Hashing.randomHex(12);
        String owner = ownerRecord(scope, token);
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (true) {
            try {
                Files.writeString(lockFile, owner, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return new FileScopedLock(scope, lockFile, token);
            } catch (FileAlreadyExistsException e) {
                if (clearIfStale(lockFile, scope)) {
                    continue;
                }
            } catch (IOException e) {
                throw new RuntimeException("Failed to create lock file: " + lockFile, e);
            }
            if (System.currentTimeMillis() >= deadline) {
                throw new OperatorException(
                        ErrorCode.LOCK_TIMEOUT,
                        "Timed out waiting for lock: " + scope,
                        Map.of("scope", scope, "timeoutMs", timeoutMs)
                );
            }
            backoff(scope);
        }
    }

    Path lockFileFor(String scope) {
        return dir.resolve(Hashing.sha256Hex(scope) + ".lock");
    }

    private boolean clearIfStale(Path lockFile, String scope) {
        try {
            long modified = Files.getLastModifiedTime(lockFile).toMillis();
            if (System.currentTimeMillis() - modified <= staleMs) {
                return false;
            }
            Files.deleteIfExists(lockFile);
            log.warn("Removed stale lock for scope {} (age {} ms)", scope, System.currentTimeMillis() - modified);
            return true;
        } catch (NoSuchFileException e) {
            return true;
        } catch (IOException e) {
            throw new RuntimeException("Failed to inspect lock file: " + lockFile, e);
        }
    }

    private void backoff(String scope) {
        try {
            Thread.sleep(ThreadLocalRandom.current().nextInt(MIN_BACKOFF_MS, MAX_BACKOFF_MS + 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperatorException(ErrorCode.LOCK_TIMEOUT, "Interrupted waiting for lock: " + scope);
        }
    }

    private static String ownerRecord(String scope, String token) {
        Map<String, Object> owner = new LinkedHashMap<>();
        owner.put("token", token);
        owner.put("pid", ProcessHandle.current().pid());
        owner.put("thread", Thread.currentThread().getName());
        owner.put("scope", scope);
        owner.put("acquired_at", Instant.now().toString());
        return Jsons.toCompactJson(owner);
    }

    private static final class FileScopedLock implements ScopedLock {
        private final String scope;
        private final Path lockFile;
        private final String token;
        private boolean released;

        private FileScopedLock(String scope, Path lockFile, String token) {
            this.scope = scope;
            this.lockFile = lockFile;
            this.token = token;
        }

        @Override
        public String scope() {
            return scope;
        }

        @Override
        public synchronized void close() {
            if (released) {
                return;
            }
            released = true;
            try {
                String current = Files.readString(lockFile, StandardCharsets.UTF_8);
                if (current.contains("\"token\":\"" + token + "\"")) {
                    Files.deleteIfExists(lockFile);
                } else {
                    log.warn("Lock for scope {} was taken over before release", scope);
                }
            } catch (NoSuchFileException e) {
                log.warn("Lock for scope {} disappeared before release", scope);
            } catch (IOException e) {
                log.warn("Failed to release lock for scope {}", scope, e);
            }
        }
    }
}
