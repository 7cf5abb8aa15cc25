package io.chainrelay.storage;

/**
 * Source of exclusive per-scope locks that hold across threads and processes.
 * {@link #acquire(String)} blocks for a bounded time and fails with
 * {@code LOCK_TIMEOUT} rather than waiting forever.
 */
public interface ScopedLocks {
    ScopedLock acquire(String scope);
}
