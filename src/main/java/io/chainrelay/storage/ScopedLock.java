package io.chainrelay.storage;

/**
 * Exclusive hold on one scope. Release is idempotent and never throws, so holders can
 * use try-with-resources around the critical section.
 */
public interface ScopedLock extends AutoCloseable {
    String scope();

    @Override
    void close();
}
