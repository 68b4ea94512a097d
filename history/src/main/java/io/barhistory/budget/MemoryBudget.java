package io.barhistory.budget;

/**
 * Memory budget shared by every build that runs against the same configuration.
 */
public interface MemoryBudget extends AutoCloseable {
    /**
     * Acquire memory bytes. Return number actually granted: 0 when refused, otherwise at least {@code bytes}
     * (rounded up to the budget's granularity). Release exactly what was granted.
     */
    long tryAcquireMemory(long bytes);

    void releaseMemory(long bytes);

    /** Bytes currently available for new grants. */
    long availableBytes();

    @Override
    default void close() {}
}
