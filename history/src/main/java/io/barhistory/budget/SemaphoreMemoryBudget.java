package io.barhistory.budget;

import java.util.concurrent.Semaphore;

/**
 * Memory permits counted in kilobytes on a semaphore, so budgets above 2GB still fit in int permits.
 * Grants are all-or-nothing; concurrent pull loops never see a partially drained budget.
 */
public class SemaphoreMemoryBudget implements MemoryBudget {
    private static final long UNIT = 1024;

    private final Semaphore mem;

    public SemaphoreMemoryBudget(long memoryBytes) {
        long permits = Math.min(Math.max(0, memoryBytes) / UNIT, Integer.MAX_VALUE);
        this.mem = new Semaphore((int) permits);
    }

    @Override
    public long tryAcquireMemory(long bytes) {
        if (bytes <= 0) return 0;
        long units = toUnits(bytes);
        if (units > Integer.MAX_VALUE) return 0;
        return mem.tryAcquire((int) units) ? units * UNIT : 0;
    }

    @Override
    public void releaseMemory(long bytes) {
        if (bytes <= 0) return;
        mem.release((int) Math.min(toUnits(bytes), Integer.MAX_VALUE));
    }

    @Override
    public long availableBytes() {
        return mem.availablePermits() * UNIT;
    }

    private static long toUnits(long bytes) {
        return (bytes + UNIT - 1) / UNIT;
    }
}
