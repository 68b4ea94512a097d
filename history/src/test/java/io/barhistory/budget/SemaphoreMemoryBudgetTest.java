package io.barhistory.budget;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SemaphoreMemoryBudgetTest {
    @Test
    void grants_are_rounded_up_to_whole_kilobytes() {
        SemaphoreMemoryBudget b = new SemaphoreMemoryBudget(8 * 1024);
        assertEquals(1024, b.tryAcquireMemory(1));
        assertEquals(2048, b.tryAcquireMemory(1025));
        assertEquals(5 * 1024, b.availableBytes());
        b.releaseMemory(1024);
        b.releaseMemory(2048);
        assertEquals(8 * 1024, b.availableBytes());
    }

    @Test
    void refusal_is_all_or_nothing() {
        SemaphoreMemoryBudget b = new SemaphoreMemoryBudget(4 * 1024);
        assertEquals(3 * 1024, b.tryAcquireMemory(3 * 1024));
        assertEquals(0, b.tryAcquireMemory(2 * 1024));
        assertEquals(1024, b.availableBytes());
        assertEquals(0, b.tryAcquireMemory(0));
    }
}
