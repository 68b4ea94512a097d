package io.barhistory.core;

import java.util.Set;

/**
 * Allocates a block whose memory is registered with an owner before it is returned.
 */
@FunctionalInterface
public interface BlockAllocator {
    DataBlock allocate(Period period, Set<Field> fields, int capacity) throws HistoryException;

    /** Allocator for blocks that live outside any build, e.g. when transforming a finished history. */
    static BlockAllocator unmanaged() {
        return (period, fields, capacity) -> {
            try {
                return new DataBlock(period, fields, capacity);
            } catch (OutOfMemoryError e) {
                throw new HistoryException(RetCode.ALLOC_ERROR, "cannot allocate " + capacity + " bars", e);
            }
        };
    }
}
