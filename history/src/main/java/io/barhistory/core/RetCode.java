package io.barhistory.core;

/**
 * Flat status taxonomy shared by the builder, the sessions and the drivers.
 */
public enum RetCode {
    SUCCESS,
    OUT_OF_RANGE_START_INDEX,
    OUT_OF_RANGE_END_INDEX,
    BAD_PARAM,
    ALLOC_ERROR,
    DRIVER_ERROR,
    INTERNAL_ERROR;

    /** Fatal codes abort the remaining build stages and discard every collected bar. */
    public boolean isFatal() {
        return this == ALLOC_ERROR || this == INTERNAL_ERROR;
    }
}
