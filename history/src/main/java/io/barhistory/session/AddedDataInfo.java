package io.barhistory.session;

/**
 * What a session accepted since the driver last asked. Timestamps are meaningless when {@code barAdded} is false.
 */
public record AddedDataInfo(boolean barAdded, long lowestTimestamp, long highestTimestamp) {
    static final AddedDataInfo NONE = new AddedDataInfo(false, 0L, 0L);
}
