package io.barhistory.core;

/**
 * One price bar as handed over by a driver. Values of fields the driver does not provide are ignored.
 * The timestamp is in epoch seconds, UTC.
 */
public record Bar(long timestamp, double open, double high, double low, double close, long volume, long openInterest) {

    public static Bar of(long timestamp, double open, double high, double low, double close, long volume) {
        return new Bar(timestamp, open, high, low, close, volume, 0L);
    }

    public static Bar close(long timestamp, double close) {
        return new Bar(timestamp, close, close, close, close, 0L, 0L);
    }
}
