package io.barhistory.core;

/**
 * Split adjustment: bars strictly older than {@code timestamp} have prices and volume multiplied by {@code factor}.
 */
public record SplitAdjust(long timestamp, double factor) {
    public SplitAdjust {
        if (!(factor > 0) || Double.isInfinite(factor)) {
            throw new IllegalArgumentException("split factor must be a positive number: " + factor);
        }
    }
}
