package io.barhistory.core;

/**
 * Value adjustment (dividend, disbursement): bars strictly older than {@code timestamp} have {@code amount}
 * subtracted from their prices. Volume is never touched.
 */
public record ValueAdjust(long timestamp, double amount) {
    public ValueAdjust {
        if (Double.isNaN(amount) || Double.isInfinite(amount)) {
            throw new IllegalArgumentException("value adjustment must be finite: " + amount);
        }
    }
}
