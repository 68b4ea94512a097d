package io.barhistory.core;

import java.util.Comparator;

/**
 * Sampling granularity of a bar sequence. Declaration order goes from finest to coarsest.
 */
public enum Period {
    ONE_MIN(60),
    FIVE_MINS(5 * 60),
    TEN_MINS(10 * 60),
    FIFTEEN_MINS(15 * 60),
    THIRTY_MINS(30 * 60),
    ONE_HOUR(60 * 60),
    DAILY(24 * 60 * 60),
    WEEKLY(7 * 24 * 60 * 60),
    MONTHLY(30L * 24 * 60 * 60),
    QUARTERLY(91L * 24 * 60 * 60),
    YEARLY(365L * 24 * 60 * 60);

    public static final Comparator<Period> COARSENESS = Comparator.comparingInt(Enum::ordinal);

    private final long nominalSeconds;

    Period(long nominalSeconds) {
        this.nominalSeconds = nominalSeconds;
    }

    /** Exact length for intraday periods, an approximation for calendar periods. */
    public long nominalSeconds() { return nominalSeconds; }

    public boolean isIntraday() { return this.ordinal() < DAILY.ordinal(); }

    public boolean isCoarserThan(Period other) { return this.ordinal() > other.ordinal(); }

    public boolean isFinerThan(Period other) { return this.ordinal() < other.ordinal(); }

    public static Period coarsest(Period a, Period b) { return a.isCoarserThan(b) ? a : b; }
}
