package io.barhistory.core;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Assembled price history. Every populated column has exactly {@link #nbBars()} entries; columns of fields
 * not in {@link #fieldProvided()} are {@code null}.
 */
public final class History {
    private Period period;
    private Set<Field> fieldProvided;
    private long[] timestamp;
    private double[] open;
    private double[] high;
    private double[] low;
    private double[] close;
    private long[] volume;
    private long[] openInterest;
    private final RetCode retCode;
    private final List<String> failedSources;

    public History(Period period, Set<Field> fieldProvided, long[] timestamp, double[] open, double[] high,
                   double[] low, double[] close, long[] volume, long[] openInterest,
                   RetCode retCode, List<String> failedSources) {
        this.period = Objects.requireNonNull(period);
        this.fieldProvided = Field.copyOf(fieldProvided);
        this.timestamp = Objects.requireNonNull(timestamp);
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
        this.openInterest = openInterest;
        this.retCode = Objects.requireNonNull(retCode);
        this.failedSources = List.copyOf(failedSources);
    }

    public static History empty(Period period, RetCode retCode, List<String> failedSources) {
        return new History(period, Set.of(), new long[0], null, null, null, null, null, null, retCode, failedSources);
    }

    public Period period() { return period; }
    public Set<Field> fieldProvided() { return fieldProvided; }
    public int nbBars() { return timestamp.length; }
    public boolean isEmpty() { return timestamp.length == 0; }

    public long[] timestamp() { return timestamp; }
    public double[] open() { return open; }
    public double[] high() { return high; }
    public double[] low() { return low; }
    public double[] close() { return close; }
    public long[] volume() { return volume; }
    public long[] openInterest() { return openInterest; }

    /**
     * {@link RetCode#SUCCESS}, or the first source error when failed sources were left out and the remaining
     * ones were merged.
     */
    public RetCode retCode() { return retCode; }
    public List<String> failedSources() { return failedSources; }

    public Instant timestampAt(int index) { return Instant.ofEpochSecond(timestamp[index]); }

    /**
     * Copy of the bars in {@code [startIdx, endIdx]}, both inclusive.
     */
    public History slice(int startIdx, int endIdx) throws HistoryException {
        if (startIdx < 0 || startIdx >= nbBars()) {
            throw new HistoryException(RetCode.OUT_OF_RANGE_START_INDEX, "start index " + startIdx + " outside [0," + nbBars() + ")");
        }
        if (endIdx < startIdx || endIdx >= nbBars()) {
            throw new HistoryException(RetCode.OUT_OF_RANGE_END_INDEX, "end index " + endIdx + " outside [" + startIdx + "," + nbBars() + ")");
        }
        int to = endIdx + 1;
        return new History(period, fieldProvided,
                Arrays.copyOfRange(timestamp, startIdx, to),
                open == null ? null : Arrays.copyOfRange(open, startIdx, to),
                high == null ? null : Arrays.copyOfRange(high, startIdx, to),
                low == null ? null : Arrays.copyOfRange(low, startIdx, to),
                close == null ? null : Arrays.copyOfRange(close, startIdx, to),
                volume == null ? null : Arrays.copyOfRange(volume, startIdx, to),
                openInterest == null ? null : Arrays.copyOfRange(openInterest, startIdx, to),
                retCode, failedSources);
    }

    /** Columns of this history seen as a block, without copying. */
    public DataBlock asBlock() {
        return DataBlock.wrap(period, fieldProvided, nbBars(), timestamp, open, high, low, close, volume, openInterest);
    }

    /** Replaces period and columns with those of {@code other}; used by in-place period transforms. */
    public void replaceContent(History other) {
        this.period = other.period;
        this.fieldProvided = other.fieldProvided;
        this.timestamp = other.timestamp;
        this.open = other.open;
        this.high = other.high;
        this.low = other.low;
        this.close = other.close;
        this.volume = other.volume;
        this.openInterest = other.openInterest;
    }

    @Override
    public String toString() {
        return "History{" +
                "period=" + period +
                ", fields=" + fieldProvided +
                ", nbBars=" + nbBars() +
                ", retCode=" + retCode +
                '}';
    }
}
