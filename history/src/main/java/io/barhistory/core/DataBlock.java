package io.barhistory.core;

import java.util.Arrays;
import java.util.Objects;
import java.util.Set;

/**
 * Columnar chunk of bars. Columns of fields that are not provided are {@code null}; the populated columns
 * hold {@link #nbBars()} valid entries and may have spare capacity beyond that.
 * <p>
 * A block is filled by a single pull loop and read only after that loop completed. Nothing outside the block
 * keeps references into its arrays across {@link #grow(int)}.
 */
public final class DataBlock {
    private final Period period;
    private final Set<Field> fieldProvided;

    private long[] timestamp;
    private double[] open;
    private double[] high;
    private double[] low;
    private double[] close;
    private long[] volume;
    private long[] openInterest;
    private int nbBars;
    private long allocatedBytes;

    public DataBlock(Period period, Set<Field> fieldProvided, int capacity) {
        this.period = Objects.requireNonNull(period);
        this.fieldProvided = Field.copyOf(fieldProvided);
        int cap = Math.max(0, capacity);
        this.timestamp = new long[cap];
        this.open = this.fieldProvided.contains(Field.OPEN) ? new double[cap] : null;
        this.high = this.fieldProvided.contains(Field.HIGH) ? new double[cap] : null;
        this.low = this.fieldProvided.contains(Field.LOW) ? new double[cap] : null;
        this.close = this.fieldProvided.contains(Field.CLOSE) ? new double[cap] : null;
        this.volume = this.fieldProvided.contains(Field.VOLUME) ? new long[cap] : null;
        this.openInterest = this.fieldProvided.contains(Field.OPEN_INTEREST) ? new long[cap] : null;
    }

    private DataBlock(Period period, Set<Field> fieldProvided, int nbBars, long[] timestamp, double[] open,
                      double[] high, double[] low, double[] close, long[] volume, long[] openInterest) {
        this.period = period;
        this.fieldProvided = Field.copyOf(fieldProvided);
        this.nbBars = nbBars;
        this.timestamp = timestamp;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
        this.openInterest = openInterest;
    }

    /** Wraps existing columns without copying them. */
    public static DataBlock wrap(Period period, Set<Field> fieldProvided, int nbBars, long[] timestamp, double[] open,
                                 double[] high, double[] low, double[] close, long[] volume, long[] openInterest) {
        return new DataBlock(period, fieldProvided, nbBars, timestamp, open, high, low, close, volume, openInterest);
    }

    /** Bytes needed by the columns of a block with this field set and capacity. */
    public static long bytesFor(Set<Field> fields, int capacity) {
        return (long) capacity * Long.BYTES * (1 + fields.size());
    }

    public void append(Bar bar) {
        if (nbBars == timestamp.length) throw new IllegalStateException("block is full: " + nbBars);
        int i = nbBars;
        timestamp[i] = bar.timestamp();
        if (open != null) open[i] = bar.open();
        if (high != null) high[i] = bar.high();
        if (low != null) low[i] = bar.low();
        if (close != null) close[i] = bar.close();
        if (volume != null) volume[i] = bar.volume();
        if (openInterest != null) openInterest[i] = bar.openInterest();
        nbBars++;
    }

    /** Appends one aggregated window; used by resampling where the values do not come from a {@link Bar}. */
    public void append(long ts, double o, double h, double l, double c, long v, long oi) {
        append(new Bar(ts, o, h, l, c, v, oi));
    }

    public void grow(int newCapacity) {
        if (newCapacity <= timestamp.length) return;
        timestamp = Arrays.copyOf(timestamp, newCapacity);
        if (open != null) open = Arrays.copyOf(open, newCapacity);
        if (high != null) high = Arrays.copyOf(high, newCapacity);
        if (low != null) low = Arrays.copyOf(low, newCapacity);
        if (close != null) close = Arrays.copyOf(close, newCapacity);
        if (volume != null) volume = Arrays.copyOf(volume, newCapacity);
        if (openInterest != null) openInterest = Arrays.copyOf(openInterest, newCapacity);
    }

    public Period period() { return period; }
    public Set<Field> fieldProvided() { return fieldProvided; }
    public boolean has(Field field) { return fieldProvided.contains(field); }
    public int nbBars() { return nbBars; }
    public int capacity() { return timestamp.length; }
    public boolean isEmpty() { return nbBars == 0; }

    public long[] timestamp() { return timestamp; }
    public double[] open() { return open; }
    public double[] high() { return high; }
    public double[] low() { return low; }
    public double[] close() { return close; }
    public long[] volume() { return volume; }
    public long[] openInterest() { return openInterest; }

    public long timestampAt(int index) { return timestamp[index]; }
    public long firstTimestamp() { return timestamp[0]; }
    public long lastTimestamp() { return timestamp[nbBars - 1]; }

    /** Price column of {@code field}, or {@code null} when not provided or not a price field. */
    public double[] priceColumn(Field field) {
        return switch (field) {
            case OPEN -> open;
            case HIGH -> high;
            case LOW -> low;
            case CLOSE -> close;
            default -> null;
        };
    }

    /** Bytes granted by the memory budget for this block; zero for wrapped blocks. */
    public long allocatedBytes() { return allocatedBytes; }

    public void recordAllocation(long bytes) { this.allocatedBytes += bytes; }

    /** Drops the column references once the owner returned the block's memory. */
    public void clear() {
        timestamp = new long[0];
        open = high = low = close = null;
        volume = openInterest = null;
        nbBars = 0;
        allocatedBytes = 0;
    }

    @Override
    public String toString() {
        return "DataBlock{" +
                "period=" + period +
                ", fields=" + fieldProvided +
                ", nbBars=" + nbBars +
                ", capacity=" + timestamp.length +
                '}';
    }
}
