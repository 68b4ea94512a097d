package io.barhistory.period;

import io.barhistory.core.BlockAllocator;
import io.barhistory.core.DataBlock;
import io.barhistory.core.Field;
import io.barhistory.core.HistoryException;
import io.barhistory.core.Period;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Groups a time-ordered block sequence into {@code target} windows: first open, highest high, lowest low,
 * last close, summed volume, last open interest. A trailing window that the data does not fully cover is
 * dropped unless incomplete bars are allowed.
 */
public final class Resampler {
    private final Period target;
    private final boolean allowIncomplete;
    private int droppedWindows;

    public Resampler(Period target, boolean allowIncomplete) {
        this.target = Objects.requireNonNull(target);
        this.allowIncomplete = allowIncomplete;
    }

    public DataBlock resample(List<DataBlock> blocks, BlockAllocator allocator) throws HistoryException {
        if (blocks.isEmpty()) throw new IllegalArgumentException("nothing to resample");
        Period from = blocks.get(0).period();
        Set<Field> fields = blocks.get(0).fieldProvided();
        if (target.isFinerThan(from)) {
            throw new IllegalArgumentException("cannot resample " + from + " into finer " + target);
        }

        // first pass sizes the output exactly
        int windows = 0;
        long key = 0;
        long lastTs = 0;
        for (DataBlock b : blocks) {
            long[] ts = b.timestamp();
            for (int i = 0; i < b.nbBars(); i++) {
                long k = PeriodWindows.windowClose(ts[i], target);
                if (windows == 0 || k != key) {
                    windows++;
                    key = k;
                }
                lastTs = ts[i];
            }
        }
        boolean dropLast = windows > 0 && !allowIncomplete && !PeriodWindows.isComplete(lastTs, from, key, target);
        int outCount = dropLast ? windows - 1 : windows;
        droppedWindows = windows - outCount;

        DataBlock out = allocator.allocate(target, fields, outCount);
        Window w = null;
        for (DataBlock b : blocks) {
            for (int i = 0; i < b.nbBars(); i++) {
                long k = PeriodWindows.windowClose(b.timestampAt(i), target);
                if (w != null && w.key == k) {
                    w.add(b, i);
                    continue;
                }
                if (w != null && out.nbBars() < outCount) w.emit(out);
                w = new Window(k, b, i);
            }
        }
        if (w != null && out.nbBars() < outCount) w.emit(out);
        return out;
    }

    /** Windows left out by the last {@link #resample} call. */
    public int droppedWindows() { return droppedWindows; }

    private static final class Window {
        final long key;
        double open;
        double high;
        double low;
        double close;
        long volume;
        long openInterest;

        Window(long key, DataBlock b, int i) {
            this.key = key;
            this.open = b.open() == null ? 0 : b.open()[i];
            this.high = b.high() == null ? 0 : b.high()[i];
            this.low = b.low() == null ? 0 : b.low()[i];
            this.close = b.close() == null ? 0 : b.close()[i];
            this.volume = b.volume() == null ? 0 : b.volume()[i];
            this.openInterest = b.openInterest() == null ? 0 : b.openInterest()[i];
        }

        void add(DataBlock b, int i) {
            if (b.high() != null) high = Math.max(high, b.high()[i]);
            if (b.low() != null) low = Math.min(low, b.low()[i]);
            if (b.close() != null) close = b.close()[i];
            if (b.volume() != null) volume += b.volume()[i];
            if (b.openInterest() != null) openInterest = b.openInterest()[i];
        }

        void emit(DataBlock out) {
            out.append(key, open, high, low, close, volume, openInterest);
        }
    }
}
