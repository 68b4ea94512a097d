package io.barhistory.runtime;

import io.barhistory.core.DataBlock;
import io.barhistory.core.Field;
import io.barhistory.core.History;
import io.barhistory.core.HistoryException;
import io.barhistory.core.Period;
import io.barhistory.core.RetCode;
import io.barhistory.merge.MergeOp;
import io.barhistory.session.BuilderSupport;

import java.util.Set;

/**
 * Executes a merge plan into the final columns and tears the build down.
 */
public final class HistoryAssembler {
    private final int maxBarsPerBuild;

    public HistoryAssembler(int maxBarsPerBuild) {
        this.maxBarsPerBuild = maxBarsPerBuild;
    }

    public History assemble(BuilderSupport support, Period period) throws HistoryException {
        int n = support.nbPriceBar();
        if (n > maxBarsPerBuild) {
            throw new HistoryException(RetCode.ALLOC_ERROR, n + " bars exceed the limit of " + maxBarsPerBuild + " per build");
        }
        Set<Field> fields = n == 0 ? Set.of() : support.outputFields();

        long[] timestamp;
        double[] open;
        double[] high;
        double[] low;
        double[] close;
        long[] volume;
        long[] openInterest;
        try {
            timestamp = new long[n];
            open = fields.contains(Field.OPEN) ? new double[n] : null;
            high = fields.contains(Field.HIGH) ? new double[n] : null;
            low = fields.contains(Field.LOW) ? new double[n] : null;
            close = fields.contains(Field.CLOSE) ? new double[n] : null;
            volume = fields.contains(Field.VOLUME) ? new long[n] : null;
            openInterest = fields.contains(Field.OPEN_INTEREST) ? new long[n] : null;
        } catch (OutOfMemoryError e) {
            throw new HistoryException(RetCode.ALLOC_ERROR, "cannot allocate " + n + " output bars", e);
        }

        int dst = 0;
        for (MergeOp op : support.mergeOps()) {
            DataBlock b = op.srcDataBlock();
            int src = op.srcIndexForCopy();
            int len = op.nbElementToCopy();
            System.arraycopy(b.timestamp(), src, timestamp, dst, len);
            if (open != null) System.arraycopy(b.open(), src, open, dst, len);
            if (high != null) System.arraycopy(b.high(), src, high, dst, len);
            if (low != null) System.arraycopy(b.low(), src, low, dst, len);
            if (close != null) System.arraycopy(b.close(), src, close, dst, len);
            if (volume != null) System.arraycopy(b.volume(), src, volume, dst, len);
            if (openInterest != null) System.arraycopy(b.openInterest(), src, openInterest, dst, len);
            dst += len;
        }
        if (dst != n) {
            throw new HistoryException(RetCode.INTERNAL_ERROR, "merge plan copied " + dst + " bars, expected " + n);
        }
        return new History(period, fields, timestamp, open, high, low, close, volume, openInterest,
                support.retCode(), support.failedSources());
    }

    /** Returns everything the build holds, whichever stage it stopped at. */
    public void teardown(BuilderSupport support) {
        support.release();
    }
}
