package io.barhistory.period;

import io.barhistory.core.DataBlock;
import io.barhistory.core.HistoryException;
import io.barhistory.core.HistoryFlag;
import io.barhistory.core.Period;
import io.barhistory.core.RetCode;
import io.barhistory.metrics.Metrics;
import io.barhistory.session.DriverSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Brings every session onto one common period: the coarsest period any session provides, or the coarsest one
 * requested when drivers delivered finer bars than asked for.
 */
public final class PeriodNormalizer {
    private static final Logger log = LoggerFactory.getLogger(PeriodNormalizer.class);

    private final Metrics metrics;

    public PeriodNormalizer(Metrics metrics) {
        this.metrics = metrics;
    }

    public static Period resolveTargetPeriod(List<DriverSession> sessions) {
        Period target = null;
        for (DriverSession s : sessions) {
            Period p = Period.coarsest(s.periodProvided(), s.params().period());
            target = target == null ? p : Period.coarsest(target, p);
        }
        if (target == null) throw new IllegalArgumentException("no session to normalize");
        return target;
    }

    /**
     * Resamples the sessions whose period is finer than the target, replacing their blocks. Sessions already at
     * the target period keep their bars but are re-stamped on the window close, like resampled ones.
     */
    public Period normalize(List<DriverSession> sessions, Set<HistoryFlag> flags) throws HistoryException {
        Period target = resolveTargetPeriod(sessions);
        boolean allowIncomplete = flags.contains(HistoryFlag.ALLOW_INCOMPLETE_PRICE_BARS);
        for (DriverSession s : sessions) {
            if (s.blocks().isEmpty()) continue;
            if (s.periodProvided() == target) {
                alignOnWindowClose(s, target);
                continue;
            }
            int before = s.nbBars();
            Resampler resampler = new Resampler(target, allowIncomplete);
            DataBlock out = resampler.resample(s.blocks(), s::allocateBlock);
            s.replaceBlocks(out.isEmpty() ? List.of() : List.of(out));
            if (resampler.droppedWindows() > 0) {
                metrics.counter(Metrics.WINDOWS_DROPPED).inc(resampler.droppedWindows());
            }
            log.debug("{}: {} bars resampled into {} {} bars ({} incomplete window dropped)",
                    s.describe(), before, out.nbBars(), target, resampler.droppedWindows());
        }
        return target;
    }

    private static void alignOnWindowClose(DriverSession s, Period target) throws HistoryException {
        int moved = 0;
        long previous = Long.MIN_VALUE;
        for (DataBlock b : s.blocks()) {
            long[] ts = b.timestamp();
            for (int i = 0; i < b.nbBars(); i++) {
                long close = PeriodWindows.windowClose(ts[i], target);
                if (close <= previous) {
                    throw new HistoryException(RetCode.INTERNAL_ERROR,
                            s.describe() + ": two " + target + " bars in the window closing at " + close);
                }
                if (close != ts[i]) {
                    ts[i] = close;
                    moved++;
                }
                previous = close;
            }
        }
        if (moved > 0) {
            s.replaceBlocks(s.blocks());
            log.debug("{}: {} bar(s) re-stamped on the {} window close", s.describe(), moved, target);
        }
    }
}
