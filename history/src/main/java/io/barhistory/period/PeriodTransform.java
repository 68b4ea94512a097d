package io.barhistory.period;

import io.barhistory.core.BlockAllocator;
import io.barhistory.core.DataBlock;
import io.barhistory.core.History;
import io.barhistory.core.HistoryException;
import io.barhistory.core.HistoryFlag;
import io.barhistory.core.Period;
import io.barhistory.core.RetCode;

import java.util.List;
import java.util.Set;

/**
 * Moves a finished history to a coarser period with the same window rules as the build.
 */
public final class PeriodTransform {
    private PeriodTransform() {}

    /**
     * @param allocateNew when true the result is a new history and {@code history} is left untouched; when false
     *                    {@code history} itself is transformed and returned
     */
    public static History transformPeriod(History history, Period newPeriod, Set<HistoryFlag> flags, boolean allocateNew)
            throws HistoryException {
        if (history == null || newPeriod == null || flags == null) {
            throw new HistoryException(RetCode.BAD_PARAM, "history, period and flags are required");
        }
        if (newPeriod.isFinerThan(history.period())) {
            throw new HistoryException(RetCode.BAD_PARAM, "cannot transform " + history.period() + " into finer " + newPeriod);
        }

        History result;
        if (newPeriod == history.period()) {
            if (!allocateNew) return history;
            result = copy(history);
        } else {
            Resampler resampler = new Resampler(newPeriod, flags.contains(HistoryFlag.ALLOW_INCOMPLETE_PRICE_BARS));
            DataBlock out = resampler.resample(List.of(history.asBlock()), BlockAllocator.unmanaged());
            result = new History(newPeriod, history.fieldProvided(), out.timestamp(), out.open(), out.high(), out.low(),
                    out.close(), out.volume(), out.openInterest(), history.retCode(), history.failedSources());
        }
        if (allocateNew) return result;
        history.replaceContent(result);
        return history;
    }

    private static History copy(History h) {
        return new History(h.period(), h.fieldProvided(),
                h.timestamp().clone(),
                h.open() == null ? null : h.open().clone(),
                h.high() == null ? null : h.high().clone(),
                h.low() == null ? null : h.low().clone(),
                h.close() == null ? null : h.close().clone(),
                h.volume() == null ? null : h.volume().clone(),
                h.openInterest() == null ? null : h.openInterest().clone(),
                h.retCode(), h.failedSources());
    }
}
