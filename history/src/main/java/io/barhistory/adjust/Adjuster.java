package io.barhistory.adjust;

import io.barhistory.core.DataBlock;
import io.barhistory.core.HistoryFlag;
import io.barhistory.core.SplitAdjust;
import io.barhistory.core.ValueAdjust;
import io.barhistory.session.DriverSession;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Applies retroactive corporate actions. Only adjustments dated strictly after a bar affect it, so older bars
 * become comparable with the most recent ones.
 */
public final class Adjuster {
    private Adjuster() {}

    public static void adjust(DriverSession session, Set<HistoryFlag> flags) {
        for (DataBlock block : session.blocks()) {
            if (!flags.contains(HistoryFlag.DISABLE_SPLIT_ADJUST)) applySplitAdjust(block, session.splitAdjusts());
            if (!flags.contains(HistoryFlag.DISABLE_VALUE_ADJUST)) applyValueAdjust(block, session.valueAdjusts());
        }
    }

    /**
     * Multiplies prices and volume of each bar by the product of the factors dated after it. Walks the block
     * once, newest bar first.
     */
    public static void applySplitAdjust(DataBlock block, List<SplitAdjust> splits) {
        if (splits.isEmpty() || block.isEmpty()) return;
        List<SplitAdjust> sorted = new ArrayList<>(splits);
        sorted.sort(Comparator.comparingLong(SplitAdjust::timestamp));

        long[] ts = block.timestamp();
        int next = sorted.size() - 1;
        double multiplier = 1.0;
        for (int i = block.nbBars() - 1; i >= 0; i--) {
            while (next >= 0 && sorted.get(next).timestamp() > ts[i]) {
                multiplier *= sorted.get(next).factor();
                next--;
            }
            if (multiplier == 1.0) continue;
            scalePrices(block, i, multiplier);
            if (block.volume() != null) {
                block.volume()[i] = Math.round(block.volume()[i] * multiplier);
            }
        }
    }

    /**
     * Subtracts from the prices of each bar the sum of the amounts dated after it. Volume is left alone.
     */
    public static void applyValueAdjust(DataBlock block, List<ValueAdjust> values) {
        if (values.isEmpty() || block.isEmpty()) return;
        List<ValueAdjust> sorted = new ArrayList<>(values);
        sorted.sort(Comparator.comparingLong(ValueAdjust::timestamp));

        long[] ts = block.timestamp();
        int next = sorted.size() - 1;
        double offset = 0.0;
        for (int i = block.nbBars() - 1; i >= 0; i--) {
            while (next >= 0 && sorted.get(next).timestamp() > ts[i]) {
                offset += sorted.get(next).amount();
                next--;
            }
            if (offset == 0.0) continue;
            if (block.open() != null) block.open()[i] -= offset;
            if (block.high() != null) block.high()[i] -= offset;
            if (block.low() != null) block.low()[i] -= offset;
            if (block.close() != null) block.close()[i] -= offset;
        }
    }

    private static void scalePrices(DataBlock block, int i, double m) {
        if (block.open() != null) block.open()[i] *= m;
        if (block.high() != null) block.high()[i] *= m;
        if (block.low() != null) block.low()[i] *= m;
        if (block.close() != null) block.close()[i] *= m;
    }
}
