package io.barhistory.merge;

import io.barhistory.core.DataBlock;
import io.barhistory.session.DriverSession;

import java.util.ArrayList;
import java.util.List;

/**
 * N-way timestamp merge across sessions. On equal timestamps the session attached first supplies the bar and
 * the others step over that instant. Runs of bars taken from the same block become a single {@link MergeOp}.
 */
public final class Merger {
    private Merger() {}

    /**
     * @param sessions sessions in attach order; each one's blocks must be time-ordered
     */
    public static List<MergeOp> merge(List<DriverSession> sessions) {
        List<Cursor> cursors = new ArrayList<>(sessions.size());
        for (DriverSession s : sessions) {
            Cursor c = new Cursor(s);
            if (!c.allDataConsumed) cursors.add(c);
        }

        List<MergeOp> plan = new ArrayList<>();
        DataBlock runBlock = null;
        int runStart = 0;
        int runCount = 0;
        while (true) {
            Cursor best = null;
            for (Cursor c : cursors) {
                // strict comparison keeps the earliest attached session on ties
                if (!c.allDataConsumed && (best == null || c.curTimestamp < best.curTimestamp)) best = c;
            }
            if (best == null) break;

            long ts = best.curTimestamp;
            DataBlock block = best.curDataBlock();
            if (block == runBlock && runStart + runCount == best.curIndex) {
                runCount++;
            } else {
                if (runBlock != null) plan.add(new MergeOp(runBlock, runStart, runCount));
                runBlock = block;
                runStart = best.curIndex;
                runCount = 1;
            }
            best.session.markContributing();
            best.advance();
            for (Cursor c : cursors) {
                if (c != best && !c.allDataConsumed && c.curTimestamp == ts) c.advance();
            }
        }
        if (runBlock != null) plan.add(new MergeOp(runBlock, runStart, runCount));
        return plan;
    }

    private static final class Cursor {
        final DriverSession session;
        final List<DataBlock> blocks;
        int curBlock;
        int curIndex;
        long curTimestamp;
        boolean allDataConsumed;

        Cursor(DriverSession session) {
            this.session = session;
            this.blocks = session.blocks();
            this.curBlock = 0;
            this.curIndex = -1;
            advance();
        }

        DataBlock curDataBlock() { return blocks.get(curBlock); }

        void advance() {
            curIndex++;
            while (curBlock < blocks.size() && curIndex >= blocks.get(curBlock).nbBars()) {
                curBlock++;
                curIndex = 0;
            }
            if (curBlock >= blocks.size()) {
                allDataConsumed = true;
            } else {
                curTimestamp = blocks.get(curBlock).timestampAt(curIndex);
            }
        }
    }
}
