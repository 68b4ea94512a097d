package io.barhistory.merge;

import com.codahale.metrics.MetricRegistry;
import io.barhistory.budget.SemaphoreMemoryBudget;
import io.barhistory.config.HistoryConfig;
import io.barhistory.core.AttachParams;
import io.barhistory.core.Bar;
import io.barhistory.core.ListDriver;
import io.barhistory.core.TestBars;
import io.barhistory.metrics.Metrics;
import io.barhistory.retry.RetryPolicy;
import io.barhistory.session.BuilderSupport;
import io.barhistory.session.DriverSession;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MergerTest {
    private final BuilderSupport support = new BuilderSupport(new SemaphoreMemoryBudget(1 << 20), RetryPolicy.NEVER,
            HistoryConfig.defaults(), new Metrics(new MetricRegistry()));

    private DriverSession source(List<Bar> bars) throws Exception {
        return support.attachSource(AttachParams.builder(ListDriver.daily(bars)).build());
    }

    private List<MergeOp> mergeAll() {
        support.pullAll(null);
        return Merger.merge(support.sessions());
    }

    private static long total(List<MergeOp> plan) {
        return plan.stream().mapToInt(MergeOp::nbElementToCopy).sum();
    }

    @Test
    void overlapping_sources_union_with_the_first_attached_winning_ties() throws Exception {
        // days 1-3 and days 2-5
        DriverSession a = source(TestBars.weekdays("2024-01-01", 3, 10));
        DriverSession b = source(TestBars.weekdays("2024-01-02", 4, 100));
        List<MergeOp> plan = mergeAll();

        assertEquals(2, plan.size());
        assertSame(a.blocks().get(0), plan.get(0).srcDataBlock());
        assertEquals(0, plan.get(0).srcIndexForCopy());
        assertEquals(3, plan.get(0).nbElementToCopy());
        assertSame(b.blocks().get(0), plan.get(1).srcDataBlock());
        assertEquals(2, plan.get(1).srcIndexForCopy());
        assertEquals(2, plan.get(1).nbElementToCopy());
        assertEquals(5, total(plan));
        assertTrue(a.isContributingDataSource());
        assertTrue(b.isContributingDataSource());
    }

    @Test
    void contiguous_bars_of_one_block_coalesce() throws Exception {
        source(TestBars.weekdays("2024-01-01", 10, 10));
        List<MergeOp> plan = mergeAll();
        assertEquals(1, plan.size());
        assertEquals(10, plan.get(0).nbElementToCopy());
    }

    @Test
    void interleaved_sources_alternate() throws Exception {
        List<Bar> week = TestBars.weekdays("2024-01-01", 5, 10);
        source(List.of(week.get(0), week.get(2), week.get(4)));
        source(List.of(week.get(1), week.get(3)));
        List<MergeOp> plan = mergeAll();
        assertEquals(5, plan.size());
        List<Long> ts = new ArrayList<>();
        for (MergeOp op : plan) ts.add(op.srcDataBlock().timestampAt(op.srcIndexForCopy()));
        for (int i = 0; i < 5; i++) assertEquals(week.get(i).timestamp(), ts.get(i));
    }

    @Test
    void fully_shadowed_source_does_not_contribute() throws Exception {
        source(TestBars.weekdays("2024-01-01", 5, 10));
        DriverSession shadow = source(TestBars.weekdays("2024-01-02", 2, 100));
        List<MergeOp> plan = mergeAll();
        assertEquals(1, plan.size());
        assertFalse(shadow.isContributingDataSource());
    }

    @Test
    void runs_split_at_block_boundaries() throws Exception {
        BuilderSupport small = new BuilderSupport(new SemaphoreMemoryBudget(1 << 20), RetryPolicy.NEVER,
                HistoryConfig.defaults().withBlockSizes(2, 4), new Metrics(new MetricRegistry()));
        small.attachSource(AttachParams.builder(ListDriver.daily(TestBars.weekdays("2024-01-01", 10, 10))).build());
        small.pullAll(null);
        List<MergeOp> plan = Merger.merge(small.sessions());
        assertEquals(3, plan.size());
        assertEquals(10, total(plan));
    }
}
