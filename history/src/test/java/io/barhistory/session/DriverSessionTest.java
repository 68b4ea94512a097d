package io.barhistory.session;

import com.codahale.metrics.MetricRegistry;
import io.barhistory.budget.SemaphoreMemoryBudget;
import io.barhistory.config.HistoryConfig;
import io.barhistory.core.AttachParams;
import io.barhistory.core.Bar;
import io.barhistory.core.DataBlock;
import io.barhistory.core.Driver;
import io.barhistory.core.Field;
import io.barhistory.core.ListDriver;
import io.barhistory.core.Period;
import io.barhistory.core.PullResult;
import io.barhistory.core.RetCode;
import io.barhistory.core.SupportedParameters;
import io.barhistory.core.TestBars;
import io.barhistory.metrics.Metrics;
import io.barhistory.retry.ExponentialBackoffRetryPolicy;
import io.barhistory.retry.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static io.barhistory.core.TestBars.day;
import static org.junit.jupiter.api.Assertions.*;

public class DriverSessionTest {
    private final MetricRegistry registry = new MetricRegistry();
    private final Metrics metrics = new Metrics(registry);
    private final SemaphoreMemoryBudget budget = new SemaphoreMemoryBudget(1 << 20);

    private DriverSession attach(ListDriver driver, HistoryConfig config, RetryPolicy retry) throws Exception {
        BuilderSupport support = new BuilderSupport(budget, retry, config, metrics);
        return support.attachSource(AttachParams.builder(driver).symbol("T").build());
    }

    private DriverSession attach(ListDriver driver) throws Exception {
        return attach(driver, HistoryConfig.defaults(), RetryPolicy.NEVER);
    }

    @Test
    void collects_bars_and_tracks_extremes() throws Exception {
        DriverSession s = attach(ListDriver.daily(TestBars.weekdays("2024-01-01", 5, 10)));
        assertEquals(SessionState.FINISHED, s.pullAll());
        assertEquals(5, s.nbBars());
        assertEquals(day("2024-01-01"), s.lowestTimestamp());
        assertEquals(day("2024-01-05"), s.highestTimestamp());
        assertEquals(Period.DAILY, s.periodProvided());
        assertEquals(RetCode.SUCCESS, s.retCode());
        assertEquals(5, registry.meter(Metrics.PULL_BARS).getCount());
    }

    @Test
    void grows_blocks_up_to_the_limit_then_chains_new_ones() throws Exception {
        DriverSession s = attach(ListDriver.daily(TestBars.weekdays("2024-01-01", 10, 10)),
                HistoryConfig.defaults().withBlockSizes(2, 4), RetryPolicy.NEVER);
        s.pullAll();
        List<DataBlock> blocks = s.blocks();
        assertEquals(3, blocks.size());
        assertEquals(4, blocks.get(0).nbBars());
        assertEquals(4, blocks.get(1).nbBars());
        assertEquals(2, blocks.get(2).nbBars());
        assertEquals(day("2024-01-08"), blocks.get(1).firstTimestamp());
        assertEquals(10, s.nbBars());
    }

    @Test
    void period_change_mid_stream_is_internal_error() throws Exception {
        DriverSession s = attach(ListDriver.daily(TestBars.weekdays("2024-01-01", 5, 10)).periodChangeAt(2, Period.WEEKLY));
        assertEquals(SessionState.ERRORED, s.pullAll());
        assertEquals(RetCode.INTERNAL_ERROR, s.retCode());
        assertTrue(s.errorMessage().contains("period changed"));
    }

    @Test
    void failed_session_tells_the_driver_to_let_go() throws Exception {
        List<Bar> bars = List.of(Bar.close(day("2024-01-02"), 1), Bar.close(day("2024-01-02"), 2));
        ListDriver driver = ListDriver.daily(bars);
        DriverSession s = attach(driver);
        assertEquals(SessionState.ERRORED, s.pullAll());
        assertEquals(RetCode.INTERNAL_ERROR, s.retCode());
        assertEquals(1, driver.cancels.get());
        assertFalse(s.isCancellationRequested());
    }

    @Test
    void error_thrown_by_the_driver_ends_the_session() throws Exception {
        BuilderSupport support = new BuilderSupport(budget, RetryPolicy.NEVER, HistoryConfig.defaults(), metrics);
        DriverSession oom = support.attachSource(AttachParams.builder(new ThrowingDriver(new OutOfMemoryError("boom"))).build());
        DriverSession broken = support.attachSource(AttachParams.builder(new ThrowingDriver(new AssertionError("bad"))).build());

        assertEquals(SessionState.ERRORED, oom.pullAll());
        assertEquals(RetCode.ALLOC_ERROR, oom.retCode());
        assertEquals(SessionState.ERRORED, broken.pullAll());
        assertEquals(RetCode.INTERNAL_ERROR, broken.retCode());
        assertEquals(RetCode.ALLOC_ERROR, support.retCode());
    }

    @Test
    void non_increasing_timestamp_is_internal_error() throws Exception {
        List<Bar> bars = List.of(Bar.close(day("2024-01-02"), 1), Bar.close(day("2024-01-02"), 2));
        DriverSession s = attach(ListDriver.daily(bars));
        assertEquals(SessionState.ERRORED, s.pullAll());
        assertEquals(RetCode.INTERNAL_ERROR, s.retCode());
    }

    @Test
    void driver_error_ends_the_session() throws Exception {
        DriverSession s = attach(ListDriver.daily(TestBars.weekdays("2024-01-01", 5, 10)).errorAt(3));
        assertEquals(SessionState.ERRORED, s.pullAll());
        assertEquals(RetCode.DRIVER_ERROR, s.retCode());
        assertTrue(s.errorMessage().contains("broken at bar 3"));
    }

    @Test
    void transient_failures_are_retried() throws Exception {
        ListDriver driver = ListDriver.daily(TestBars.weekdays("2024-01-01", 5, 10)).transientFailures(2);
        DriverSession s = attach(driver, HistoryConfig.defaults(), new ExponentialBackoffRetryPolicy(3, 1, 2));
        assertEquals(SessionState.FINISHED, s.pullAll());
        assertEquals(5, s.nbBars());
        assertEquals(2, registry.meter(Metrics.PULL_RETRIES).getCount());
    }

    @Test
    void retries_give_up_after_max_attempts() throws Exception {
        ListDriver driver = ListDriver.daily(TestBars.weekdays("2024-01-01", 5, 10)).transientFailures(5);
        DriverSession s = attach(driver, HistoryConfig.defaults(), new ExponentialBackoffRetryPolicy(3, 1, 2));
        assertEquals(SessionState.ERRORED, s.pullAll());
        assertEquals(RetCode.DRIVER_ERROR, s.retCode());
        assertEquals(3, driver.pulls.get());
    }

    @Test
    void cancellation_keeps_collected_bars() throws Exception {
        ListDriver driver = ListDriver.daily(TestBars.weekdays("2024-01-01", 10, 10)).cancelAfter(3);
        DriverSession s = attach(driver);
        assertEquals(SessionState.FINISHED, s.pullAll());
        assertEquals(3, s.nbBars());
        assertEquals(1, driver.cancels.get());
        assertTrue(s.isCancellationRequested());
    }

    @Test
    void start_after_end_never_pulls() throws Exception {
        ListDriver driver = ListDriver.daily(TestBars.weekdays("2024-01-01", 5, 10));
        BuilderSupport support = new BuilderSupport(budget, RetryPolicy.NEVER, HistoryConfig.defaults(), metrics);
        DriverSession s = support.attachSource(AttachParams.builder(driver).range(day("2024-01-05"), day("2024-01-01")).build());
        assertEquals(SessionState.FINISHED, s.pullAll());
        assertEquals(0, s.nbBars());
        assertEquals(0, driver.pulls.get());
    }

    @Test
    void bars_outside_the_range_are_skipped() throws Exception {
        ListDriver driver = ListDriver.daily(TestBars.weekdays("2024-01-01", 10, 10));
        BuilderSupport support = new BuilderSupport(budget, RetryPolicy.NEVER, HistoryConfig.defaults(), metrics);
        DriverSession s = support.attachSource(AttachParams.builder(driver).range(day("2024-01-03"), day("2024-01-09")).build());
        s.pullAll();
        assertEquals(5, s.nbBars());
        assertEquals(day("2024-01-03"), s.lowestTimestamp());
        assertEquals(day("2024-01-09"), s.highestTimestamp());
    }

    @Test
    void added_data_info_resets_after_each_call() throws Exception {
        DriverSession s = attach(ListDriver.daily(TestBars.weekdays("2024-01-01", 3, 10)));
        s.pullAll();
        AddedDataInfo info = s.takeAddedDataInfo();
        assertTrue(info.barAdded());
        assertEquals(day("2024-01-01"), info.lowestTimestamp());
        assertEquals(day("2024-01-03"), info.highestTimestamp());
        assertFalse(s.takeAddedDataInfo().barAdded());
    }

    @Test
    void adjustments_reported_by_the_driver_are_kept() throws Exception {
        ListDriver driver = ListDriver.daily(TestBars.weekdays("2024-01-01", 3, 10))
                .split(day("2024-01-02"), 2).valueAdjust(day("2024-01-03"), 0.5);
        DriverSession s = attach(driver);
        s.pullAll();
        assertEquals(1, s.splitAdjusts().size());
        assertEquals(2.0, s.splitAdjusts().get(0).factor());
        assertEquals(0.5, s.valueAdjusts().get(0).amount());
    }

    @Test
    void second_pull_is_rejected() throws Exception {
        DriverSession s = attach(ListDriver.daily(TestBars.weekdays("2024-01-01", 3, 10)));
        s.pullAll();
        assertThrows(IllegalStateException.class, s::pullAll);
    }

    @Test
    void data_is_not_readable_before_the_pull_completes() throws Exception {
        DriverSession s = attach(ListDriver.daily(TestBars.weekdays("2024-01-01", 3, 10)));
        assertThrows(IllegalStateException.class, s::nbBars);
        assertThrows(IllegalStateException.class, s::blocks);
    }

    @Test
    void release_returns_every_granted_byte() throws Exception {
        long before = budget.availableBytes();
        DriverSession s = attach(ListDriver.daily(TestBars.weekdays("2024-01-01", 10, 10)),
                HistoryConfig.defaults().withBlockSizes(3, 5), RetryPolicy.NEVER);
        s.pullAll();
        assertTrue(budget.availableBytes() < before);
        s.release();
        s.release();
        assertEquals(before, budget.availableBytes());
        assertTrue(s.isReleased());
    }

    @Test
    void budget_refusal_is_alloc_error() throws Exception {
        SemaphoreMemoryBudget tiny = new SemaphoreMemoryBudget(1024);
        BuilderSupport support = new BuilderSupport(tiny, RetryPolicy.NEVER, HistoryConfig.defaults(), metrics);
        DriverSession s = support.attachSource(AttachParams.builder(ListDriver.daily(TestBars.weekdays("2024-01-01", 3, 10))).build());
        assertEquals(SessionState.ERRORED, s.pullAll());
        assertEquals(RetCode.ALLOC_ERROR, s.retCode());
        assertEquals(1024, tiny.availableBytes());
    }

    private static final class ThrowingDriver implements Driver {
        private final Error error;

        ThrowingDriver(Error error) { this.error = error; }

        @Override
        public SupportedParameters describeSupportedParameters() {
            return SupportedParameters.of(Period.DAILY, Field.of(Field.CLOSE));
        }

        @Override
        public PullResult pull(DriverSession session, Long start, Long end, Set<Field> fields) {
            throw error;
        }
    }
}
