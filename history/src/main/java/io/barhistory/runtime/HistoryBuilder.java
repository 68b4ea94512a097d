package io.barhistory.runtime;

import com.codahale.metrics.Timer;
import io.barhistory.adjust.Adjuster;
import io.barhistory.budget.MemoryBudget;
import io.barhistory.config.HistoryConfig;
import io.barhistory.core.AttachParams;
import io.barhistory.core.Driver;
import io.barhistory.core.Field;
import io.barhistory.core.History;
import io.barhistory.core.HistoryException;
import io.barhistory.core.HistoryFlag;
import io.barhistory.core.Period;
import io.barhistory.core.RetCode;
import io.barhistory.merge.MergeOp;
import io.barhistory.merge.Merger;
import io.barhistory.metrics.Metrics;
import io.barhistory.period.PeriodNormalizer;
import io.barhistory.retry.RetryPolicy;
import io.barhistory.session.BuilderSupport;
import io.barhistory.session.DriverSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Builds one history out of the attached sources: pull, normalize, adjust, merge, assemble. A builder runs
 * once; {@link #build()} either returns a complete history or throws, and always releases what it allocated.
 */
public class HistoryBuilder {
    private static final Logger log = LoggerFactory.getLogger(HistoryBuilder.class);

    private final BuilderSupport support;
    private final Executor pullExecutor;
    private final Metrics metrics;
    private final Set<HistoryFlag> flags;
    private final PeriodNormalizer normalizer;
    private final HistoryAssembler assembler;
    private final AtomicBoolean built = new AtomicBoolean(false);

    public HistoryBuilder(HistoryConfig config, MemoryBudget budget, RetryPolicy retryPolicy, Executor pullExecutor,
                          Metrics metrics, Set<HistoryFlag> flags) {
        this.support = new BuilderSupport(budget, retryPolicy, config, metrics);
        this.pullExecutor = pullExecutor;
        this.metrics = Objects.requireNonNull(metrics);
        this.flags = flags.isEmpty() ? EnumSet.noneOf(HistoryFlag.class) : EnumSet.copyOf(flags);
        this.normalizer = new PeriodNormalizer(metrics);
        this.assembler = new HistoryAssembler(config.maxBarsPerBuild());
    }

    public DriverSession attachSource(AttachParams params) throws HistoryException {
        if (built.get()) throw new HistoryException(RetCode.BAD_PARAM, "sources must be attached before build");
        return support.attachSource(params);
    }

    /**
     * @param fields requested fields, {@code null} for all available
     */
    public DriverSession attachSource(Driver driver, String category, String symbol, Period period,
                                      Long start, Long end, Set<Field> fields) throws HistoryException {
        AttachParams.Builder b = AttachParams.builder(driver).category(category).symbol(symbol).period(period).range(start, end);
        if (fields != null) b.fields(fields);
        return attachSource(b.build());
    }

    public History build() throws HistoryException {
        if (!built.compareAndSet(false, true)) {
            throw new HistoryException(RetCode.BAD_PARAM, "build already ran");
        }
        if (support.sessions().isEmpty()) {
            support.release();
            throw new HistoryException(RetCode.BAD_PARAM, "no data source attached");
        }
        Timer.Context timer = metrics.timer(Metrics.BUILD_TIME).time();
        try {
            support.pullAll(pullExecutor);
            List<DriverSession> eligible = support.eligibleSessions();

            Period target;
            List<MergeOp> plan;
            if (eligible.isEmpty()) {
                target = support.sessions().stream().map(s -> s.params().period()).max(Period.COARSENESS).orElseThrow();
                plan = List.of();
            } else {
                target = normalizer.normalize(eligible, flags);
                for (DriverSession s : eligible) Adjuster.adjust(s, flags);
                plan = Merger.merge(eligible);
            }
            support.finalizeBuild(plan);
            metrics.histogram(Metrics.MERGE_OPS).update(plan.size());

            History history = assembler.assemble(support, target);
            metrics.counter(Metrics.BARS_EMITTED).inc(history.nbBars());
            if (history.retCode() != RetCode.SUCCESS) {
                log.warn("built {} {} bars, failed sources left out: {}", history.nbBars(), target, history.failedSources());
            } else {
                log.info("built {} {} bars from {} source(s) with {} merge op(s)", history.nbBars(), target, eligible.size(), plan.size());
            }
            return history;
        } catch (HistoryException e) {
            metrics.meter(Metrics.BUILD_FAILURES).mark();
            log.warn("history build failed: {}", e.getMessage());
            throw e;
        } catch (OutOfMemoryError e) {
            metrics.meter(Metrics.BUILD_FAILURES).mark();
            throw new HistoryException(RetCode.ALLOC_ERROR, "out of memory while building", e);
        } finally {
            assembler.teardown(support);
            timer.stop();
        }
    }

    /** Stops every source at its next pull; what was collected so far still makes up the result. */
    public void cancel() {
        support.cancelAll();
    }

    BuilderSupport support() { return support; }
}
