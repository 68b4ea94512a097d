package io.barhistory.runtime;

import com.codahale.metrics.MetricRegistry;
import io.barhistory.budget.MemoryBudget;
import io.barhistory.config.HistoryConfig;
import io.barhistory.core.HistoryFlag;
import io.barhistory.metrics.Metrics;
import io.barhistory.retry.RetryPolicy;

import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Shares config, budget, pull threads and metrics across builders.
 */
public class HistoryBuilderFactory {
    private final HistoryConfig config;
    private final MemoryBudget budget;
    private final RetryPolicy retryPolicy;
    private final Executor pullExecutor;
    private final Metrics metrics;

    public HistoryBuilderFactory(HistoryConfig config, MemoryBudget budget, RetryPolicy retryPolicy,
                                 Executor pullExecutor, MetricRegistry registry) {
        this.config = config;
        this.budget = budget;
        this.retryPolicy = retryPolicy;
        this.pullExecutor = pullExecutor;
        this.metrics = new Metrics(registry);
    }

    public HistoryBuilder newBuilder() { return newBuilder(Set.of()); }

    public HistoryBuilder newBuilder(Set<HistoryFlag> flags) {
        return new HistoryBuilder(config, budget, retryPolicy, pullExecutor, metrics, flags);
    }

    public HistoryConfig config() { return config; }
    public MemoryBudget budget() { return budget; }
}
