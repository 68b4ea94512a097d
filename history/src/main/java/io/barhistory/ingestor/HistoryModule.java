package io.barhistory.ingestor;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.barhistory.budget.MemoryBudget;
import io.barhistory.budget.SemaphoreMemoryBudget;
import io.barhistory.config.HistoryConfig;
import io.barhistory.retry.ExponentialBackoffRetryPolicy;
import io.barhistory.retry.RetryPolicy;
import io.barhistory.runtime.HistoryBuilderFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class HistoryModule extends AbstractModule {
    private final HistoryConfig config;

    public HistoryModule(HistoryConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(HistoryConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton MemoryBudget memoryBudget() { return new SemaphoreMemoryBudget(config.memoryBytes()); }

    @Provides @Singleton RetryPolicy retryPolicy() {
        return new ExponentialBackoffRetryPolicy(config.retryAttempts(), config.retryBaseMillis(), config.retryMaxMillis());
    }

    // pull loops may block on I/O; daemon threads keep them from holding the JVM open
    @Provides @Singleton ExecutorService pullExecutor() {
        AtomicInteger n = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "history-pull-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(config.pullThreads(), tf);
    }

    @Provides @Singleton HistoryBuilderFactory builderFactory(MemoryBudget budget, RetryPolicy retry, ExecutorService pullExecutor, MetricRegistry registry) {
        return new HistoryBuilderFactory(config, budget, retry, pullExecutor, registry);
    }
}
