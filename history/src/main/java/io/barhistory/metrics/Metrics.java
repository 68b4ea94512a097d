package io.barhistory.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class Metrics {
    public static final String PULL_BARS = "history.pull.bars";
    public static final String PULL_RETRIES = "history.pull.retries";
    public static final String SESSION_ERRORS = "history.session.errors";
    public static final String BUILD_TIME = "history.build.time";
    public static final String BUILD_FAILURES = "history.build.failures";
    public static final String MERGE_OPS = "history.merge.ops";
    public static final String BARS_EMITTED = "history.bars.emitted";
    public static final String WINDOWS_DROPPED = "history.normalize.windows.dropped";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }
    public Histogram histogram(String name) { return registry.histogram(name); }
}
