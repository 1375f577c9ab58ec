package io.layoffs.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Thin facade over a {@link MetricRegistry} that namespaces stage metrics.
 */
public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    public Timer stageTimer(String stage) { return registry.timer(MetricRegistry.name("stage", stage, "time")); }
    public Counter stageIn(String stage) { return registry.counter(MetricRegistry.name("stage", stage, "in")); }
    public Counter stageOut(String stage) { return registry.counter(MetricRegistry.name("stage", stage, "out")); }
}
