package io.backfill.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Thin view over a {@link MetricRegistry} that prefixes every name, e.g. {@code backfill.batcher.emitted}.
 */
public class Metrics {
    private final MetricRegistry registry;
    private final String prefix;

    public Metrics(MetricRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix;
    }

    public MetricRegistry registry() { return registry; }
    public String prefix() { return prefix; }

    public Metrics scoped(String name) { return new Metrics(registry, MetricRegistry.name(prefix, name)); }

    public Counter counter(String name) { return registry.counter(MetricRegistry.name(prefix, name)); }
    public Meter meter(String name) { return registry.meter(MetricRegistry.name(prefix, name)); }
    public Timer timer(String name) { return registry.timer(MetricRegistry.name(prefix, name)); }
}
