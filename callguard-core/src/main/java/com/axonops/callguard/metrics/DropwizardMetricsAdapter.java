/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.callguard.metrics;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Publishes rate limiter and cache metrics into a Dropwizard {@link MetricRegistry}.
 *
 * <p>Every name is qualified with a prefix, so an endpoint's admitted counter appears as {@code
 * <prefix>.ratelimit.chat-completion.admitted.total.count} and a cache's entry gauge as {@code
 * <prefix>.cache.chat-completion.entries.current.count}. Counters and timers are created lazily on
 * first update. Queue-wait and snapshot latencies are recorded as timers in nanoseconds.
 *
 * <p>Registering a gauge replaces any gauge of the same name, so re-configuring an endpoint or
 * recreating a cache with the same name rebinds the gauge to the live instance.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * CallGuardMetricsRegistry metrics = new DropwizardMetricsAdapter(registry, "com.myapp.callguard");
 * RateLimiter limiter = new RateLimiter(RateLimiterConfig.builder().metricsRegistry(metrics).build());
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements CallGuardMetricsRegistry {

    /** Prefix used when none is given. */
    public static final String DEFAULT_PREFIX = "com.axonops.callguard";

    private final MetricRegistry registry;
    private final String prefix;

    /**
     * Creates adapter with default metric prefix: {@code com.axonops.callguard}
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     * @throws NullPointerException if registry is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates adapter with custom metric prefix.
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     * @param prefix the metric name prefix (e.g., "com.myapp.callguard")
     * @throws NullPointerException if registry or prefix is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(metricName(name)).inc();
    }

    @Override
    public void incrementCounter(String name, long delta) {
        registry.counter(metricName(name)).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(metricName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void registerGauge(String name, Supplier<Number> valueSupplier) {
        String fullName = metricName(name);

        // Idempotent registration: a reconfigured endpoint or cache replaces its gauges
        registry.remove(fullName);
        registry.register(fullName, (Gauge<Number>) valueSupplier::get);
    }

    @Override
    public void removeGauge(String name) {
        registry.remove(metricName(name));
    }

    private String metricName(String name) {
        return MetricRegistry.name(prefix, name);
    }
}
