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

import java.util.function.Supplier;

/**
 * Sink for the metrics published by {@code RateLimiter} and {@code ResponseCache}.
 *
 * <p>Two families of names are published, both built by {@link MetricNames}:
 *
 * <ul>
 *   <li>{@code ratelimit.<endpoint>.*}: request, admission, rejection, timeout and cancellation
 *       counters, a queue-wait timer, and live token and queue-depth gauges. Gauges are registered
 *       by {@code configure} and removed by {@code destroy}.
 *   <li>{@code cache.<name>.*}: hit, miss, eviction, expiration and compression counters, a
 *       snapshot-write timer, a persistence failure counter, and live entry-count and size gauges.
 *       Gauges are registered on construction and removed by {@code shutdown}.
 * </ul>
 *
 * <p>Counters only ever increase. Gauge suppliers take the owning component's lock briefly.
 * Implementations must be thread-safe: callbacks arrive from caller threads and from the rate
 * limiter and cache background threads.
 *
 * @since 1.0.0
 * @see NoOpMetricsRegistry
 * @see DropwizardMetricsAdapter
 */
public interface CallGuardMetricsRegistry {

    /**
     * Counts one event, such as an admitted request or a cache hit.
     *
     * @param name metric name (e.g., "ratelimit.chat.admitted.total.count")
     */
    void incrementCounter(String name);

    /**
     * Counts a batch of events, such as the entries removed by one expiry sweep or one LRU pass.
     *
     * @param name metric name
     * @param delta amount to increment (must be non-negative)
     */
    void incrementCounter(String name, long delta);

    /**
     * Records one latency sample: how long a request waited in the queue, or how long a snapshot
     * write took.
     *
     * @param name metric name (e.g., "ratelimit.chat.queue_wait.latency")
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Registers a live value such as available tokens, queue depth or cached bytes.
     *
     * <p>The supplier is called each time the gauge is read and must not block. Registering a name
     * that already exists replaces the previous gauge.
     *
     * @param name metric name (e.g., "cache.llm.entries.current.count")
     * @param valueSupplier function that returns the current value
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /**
     * Removes a gauge when its endpoint or cache goes away. No-op if absent.
     *
     * @param name metric name to remove
     */
    void removeGauge(String name);
}
