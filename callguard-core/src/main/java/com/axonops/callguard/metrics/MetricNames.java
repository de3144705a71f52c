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

/**
 * Metric name templates for CallGuard instrumentation.
 *
 * <p>Rate limiter metrics are scoped per endpoint and cache metrics per cache name. Use {@link
 * #rateLimit(String, String)} and {@link #cache(String, String)} to build the full name, e.g.
 * {@code ratelimit.chat-completion.admitted.total.count}.
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Gauge</b> - Current value (suffix: {@code .current.*})
 * </ul>
 *
 * <h2>Rate limiter (per endpoint)</h2>
 *
 * <ul>
 *   <li>{@link #RL_REQUESTS} - every {@code acquire} on a configured endpoint
 *   <li>{@link #RL_ADMITTED} - admitted immediately or after queueing
 *   <li>{@link #RL_REJECTED} - rejected because the wait queue was full
 *   <li>{@link #RL_TIMEOUTS} - queued requests that hit their deadline
 *   <li>{@link #RL_CANCELLED} - queued requests failed by clearQueue/destroy
 *   <li>{@link #RL_QUEUE_WAIT} - time spent queued by admitted requests
 *   <li>{@link #RL_TOKENS} / {@link #RL_QUEUE_DEPTH} - live bucket and queue state
 * </ul>
 *
 * <h2>Response cache (per cache name)</h2>
 *
 * <ul>
 *   <li>{@link #CACHE_HITS}, {@link #CACHE_MISSES}
 *   <li>{@link #CACHE_EVICTIONS_LRU}, {@link #CACHE_EXPIRATIONS}
 *   <li>{@link #CACHE_COMPRESSED}, {@link #CACHE_COMPRESSION_FAILURES}
 *   <li>{@link #CACHE_PERSIST_LATENCY}, {@link #CACHE_PERSIST_FAILURES}
 *   <li>{@link #CACHE_ENTRIES}, {@link #CACHE_SIZE_BYTES}
 * </ul>
 *
 * @since 1.0.0
 */
public final class MetricNames {

  private MetricNames() {}

  // Rate limiter
  public static final String RL_REQUESTS = "requests.total.count";
  public static final String RL_ADMITTED = "admitted.total.count";
  public static final String RL_REJECTED = "rejected.queue_full.total.count";
  public static final String RL_TIMEOUTS = "rejected.timeout.total.count";
  public static final String RL_CANCELLED = "cancelled.total.count";
  public static final String RL_QUEUE_WAIT = "queue_wait.latency";
  public static final String RL_TOKENS = "tokens.current.count";
  public static final String RL_QUEUE_DEPTH = "queue.current.count";

  // Response cache
  public static final String CACHE_HITS = "hits.total.count";
  public static final String CACHE_MISSES = "misses.total.count";
  public static final String CACHE_EVICTIONS_LRU = "evictions.lru.total.count";
  public static final String CACHE_EXPIRATIONS = "evictions.expired.total.count";
  public static final String CACHE_COMPRESSED = "entries.compressed.total.count";
  public static final String CACHE_COMPRESSION_FAILURES = "errors.compression.total.count";
  public static final String CACHE_PERSIST_LATENCY = "persistence.snapshot.latency";
  public static final String CACHE_PERSIST_FAILURES = "errors.persistence.total.count";
  public static final String CACHE_ENTRIES = "entries.current.count";
  public static final String CACHE_SIZE_BYTES = "size.current.bytes";

  /**
   * Full name of a per-endpoint rate limiter metric.
   *
   * @param endpoint logical endpoint name
   * @param metric one of the {@code RL_*} constants
   * @return dotted metric name
   */
  public static String rateLimit(String endpoint, String metric) {
    return "ratelimit." + endpoint + "." + metric;
  }

  /**
   * Full name of a per-cache metric.
   *
   * @param cacheName cache name from its configuration
   * @param metric one of the {@code CACHE_*} constants
   * @return dotted metric name
   */
  public static String cache(String cacheName, String metric) {
    return "cache." + cacheName + "." + metric;
  }
}
