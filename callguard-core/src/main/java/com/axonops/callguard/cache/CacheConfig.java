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

package com.axonops.callguard.cache;

import com.axonops.callguard.metrics.CallGuardMetricsRegistry;
import com.axonops.callguard.metrics.NoOpMetricsRegistry;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a {@link ResponseCache}.
 *
 * <p>Immutable configuration using Java 17 records. Controls bounds, expiry, compression,
 * persistence and metrics of one cache instance.
 *
 * <h2>Bounds</h2>
 *
 * <p>After every insertion least-recently-accessed entries are evicted until the cache holds at
 * most {@code maxEntries} entries and at most {@code maxSizeBytes} stored bytes. Sizes are measured
 * on the stored form, so compressed entries count at their compressed size.
 *
 * <h2>Expiry</h2>
 *
 * <p>Each entry expires {@code ttl} after it was written ({@code defaultTtl} unless the caller
 * passes one). Expired entries are removed lazily on lookup and by the maintenance thread every
 * {@code cleanupInterval}.
 *
 * <h2>Persistence</h2>
 *
 * <p>With {@code persistenceEnabled}, the cache loads {@code persistPath} on construction and the
 * maintenance thread rewrites it every {@code persistInterval}, plus once more on shutdown. A
 * missing or unreadable file means an empty cache, never a startup failure.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // In-memory only, defaults
 * ResponseCache<String> cache = ResponseCache.create(String.class);
 *
 * // Chat completions, persisted across restarts
 * ResponseCache<String> llm =
 *     ResponseCache.create(String.class, CacheConfig.forChatCompletions(Path.of("cache/llm.json")));
 *
 * // Custom
 * CacheConfig config = CacheConfig.builder()
 *     .name("transcripts")
 *     .maxEntries(2_000)
 *     .defaultTtl(Duration.ofMinutes(30))
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.callguard"))
 *     .build();
 * }</pre>
 *
 * @param name cache name, used in logs, metric names and the maintenance thread name
 * @param maxEntries maximum number of entries (must be > 0)
 * @param maxSizeBytes maximum total stored bytes (must be > 0)
 * @param defaultTtl expiry used when a write does not pass one (must be > 0)
 * @param compressionThreshold values whose encoded size exceeds this many bytes are gzipped (must
 *     be >= 0)
 * @param persistenceEnabled load and write snapshots at {@code persistPath}
 * @param persistPath snapshot file (required when persistence is enabled)
 * @param persistInterval period between background snapshots (must be > 0)
 * @param cleanupInterval period between expired-entry sweeps (must be > 0 and, with persistence,
 *     <= persistInterval)
 * @param clock time source for expiry and access times
 * @param metricsRegistry metrics implementation (use {@link NoOpMetricsRegistry} for none)
 * @since 1.0.0
 * @see ResponseCache
 */
public record CacheConfig(
    String name,
    int maxEntries,
    long maxSizeBytes,
    Duration defaultTtl,
    int compressionThreshold,
    boolean persistenceEnabled,
    Path persistPath,
    Duration persistInterval,
    Duration cleanupInterval,
    Clock clock,
    CallGuardMetricsRegistry metricsRegistry) {

  /** 1000 entries, 100MB, one hour TTL, compress above 1KB, in-memory only. */
  public static final CacheConfig DEFAULT = builder().build();

  public CacheConfig {
    Objects.requireNonNull(name, "name cannot be null");
    Objects.requireNonNull(defaultTtl, "defaultTtl cannot be null");
    Objects.requireNonNull(persistInterval, "persistInterval cannot be null");
    Objects.requireNonNull(cleanupInterval, "cleanupInterval cannot be null");
    Objects.requireNonNull(clock, "clock cannot be null");
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");

    if (name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    if (maxEntries <= 0) {
      throw new IllegalArgumentException("maxEntries must be positive");
    }
    if (maxSizeBytes <= 0) {
      throw new IllegalArgumentException("maxSizeBytes must be positive");
    }
    if (!isPositive(defaultTtl)) {
      throw new IllegalArgumentException("defaultTtl must be positive");
    }
    if (compressionThreshold < 0) {
      throw new IllegalArgumentException("compressionThreshold must be non-negative");
    }
    if (!isPositive(persistInterval)) {
      throw new IllegalArgumentException("persistInterval must be positive");
    }
    if (!isPositive(cleanupInterval)) {
      throw new IllegalArgumentException("cleanupInterval must be positive");
    }

    if (persistenceEnabled) {
      if (persistPath == null) {
        throw new IllegalArgumentException("persistPath is required when persistence is enabled");
      }
      // The maintenance thread wakes every cleanupInterval and persists when due
      if (cleanupInterval.compareTo(persistInterval) > 0) {
        throw new IllegalArgumentException(
            "cleanupInterval ("
                + cleanupInterval.toMillis()
                + "ms) must be <= persistInterval ("
                + persistInterval.toMillis()
                + "ms)");
      }
    }
  }

  /**
   * Preset for chat completion responses: 50MB, 500 entries, two hour TTL, compress above 512
   * bytes, persisted.
   *
   * @param persistPath snapshot file
   * @return preset config
   */
  public static CacheConfig forChatCompletions(Path persistPath) {
    return builder()
        .name("chat-completion")
        .maxSizeBytes(50L * 1024 * 1024)
        .maxEntries(500)
        .defaultTtl(Duration.ofHours(2))
        .compressionThreshold(512)
        .persistPath(persistPath)
        .build();
  }

  /**
   * Preset for speech synthesis results: 200MB, 1000 entries, 24 hour TTL, compress above 2KB,
   * persisted.
   *
   * @param persistPath snapshot file
   * @return preset config
   */
  public static CacheConfig forSpeechSynthesis(Path persistPath) {
    return builder()
        .name("speech-synthesis")
        .maxSizeBytes(200L * 1024 * 1024)
        .maxEntries(1000)
        .defaultTtl(Duration.ofHours(24))
        .compressionThreshold(2048)
        .persistPath(persistPath)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  private static boolean isPositive(Duration duration) {
    return !duration.isNegative() && !duration.isZero();
  }

  /**
   * Builder for custom cache configuration.
   *
   * <p>All fields start with the values of {@link #DEFAULT}. Setting a {@code persistPath}
   * enables persistence unless {@link #persistenceEnabled(boolean)} turns it off again.
   */
  public static class Builder {
    private String name = "default";
    private int maxEntries = 1000;
    private long maxSizeBytes = 100L * 1024 * 1024;
    private Duration defaultTtl = Duration.ofHours(1);
    private int compressionThreshold = 1024;
    private Boolean persistenceEnabled;
    private Path persistPath;
    private Duration persistInterval = Duration.ofMinutes(5);
    private Duration cleanupInterval = Duration.ofSeconds(60);
    private Clock clock = Clock.systemUTC();
    private CallGuardMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder maxEntries(int maxEntries) {
      this.maxEntries = maxEntries;
      return this;
    }

    public Builder maxSizeBytes(long maxSizeBytes) {
      this.maxSizeBytes = maxSizeBytes;
      return this;
    }

    public Builder defaultTtl(Duration ttl) {
      this.defaultTtl = ttl;
      return this;
    }

    public Builder compressionThreshold(int bytes) {
      this.compressionThreshold = bytes;
      return this;
    }

    public Builder persistenceEnabled(boolean enabled) {
      this.persistenceEnabled = enabled;
      return this;
    }

    public Builder persistPath(Path path) {
      this.persistPath = path;
      return this;
    }

    public Builder persistInterval(Duration interval) {
      this.persistInterval = interval;
      return this;
    }

    public Builder cleanupInterval(Duration interval) {
      this.cleanupInterval = interval;
      return this;
    }

    /** Time source; tests pass a controllable clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(CallGuardMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated immutable configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public CacheConfig build() {
      boolean persist = persistenceEnabled != null ? persistenceEnabled : persistPath != null;
      return new CacheConfig(
          name,
          maxEntries,
          maxSizeBytes,
          defaultTtl,
          compressionThreshold,
          persist,
          persistPath,
          persistInterval,
          cleanupInterval,
          clock,
          metricsRegistry);
    }
  }
}
