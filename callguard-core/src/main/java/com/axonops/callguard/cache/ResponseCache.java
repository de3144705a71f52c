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

import com.axonops.callguard.api.CacheSerializationException;
import com.axonops.callguard.api.PersistenceException;
import com.axonops.callguard.metrics.CallGuardMetricsRegistry;
import com.axonops.callguard.metrics.MetricNames;
import com.axonops.callguard.util.CacheKeys;
import com.axonops.callguard.util.KeyHasher;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, expiring response cache with optional gzip compression and snapshot persistence.
 *
 * <p>Values are encoded with a {@link ValueCodec} on write and decoded on every read, so callers
 * never share a mutable instance with the cache. Encoded values larger than {@link
 * CacheConfig#compressionThreshold()} are stored gzipped.
 *
 * <p>Eviction: after every write, least-recently-accessed entries are removed until both {@link
 * CacheConfig#maxEntries()} and {@link CacheConfig#maxSizeBytes()} hold. Expired entries are removed
 * on lookup and by a background sweep.
 *
 * <p>The {@code getOrSet} family runs the factory outside the cache lock. Concurrent misses on the
 * same key each invoke their own factory and the last write wins.
 *
 * <p>Thread-safe. Call {@link #shutdown()} when done to stop the maintenance thread and write a
 * final snapshot.
 *
 * @param <T> cached value type
 * @since 1.0.0
 */
public final class ResponseCache<T> implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ResponseCache.class);

  private final CacheConfig config;
  private final ValueCodec<T> codec;
  private final CallGuardMetricsRegistry metrics;
  private final SnapshotStore snapshotStore;
  private final CacheMaintenanceTask maintenanceTask;
  private final AtomicBoolean shutdown = new AtomicBoolean(false);

  private final String hitsMetric;
  private final String missesMetric;
  private final String evictionsMetric;
  private final String expirationsMetric;
  private final String entriesGauge;
  private final String sizeGauge;

  // Guarded by this. Kept in access order: head is the least recently used entry
  private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>();
  private long totalSizeBytes;
  private long hits;
  private long misses;
  private long evictionsLRU;
  private long expirations;

  /**
   * Creates a cache of JSON-encoded values with {@link CacheConfig#DEFAULT}.
   *
   * @param type value type
   * @return new cache; call {@link #shutdown()} when done
   */
  public static <T> ResponseCache<T> create(Class<T> type) {
    return create(type, CacheConfig.DEFAULT);
  }

  /**
   * Creates a cache of JSON-encoded values.
   *
   * @param type value type
   * @param config cache settings
   * @return new cache; call {@link #shutdown()} when done
   */
  public static <T> ResponseCache<T> create(Class<T> type, CacheConfig config) {
    return new ResponseCache<>(config, JacksonValueCodec.of(type));
  }

  /**
   * Creates a cache, restoring the snapshot first when persistence is enabled, then starts the
   * maintenance thread.
   *
   * @param config cache settings
   * @param codec value codec
   */
  public ResponseCache(CacheConfig config, ValueCodec<T> codec) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.codec = Objects.requireNonNull(codec, "codec cannot be null");
    this.metrics = config.metricsRegistry();

    String name = config.name();
    this.hitsMetric = MetricNames.cache(name, MetricNames.CACHE_HITS);
    this.missesMetric = MetricNames.cache(name, MetricNames.CACHE_MISSES);
    this.evictionsMetric = MetricNames.cache(name, MetricNames.CACHE_EVICTIONS_LRU);
    this.expirationsMetric = MetricNames.cache(name, MetricNames.CACHE_EXPIRATIONS);
    this.entriesGauge = MetricNames.cache(name, MetricNames.CACHE_ENTRIES);
    this.sizeGauge = MetricNames.cache(name, MetricNames.CACHE_SIZE_BYTES);

    this.snapshotStore = config.persistenceEnabled() ? new SnapshotStore(config.persistPath()) : null;
    if (snapshotStore != null) {
      restoreSnapshot();
    }

    metrics.registerGauge(entriesGauge, this::size);
    metrics.registerGauge(sizeGauge, this::totalSizeBytes);

    this.maintenanceTask = new CacheMaintenanceTask(this, config);
    maintenanceTask.start();

    logger.info(
        "CallGuard: Response cache created - name: {}, maxEntries: {}, maxSize: {}MB, ttl: {}, persistence: {}",
        name,
        config.maxEntries(),
        config.maxSizeBytes() / (1024 * 1024),
        config.defaultTtl(),
        snapshotStore != null ? snapshotStore.path() : "disabled");
  }

  public CacheConfig getConfig() {
    return config;
  }

  /**
   * Looks up a value.
   *
   * <p>A hit moves the entry to the most recently used position. An expired entry is removed and
   * counts as a miss.
   *
   * <p>An entry that no longer decodes is removed and counts as a miss.
   *
   * @param key cache key
   * @return the decoded value, or empty on a miss
   */
  public Optional<T> get(String key) {
    Objects.requireNonNull(key, "key cannot be null");

    CacheEntry entry;
    synchronized (this) {
      long now = config.clock().millis();
      entry = entries.get(key);
      if (entry != null && entry.isExpiredAt(now)) {
        removeEntry(key);
        expirations++;
        metrics.incrementCounter(expirationsMetric);
        logger.trace(
            "CallGuard: Expired on lookup - cache: {}, key: {}",
            config.name(),
            KeyHasher.hash(key));
        entry = null;
      }
      if (entry == null) {
        misses++;
        metrics.incrementCounter(missesMetric);
        return Optional.empty();
      }
      entry.recordAccess(now);
      touch(entry);
    }

    T value;
    try {
      value = decode(entry);
    } catch (CacheSerializationException e) {
      // Unreadable entries (e.g. restored under another value type) are dropped, not served
      synchronized (this) {
        if (entries.get(key) == entry) {
          removeEntry(key);
        }
        misses++;
        metrics.incrementCounter(missesMetric);
      }
      logger.warn(
          "CallGuard: Discarding undecodable entry - cache: {}, key: {}",
          config.name(),
          KeyHasher.hash(key),
          e);
      return Optional.empty();
    }

    synchronized (this) {
      hits++;
      metrics.incrementCounter(hitsMetric);
    }
    return Optional.of(value);
  }

  /** Stores a value with {@link CacheConfig#defaultTtl()}. */
  public void set(String key, T value) {
    set(key, value, config.defaultTtl());
  }

  /**
   * Stores a value, replacing any previous entry for the key, then evicts least recently used
   * entries until both bounds hold.
   *
   * @param key cache key
   * @param value value to store
   * @param ttl time until the entry expires
   * @throws IllegalArgumentException if ttl is not positive
   * @throws CacheSerializationException if the value cannot be encoded
   */
  public void set(String key, T value, Duration ttl) {
    Objects.requireNonNull(key, "key cannot be null");
    Objects.requireNonNull(value, "value cannot be null");
    requirePositive(ttl);

    byte[] data = codec.encode(value);
    boolean compressed = false;
    if (data.length > config.compressionThreshold()) {
      try {
        data = GzipCompression.compress(data);
        compressed = true;
        metrics.incrementCounter(MetricNames.cache(config.name(), MetricNames.CACHE_COMPRESSED));
      } catch (IOException e) {
        metrics.incrementCounter(
            MetricNames.cache(config.name(), MetricNames.CACHE_COMPRESSION_FAILURES));
        logger.warn(
            "CallGuard: Compression failed, storing uncompressed - cache: {}, key: {}",
            config.name(),
            KeyHasher.hash(key),
            e);
      }
    }

    synchronized (this) {
      long now = config.clock().millis();
      putEntry(CacheEntry.create(key, data, compressed, now, ttl.toMillis()));
      int evicted = evictIfNeeded();
      if (evicted > 0) {
        logger.debug(
            "CallGuard: Evicted {} LRU entries - cache: {}, entries: {}, size: {} bytes",
            evicted,
            config.name(),
            entries.size(),
            totalSizeBytes);
      }
    }
  }

  /**
   * Removes an entry.
   *
   * @return true if an entry was present
   */
  public synchronized boolean delete(String key) {
    Objects.requireNonNull(key, "key cannot be null");
    return removeEntry(key) != null;
  }

  /** Removes every entry and resets the hit and miss counters. */
  public synchronized void clear() {
    int removed = entries.size();
    entries.clear();
    totalSizeBytes = 0;
    hits = 0;
    misses = 0;
    logger.debug("CallGuard: Cache cleared - name: {}, removed: {}", config.name(), removed);
  }

  /**
   * Removes every expired entry.
   *
   * @return number of entries removed
   */
  public synchronized int cleanup() {
    long now = config.clock().millis();
    int removed = 0;
    Iterator<CacheEntry> it = entries.values().iterator();
    while (it.hasNext()) {
      CacheEntry entry = it.next();
      if (entry.isExpiredAt(now)) {
        it.remove();
        totalSizeBytes -= entry.sizeBytes();
        removed++;
      }
    }
    if (removed > 0) {
      expirations += removed;
      metrics.incrementCounter(expirationsMetric, removed);
    }
    return removed;
  }

  public synchronized int size() {
    return entries.size();
  }

  /** True if a live entry exists. Does not count as an access. */
  public synchronized boolean containsKey(String key) {
    Objects.requireNonNull(key, "key cannot be null");
    CacheEntry entry = entries.get(key);
    return entry != null && !entry.isExpiredAt(config.clock().millis());
  }

  /** Returns the cached value or computes, stores and returns it. */
  public T getOrSet(String key, Supplier<? extends T> factory) {
    return getOrSet(key, factory, config.defaultTtl());
  }

  /**
   * Returns the cached value or computes, stores and returns it.
   *
   * <p>The factory is not invoked on a hit. Exceptions from the factory propagate and nothing is
   * stored.
   *
   * @param key cache key
   * @param factory computes the value on a miss
   * @param ttl expiry of a newly stored value
   * @return cached or computed value
   */
  public T getOrSet(String key, Supplier<? extends T> factory, Duration ttl) {
    Objects.requireNonNull(factory, "factory cannot be null");
    requirePositive(ttl);

    Optional<T> cached = get(key);
    if (cached.isPresent()) {
      return cached.get();
    }
    T value = Objects.requireNonNull(factory.get(), "factory returned null");
    set(key, value, ttl);
    return value;
  }

  /** Async form of {@link #getOrSet(String, Supplier)}. */
  public CompletableFuture<T> getOrSetAsync(
      String key, Supplier<? extends CompletionStage<T>> factory) {
    return getOrSetAsync(key, factory, config.defaultTtl());
  }

  /**
   * Returns the cached value or starts the factory and stores its result when it completes.
   *
   * <p>A failed stage fails the returned future with the same cause and nothing is stored.
   *
   * @param key cache key
   * @param factory starts the computation on a miss
   * @param ttl expiry of a newly stored value
   * @return future of the cached or computed value
   */
  public CompletableFuture<T> getOrSetAsync(
      String key, Supplier<? extends CompletionStage<T>> factory, Duration ttl) {
    Objects.requireNonNull(factory, "factory cannot be null");
    requirePositive(ttl);

    Optional<T> cached = get(key);
    if (cached.isPresent()) {
      return CompletableFuture.completedFuture(cached.get());
    }

    CompletionStage<T> stage;
    try {
      stage = Objects.requireNonNull(factory.get(), "factory returned null");
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }

    CompletableFuture<T> result = new CompletableFuture<>();
    stage.whenComplete(
        (value, error) -> {
          if (error != null) {
            result.completeExceptionally(error);
            return;
          }
          try {
            set(key, value, ttl);
            result.complete(value);
          } catch (RuntimeException e) {
            result.completeExceptionally(e);
          }
        });
    return result;
  }

  /**
   * Looks up a value by structured input.
   *
   * @param input any Jackson-serializable value; see {@link CacheKeys#of(Object)}
   */
  public Optional<T> getCached(Object input) {
    return get(CacheKeys.of(input));
  }

  public void setCached(Object input, T value) {
    set(CacheKeys.of(input), value);
  }

  public void setCached(Object input, T value, Duration ttl) {
    set(CacheKeys.of(input), value, ttl);
  }

  public T getOrSetCached(Object input, Supplier<? extends T> factory) {
    return getOrSet(CacheKeys.of(input), factory);
  }

  public T getOrSetCached(Object input, Supplier<? extends T> factory, Duration ttl) {
    return getOrSet(CacheKeys.of(input), factory, ttl);
  }

  public CompletableFuture<T> getOrSetCachedAsync(
      Object input, Supplier<? extends CompletionStage<T>> factory) {
    return getOrSetAsync(CacheKeys.of(input), factory);
  }

  public CompletableFuture<T> getOrSetCachedAsync(
      Object input, Supplier<? extends CompletionStage<T>> factory, Duration ttl) {
    return getOrSetAsync(CacheKeys.of(input), factory, ttl);
  }

  /**
   * Get cache statistics.
   *
   * @return point-in-time statistics
   */
  public synchronized CacheStatistics getStatistics() {
    long oldest = Long.MAX_VALUE;
    long newest = Long.MIN_VALUE;
    for (CacheEntry entry : entries.values()) {
      oldest = Math.min(oldest, entry.createdAtMillis());
      newest = Math.max(newest, entry.createdAtMillis());
    }
    boolean empty = entries.isEmpty();
    return new CacheStatistics(
        entries.size(),
        totalSizeBytes,
        hits,
        misses,
        evictionsLRU,
        expirations,
        config.maxEntries(),
        config.maxSizeBytes(),
        empty ? null : Instant.ofEpochMilli(oldest),
        empty ? null : Instant.ofEpochMilli(newest));
  }

  /**
   * Writes a snapshot of all live entries now.
   *
   * <p>The entry table is copied under the lock; file I/O happens outside it.
   *
   * @throws IllegalStateException if persistence is not enabled
   * @throws PersistenceException if the snapshot cannot be written
   */
  public void persist() {
    if (snapshotStore == null) {
      throw new IllegalStateException(
          "CallGuard: Persistence is not enabled for cache: " + config.name());
    }

    long start = System.nanoTime();
    CacheSnapshot snapshot = takeSnapshot();
    try {
      snapshotStore.write(snapshot);
    } catch (PersistenceException e) {
      metrics.incrementCounter(
          MetricNames.cache(config.name(), MetricNames.CACHE_PERSIST_FAILURES));
      throw e;
    }
    long elapsed = System.nanoTime() - start;
    metrics.recordTimer(
        MetricNames.cache(config.name(), MetricNames.CACHE_PERSIST_LATENCY), elapsed);

    logger.debug(
        "CallGuard: Snapshot written - cache: {}, entries: {}, path: {}, took: {}ms",
        config.name(),
        snapshot.entries().size(),
        snapshotStore.path(),
        elapsed / 1_000_000);
  }

  /** Persists and logs failures instead of throwing. Used by background paths. */
  void persistQuietly() {
    try {
      persist();
    } catch (PersistenceException e) {
      logger.warn("CallGuard: Snapshot failed - cache: {}", config.name(), e);
    }
  }

  /**
   * Stops the maintenance thread, writes a final snapshot if persistence is enabled and clears
   * memory. Idempotent.
   */
  public void shutdown() {
    if (!shutdown.compareAndSet(false, true)) {
      return;
    }

    logger.info("CallGuard: Shutting down response cache - name: {}", config.name());
    maintenanceTask.stop();

    if (snapshotStore != null) {
      persistQuietly();
    }

    clear();
    metrics.removeGauge(entriesGauge);
    metrics.removeGauge(sizeGauge);
  }

  @Override
  public void close() {
    shutdown();
  }

  /** For tests. */
  boolean isMaintenanceRunning() {
    return maintenanceTask.isRunning();
  }

  private synchronized long totalSizeBytes() {
    return totalSizeBytes;
  }

  private T decode(CacheEntry entry) {
    byte[] bytes = entry.data();
    if (entry.compressed()) {
      try {
        bytes = GzipCompression.decompress(bytes);
      } catch (IOException e) {
        throw new CacheSerializationException(
            "Failed to decompress cached value: " + entry.key(), e);
      }
    }
    return codec.decode(bytes);
  }

  private CacheSnapshot takeSnapshot() {
    List<CacheSnapshot.Entry> stored;
    long snapshotHits;
    long snapshotMisses;
    long snapshotSize = 0;
    synchronized (this) {
      long now = config.clock().millis();
      stored = new ArrayList<>(entries.size());
      for (CacheEntry entry : entries.values()) {
        if (!entry.isExpiredAt(now)) {
          stored.add(CacheSnapshot.Entry.from(entry));
          snapshotSize += entry.sizeBytes();
        }
      }
      snapshotHits = hits;
      snapshotMisses = misses;
    }
    return new CacheSnapshot(
        CacheSnapshot.FORMAT,
        CacheSnapshot.VERSION,
        config.name(),
        config.clock().instant(),
        snapshotHits,
        snapshotMisses,
        snapshotSize,
        stored);
  }

  private void restoreSnapshot() {
    Optional<CacheSnapshot> loaded;
    try {
      loaded = snapshotStore.read();
    } catch (PersistenceException e) {
      logger.warn(
          "CallGuard: Ignoring unreadable snapshot, starting empty - cache: {}, path: {}",
          config.name(),
          snapshotStore.path(),
          e);
      return;
    }
    if (loaded.isEmpty()) {
      logger.info(
          "CallGuard: No snapshot found, starting empty - cache: {}, path: {}",
          config.name(),
          snapshotStore.path());
      return;
    }

    CacheSnapshot snapshot = loaded.get();
    if (snapshot.cacheName() != null && !snapshot.cacheName().equals(config.name())) {
      logger.warn(
          "CallGuard: Ignoring snapshot of another cache, starting empty - cache: {}, snapshot: {}, path: {}",
          config.name(),
          snapshot.cacheName(),
          snapshotStore.path());
      return;
    }
    long now = config.clock().millis();
    List<CacheEntry> restored = new ArrayList<>();
    int skipped = 0;
    for (CacheSnapshot.Entry stored : snapshot.entries()) {
      if (stored == null || !stored.hasRequiredFields()) {
        skipped++;
        continue;
      }
      CacheEntry entry = stored.toCacheEntry();
      if (entry.isExpiredAt(now)) {
        skipped++;
        continue;
      }
      restored.add(entry);
    }
    // Re-inserting oldest access first rebuilds the LRU order
    restored.sort(Comparator.comparingLong(CacheEntry::lastAccessedAtMillis));

    synchronized (this) {
      for (CacheEntry entry : restored) {
        putEntry(entry);
      }
      hits = snapshot.hits();
      misses = snapshot.misses();
      evictIfNeeded();
      logger.info(
          "CallGuard: Snapshot restored - cache: {}, entries: {}, skipped: {}, path: {}",
          config.name(),
          entries.size(),
          skipped,
          snapshotStore.path());
    }
  }

  // Caller holds the lock. New and replaced entries go to the tail
  private void putEntry(CacheEntry entry) {
    CacheEntry previous = entries.remove(entry.key());
    if (previous != null) {
      totalSizeBytes -= previous.sizeBytes();
    }
    entries.put(entry.key(), entry);
    totalSizeBytes += entry.sizeBytes();
  }

  // Caller holds the lock
  private void touch(CacheEntry entry) {
    entries.remove(entry.key());
    entries.put(entry.key(), entry);
  }

  // Caller holds the lock
  private CacheEntry removeEntry(String key) {
    CacheEntry removed = entries.remove(key);
    if (removed != null) {
      totalSizeBytes -= removed.sizeBytes();
    }
    return removed;
  }

  // Caller holds the lock
  private int evictIfNeeded() {
    int evicted = 0;
    Iterator<CacheEntry> it = entries.values().iterator();
    while (it.hasNext()
        && (entries.size() > config.maxEntries() || totalSizeBytes > config.maxSizeBytes())) {
      CacheEntry eldest = it.next();
      it.remove();
      totalSizeBytes -= eldest.sizeBytes();
      evicted++;
      logger.trace(
          "CallGuard: LRU eviction - cache: {}, key: {}", config.name(), KeyHasher.hash(eldest.key()));
    }
    if (evicted > 0) {
      evictionsLRU += evicted;
      metrics.incrementCounter(evictionsMetric, evicted);
    }
    return evicted;
  }

  private static void requirePositive(Duration ttl) {
    Objects.requireNonNull(ttl, "ttl cannot be null");
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
  }
}
