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

package com.axonops.callguard.ratelimit;

import com.axonops.callguard.api.AdmissionTimeoutException;
import com.axonops.callguard.api.EndpointNotConfiguredException;
import com.axonops.callguard.api.QueueClearedException;
import com.axonops.callguard.api.QueueFullException;
import com.axonops.callguard.metrics.CallGuardMetricsRegistry;
import com.axonops.callguard.metrics.MetricNames;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-endpoint admission controller: a token bucket plus a bounded priority wait queue for every
 * logical endpoint.
 *
 * <p>Admission decision for {@link #acquire(String, Priority)}:
 *
 * <ol>
 *   <li>Unknown endpoint: failed future with {@link EndpointNotConfiguredException}
 *   <li>Refill lazily from elapsed time, admit waiters already queued, then take a token if one is
 *       left: completed future
 *   <li>No token and queue full: failed future with {@link QueueFullException}
 *   <li>Otherwise queue the caller: pending future that completes when a token is due, or fails
 *       with {@link AdmissionTimeoutException} at its deadline
 * </ol>
 *
 * <p>Waiters are admitted highest priority first, FIFO within a priority. A token is only consumed
 * when the returned future is about to complete successfully.
 *
 * <p>Thread-safe. Bucket and queue state is guarded by this instance's monitor; futures are
 * completed and listeners notified after the monitor is released, so caller continuations never
 * run under the lock.
 *
 * <p>Each instance owns one scheduler thread for deadlines, precise wake-ups and a periodic drain.
 * Build one limiter at the composition root, share it by injection and call {@link #destroy()} on
 * shutdown.
 *
 * @since 1.0.0
 */
public final class RateLimiter implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

  private final RateLimiterConfig config;
  private final CallGuardMetricsRegistry metrics;
  private final ScheduledThreadPoolExecutor scheduler;
  private final ScheduledFuture<?> drainTask;
  private final List<RateLimiterListener> listeners = new CopyOnWriteArrayList<>();
  private final AtomicLong sequence = new AtomicLong(0);

  // Guarded by this
  private final Map<String, EndpointState> endpoints = new LinkedHashMap<>();
  private boolean destroyed;

  /** Creates a limiter with {@link RateLimiterConfig#DEFAULT}. */
  public RateLimiter() {
    this(RateLimiterConfig.DEFAULT);
  }

  /**
   * Creates a limiter and starts its background drain.
   *
   * @param config limiter settings
   */
  public RateLimiter(RateLimiterConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.metrics = config.metricsRegistry();

    this.scheduler =
        new ScheduledThreadPoolExecutor(
            1,
            r -> {
              Thread t = new Thread(r, "CallGuard-RateLimiter");
              t.setDaemon(true);
              return t;
            });
    // Cancelled deadlines must not pile up in the work queue until they would have fired
    this.scheduler.setRemoveOnCancelPolicy(true);

    long intervalMs = config.drainInterval().toMillis();
    this.drainTask =
        scheduler.scheduleAtFixedRate(
            this::drainAll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

    logger.debug("CallGuard: Rate limiter started - drainInterval: {}ms", intervalMs);
  }

  public RateLimiterConfig getConfig() {
    return config;
  }

  /**
   * Configures (or re-configures) an endpoint.
   *
   * <p>The bucket is reset to full and the endpoint's metrics are reset. Requests already waiting
   * on the endpoint stay queued and are admitted against the new bucket.
   *
   * @param endpoint logical endpoint name
   * @param endpointConfig limits for the endpoint
   * @throws IllegalStateException if the limiter was destroyed
   */
  public void configure(String endpoint, EndpointConfig endpointConfig) {
    Objects.requireNonNull(endpoint, "endpoint cannot be null");
    Objects.requireNonNull(endpointConfig, "endpointConfig cannot be null");

    List<Runnable> completions = new ArrayList<>();
    boolean created;
    synchronized (this) {
      ensureNotDestroyed();
      long now = System.nanoTime();
      EndpointState state = endpoints.get(endpoint);
      created = state == null;
      if (created) {
        state = new EndpointState(endpoint, endpointConfig, now);
        endpoints.put(endpoint, state);
      } else {
        state.reconfigure(endpointConfig, now);
        drain(state, now, completions);
        scheduleWakeUp(state);
      }
    }

    if (created) {
      registerEndpointMetrics(endpoint);
    }
    runAll(completions);

    logger.info(
        "CallGuard: Endpoint configured - {}: {} rpm, burst: {}, queueSize: {}, queueTimeout: {}ms",
        endpoint,
        endpointConfig.requestsPerMinute(),
        endpointConfig.burstLimit(),
        endpointConfig.queueSize(),
        endpointConfig.queueTimeout().toMillis());
  }

  /** Acquires with {@link Priority#MEDIUM}. */
  public CompletableFuture<Void> acquire(String endpoint) {
    return acquire(endpoint, Priority.MEDIUM);
  }

  /**
   * Asks permission to make one call to the endpoint.
   *
   * <p>Never blocks. The returned future is already complete when a token was available or the
   * request was rejected, and pending while the request waits in the queue. Cancelling a pending
   * future withdraws the request without consuming a token.
   *
   * @param endpoint logical endpoint name
   * @param priority admission priority while queued
   * @return future completing on admission, or failing with {@link EndpointNotConfiguredException},
   *     {@link QueueFullException}, {@link AdmissionTimeoutException} or {@link
   *     QueueClearedException}
   */
  public CompletableFuture<Void> acquire(String endpoint, Priority priority) {
    Objects.requireNonNull(endpoint, "endpoint cannot be null");
    Objects.requireNonNull(priority, "priority cannot be null");

    List<Runnable> completions = new ArrayList<>();
    CompletableFuture<Void> result;

    synchronized (this) {
      if (destroyed) {
        return CompletableFuture.failedFuture(
            new IllegalStateException("CallGuard: Rate limiter has been destroyed"));
      }

      EndpointState state = endpoints.get(endpoint);
      if (state == null) {
        logger.warn("CallGuard: acquire() on unconfigured endpoint: {}", endpoint);
        return CompletableFuture.failedFuture(new EndpointNotConfiguredException(endpoint));
      }

      state.totalRequests++;
      metrics.incrementCounter(MetricNames.rateLimit(endpoint, MetricNames.RL_REQUESTS));

      long now = System.nanoTime();
      state.bucket.refill(now);
      // Waiters first, so a newcomer never overtakes the queue
      drain(state, now, completions);

      if (state.bucket.tryConsume()) {
        state.successfulRequests++;
        metrics.incrementCounter(MetricNames.rateLimit(endpoint, MetricNames.RL_ADMITTED));
        result = CompletableFuture.completedFuture(null);
      } else if (state.queue.size() >= state.config.queueSize()) {
        state.rateLimitedRequests++;
        metrics.incrementCounter(MetricNames.rateLimit(endpoint, MetricNames.RL_REJECTED));
        logger.debug(
            "CallGuard: Queue full, rejecting - endpoint: {}, queueSize: {}",
            endpoint,
            state.config.queueSize());
        result =
            CompletableFuture.failedFuture(
                new QueueFullException(endpoint, state.config.queueSize()));
      } else {
        result = enqueue(state, priority, now, completions);
      }
    }

    runAll(completions);
    return result;
  }

  /** Snapshot of an endpoint's metrics, empty if it is not configured. */
  public synchronized Optional<EndpointMetrics> getMetrics(String endpoint) {
    EndpointState state = endpoints.get(endpoint);
    return state == null ? Optional.empty() : Optional.of(state.snapshot(System.nanoTime()));
  }

  /** Snapshots for every configured endpoint, keyed by endpoint name. */
  public synchronized Map<String, EndpointMetrics> getAllMetrics() {
    long now = System.nanoTime();
    Map<String, EndpointMetrics> all = new LinkedHashMap<>();
    endpoints.forEach((name, state) -> all.put(name, state.snapshot(now)));
    return Collections.unmodifiableMap(all);
  }

  /** Zeroes an endpoint's counters. Live queue depth and tokens are unaffected. */
  public synchronized void resetMetrics(String endpoint) {
    EndpointState state = endpoints.get(endpoint);
    if (state != null) {
      state.resetCounters();
      logger.trace("CallGuard: Metrics reset - endpoint: {}", endpoint);
    }
  }

  /** Queue depth per endpoint, including endpoints with an empty queue. */
  public synchronized Map<String, QueueStatus> getQueueStatus() {
    Map<String, QueueStatus> status = new LinkedHashMap<>();
    endpoints.forEach((name, state) -> status.put(name, state.queueStatus()));
    return Collections.unmodifiableMap(status);
  }

  /** Whether the endpoint has been configured. */
  public synchronized boolean isConfigured(String endpoint) {
    return endpoints.containsKey(endpoint);
  }

  /** Fails every queued request on every endpoint with {@link QueueClearedException}. */
  public void clearQueue() {
    List<Runnable> completions = new ArrayList<>();
    synchronized (this) {
      endpoints.values().forEach(state -> cancelQueued(state, completions));
    }
    runAll(completions);
  }

  /**
   * Fails every request queued on one endpoint with {@link QueueClearedException}. No-op for
   * unknown endpoints.
   *
   * @param endpoint endpoint whose queue is cleared
   */
  public void clearQueue(String endpoint) {
    List<Runnable> completions = new ArrayList<>();
    synchronized (this) {
      EndpointState state = endpoints.get(endpoint);
      if (state != null) {
        cancelQueued(state, completions);
      }
    }
    runAll(completions);
  }

  public void addListener(RateLimiterListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
  }

  public void removeListener(RateLimiterListener listener) {
    listeners.remove(listener);
  }

  /**
   * Stops the background task, fails all queued requests with {@link QueueClearedException} and
   * forgets every endpoint. Idempotent.
   */
  public void destroy() {
    List<Runnable> completions = new ArrayList<>();
    List<String> names;
    synchronized (this) {
      if (destroyed) {
        return;
      }
      destroyed = true;
      endpoints.values().forEach(state -> cancelQueued(state, completions));
      names = new ArrayList<>(endpoints.keySet());
      endpoints.clear();
    }

    logger.info("CallGuard: Destroying rate limiter - {} endpoints", names.size());

    drainTask.cancel(false);
    scheduler.shutdownNow();
    for (String name : names) {
      metrics.removeGauge(MetricNames.rateLimit(name, MetricNames.RL_TOKENS));
      metrics.removeGauge(MetricNames.rateLimit(name, MetricNames.RL_QUEUE_DEPTH));
    }
    runAll(completions);
  }

  /** Same as {@link #destroy()}. */
  @Override
  public void close() {
    destroy();
  }

  // ---------------------------------------------------------------------------------------------
  // Internals. Methods taking an EndpointState must be called while holding the monitor.
  // ---------------------------------------------------------------------------------------------

  private CompletableFuture<Void> enqueue(
      EndpointState state, Priority priority, long now, List<Runnable> completions) {
    long timeoutMs = state.config.queueTimeout().toMillis();
    QueuedRequest request =
        new QueuedRequest(sequence.incrementAndGet(), state.name, priority, now, timeoutMs);
    state.queue.add(request);
    request.deadline(scheduler.schedule(() -> expire(request), timeoutMs, TimeUnit.MILLISECONDS));
    // A caller cancelling the future frees its queue slot at once
    request
        .future()
        .whenComplete(
            (ignored, error) -> {
              if (request.future().isCancelled()) {
                withdraw(request);
              }
            });
    scheduleWakeUp(state);

    int depth = state.queue.size();
    logger.trace("CallGuard: Queued {} - depth: {}", request, depth);
    completions.add(() -> notifyQueued(state.name, depth));
    return request.future();
  }

  /** Admits queued requests while tokens last. Caller must have refilled the bucket. */
  private void drain(EndpointState state, long now, List<Runnable> completions) {
    while (!state.queue.isEmpty()) {
      QueuedRequest head = state.queue.peek();
      if (head.future().isDone()) {
        // Withdrawn by the caller
        state.queue.poll();
        head.cancelDeadline();
        continue;
      }
      if (!state.bucket.tryConsume()) {
        return;
      }
      state.queue.poll();
      head.cancelDeadline();

      long waitNanos = Math.max(0L, now - head.enqueuedNanos());
      long waitMs = TimeUnit.NANOSECONDS.toMillis(waitNanos);
      state.successfulRequests++;
      state.admittedFromQueue++;
      state.totalWaitNanos += waitNanos;
      metrics.incrementCounter(MetricNames.rateLimit(state.name, MetricNames.RL_ADMITTED));
      metrics.recordTimer(MetricNames.rateLimit(state.name, MetricNames.RL_QUEUE_WAIT), waitNanos);
      logger.trace("CallGuard: Admitted {} after {}ms", head, waitMs);

      completions.add(
          () -> {
            if (head.future().complete(null)) {
              notifyProcessed(state.name, waitMs);
            }
          });
    }
  }

  /** Schedules a one-shot drain for when the next token is due, unless one is pending. */
  private void scheduleWakeUp(EndpointState state) {
    if (state.queue.isEmpty() || destroyed) {
      return;
    }
    if (state.wakeUp != null && !state.wakeUp.isDone()) {
      return;
    }
    long delayNanos = Math.max(state.bucket.nanosUntilNextToken(), 1L);
    String name = state.name;
    state.wakeUp = scheduler.schedule(() -> drainEndpoint(name), delayNanos, TimeUnit.NANOSECONDS);
  }

  private void drainEndpoint(String endpoint) {
    List<Runnable> completions = new ArrayList<>();
    synchronized (this) {
      EndpointState state = endpoints.get(endpoint);
      if (state == null) {
        return;
      }
      state.wakeUp = null;
      long now = System.nanoTime();
      state.bucket.refill(now);
      drain(state, now, completions);
      scheduleWakeUp(state);
    }
    runAll(completions);
  }

  /** Periodic safety net for endpoints that see no further calls. */
  private void drainAll() {
    List<Runnable> completions = new ArrayList<>();
    try {
      synchronized (this) {
        long now = System.nanoTime();
        for (EndpointState state : endpoints.values()) {
          if (state.queue.isEmpty()) {
            continue;
          }
          state.bucket.refill(now);
          drain(state, now, completions);
          scheduleWakeUp(state);
        }
      }
    } catch (RuntimeException e) {
      // Must not escape: a throwing periodic task is never rescheduled
      logger.error("CallGuard: Error in rate limiter drain task", e);
    }
    if (!completions.isEmpty()) {
      logger.debug("CallGuard: Background drain admitted {} requests", completions.size());
    }
    runAll(completions);
  }

  private void expire(QueuedRequest request) {
    synchronized (this) {
      EndpointState state = endpoints.get(request.endpoint());
      if (state == null || !state.queue.remove(request) || request.future().isDone()) {
        return;
      }
      state.timedOutRequests++;
      metrics.incrementCounter(MetricNames.rateLimit(state.name, MetricNames.RL_TIMEOUTS));
    }
    logger.debug(
        "CallGuard: Queued request timed out - {}, after {}ms", request, request.timeoutMillis());
    request
        .future()
        .completeExceptionally(
            new AdmissionTimeoutException(request.endpoint(), request.timeoutMillis()));
  }

  /** Frees the queue slot of a waiter its caller cancelled. */
  private void withdraw(QueuedRequest request) {
    synchronized (this) {
      EndpointState state = endpoints.get(request.endpoint());
      if (state == null || !state.queue.remove(request)) {
        return;
      }
      request.cancelDeadline();
      state.cancelledRequests++;
      metrics.incrementCounter(MetricNames.rateLimit(state.name, MetricNames.RL_CANCELLED));
    }
    logger.trace("CallGuard: Withdrawn by caller {}", request);
  }

  private void cancelQueued(EndpointState state, List<Runnable> completions) {
    int cancelled = 0;
    QueuedRequest request;
    while ((request = state.queue.poll()) != null) {
      request.cancelDeadline();
      if (request.future().isDone()) {
        continue;
      }
      CompletableFuture<Void> future = request.future();
      String name = state.name;
      completions.add(() -> future.completeExceptionally(new QueueClearedException(name)));
      cancelled++;
    }
    if (state.wakeUp != null) {
      state.wakeUp.cancel(false);
      state.wakeUp = null;
    }
    if (cancelled > 0) {
      state.cancelledRequests += cancelled;
      metrics.incrementCounter(
          MetricNames.rateLimit(state.name, MetricNames.RL_CANCELLED), cancelled);
      logger.debug("CallGuard: Cleared {} queued requests - endpoint: {}", cancelled, state.name);
    }
  }

  private void ensureNotDestroyed() {
    if (destroyed) {
      throw new IllegalStateException("CallGuard: Rate limiter has been destroyed");
    }
  }

  private void registerEndpointMetrics(String endpoint) {
    metrics.registerGauge(
        MetricNames.rateLimit(endpoint, MetricNames.RL_TOKENS),
        () -> getMetrics(endpoint).map(EndpointMetrics::currentTokens).orElse(0.0));
    metrics.registerGauge(
        MetricNames.rateLimit(endpoint, MetricNames.RL_QUEUE_DEPTH),
        () -> getMetrics(endpoint).map(EndpointMetrics::queuedRequests).orElse(0));
  }

  private void notifyQueued(String endpoint, int depth) {
    for (RateLimiterListener listener : listeners) {
      try {
        listener.onRequestQueued(endpoint, depth);
      } catch (RuntimeException e) {
        logger.warn("CallGuard: Listener failed on requestQueued - endpoint: {}", endpoint, e);
      }
    }
  }

  private void notifyProcessed(String endpoint, long waitMs) {
    for (RateLimiterListener listener : listeners) {
      try {
        listener.onRequestProcessed(endpoint, waitMs);
      } catch (RuntimeException e) {
        logger.warn("CallGuard: Listener failed on requestProcessed - endpoint: {}", endpoint, e);
      }
    }
  }

  private static void runAll(List<Runnable> completions) {
    for (Runnable completion : completions) {
      completion.run();
    }
  }

  /** Bucket, queue and counters of one endpoint. */
  private static final class EndpointState {
    private final String name;
    private final PriorityQueue<QueuedRequest> queue =
        new PriorityQueue<>(QueuedRequest.ADMISSION_ORDER);
    private EndpointConfig config;
    private TokenBucket bucket;
    private ScheduledFuture<?> wakeUp;

    private long totalRequests;
    private long successfulRequests;
    private long rateLimitedRequests;
    private long timedOutRequests;
    private long cancelledRequests;
    private long admittedFromQueue;
    private long totalWaitNanos;

    EndpointState(String name, EndpointConfig config, long nowNanos) {
      this.name = name;
      this.config = config;
      this.bucket = new TokenBucket(config, nowNanos);
    }

    void reconfigure(EndpointConfig newConfig, long nowNanos) {
      this.config = newConfig;
      this.bucket = new TokenBucket(newConfig, nowNanos);
      if (wakeUp != null) {
        wakeUp.cancel(false);
        wakeUp = null;
      }
      resetCounters();
    }

    void resetCounters() {
      totalRequests = 0;
      successfulRequests = 0;
      rateLimitedRequests = 0;
      timedOutRequests = 0;
      cancelledRequests = 0;
      admittedFromQueue = 0;
      totalWaitNanos = 0;
    }

    EndpointMetrics snapshot(long nowNanos) {
      double averageWaitMs =
          admittedFromQueue == 0 ? 0.0 : (totalWaitNanos / 1_000_000d) / admittedFromQueue;
      return new EndpointMetrics(
          name,
          totalRequests,
          successfulRequests,
          rateLimitedRequests,
          timedOutRequests,
          cancelledRequests,
          queue.size(),
          averageWaitMs,
          bucket.availableTokens(nowNanos),
          bucket.maxTokens());
    }

    QueueStatus queueStatus() {
      int high = 0;
      int medium = 0;
      int low = 0;
      for (QueuedRequest request : queue) {
        switch (request.priority()) {
          case HIGH -> high++;
          case MEDIUM -> medium++;
          case LOW -> low++;
        }
      }
      return new QueueStatus(name, high, medium, low);
    }
  }
}
