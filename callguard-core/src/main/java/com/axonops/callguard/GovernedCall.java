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

package com.axonops.callguard;

import com.axonops.callguard.cache.ResponseCache;
import com.axonops.callguard.ratelimit.Priority;
import com.axonops.callguard.ratelimit.RateLimiter;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Cache-then-admit-then-call flow for one external endpoint.
 *
 * <p>A cache hit completes immediately without taking a rate limit token. On a miss the call waits
 * for admission on the endpoint, runs, and its successful result is cached under the key derived
 * from the input. Admission failures and call failures propagate unchanged and nothing is cached.
 *
 * <pre>{@code
 * RateLimiter limiter = new RateLimiter();
 * ExternalEndpoints.configureDefaults(limiter);
 * ResponseCache<String> cache = ResponseCache.create(String.class, CacheConfig.forChatCompletions(path));
 *
 * GovernedCall<String> chat = new GovernedCall<>(limiter, cache, ExternalEndpoints.CHAT_COMPLETION);
 * CompletableFuture<String> reply = chat.execute(request, Priority.HIGH, () -> client.send(request));
 * }</pre>
 *
 * <p>The limiter and cache are not owned: shut them down separately.
 *
 * @param <T> response type
 * @since 1.0.0
 */
public final class GovernedCall<T> {

  private final RateLimiter rateLimiter;
  private final ResponseCache<T> cache;
  private final String endpoint;
  private final Duration ttl;

  /** Uses the cache's default TTL. */
  public GovernedCall(RateLimiter rateLimiter, ResponseCache<T> cache, String endpoint) {
    this(rateLimiter, cache, endpoint, cache.getConfig().defaultTtl());
  }

  public GovernedCall(
      RateLimiter rateLimiter, ResponseCache<T> cache, String endpoint, Duration ttl) {
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter cannot be null");
    this.cache = Objects.requireNonNull(cache, "cache cannot be null");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint cannot be null");
    this.ttl = Objects.requireNonNull(ttl, "ttl cannot be null");
  }

  public String endpoint() {
    return endpoint;
  }

  /** Executes at {@link Priority#MEDIUM}. */
  public CompletableFuture<T> execute(Object input, Supplier<? extends CompletionStage<T>> call) {
    return execute(input, Priority.MEDIUM, call);
  }

  /**
   * Returns the cached response for {@code input}, or acquires admission and runs {@code call}.
   *
   * @param input semantic input of the call; the cache key is derived from it
   * @param priority admission priority on a miss
   * @param call starts the external call once admitted
   * @return future of the cached or fresh response
   */
  public CompletableFuture<T> execute(
      Object input, Priority priority, Supplier<? extends CompletionStage<T>> call) {
    Objects.requireNonNull(priority, "priority cannot be null");
    Objects.requireNonNull(call, "call cannot be null");

    return cache.getOrSetCachedAsync(
        input, () -> rateLimiter.acquire(endpoint, priority).thenCompose(admitted -> call.get()), ttl);
  }
}
