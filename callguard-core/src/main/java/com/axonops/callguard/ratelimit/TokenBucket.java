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

/**
 * Continuously refilling token bucket for one endpoint.
 *
 * <p>Not thread-safe: every access happens under the owning {@link RateLimiter}'s monitor.
 * Invariant: {@code 0 <= tokens <= maxTokens}.
 */
final class TokenBucket {
  private final int maxTokens;
  private final double refillPerNano;

  private double tokens;
  private long lastRefillNanos;

  TokenBucket(EndpointConfig config, long nowNanos) {
    this.maxTokens = config.burstLimit();
    this.refillPerNano = config.refillPerMillisecond() / 1_000_000d;
    this.tokens = maxTokens;
    this.lastRefillNanos = nowNanos;
  }

  /** Adds the tokens earned since the last refill, clamped at capacity. */
  void refill(long nowNanos) {
    long elapsed = nowNanos - lastRefillNanos;
    if (elapsed <= 0) {
      return;
    }
    tokens = Math.min(maxTokens, tokens + elapsed * refillPerNano);
    lastRefillNanos = nowNanos;
  }

  /** Consumes one token if a whole token is available. */
  boolean tryConsume() {
    if (tokens >= 1.0) {
      tokens -= 1.0;
      return true;
    }
    return false;
  }

  /** Token count as of {@code nowNanos} without mutating the bucket. */
  double availableTokens(long nowNanos) {
    long elapsed = Math.max(0L, nowNanos - lastRefillNanos);
    return Math.min(maxTokens, tokens + elapsed * refillPerNano);
  }

  /** Nanoseconds until a whole token is available, 0 if one already is. */
  long nanosUntilNextToken() {
    if (tokens >= 1.0) {
      return 0L;
    }
    return (long) Math.ceil((1.0 - tokens) / refillPerNano);
  }

  double tokens() {
    return tokens;
  }

  int maxTokens() {
    return maxTokens;
  }
}
