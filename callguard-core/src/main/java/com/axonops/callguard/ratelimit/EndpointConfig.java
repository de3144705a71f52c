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

import java.time.Duration;
import java.util.Objects;

/**
 * Rate limit settings for one logical endpoint.
 *
 * <p>The token bucket holds up to {@code burstLimit} tokens, starts full and refills continuously
 * at {@code requestsPerMinute / 60000} tokens per millisecond. When the bucket is empty up to
 * {@code queueSize} callers wait, each for at most {@code queueTimeout}.
 *
 * <pre>{@code
 * limiter.configure("chat-completion", EndpointConfig.of(60, 10, 50));
 * }</pre>
 *
 * @param requestsPerMinute sustained admission rate (must be > 0)
 * @param burstLimit bucket capacity, i.e. how many calls may pass back to back (must be > 0)
 * @param queueSize maximum waiting callers (must be >= 0; 0 rejects as soon as the bucket is empty)
 * @param queueTimeout how long a caller may wait before failing with a timeout (must be > 0)
 * @since 1.0.0
 */
public record EndpointConfig(
    int requestsPerMinute, int burstLimit, int queueSize, Duration queueTimeout) {

  /** Queue deadline used by {@link #of(int, int, int)}. */
  public static final Duration DEFAULT_QUEUE_TIMEOUT = Duration.ofSeconds(30);

  public EndpointConfig {
    if (requestsPerMinute <= 0) {
      throw new IllegalArgumentException("requestsPerMinute must be positive");
    }
    if (burstLimit <= 0) {
      throw new IllegalArgumentException("burstLimit must be positive");
    }
    if (queueSize < 0) {
      throw new IllegalArgumentException("queueSize must be non-negative");
    }
    Objects.requireNonNull(queueTimeout, "queueTimeout cannot be null");
    if (queueTimeout.isNegative() || queueTimeout.isZero()) {
      throw new IllegalArgumentException("queueTimeout must be positive");
    }
  }

  /**
   * Endpoint settings with the default 30 second queue timeout.
   *
   * @param requestsPerMinute sustained admission rate
   * @param burstLimit bucket capacity
   * @param queueSize maximum waiting callers
   * @return validated config
   */
  public static EndpointConfig of(int requestsPerMinute, int burstLimit, int queueSize) {
    return new EndpointConfig(requestsPerMinute, burstLimit, queueSize, DEFAULT_QUEUE_TIMEOUT);
  }

  /** Copy of this config with a different queue timeout. */
  public EndpointConfig withQueueTimeout(Duration timeout) {
    return new EndpointConfig(requestsPerMinute, burstLimit, queueSize, timeout);
  }

  /** Tokens added per millisecond of elapsed time. */
  public double refillPerMillisecond() {
    return requestsPerMinute / 60_000d;
  }
}
