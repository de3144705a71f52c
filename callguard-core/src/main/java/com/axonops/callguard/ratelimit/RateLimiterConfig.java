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

import com.axonops.callguard.metrics.CallGuardMetricsRegistry;
import com.axonops.callguard.metrics.NoOpMetricsRegistry;
import java.time.Duration;
import java.util.Objects;

/**
 * Instance-wide settings for a {@link RateLimiter}.
 *
 * <p>Per-endpoint limits live in {@link EndpointConfig}; this record only carries what the
 * limiter itself owns.
 *
 * <p>Refill is computed lazily from elapsed time on every call, and a waiter is woken exactly when
 * the next token is due. The background drain that runs every {@code drainInterval} is a safety net
 * for endpoints that receive no further calls, so it can stay coarse.
 *
 * @param drainInterval period of the background queue drain (must be > 0)
 * @param metricsRegistry metrics implementation (use {@link NoOpMetricsRegistry} for none)
 * @since 1.0.0
 */
public record RateLimiterConfig(Duration drainInterval, CallGuardMetricsRegistry metricsRegistry) {

  /** One second background drain, metrics disabled. */
  public static final RateLimiterConfig DEFAULT =
      new RateLimiterConfig(Duration.ofSeconds(1), NoOpMetricsRegistry.INSTANCE);

  public RateLimiterConfig {
    Objects.requireNonNull(drainInterval, "drainInterval cannot be null");
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
    if (drainInterval.isNegative() || drainInterval.isZero()) {
      throw new IllegalArgumentException("drainInterval must be positive");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder starting from {@link #DEFAULT}. */
  public static class Builder {
    private Duration drainInterval = Duration.ofSeconds(1);
    private CallGuardMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    public Builder drainInterval(Duration interval) {
      this.drainInterval = interval;
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

    public RateLimiterConfig build() {
      return new RateLimiterConfig(drainInterval, metricsRegistry);
    }
  }
}
