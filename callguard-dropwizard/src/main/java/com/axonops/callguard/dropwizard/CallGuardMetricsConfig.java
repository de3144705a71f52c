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

package com.axonops.callguard.dropwizard;

import com.axonops.callguard.cache.CacheConfig;
import com.axonops.callguard.metrics.CallGuardMetricsRegistry;
import com.axonops.callguard.metrics.DropwizardMetricsAdapter;
import com.axonops.callguard.ratelimit.RateLimiterConfig;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for CallGuard configs with Dropwizard Metrics integration.
 *
 * <p>This class provides easy setup for applications using Dropwizard Metrics,
 * including automatic JMX exposure. Works with any framework that uses Dropwizard
 * (Dropwizard apps, Spring Boot with the metrics bridge, plain services, etc.).
 *
 * <p><strong>Usage Examples:</strong>
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 *
 * RateLimiter limiter = new RateLimiter(
 *     CallGuardMetricsConfig.rateLimiterConfig(registry, "com.mycompany.gateway"));
 *
 * ResponseCache<String> cache = ResponseCache.create(String.class,
 *     CallGuardMetricsConfig.cacheConfigBuilder(registry, "com.mycompany.gateway")
 *         .name("chat-completion")
 *         .persistPath(Path.of("cache/chat.json"))
 *         .build());
 * }</pre>
 *
 * <p><strong>JMX Exposure:</strong> This class automatically sets up a JmxReporter
 * for the provided registry (if not already configured), so rate limiter and cache
 * metrics are visible via JMX.
 *
 * @since 1.0.0
 */
public final class CallGuardMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(CallGuardMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private CallGuardMetricsConfig() {
        // Utility class
    }

    /**
     * Creates a metrics registry backed by Dropwizard with automatic JMX.
     *
     * <p><strong>Metric Prefix Examples:</strong>
     * <ul>
     *   <li>Spring Boot: {@code "com.myapp.callguard"}</li>
     *   <li>Generic: {@code "com.axonops.callguard"}</li>
     * </ul>
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return registry to pass to {@link RateLimiterConfig} and {@link CacheConfig}
     */
    public static CallGuardMetricsRegistry withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates a metrics registry backed by Dropwizard.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return registry to pass to {@link RateLimiterConfig} and {@link CacheConfig}
     */
    public static CallGuardMetricsRegistry withMetrics(
            MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return new DropwizardMetricsAdapter(registry, metricPrefix);
    }

    /**
     * Creates a metrics registry with the default prefix {@code "com.axonops.callguard"}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return registry with JMX enabled
     */
    public static CallGuardMetricsRegistry withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Rate limiter config publishing to the given registry with JMX enabled.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return rate limiter config with default drain interval
     */
    public static RateLimiterConfig rateLimiterConfig(MetricRegistry registry, String metricPrefix) {
        return RateLimiterConfig.builder()
            .metricsRegistry(withMetrics(registry, metricPrefix, true))
            .build();
    }

    /**
     * Cache config builder pre-wired to the given registry with JMX enabled.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return builder; other settings keep their defaults
     */
    public static CacheConfig.Builder cacheConfigBuilder(MetricRegistry registry, String metricPrefix) {
        return CacheConfig.builder().metricsRegistry(withMetrics(registry, metricPrefix, true));
    }

    /**
     * Ensures JmxReporter is registered for the given MetricRegistry.
     *
     * <p>Idempotent: only the first registry gets a reporter.
     *
     * @param registry the MetricRegistry to expose via JMX
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("CallGuard: Registering JmxReporter for metrics");
                jmxReporter = JmxReporter.forRegistry(registry).build();
                jmxReporter.start();
                logger.info("CallGuard: JmxReporter started - metrics available via JMX");
            } catch (Exception e) {
                logger.warn("CallGuard: Failed to start JmxReporter (may already be configured)", e);
                // Not fatal - registry may already have JMX exposure
            }
        }
    }

    /** Stops the JMX reporter started by this class, if any. */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("CallGuard: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
