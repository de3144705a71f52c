package com.axonops.callguard.metrics;

import com.axonops.callguard.api.AdmissionTimeoutException;
import com.axonops.callguard.cache.CacheConfig;
import com.axonops.callguard.cache.ResponseCache;
import com.axonops.callguard.ratelimit.EndpointConfig;
import com.axonops.callguard.ratelimit.RateLimiter;
import com.axonops.callguard.ratelimit.RateLimiterConfig;
import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests verifying metrics are actually collected during operations.
 *
 * Wires a DropwizardMetricsAdapter into a rate limiter and a cache, performs real
 * operations and checks the registry.
 */
class MetricsIntegrationTest {

    private MetricRegistry registry;
    private RateLimiter limiter;
    private ResponseCache<String> cache;

    @BeforeEach
    void setup() {
        registry = new MetricRegistry();
        DropwizardMetricsAdapter adapter = new DropwizardMetricsAdapter(registry, "test.callguard");

        limiter = new RateLimiter(RateLimiterConfig.builder().metricsRegistry(adapter).build());
        cache = ResponseCache.create(String.class, CacheConfig.builder()
            .name("llm")
            .maxEntries(2)
            .compressionThreshold(16)
            .metricsRegistry(adapter)
            .build());
    }

    @AfterEach
    void cleanup() {
        limiter.destroy();
        cache.shutdown();
    }

    @Test
    void testRateLimiterCounters() {
        limiter.configure("chat", EndpointConfig.of(1, 2, 0));

        limiter.acquire("chat");
        limiter.acquire("chat");
        limiter.acquire("chat");

        assertThat(registry.counter("test.callguard.ratelimit.chat.requests.total.count").getCount()).isEqualTo(3);
        assertThat(registry.counter("test.callguard.ratelimit.chat.admitted.total.count").getCount()).isEqualTo(2);
        assertThat(registry.counter("test.callguard.ratelimit.chat.rejected.queue_full.total.count").getCount())
            .isEqualTo(1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testRateLimiterGauges() {
        limiter.configure("chat", EndpointConfig.of(1, 3, 5));
        limiter.acquire("chat");

        Gauge<Number> tokens = registry.getGauges().get("test.callguard.ratelimit.chat.tokens.current.count");
        Gauge<Number> depth = registry.getGauges().get("test.callguard.ratelimit.chat.queue.current.count");

        assertThat(tokens).isNotNull();
        assertThat(tokens.getValue().doubleValue()).isBetween(2.0, 2.1);
        assertThat(depth.getValue().intValue()).isZero();

        limiter.destroy();

        assertThat(registry.getGauges()).doesNotContainKey("test.callguard.ratelimit.chat.tokens.current.count");
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testQueueWaitTimerRecorded() throws Exception {
        limiter.configure("chat", EndpointConfig.of(600, 1, 5));
        limiter.acquire("chat").join();

        limiter.acquire("chat").get(3, TimeUnit.SECONDS);

        Timer wait = registry.timer("test.callguard.ratelimit.chat.queue_wait.latency");
        assertThat(wait.getCount()).isEqualTo(1);
        assertThat(wait.getSnapshot().getMax()).isGreaterThan(0);
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testTimeoutCounter() {
        limiter.configure("chat", EndpointConfig.of(1, 1, 5).withQueueTimeout(Duration.ofMillis(100)));
        limiter.acquire("chat").join();

        assertThatThrownBy(() -> limiter.acquire("chat").join())
            .hasCauseInstanceOf(AdmissionTimeoutException.class);

        assertThat(registry.counter("test.callguard.ratelimit.chat.rejected.timeout.total.count").getCount())
            .isEqualTo(1);
    }

    @Test
    void testCacheCounters() {
        cache.set("a", "short");
        cache.set("b", "a value long enough to be compressed");
        cache.get("a");
        cache.get("missing");
        cache.set("c", "third");

        assertThat(registry.counter("test.callguard.cache.llm.hits.total.count").getCount()).isEqualTo(1);
        assertThat(registry.counter("test.callguard.cache.llm.misses.total.count").getCount()).isEqualTo(1);
        assertThat(registry.counter("test.callguard.cache.llm.entries.compressed.total.count").getCount())
            .isEqualTo(1);
        assertThat(registry.counter("test.callguard.cache.llm.evictions.lru.total.count").getCount()).isEqualTo(1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCacheGauges() {
        cache.set("a", "1");
        cache.set("b", "2");

        Gauge<Number> entries = registry.getGauges().get("test.callguard.cache.llm.entries.current.count");
        Gauge<Number> size = registry.getGauges().get("test.callguard.cache.llm.size.current.bytes");

        assertThat(entries.getValue().intValue()).isEqualTo(2);
        assertThat(size.getValue().longValue()).isEqualTo(6);

        cache.shutdown();

        assertThat(registry.getGauges()).doesNotContainKey("test.callguard.cache.llm.entries.current.count");
    }

    @Test
    void testNoOpRegistryIsDefault() {
        assertThat(RateLimiterConfig.DEFAULT.metricsRegistry()).isSameAs(NoOpMetricsRegistry.INSTANCE);
        assertThatCode(() -> {
            NoOpMetricsRegistry.INSTANCE.incrementCounter("x");
            NoOpMetricsRegistry.INSTANCE.recordTimer("x", 1);
            NoOpMetricsRegistry.INSTANCE.registerGauge("x", () -> 1);
            NoOpMetricsRegistry.INSTANCE.removeGauge("x");
        }).doesNotThrowAnyException();
    }

    @Test
    void testDefaultPrefix() {
        DropwizardMetricsAdapter adapter = new DropwizardMetricsAdapter(registry);
        adapter.incrementCounter("sample", 5);

        Counter counter = registry.counter("com.axonops.callguard.sample");
        assertThat(counter.getCount()).isEqualTo(5);
    }
}
