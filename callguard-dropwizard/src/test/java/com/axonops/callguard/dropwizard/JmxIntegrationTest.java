package com.axonops.callguard.dropwizard;

import com.axonops.callguard.cache.ResponseCache;
import com.axonops.callguard.metrics.CallGuardMetricsRegistry;
import com.axonops.callguard.metrics.DropwizardMetricsAdapter;
import com.axonops.callguard.ratelimit.EndpointConfig;
import com.axonops.callguard.ratelimit.RateLimiter;
import com.axonops.callguard.ratelimit.RateLimiterConfig;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.management.MBeanServer;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * JMX integration tests.
 *
 * Verifies that metrics are actually exposed via JMX and accessible
 * through the platform MBean server.
 */
class JmxIntegrationTest {

    private JmxReporter jmxReporter;
    private MetricRegistry registry;
    private RateLimiter limiter;
    private ResponseCache<String> cache;

    @BeforeEach
    void setup() {
        registry = new MetricRegistry();

        // Start JMX reporter
        jmxReporter = JmxReporter.forRegistry(registry).build();
        jmxReporter.start();
    }

    @AfterEach
    void cleanup() {
        if (limiter != null) {
            limiter.destroy();
        }
        if (cache != null) {
            cache.shutdown();
        }
        if (jmxReporter != null) {
            jmxReporter.stop();
        }
        CallGuardMetricsConfig.shutdown();
    }

    @Test
    void testMetricsExposedViaJmx() throws Exception {
        CallGuardMetricsRegistry metrics = CallGuardMetricsConfig.withMetrics(registry, "com.test.jmx", false);
        limiter = new RateLimiter(RateLimiterConfig.builder().metricsRegistry(metrics).build());
        limiter.configure("chat", EndpointConfig.of(60, 5, 5));
        limiter.acquire("chat").join();

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();

        // Dropwizard uses "metrics" domain with type classification
        Set<ObjectName> mbeans = mBeanServer.queryNames(
            new ObjectName("metrics:name=com.test.jmx.*,type=*"), null
        );

        assertThat(mbeans)
            .as("JMX MBeans should be registered for rate limiter metrics")
            .hasSizeGreaterThanOrEqualTo(4);

        boolean foundTokensGauge = mbeans.stream()
            .anyMatch(name -> name.toString().contains("ratelimit.chat.tokens.current.count") && name.toString().contains("type=gauges"));

        boolean foundAdmittedCounter = mbeans.stream()
            .anyMatch(name -> name.toString().contains("ratelimit.chat.admitted.total.count") && name.toString().contains("type=counters"));

        assertThat(foundTokensGauge)
            .as("ratelimit.chat.tokens.current.count gauge should be in JMX")
            .isTrue();

        assertThat(foundAdmittedCounter)
            .as("ratelimit.chat.admitted.total.count counter should be in JMX")
            .isTrue();
    }

    @Test
    void testJmxGaugeReadable() throws Exception {
        cache = ResponseCache.create(String.class,
            CallGuardMetricsConfig.cacheConfigBuilder(registry, "jmx.readable.test").name("llm").build());

        cache.set("p1", "a");
        cache.set("p2", "b");
        cache.set("p3", "c");

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        ObjectName entriesName = new ObjectName("metrics:name=jmx.readable.test.cache.llm.entries.current.count,type=gauges");

        assertThat(mBeanServer.isRegistered(entriesName))
            .as("cache.llm.entries.current.count gauge should be registered in JMX")
            .isTrue();

        Object value = mBeanServer.getAttribute(entriesName, "Value");

        assertThat(value)
            .as("Should be able to read gauge value via JMX")
            .isInstanceOf(Number.class);
        assertThat(((Number) value).intValue())
            .as("Entry count via JMX should reflect actual cache state")
            .isEqualTo(3);
    }

    @Test
    void testConvenienceFactories() {
        RateLimiterConfig limiterConfig = CallGuardMetricsConfig.rateLimiterConfig(registry, "conv.test");
        assertThat(limiterConfig.metricsRegistry()).isInstanceOf(DropwizardMetricsAdapter.class);

        limiter = new RateLimiter(limiterConfig);
        limiter.configure("tts", EndpointConfig.of(60, 1, 0));
        limiter.acquire("tts");
        limiter.acquire("tts");

        assertThat(registry.counter("conv.test.ratelimit.tts.rejected.queue_full.total.count").getCount())
            .isEqualTo(1);
    }

    @Test
    void testDefaultPrefix() {
        CallGuardMetricsRegistry metrics = CallGuardMetricsConfig.withMetrics(registry);
        metrics.incrementCounter("sample");

        assertThat(registry.getCounters()).containsKey("com.axonops.callguard.sample");
    }

    @Test
    void testNullArgumentsRejected() {
        assertThatThrownBy(() -> CallGuardMetricsConfig.withMetrics(null, "x", false))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> CallGuardMetricsConfig.withMetrics(registry, null, false))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void testShutdownIsIdempotent() {
        CallGuardMetricsConfig.withMetrics(registry, "idem", true);

        assertThatCode(() -> {
            CallGuardMetricsConfig.shutdown();
            CallGuardMetricsConfig.shutdown();
        }).doesNotThrowAnyException();
    }
}
