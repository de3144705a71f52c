package com.axonops.callguard;

import com.axonops.callguard.api.EndpointNotConfiguredException;
import com.axonops.callguard.api.QueueFullException;
import com.axonops.callguard.cache.ResponseCache;
import com.axonops.callguard.ratelimit.EndpointConfig;
import com.axonops.callguard.ratelimit.EndpointMetrics;
import com.axonops.callguard.ratelimit.Priority;
import com.axonops.callguard.ratelimit.RateLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end flow: cache lookup, admission, external call, cache fill.
 */
class GovernedCallTest {

    private RateLimiter limiter;
    private ResponseCache<String> cache;
    private final AtomicInteger upstreamCalls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        limiter = new RateLimiter();
        limiter.configure("chat", EndpointConfig.of(60, 2, 0));
        cache = ResponseCache.create(String.class);
    }

    @AfterEach
    void tearDown() {
        limiter.destroy();
        cache.shutdown();
    }

    private CompletableFuture<String> upstream(String reply) {
        upstreamCalls.incrementAndGet();
        return CompletableFuture.supplyAsync(() -> reply);
    }

    @Test
    void testHitSkipsAdmissionAndCall() throws Exception {
        GovernedCall<String> call = new GovernedCall<>(limiter, cache, "chat");
        Map<String, String> request = Map.of("prompt", "hello");

        String first = call.execute(request, () -> upstream("hi there")).get(5, TimeUnit.SECONDS);
        String second = call.execute(request, Priority.HIGH, () -> upstream("other")).get(5, TimeUnit.SECONDS);

        assertThat(first).isEqualTo("hi there");
        assertThat(second).isEqualTo("hi there");
        assertThat(upstreamCalls).hasValue(1);

        EndpointMetrics metrics = limiter.getMetrics("chat").orElseThrow();
        assertThat(metrics.totalRequests()).isEqualTo(1);
    }

    @Test
    void testAdmissionFailurePropagatesWithoutCalling() throws Exception {
        GovernedCall<String> call = new GovernedCall<>(limiter, cache, "chat");
        call.execute(Map.of("n", 1), () -> upstream("1")).get(5, TimeUnit.SECONDS);
        call.execute(Map.of("n", 2), () -> upstream("2")).get(5, TimeUnit.SECONDS);

        CompletableFuture<String> rejected = call.execute(Map.of("n", 3), () -> upstream("3"));

        assertThatThrownBy(rejected::join).hasCauseInstanceOf(QueueFullException.class);
        assertThat(upstreamCalls).hasValue(2);
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void testUnknownEndpoint() {
        GovernedCall<String> call = new GovernedCall<>(limiter, cache, "unknown");

        assertThatThrownBy(() -> call.execute("input", () -> upstream("x")).join())
            .hasCauseInstanceOf(EndpointNotConfiguredException.class);
        assertThat(upstreamCalls).hasValue(0);
    }

    @Test
    void testCallFailureNotCached() throws Exception {
        GovernedCall<String> call = new GovernedCall<>(limiter, cache, "chat", Duration.ofMinutes(1));

        CompletableFuture<String> failed = call.execute("input",
            () -> CompletableFuture.failedFuture(new IllegalStateException("503")));

        assertThatThrownBy(failed::join).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(cache.getCached("input")).isEmpty();

        assertThat(call.execute("input", () -> upstream("ok")).get(5, TimeUnit.SECONDS)).isEqualTo("ok");
        assertThat(cache.getCached("input")).contains("ok");
    }
}
