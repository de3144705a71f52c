package com.axonops.callguard.ratelimit;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TokenBucketTest {

    private static final long SECOND = 1_000_000_000L;

    @Test
    void testStartsFull() {
        TokenBucket bucket = new TokenBucket(EndpointConfig.of(60, 5, 0), 0L);

        assertThat(bucket.tokens()).isEqualTo(5.0);
        assertThat(bucket.maxTokens()).isEqualTo(5);
        assertThat(bucket.nanosUntilNextToken()).isZero();
    }

    @Test
    void testConsumeUntilEmpty() {
        TokenBucket bucket = new TokenBucket(EndpointConfig.of(60, 5, 0), 0L);

        for (int i = 0; i < 5; i++) {
            assertThat(bucket.tryConsume()).isTrue();
        }
        assertThat(bucket.tryConsume()).isFalse();
        assertThat(bucket.tokens()).isZero();
    }

    @Test
    void testRefillIsProportionalToElapsedTime() {
        // 60 rpm = one token per second
        TokenBucket bucket = new TokenBucket(EndpointConfig.of(60, 5, 0), 0L);
        while (bucket.tryConsume()) {
            // drain
        }

        bucket.refill(SECOND / 2);
        assertThat(bucket.tokens()).isCloseTo(0.5, within(1e-9));
        assertThat(bucket.tryConsume()).isFalse();
        assertThat(bucket.nanosUntilNextToken()).isCloseTo(SECOND / 2, within(1_000L));

        bucket.refill(SECOND);
        assertThat(bucket.tryConsume()).isTrue();
    }

    @Test
    void testRefillClampedAtCapacity() {
        TokenBucket bucket = new TokenBucket(EndpointConfig.of(60, 3, 0), 0L);
        bucket.tryConsume();

        bucket.refill(3600 * SECOND);

        assertThat(bucket.tokens()).isEqualTo(3.0);
    }

    @Test
    void testAvailableTokensDoesNotMutate() {
        TokenBucket bucket = new TokenBucket(EndpointConfig.of(60, 2, 0), 0L);
        bucket.tryConsume();
        bucket.tryConsume();

        assertThat(bucket.availableTokens(SECOND)).isCloseTo(1.0, within(1e-9));
        assertThat(bucket.tokens()).isZero();
    }

    @Test
    void testClockGoingBackwardsIgnored() {
        TokenBucket bucket = new TokenBucket(EndpointConfig.of(60, 2, 0), 10 * SECOND);
        bucket.tryConsume();

        bucket.refill(5 * SECOND);

        assertThat(bucket.tokens()).isEqualTo(1.0);
    }
}
