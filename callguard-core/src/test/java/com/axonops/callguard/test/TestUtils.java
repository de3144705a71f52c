package com.axonops.callguard.test;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Test utilities shared across test classes.
 */
public final class TestUtils {

    private TestUtils() {
    }

    /**
     * Polls until the condition holds or the timeout passes.
     *
     * @return whether the condition held before the timeout
     */
    public static boolean waitFor(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }
}
