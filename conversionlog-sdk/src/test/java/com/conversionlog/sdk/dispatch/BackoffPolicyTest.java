package com.conversionlog.sdk.dispatch;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    @Test
    void defaultsDoubleUpToTenSeconds() {
        BackoffPolicy policy = BackoffPolicy.defaults();
        assertEquals(Duration.ofSeconds(1), policy.delayFor(1));
        assertEquals(Duration.ofSeconds(2), policy.delayFor(2));
        assertEquals(Duration.ofSeconds(4), policy.delayFor(3));
        assertEquals(Duration.ofSeconds(8), policy.delayFor(4));
        assertEquals(Duration.ofSeconds(10), policy.delayFor(5));
        assertEquals(Duration.ofSeconds(10), policy.delayFor(500));
    }

    @Test
    void delaysNeverDecrease() {
        BackoffPolicy policy = BackoffPolicy.exponential(Duration.ofMillis(150), Duration.ofSeconds(30));
        Duration previous = Duration.ZERO;
        for (int attempt = 1; attempt <= 80; attempt++) {
            Duration delay = policy.delayFor(attempt);
            assertTrue(delay.compareTo(previous) >= 0, "attempt " + attempt);
            assertTrue(delay.compareTo(Duration.ofSeconds(30)) <= 0, "attempt " + attempt);
            previous = delay;
        }
    }

    @Test
    void zeroBaseDelayIsAllowed() {
        assertEquals(Duration.ZERO, BackoffPolicy.exponential(Duration.ZERO, Duration.ZERO).delayFor(3));
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> BackoffPolicy.exponential(Duration.ofSeconds(5), Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> BackoffPolicy.exponential(Duration.ofSeconds(-1), Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.defaults().delayFor(0));
    }
}
