/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.resilience;

import com.quoterouter.domain.model.CircuitState;
import com.quoterouter.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VenueCircuitBreakerTest {
    private MutableClock clock;
    private VenueCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        breaker = new VenueCircuitBreaker("oneinch", 5, Duration.ofSeconds(30), Duration.ofMinutes(5), 2.0,
                Duration.ofSeconds(60), clock);
    }

    @Test
    void opensAfterThresholdConsecutiveFailures() {
        failTimes(4);
        assertEquals(CircuitState.CLOSED, breaker.state());

        failTimes(1);

        assertEquals(CircuitState.OPEN, breaker.state());
        assertNull(breaker.tryAcquire());
        CircuitSnapshot snapshot = breaker.snapshot();
        assertEquals(5, snapshot.failureCount());
        assertEquals(1, snapshot.consecutiveOpens());
        assertEquals(clock.instant().plusSeconds(30), snapshot.nextRetryAt());
        assertEquals(1, snapshot.rejections());
    }

    @Test
    void halfOpenAdmitsSingleTrial() {
        failTimes(5);
        clock.advance(Duration.ofSeconds(30));

        assertEquals(CircuitState.HALF_OPEN, breaker.state());
        VenueCircuitBreaker.Permit trial = breaker.tryAcquire();
        assertNotNull(trial);
        assertTrue(trial.trial());
        assertNull(breaker.tryAcquire());
    }

    @Test
    void successfulTrialClosesAndResetsCounters() {
        failTimes(5);
        clock.advance(Duration.ofSeconds(31));

        breaker.onSuccess(breaker.tryAcquire());

        assertEquals(CircuitState.CLOSED, breaker.state());
        CircuitSnapshot snapshot = breaker.snapshot();
        assertEquals(0, snapshot.failureCount());
        assertEquals(0, snapshot.consecutiveOpens());
        assertNull(snapshot.nextRetryAt());
        assertFalse(breaker.tryAcquire().trial());
    }

    @Test
    void failedTrialReopensWithLongerTimeout() {
        failTimes(5);
        clock.advance(Duration.ofSeconds(30));

        breaker.onFailure(breaker.tryAcquire());

        assertEquals(CircuitState.OPEN, breaker.state());
        assertEquals(2, breaker.snapshot().consecutiveOpens());
        clock.advance(Duration.ofSeconds(59));
        assertEquals(CircuitState.OPEN, breaker.state());
        clock.advance(Duration.ofSeconds(1));
        assertEquals(CircuitState.HALF_OPEN, breaker.state());
    }

    @Test
    void backoffIsCappedAtMaximum() {
        assertEquals(Duration.ofSeconds(30), breaker.backoff(0));
        assertEquals(Duration.ofSeconds(120), breaker.backoff(2));
        assertEquals(Duration.ofMinutes(5), breaker.backoff(4));
        assertEquals(Duration.ofMinutes(5), breaker.backoff(200));
    }

    @Test
    void successDecaysRecentFailureCount() {
        failTimes(4);

        breaker.onSuccess(breaker.tryAcquire());

        assertEquals(3, breaker.snapshot().failureCount());
        failTimes(1);
        assertEquals(CircuitState.CLOSED, breaker.state());
    }

    @Test
    void successAfterDecayWindowResetsFailureCount() {
        failTimes(4);
        clock.advance(Duration.ofSeconds(61));

        breaker.onSuccess(breaker.tryAcquire());

        assertEquals(0, breaker.snapshot().failureCount());
    }

    @Test
    void abandonedTrialReleasesSlotWithoutChangingState() {
        failTimes(5);
        clock.advance(Duration.ofSeconds(30));

        breaker.onAbandoned(breaker.tryAcquire());

        assertEquals(CircuitState.HALF_OPEN, breaker.state());
        VenueCircuitBreaker.Permit next = breaker.tryAcquire();
        assertNotNull(next);
        assertTrue(next.trial());
        assertEquals(1, breaker.snapshot().consecutiveOpens());
    }

    @Test
    void lateFailureWhileOpenDoesNotExtendOpenPeriod() {
        VenueCircuitBreaker.Permit slow = breaker.tryAcquire();
        failTimes(5);
        Instant retryAt = breaker.snapshot().nextRetryAt();

        clock.advance(Duration.ofSeconds(10));
        breaker.onFailure(slow);

        assertEquals(retryAt, breaker.snapshot().nextRetryAt());
        assertEquals(1, breaker.snapshot().consecutiveOpens());
    }

    private void failTimes(int count) {
        for (int i = 0; i < count; i++) {
            breaker.onFailure(breaker.tryAcquire());
        }
    }
}
