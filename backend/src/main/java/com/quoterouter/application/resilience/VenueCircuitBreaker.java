/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.resilience;

import com.quoterouter.domain.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-venue circuit breaker.
 * <p>
 * CLOSED counts failures (decayed by successes) until {@code failureThreshold}, then opens for the
 * recovery timeout. OPEN rejects until the retry time, then becomes HALF_OPEN, which admits a single
 * trial call. A failed trial re-opens with the timeout grown by {@code backoffMultiplier} per
 * consecutive open, capped at {@code maxRecoveryTimeout}.
 * <p>
 * Every caller that obtained a {@link Permit} must report exactly one of
 * {@link #onSuccess}, {@link #onFailure} or {@link #onAbandoned}.
 */
public class VenueCircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(VenueCircuitBreaker.class);

    private final String venueId;
    private final int failureThreshold;
    private final Duration maxRecoveryTimeout;
    private final double backoffMultiplier;
    private final Duration failureDecay;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private Duration recoveryTimeout;
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureAt;
    private Instant nextRetryAt;
    private int consecutiveOpens;
    private boolean trialInFlight;

    private long totalCalls;
    private long successes;
    private long failures;
    private long rejections;

    public VenueCircuitBreaker(
            String venueId,
            int failureThreshold,
            Duration recoveryTimeout,
            Duration maxRecoveryTimeout,
            double backoffMultiplier,
            Duration failureDecay,
            Clock clock
    ) {
        if (failureThreshold <= 0) throw new IllegalArgumentException("failureThreshold must be > 0");
        this.venueId = venueId;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.maxRecoveryTimeout = maxRecoveryTimeout.compareTo(recoveryTimeout) < 0 ? recoveryTimeout : maxRecoveryTimeout;
        this.backoffMultiplier = Math.max(1.0, backoffMultiplier);
        this.failureDecay = failureDecay;
        this.clock = clock;
    }

    public record Permit(boolean trial) {}

    /**
     * @return a permit to call the venue, or {@code null} when the circuit rejects the call
     */
    public Permit tryAcquire() {
        lock.lock();
        try {
            totalCalls++;
            Instant now = clock.instant();
            if (state == CircuitState.OPEN && !now.isBefore(nextRetryAt)) {
                transition(CircuitState.HALF_OPEN);
            }
            switch (state) {
                case CLOSED:
                    return new Permit(false);
                case HALF_OPEN:
                    if (!trialInFlight) {
                        trialInFlight = true;
                        return new Permit(true);
                    }
                    rejections++;
                    return null;
                default:
                    rejections++;
                    return null;
            }
        } finally {
            lock.unlock();
        }
    }

    public void onSuccess(Permit permit) {
        lock.lock();
        try {
            successes++;
            Instant now = clock.instant();
            if (permit.trial()) {
                trialInFlight = false;
                if (state == CircuitState.HALF_OPEN) {
                    failureCount = 0;
                    consecutiveOpens = 0;
                    lastFailureAt = null;
                    nextRetryAt = null;
                    transition(CircuitState.CLOSED);
                }
                return;
            }
            if (state == CircuitState.CLOSED && failureCount > 0) {
                if (lastFailureAt == null || Duration.between(lastFailureAt, now).compareTo(failureDecay) > 0) {
                    failureCount = 0;
                } else {
                    failureCount--;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public void onFailure(Permit permit) {
        lock.lock();
        try {
            failures++;
            Instant now = clock.instant();
            lastFailureAt = now;
            if (permit.trial()) {
                trialInFlight = false;
                if (state == CircuitState.HALF_OPEN) {
                    open(now);
                }
                return;
            }
            // a call admitted before the circuit opened must not extend the open period
            if (state != CircuitState.CLOSED) return;
            failureCount++;
            if (failureCount >= failureThreshold) {
                open(now);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * The call was given up by the caller (deadline, local rejection) before the venue answered.
     * Releases a half-open trial slot and leaves the failure accounting untouched.
     */
    public void onAbandoned(Permit permit) {
        if (!permit.trial()) return;
        lock.lock();
        try {
            trialInFlight = false;
        } finally {
            lock.unlock();
        }
    }

    public void updateRecoveryTimeout(Duration value) {
        if (value == null || value.isNegative() || value.isZero()) return;
        lock.lock();
        try {
            this.recoveryTimeout = value;
        } finally {
            lock.unlock();
        }
    }

    public CircuitSnapshot snapshot() {
        lock.lock();
        try {
            return new CircuitSnapshot(
                    venueId,
                    effectiveState(clock.instant()),
                    failureCount,
                    lastFailureAt,
                    nextRetryAt,
                    consecutiveOpens,
                    totalCalls,
                    successes,
                    failures,
                    rejections
            );
        } finally {
            lock.unlock();
        }
    }

    public CircuitState state() {
        lock.lock();
        try {
            return effectiveState(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public String venueId() {
        return venueId;
    }

    private CircuitState effectiveState(Instant now) {
        if (state != CircuitState.OPEN) return state;
        if (nextRetryAt != null && !now.isBefore(nextRetryAt)) return CircuitState.HALF_OPEN;
        return CircuitState.OPEN;
    }

    private void open(Instant now) {
        Duration timeout = backoff(consecutiveOpens);
        consecutiveOpens++;
        nextRetryAt = now.plus(timeout);
        transition(CircuitState.OPEN);
        log.warn("Circuit opened venue={} failures={} retryInMs={} consecutiveOpens={}",
                venueId, failureCount, timeout.toMillis(), consecutiveOpens);
    }

    Duration backoff(int previousOpens) {
        double factor = Math.pow(backoffMultiplier, previousOpens);
        double millis = recoveryTimeout.toMillis() * factor;
        if (Double.isInfinite(millis) || millis >= maxRecoveryTimeout.toMillis()) {
            return maxRecoveryTimeout;
        }
        return Duration.ofMillis((long) millis);
    }

    private void transition(CircuitState next) {
        if (state == next) return;
        log.info("Circuit transition venue={} from={} to={}", venueId, state, next);
        state = next;
    }
}
