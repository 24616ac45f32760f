/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.resilience;

import com.quoterouter.config.AppProperties;
import com.quoterouter.domain.model.Quote;
import com.quoterouter.domain.model.VenueDescriptor;
import com.quoterouter.infrastructure.venue.VenueErrorType;
import com.quoterouter.infrastructure.venue.VenueException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Wraps every venue call with, in order: retry, circuit breaker, local rate limiter and a hard
 * timeout. Each venue owns its guard; nothing is shared across venues.
 */
@Service
public class VenueResilienceService {
    private static final Logger log = LoggerFactory.getLogger(VenueResilienceService.class);

    private final AppProperties.Resilience settings;
    private final AsyncTaskExecutor venueCallExecutor;
    private final Clock clock;
    private final Map<String, VenueGuard> guards = new ConcurrentHashMap<>();

    public VenueResilienceService(
            AppProperties properties,
            @Qualifier("venueCallExecutor") AsyncTaskExecutor venueCallExecutor,
            Clock clock
    ) {
        this.settings = properties.resilience();
        this.venueCallExecutor = venueCallExecutor;
        this.clock = clock;
    }

    private record VenueGuard(VenueCircuitBreaker breaker, RateLimiter rateLimiter, RetryConfig retryConfig) {}

    /**
     * Runs {@code venueCall} for {@code venue}. The function receives the time budget of the
     * attempt. Never blocks past {@code deadline}.
     *
     * @throws VenueException with the classified failure; rejections raised before contacting the
     *                        venue are flagged {@link VenueException#isLocalRejection()}
     */
    public Quote call(VenueDescriptor venue, Instant deadline, Function<Duration, Quote> venueCall) {
        VenueGuard guard = guardFor(venue);
        if (settings.retryMaxAttempts() <= 1) {
            return attempt(venue.id(), guard, deadline, venueCall);
        }

        Predicate<Throwable> retryable = e -> e instanceof VenueException ve
                && !ve.isLocalRejection()
                && ve.getType().isRetryable()
                && clock.instant().isBefore(deadline);
        Retry retry = Retry.of(venue.id(), RetryConfig.from(guard.retryConfig())
                .retryOnException(retryable)
                .build());
        retry.getEventPublisher().onRetry(event -> log.info("Retrying venue={} attempt={} cause={}",
                venue.id(), event.getNumberOfRetryAttempts(), String.valueOf(event.getLastThrowable())));

        return Retry.decorateSupplier(retry, () -> attempt(venue.id(), guard, deadline, venueCall)).get();
    }

    private Quote attempt(String venueId, VenueGuard guard, Instant deadline, Function<Duration, Quote> venueCall) {
        VenueCircuitBreaker.Permit permit = guard.breaker().tryAcquire();
        if (permit == null) {
            throw VenueException.rejected(venueId, VenueErrorType.CIRCUIT_OPEN, "Circuit open");
        }
        if (!guard.rateLimiter().acquirePermission()) {
            guard.breaker().onAbandoned(permit);
            throw VenueException.rejected(venueId, VenueErrorType.RATE_LIMITED, "Local rate limit reached");
        }

        Duration remaining = Duration.between(clock.instant(), deadline);
        Duration budget = remaining.compareTo(settings.callTimeout()) < 0 ? remaining : settings.callTimeout();
        if (budget.isNegative() || budget.isZero()) {
            guard.breaker().onAbandoned(permit);
            throw VenueException.rejected(venueId, VenueErrorType.TIMEOUT, "Deadline already passed");
        }

        Future<Quote> future;
        try {
            future = venueCallExecutor.submit(() -> venueCall.apply(budget));
        } catch (TaskRejectedException e) {
            guard.breaker().onAbandoned(permit);
            log.warn("Venue call executor saturated venue={}", venueId);
            throw VenueException.rejected(venueId, VenueErrorType.CAPACITY_EXHAUSTED, "Too many concurrent venue calls");
        }

        try {
            Quote quote = future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
            guard.breaker().onSuccess(permit);
            return quote;
        } catch (TimeoutException e) {
            future.cancel(true);
            guard.breaker().onFailure(permit);
            log.warn("Venue call timed out venue={} budgetMs={}", venueId, budget.toMillis());
            throw new VenueException(venueId, VenueErrorType.TIMEOUT, "No answer within " + budget.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            guard.breaker().onAbandoned(permit);
            Thread.currentThread().interrupt();
            throw VenueException.rejected(venueId, VenueErrorType.TIMEOUT, "Call abandoned");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof VenueException ve) {
                if (ve.getType().countsAsFailure()) {
                    guard.breaker().onFailure(permit);
                } else {
                    guard.breaker().onSuccess(permit);
                }
                throw ve;
            }
            guard.breaker().onFailure(permit);
            log.warn("Venue adapter failed venue={} error={}", venueId, String.valueOf(cause));
            throw new VenueException(venueId, VenueErrorType.UPSTREAM_ERROR, "Unexpected adapter failure", cause);
        }
    }

    public void reconfigure(List<VenueDescriptor> venues) {
        for (VenueDescriptor venue : venues) {
            VenueGuard guard = guards.get(venue.id());
            if (guard == null) continue;
            guard.breaker().updateRecoveryTimeout(recoveryTimeout(venue));
            guard.rateLimiter().changeLimitForPeriod(rateLimit(venue));
        }
    }

    public CircuitSnapshot snapshot(String venueId) {
        VenueGuard guard = guards.get(venueId);
        return guard == null ? CircuitSnapshot.initial(venueId) : guard.breaker().snapshot();
    }

    public List<CircuitSnapshot> snapshots() {
        return guards.values().stream()
                .map(g -> g.breaker().snapshot())
                .sorted(Comparator.comparing(CircuitSnapshot::venueId))
                .toList();
    }

    private VenueGuard guardFor(VenueDescriptor venue) {
        return guards.computeIfAbsent(venue.id(), id -> {
            VenueCircuitBreaker breaker = new VenueCircuitBreaker(
                    id,
                    settings.failureThreshold(),
                    recoveryTimeout(venue),
                    settings.maxRecoveryTimeout(),
                    settings.backoffMultiplier(),
                    settings.failureDecay(),
                    clock
            );
            RateLimiterConfig limiterConfig = RateLimiterConfig.custom()
                    .limitRefreshPeriod(Duration.ofSeconds(1))
                    .limitForPeriod(rateLimit(venue))
                    .timeoutDuration(Duration.ZERO)
                    .build();
            RetryConfig retryConfig = RetryConfig.custom()
                    .maxAttempts(settings.retryMaxAttempts())
                    .intervalFunction(IntervalFunction.ofExponentialBackoff(settings.retryBaseDelay(), 2.0))
                    .build();
            return new VenueGuard(breaker, RateLimiter.of("venue-" + id, limiterConfig), retryConfig);
        });
    }

    private Duration recoveryTimeout(VenueDescriptor venue) {
        Duration override = venue.recoveryTimeout();
        return override != null && !override.isZero() && !override.isNegative() ? override : settings.recoveryTimeout();
    }

    private int rateLimit(VenueDescriptor venue) {
        Integer override = venue.rateLimitPerSecond();
        return override != null && override > 0 ? override : settings.rateLimitPerSecond();
    }
}
