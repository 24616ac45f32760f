/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.resilience;

import com.quoterouter.config.AppProperties;
import com.quoterouter.domain.model.CircuitState;
import com.quoterouter.domain.model.Quote;
import com.quoterouter.domain.model.VenueDescriptor;
import com.quoterouter.infrastructure.venue.VenueErrorType;
import com.quoterouter.infrastructure.venue.VenueException;
import com.quoterouter.support.MutableClock;
import com.quoterouter.support.TestFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VenueResilienceServiceTest {
    private final VenueDescriptor venue = TestFixtures.descriptor("paraswap");

    private MutableClock clock;
    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        executor = TestFixtures.executor("venue-call-test-");
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void slowVenueIsCutAtCallTimeoutAndCountedAsFailure() {
        VenueResilienceService service = service(TestFixtures.resilience(Duration.ofMillis(200), 1));

        long start = System.nanoTime();
        VenueException ex = assertThrows(VenueException.class, () -> service.call(venue, deadline(), budget -> {
            sleep(2_000);
            return quote();
        }));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(VenueErrorType.TIMEOUT, ex.getType());
        assertTrue(elapsedMs < 1_000, "call should be cut near 200ms but took " + elapsedMs);
        assertEquals(1, service.snapshot("paraswap").failureCount());
    }

    @Test
    void budgetIsBoundedByDeadline() {
        VenueResilienceService service = service(TestFixtures.resilience(Duration.ofSeconds(5), 1));
        AtomicInteger seenBudgetMs = new AtomicInteger();

        service.call(venue, clock.instant().plusMillis(300), budget -> {
            seenBudgetMs.set((int) budget.toMillis());
            return quote();
        });

        assertEquals(300, seenBudgetMs.get());
    }

    @Test
    void pastDeadlineIsRejectedWithoutCallingVenue() {
        VenueResilienceService service = service(TestFixtures.resilience(Duration.ofSeconds(1), 1));
        AtomicInteger calls = new AtomicInteger();

        VenueException ex = assertThrows(VenueException.class, () -> service.call(venue, clock.instant(), budget -> {
            calls.incrementAndGet();
            return quote();
        }));

        assertEquals(VenueErrorType.TIMEOUT, ex.getType());
        assertTrue(ex.isLocalRejection());
        assertEquals(0, calls.get());
    }

    @Test
    void localRateLimitRejectsWithoutCountingFailure() {
        AppProperties.Resilience settings = new AppProperties.Resilience(5, Duration.ofSeconds(30), Duration.ofMinutes(5),
                2.0, Duration.ofSeconds(60), Duration.ofSeconds(1), 2, 1, Duration.ofMillis(10));
        VenueResilienceService service = service(settings);

        service.call(venue, deadline(), budget -> quote());
        service.call(venue, deadline(), budget -> quote());
        VenueException ex = assertThrows(VenueException.class, () -> service.call(venue, deadline(), budget -> quote()));

        assertEquals(VenueErrorType.RATE_LIMITED, ex.getType());
        assertTrue(ex.isLocalRejection());
        assertEquals(0, service.snapshot("paraswap").failureCount());
        assertEquals(CircuitState.CLOSED, service.snapshot("paraswap").state());
    }

    @Test
    void saturatedCallPoolIsLocalCapacityNotVenueFailure() throws Exception {
        executor.shutdown();
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(0);
        executor.initialize();
        CountDownLatch release = new CountDownLatch(1);
        executor.execute(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        VenueResilienceService service = service(TestFixtures.resilience(Duration.ofSeconds(1), 3));
        AtomicInteger calls = new AtomicInteger();

        try {
            VenueException ex = assertThrows(VenueException.class, () -> service.call(venue, deadline(), budget -> {
                calls.incrementAndGet();
                return quote();
            }));

            assertEquals(VenueErrorType.CAPACITY_EXHAUSTED, ex.getType());
            assertTrue(ex.isLocalRejection());
            assertEquals(0, calls.get());
            assertEquals(0, service.snapshot("paraswap").failureCount());
        } finally {
            release.countDown();
        }
    }

    @Test
    void unsupportedAnswersNeverOpenCircuit() {
        VenueResilienceService service = service(TestFixtures.resilience(Duration.ofSeconds(1), 1));

        for (int i = 0; i < 8; i++) {
            VenueException ex = assertThrows(VenueException.class, () -> service.call(venue, deadline(), budget -> {
                throw new VenueException("paraswap", VenueErrorType.UNSUPPORTED, "no route");
            }));
            assertEquals(VenueErrorType.UNSUPPORTED, ex.getType());
        }

        CircuitSnapshot snapshot = service.snapshot("paraswap");
        assertEquals(CircuitState.CLOSED, snapshot.state());
        assertEquals(0, snapshot.failureCount());
    }

    @Test
    void openCircuitShortCircuitsVenueCalls() {
        VenueResilienceService service = service(TestFixtures.resilience(Duration.ofSeconds(1), 1));
        AtomicInteger calls = new AtomicInteger();

        for (int i = 0; i < 5; i++) {
            assertThrows(VenueException.class, () -> service.call(venue, deadline(), budget -> {
                calls.incrementAndGet();
                throw new VenueException("paraswap", VenueErrorType.UPSTREAM_ERROR, "HTTP 502");
            }));
        }
        VenueException ex = assertThrows(VenueException.class, () -> service.call(venue, deadline(), budget -> {
            calls.incrementAndGet();
            return quote();
        }));

        assertEquals(VenueErrorType.CIRCUIT_OPEN, ex.getType());
        assertEquals(5, calls.get());
        assertEquals(CircuitState.OPEN, service.snapshot("paraswap").state());
    }

    @Test
    void unexpectedAdapterFailureBecomesUpstreamError() {
        VenueResilienceService service = service(TestFixtures.resilience(Duration.ofSeconds(1), 1));

        VenueException ex = assertThrows(VenueException.class, () -> service.call(venue, deadline(), budget -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(VenueErrorType.UPSTREAM_ERROR, ex.getType());
        assertEquals(1, service.snapshot("paraswap").failureCount());
    }

    @Test
    void halfOpenLetsOnlyOneConcurrentTrialThrough() throws Exception {
        VenueResilienceService service = service(TestFixtures.resilience(Duration.ofSeconds(2), 1));
        for (int i = 0; i < 5; i++) {
            assertThrows(VenueException.class, () -> service.call(venue, deadline(), budget -> {
                throw new VenueException("paraswap", VenueErrorType.UPSTREAM_ERROR, "HTTP 500");
            }));
        }
        clock.advance(Duration.ofSeconds(30));

        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Quote> trial = CompletableFuture.supplyAsync(() -> service.call(venue, deadline(), budget -> {
            entered.countDown();
            await(release);
            return quote();
        }));
        assertTrue(entered.await(2, TimeUnit.SECONDS));

        VenueException ex = assertThrows(VenueException.class, () -> service.call(venue, deadline(), budget -> quote()));
        assertEquals(VenueErrorType.CIRCUIT_OPEN, ex.getType());

        release.countDown();
        trial.get(2, TimeUnit.SECONDS);
        assertEquals(CircuitState.CLOSED, service.snapshot("paraswap").state());
    }

    @Test
    void transientErrorsAreRetried() {
        VenueResilienceService service = service(TestFixtures.resilience(Duration.ofSeconds(1), 3));
        AtomicInteger calls = new AtomicInteger();

        Quote quote = service.call(venue, deadline(), budget -> {
            if (calls.incrementAndGet() < 3) {
                throw new VenueException("paraswap", VenueErrorType.UPSTREAM_ERROR, "HTTP 503");
            }
            return quote();
        });

        assertEquals("paraswap", quote.venueId());
        assertEquals(3, calls.get());
    }

    @Test
    void unsupportedIsNotRetried() {
        VenueResilienceService service = service(TestFixtures.resilience(Duration.ofSeconds(1), 3));
        AtomicInteger calls = new AtomicInteger();

        assertThrows(VenueException.class, () -> service.call(venue, deadline(), budget -> {
            calls.incrementAndGet();
            throw new VenueException("paraswap", VenueErrorType.UNSUPPORTED, "no route");
        }));

        assertEquals(1, calls.get());
    }

    @Test
    void reconfigureKeepsBreakerState() {
        VenueResilienceService service = service(TestFixtures.resilience(Duration.ofSeconds(1), 1));
        assertThrows(VenueException.class, () -> service.call(venue, deadline(), budget -> {
            throw new VenueException("paraswap", VenueErrorType.TIMEOUT, "slow");
        }));

        service.reconfigure(List.of(venue));

        assertEquals(1, service.snapshot("paraswap").failureCount());
        assertEquals(1, service.snapshots().size());
    }

    private VenueResilienceService service(AppProperties.Resilience resilience) {
        AppProperties properties = TestFixtures.properties(AppProperties.Quoting.defaults(), resilience, List.of(), List.of());
        return new VenueResilienceService(properties, executor, clock);
    }

    private Instant deadline() {
        return clock.instant().plusSeconds(10);
    }

    private Quote quote() {
        return TestFixtures.quote("paraswap", 3_000_000_000L, clock.instant());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
