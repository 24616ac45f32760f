/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.quoting;

import com.quoterouter.application.VenueAdapterRegistry;
import com.quoterouter.application.VenueRegistry;
import com.quoterouter.application.resilience.VenueResilienceService;
import com.quoterouter.domain.model.Quote;
import com.quoterouter.domain.model.SwapRequest;
import com.quoterouter.domain.model.VenueDescriptor;
import com.quoterouter.infrastructure.venue.QuoteCommand;
import com.quoterouter.infrastructure.venue.VenueErrorType;
import com.quoterouter.infrastructure.venue.VenueException;
import com.quoterouter.infrastructure.venue.VenueQuoteAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Fans a swap request out to every eligible venue in parallel and ranks what comes back before the
 * deadline. Never throws for venue failures: they become {@link VenueOutcome}s.
 */
@Service
public class QuoteAggregator {
    private static final Logger log = LoggerFactory.getLogger(QuoteAggregator.class);

    private final VenueRegistry venueRegistry;
    private final VenueAdapterRegistry adapterRegistry;
    private final VenueResilienceService resilienceService;
    private final NetOutputCalculator calculator;
    private final PriceImpactEstimator impactEstimator;
    private final ThreadPoolTaskExecutor fanOutExecutor;
    private final Clock clock;

    public QuoteAggregator(
            VenueRegistry venueRegistry,
            VenueAdapterRegistry adapterRegistry,
            VenueResilienceService resilienceService,
            NetOutputCalculator calculator,
            PriceImpactEstimator impactEstimator,
            @Qualifier("quoteFanOutExecutor") ThreadPoolTaskExecutor fanOutExecutor,
            Clock clock
    ) {
        this.venueRegistry = venueRegistry;
        this.adapterRegistry = adapterRegistry;
        this.resilienceService = resilienceService;
        this.calculator = calculator;
        this.impactEstimator = impactEstimator;
        this.fanOutExecutor = fanOutExecutor;
        this.clock = clock;
    }

    private record Attempt(VenueDescriptor venue, Quote quote, VenueOutcome outcome) {}

    public AggregationResult aggregate(SwapRequest request, Instant deadline) {
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();

        List<VenueDescriptor> eligible = venueRegistry.eligibleFor(request.chainId()).stream()
                .filter(v -> adapterRegistry.find(v.id()).isPresent())
                .toList();
        if (eligible.isEmpty()) {
            log.info("No eligible venues chain={}", request.chainId());
            return AggregationResult.of(request, List.of(), List.of(), startedAt, elapsedMs(startNanos));
        }

        List<Callable<Attempt>> tasks = new ArrayList<>(eligible.size());
        for (VenueDescriptor venue : eligible) {
            tasks.add(() -> callVenue(venue, request, deadline));
        }

        List<Attempt> attempts = new ArrayList<>(eligible.size());
        long remainingMs = Duration.between(clock.instant(), deadline).toMillis();
        if (remainingMs <= 0) {
            for (VenueDescriptor venue : eligible) {
                attempts.add(deadlineExceeded(venue, 0));
            }
        } else {
            try {
                List<Future<Attempt>> futures = fanOutExecutor.getThreadPoolExecutor()
                        .invokeAll(tasks, remainingMs, TimeUnit.MILLISECONDS);
                for (int i = 0; i < futures.size(); i++) {
                    attempts.add(collect(futures.get(i), eligible.get(i), startNanos));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Aggregation interrupted chain={}", request.chainId());
                for (VenueDescriptor venue : eligible) {
                    attempts.add(deadlineExceeded(venue, elapsedMs(startNanos)));
                }
            } catch (RejectedExecutionException e) {
                // local saturation, not a venue fault
                log.error("Fan-out executor saturated venues={}", eligible.size());
                attempts.clear();
                for (VenueDescriptor venue : eligible) {
                    attempts.add(new Attempt(venue, null, new VenueOutcome(venue.id(), OutcomeKind.CAPACITY_EXHAUSTED, 0, "Local quote capacity exhausted")));
                }
            }
        }

        List<RankedQuote> ranked = new ArrayList<>();
        List<VenueOutcome> outcomes = new ArrayList<>(attempts.size());
        for (Attempt attempt : attempts) {
            outcomes.add(attempt.outcome());
            if (attempt.quote() != null) {
                Quote assessed = impactEstimator.assess(attempt.quote(), request);
                ranked.add(calculator.rank(assessed, request, attempt.venue().feePerMille()));
            }
        }
        ranked.sort(RankedQuote.RANKING);

        AggregationResult result = AggregationResult.of(request, ranked, outcomes, startedAt, elapsedMs(startNanos));
        log.info("Aggregation done chain={} venues={} quoted={} status={} elapsedMs={}",
                request.chainId(), eligible.size(), ranked.size(), result.status(), result.elapsedMs());
        return result;
    }

    private Attempt callVenue(VenueDescriptor venue, SwapRequest request, Instant deadline) {
        long start = System.nanoTime();
        VenueQuoteAdapter adapter = adapterRegistry.getRequired(venue.id());
        try {
            Quote quote = resilienceService.call(venue, deadline, budget -> adapter.quote(new QuoteCommand(
                    request,
                    venue,
                    budget,
                    venueRegistry.settingsFor(venue.id())
            )));
            return new Attempt(venue, quote, new VenueOutcome(venue.id(), OutcomeKind.QUOTED, elapsedMs(start), null));
        } catch (VenueException e) {
            OutcomeKind kind = OutcomeKind.from(e.getType());
            if (e.getType() == VenueErrorType.UNSUPPORTED || e.getType() == VenueErrorType.CIRCUIT_OPEN) {
                log.info("Venue skipped venue={} kind={} message={}", venue.id(), kind, e.getSafeMessage());
            } else {
                log.warn("Venue failed venue={} kind={} message={}", venue.id(), kind, e.getSafeMessage());
            }
            return new Attempt(venue, null, new VenueOutcome(venue.id(), kind, elapsedMs(start), e.getSafeMessage()));
        } catch (RuntimeException e) {
            log.warn("Venue failed venue={} error={}", venue.id(), e.toString());
            return new Attempt(venue, null, new VenueOutcome(venue.id(), OutcomeKind.UPSTREAM_ERROR, elapsedMs(start), "Unexpected venue failure"));
        }
    }

    private Attempt collect(Future<Attempt> future, VenueDescriptor venue, long startNanos) throws InterruptedException {
        if (future.isCancelled()) {
            return deadlineExceeded(venue, elapsedMs(startNanos));
        }
        try {
            return future.get();
        } catch (CancellationException e) {
            return deadlineExceeded(venue, elapsedMs(startNanos));
        } catch (ExecutionException e) {
            log.warn("Venue task failed venue={} error={}", venue.id(), String.valueOf(e.getCause()));
            return new Attempt(venue, null, new VenueOutcome(venue.id(), OutcomeKind.UPSTREAM_ERROR, elapsedMs(startNanos), "Unexpected venue failure"));
        }
    }

    private Attempt deadlineExceeded(VenueDescriptor venue, long elapsedMs) {
        log.warn("Venue missed deadline venue={}", venue.id());
        return new Attempt(venue, null, new VenueOutcome(venue.id(), OutcomeKind.DEADLINE_EXCEEDED, elapsedMs, "No answer before deadline"));
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
