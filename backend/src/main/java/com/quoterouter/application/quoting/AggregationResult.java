/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.quoting;

import com.quoterouter.domain.model.SwapRequest;

import java.time.Instant;
import java.util.List;

public record AggregationResult(
        SwapRequest request,
        Status status,
        List<RankedQuote> quotes,
        List<VenueOutcome> outcomes,
        Instant startedAt,
        long elapsedMs,
        MarketSummary summary,
        RiskAssessment risk
) {
    public enum Status {
        QUOTED,
        NO_QUOTES_AVAILABLE
    }

    public AggregationResult {
        quotes = List.copyOf(quotes);
        outcomes = List.copyOf(outcomes);
    }

    public static AggregationResult of(SwapRequest request, List<RankedQuote> quotes, List<VenueOutcome> outcomes, Instant startedAt, long elapsedMs) {
        Status status = quotes.isEmpty() ? Status.NO_QUOTES_AVAILABLE : Status.QUOTED;
        MarketSummary summary = MarketSummary.of(request, quotes);
        return new AggregationResult(request, status, quotes, outcomes, startedAt, elapsedMs, summary,
                RiskAssessment.of(quotes, summary));
    }
}
