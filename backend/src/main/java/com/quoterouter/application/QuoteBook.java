/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application;

import com.quoterouter.config.AppProperties;
import com.quoterouter.domain.model.Quote;
import com.quoterouter.domain.model.SwapRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issued quotes by id. Entries are kept for three freshness windows so an expired quote is still
 * recognised (and rejected as stale) instead of reported as unknown.
 */
@Component
public class QuoteBook {
    private static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);

    private final Map<UUID, Entry> entries = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Clock clock;
    private volatile Instant lastSweep;

    public QuoteBook(AppProperties properties, Clock clock) {
        this.retention = properties.quoting().freshnessWindow().multipliedBy(3);
        this.clock = clock;
        this.lastSweep = clock.instant();
    }

    public record Entry(Quote quote, SwapRequest request) {}

    public void put(Quote quote, SwapRequest request) {
        entries.put(quote.id(), new Entry(quote, request));
        sweepIfDue();
    }

    public Optional<Entry> find(UUID quoteId) {
        if (quoteId == null) return Optional.empty();
        return Optional.ofNullable(entries.get(quoteId));
    }

    public int size() {
        return entries.size();
    }

    private void sweepIfDue() {
        Instant now = clock.instant();
        if (Duration.between(lastSweep, now).compareTo(SWEEP_INTERVAL) < 0) return;
        lastSweep = now;
        entries.values().removeIf(e -> e.quote().ageAt(now).compareTo(retention) > 0);
    }
}
