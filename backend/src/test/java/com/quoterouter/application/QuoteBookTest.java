/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application;

import com.quoterouter.config.AppProperties;
import com.quoterouter.domain.model.Quote;
import com.quoterouter.support.MutableClock;
import com.quoterouter.support.TestFixtures;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuoteBookTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
    private final QuoteBook book = new QuoteBook(
            TestFixtures.properties(AppProperties.Quoting.defaults(), AppProperties.Resilience.defaults(), List.of(), List.of()),
            clock);

    @Test
    void expiredQuoteIsStillKnownWithinRetention() {
        Quote quote = TestFixtures.quote("oneinch", 100, clock.instant());
        book.put(quote, TestFixtures.wethToUsdc(BigInteger.TEN, clock.instant().plusSeconds(3)));

        clock.advance(Duration.ofMinutes(25));
        book.put(TestFixtures.quote("oneinch", 100, clock.instant()), TestFixtures.wethToUsdc(BigInteger.TEN, clock.instant()));

        assertTrue(book.find(quote.id()).isPresent());
        assertEquals(2, book.size());
    }

    @Test
    void quotesPastRetentionAreSweptOnNextPut() {
        Quote quote = TestFixtures.quote("oneinch", 100, clock.instant());
        book.put(quote, TestFixtures.wethToUsdc(BigInteger.TEN, clock.instant().plusSeconds(3)));

        clock.advance(Duration.ofMinutes(31));
        book.put(TestFixtures.quote("paraswap", 100, clock.instant()), TestFixtures.wethToUsdc(BigInteger.TEN, clock.instant()));

        assertTrue(book.find(quote.id()).isEmpty());
        assertEquals(1, book.size());
    }

    @Test
    void unknownIdIsEmpty() {
        assertTrue(book.find(UUID.randomUUID()).isEmpty());
        assertTrue(book.find(null).isEmpty());
    }
}
