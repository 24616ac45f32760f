/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quoterouter.application.quoting.AggregationResult;
import com.quoterouter.application.quoting.OutcomeKind;
import com.quoterouter.application.quoting.QuoteAggregator;
import com.quoterouter.application.quoting.RankedQuote;
import com.quoterouter.application.quoting.VenueOutcome;
import com.quoterouter.config.AppProperties;
import com.quoterouter.domain.model.Quote;
import com.quoterouter.domain.model.SwapRequest;
import com.quoterouter.infrastructure.persistence.entity.QuoteDecisionEntity;
import com.quoterouter.infrastructure.persistence.repository.QuoteDecisionRepository;
import com.quoterouter.support.MutableClock;
import com.quoterouter.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QuoteServiceTest {
    private static final BigInteger ONE_WETH = BigInteger.TEN.pow(18);

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
    private QuoteAggregator aggregator;
    private QuoteDecisionRepository decisionRepository;
    private QuoteBook quoteBook;
    private QuoteService service;

    @BeforeEach
    void setUp() {
        AppProperties properties = TestFixtures.properties(AppProperties.Quoting.defaults(), AppProperties.Resilience.defaults(), List.of(), List.of());
        aggregator = mock(QuoteAggregator.class);
        decisionRepository = mock(QuoteDecisionRepository.class);
        quoteBook = new QuoteBook(properties, clock);
        service = new QuoteService(aggregator, new TokenDirectory(properties), quoteBook, decisionRepository,
                properties, new ObjectMapper(), clock);
    }

    @Test
    void resolvesSymbolsAndAppliesDefaults() {
        SwapRequest request = service.toSwapRequest(query("weth", "USDC", ONE_WETH, "1", null, null));

        assertEquals(TestFixtures.WETH, request.inputToken().address());
        assertEquals(6, request.outputToken().decimals());
        assertEquals(new BigDecimal("0.005"), request.slippageTolerance());
        assertEquals(clock.instant().plusSeconds(3), request.deadline());
    }

    @Test
    void unknownTokenNeedsDecimals() {
        String unknown = "0x1f9840a85d5aF5bf1D1762F925BDADdC4201F984";

        assertThrows(InvalidSwapRequestException.class,
                () -> service.toSwapRequest(query(unknown, "USDC", ONE_WETH, "1", null, null)));

        SwapRequest request = service.toSwapRequest(new QuoteService.QuoteQuery(unknown, "USDC", ONE_WETH, "1", null, null, 18, null));
        assertEquals(18, request.inputToken().decimals());
    }

    @Test
    void rejectsInvalidInput() {
        assertThrows(InvalidSwapRequestException.class, () -> service.toSwapRequest(query("WETH", "USDC", BigInteger.ZERO, "1", null, null)));
        assertThrows(InvalidSwapRequestException.class, () -> service.toSwapRequest(query("WETH", "USDC", ONE_WETH, " ", null, null)));
        assertThrows(InvalidSwapRequestException.class, () -> service.toSwapRequest(query("WETH", "WETH", ONE_WETH, "1", null, null)));
        assertThrows(InvalidSwapRequestException.class, () -> service.toSwapRequest(query("WETH", "USDC", ONE_WETH, "1", BigDecimal.ONE, null)));
        assertThrows(InvalidSwapRequestException.class, () -> service.toSwapRequest(query("WETH", "USDC", ONE_WETH, "1", new BigDecimal("-0.1"), null)));
        assertThrows(InvalidSwapRequestException.class, () -> service.toSwapRequest(query("WETH", "USDC", ONE_WETH, "1", null, 0L)));
        assertThrows(InvalidSwapRequestException.class, () -> service.toSwapRequest(query("WETH", "USDC", ONE_WETH, "1", null, 60_000L)));
    }

    @Test
    void quotedResultIsKeptForExecutionAndAudited() {
        Quote quote = TestFixtures.quote("alpha", 3_000_000_000L, clock.instant());
        when(aggregator.aggregate(any(SwapRequest.class), any(Instant.class))).thenAnswer(inv -> {
            SwapRequest request = inv.getArgument(0);
            RankedQuote ranked = new RankedQuote(quote, BigInteger.valueOf(2_990_000_000L), BigInteger.ZERO, BigInteger.ZERO, true);
            return AggregationResult.of(request, List.of(ranked),
                    List.of(new VenueOutcome("alpha", OutcomeKind.QUOTED, 12, null),
                            new VenueOutcome("beta", OutcomeKind.TIMEOUT, 1500, "No answer within 1500ms")),
                    clock.instant(), 1500);
        });

        AggregationResult result = service.getQuotes(query("WETH", "USDC", ONE_WETH, "1", null, 1_500L), "req-7");

        assertEquals(AggregationResult.Status.QUOTED, result.status());
        assertTrue(quoteBook.find(quote.id()).isPresent());
        verify(aggregator).aggregate(any(SwapRequest.class), eq(clock.instant().plus(Duration.ofMillis(1_500))));

        ArgumentCaptor<QuoteDecisionEntity> captor = ArgumentCaptor.forClass(QuoteDecisionEntity.class);
        verify(decisionRepository).save(captor.capture());
        QuoteDecisionEntity decision = captor.getValue();
        assertEquals("alpha", decision.getBestVenueId());
        assertEquals(quote.id(), decision.getBestQuoteId());
        assertEquals("req-7", decision.getRequestId());
        assertTrue(decision.getOutcomesJson().contains("\"kind\":\"TIMEOUT\""));
    }

    @Test
    void auditFailureDoesNotFailQuoting() {
        when(aggregator.aggregate(any(SwapRequest.class), any(Instant.class))).thenAnswer(inv ->
                AggregationResult.of(inv.getArgument(0), List.of(), List.of(), clock.instant(), 3));
        when(decisionRepository.save(any(QuoteDecisionEntity.class))).thenThrow(new DataAccessResourceFailureException("database is locked"));

        AggregationResult result = service.getQuotes(query("WETH", "USDC", ONE_WETH, "1", null, null), "req-8");

        assertEquals(AggregationResult.Status.NO_QUOTES_AVAILABLE, result.status());
    }

    private static QuoteService.QuoteQuery query(String in, String out, BigInteger amount, String chain, BigDecimal slippage, Long deadlineMs) {
        return new QuoteService.QuoteQuery(in, out, amount, chain, slippage, deadlineMs, null, null);
    }
}
