/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.quoting;

import com.quoterouter.config.AppProperties;
import com.quoterouter.domain.model.Quote;
import com.quoterouter.domain.model.SwapRequest;
import com.quoterouter.domain.model.Token;
import com.quoterouter.support.MutableClock;
import com.quoterouter.support.TestFixtures;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NetOutputCalculatorTest {
    private static final BigInteger ONE_FINNEY = BigInteger.TEN.pow(15);

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));

    @Test
    void subtractsFeesAndConvertedExecutionCost() {
        NetOutputCalculator calculator = calculator(new PriceReferenceStore(properties(ethUsdc("2000"))));

        RankedQuote ranked = calculator.rank(quote(3_000_000_000L, ONE_FINNEY), request(TestFixtures.usdc()), 3);

        assertEquals(BigInteger.valueOf(10_500_000), ranked.feeAmount());
        assertEquals(BigInteger.valueOf(2_000_000), ranked.costInOutput());
        assertEquals(BigInteger.valueOf(2_987_500_000L), ranked.netOutput());
        assertTrue(ranked.costAdjusted());
    }

    @Test
    void usesInverseOfOppositePair() {
        AppProperties.PriceEntry usdcEth = new AppProperties.PriceEntry("1", TestFixtures.USDC, TestFixtures.NATIVE, new BigDecimal("0.0005"));
        NetOutputCalculator calculator = calculator(new PriceReferenceStore(properties(List.of(usdcEth))));

        RankedQuote ranked = calculator.rank(quote(3_000_000_000L, ONE_FINNEY), request(TestFixtures.usdc()), 0);

        assertEquals(BigInteger.valueOf(2_000_000), ranked.costInOutput());
        assertTrue(ranked.costAdjusted());
    }

    @Test
    void missingPriceRanksOnFeesOnly() {
        NetOutputCalculator calculator = calculator(new PriceReferenceStore(properties(List.of())));

        RankedQuote ranked = calculator.rank(quote(3_000_000_000L, ONE_FINNEY), request(TestFixtures.usdc()), 3);

        assertFalse(ranked.costAdjusted());
        assertEquals(BigInteger.ZERO, ranked.costInOutput());
        assertEquals(BigInteger.valueOf(2_989_500_000L), ranked.netOutput());
    }

    @Test
    void stalePushedPriceIsIgnored() {
        PriceReferenceStore store = new PriceReferenceStore(properties(List.of()));
        store.update("1", TestFixtures.NATIVE, TestFixtures.USDC, new BigDecimal("2000"), clock.instant().minus(Duration.ofMinutes(6)));
        NetOutputCalculator calculator = calculator(store);

        RankedQuote ranked = calculator.rank(quote(3_000_000_000L, ONE_FINNEY), request(TestFixtures.usdc()), 0);

        assertFalse(ranked.costAdjusted());
    }

    @Test
    void freshPushedPriceIsUsed() {
        PriceReferenceStore store = new PriceReferenceStore(properties(List.of()));
        store.update("1", TestFixtures.NATIVE, TestFixtures.USDC, new BigDecimal("2500"), clock.instant().minus(Duration.ofMinutes(1)));
        NetOutputCalculator calculator = calculator(store);

        RankedQuote ranked = calculator.rank(quote(3_000_000_000L, ONE_FINNEY), request(TestFixtures.usdc()), 0);

        assertTrue(ranked.costAdjusted());
        assertEquals(BigInteger.valueOf(2_500_000), ranked.costInOutput());
    }

    @Test
    void nativeOutputNeedsNoPrice() {
        NetOutputCalculator calculator = calculator(new PriceReferenceStore(properties(List.of())));
        Token eth = new Token(TestFixtures.NATIVE, "1", 18, "ETH");
        BigInteger out = BigInteger.TEN.pow(18);

        RankedQuote ranked = calculator.rank(quote(out, ONE_FINNEY), request(eth), 0);

        assertTrue(ranked.costAdjusted());
        BigInteger expected = new BigInteger("999500000000000000").subtract(ONE_FINNEY);
        assertEquals(expected, ranked.netOutput());
    }

    @Test
    void netOutputMayBeNegative() {
        NetOutputCalculator calculator = calculator(new PriceReferenceStore(properties(ethUsdc("2000"))));

        RankedQuote ranked = calculator.rank(quote(1_000_000L, ONE_FINNEY), request(TestFixtures.usdc()), 0);

        assertTrue(ranked.netOutput().signum() < 0);
    }

    private NetOutputCalculator calculator(PriceReference prices) {
        return new NetOutputCalculator(properties(List.of()), prices, clock);
    }

    private static AppProperties properties(List<AppProperties.PriceEntry> prices) {
        AppProperties.Quoting quoting = new AppProperties.Quoting(5, null, null, null, Duration.ofMinutes(5), 0);
        return TestFixtures.properties(quoting, AppProperties.Resilience.defaults(), List.of(), prices);
    }

    private static List<AppProperties.PriceEntry> ethUsdc(String price) {
        return List.of(new AppProperties.PriceEntry("1", TestFixtures.NATIVE, TestFixtures.USDC, new BigDecimal(price)));
    }

    private SwapRequest request(Token output) {
        return new SwapRequest(TestFixtures.weth(), output, BigInteger.TEN.pow(18), new BigDecimal("0.01"), clock.instant().plusSeconds(3));
    }

    private Quote quote(long amountOut, BigInteger cost) {
        return quote(BigInteger.valueOf(amountOut), cost);
    }

    private Quote quote(BigInteger amountOut, BigInteger cost) {
        return new Quote(null, "oneinch", BigInteger.TEN.pow(18), amountOut, BigDecimal.ZERO, 150_000, cost,
                List.of(), 0.9, clock.instant());
    }
}
