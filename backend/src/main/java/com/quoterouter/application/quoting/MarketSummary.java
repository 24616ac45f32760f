/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.quoting;

import com.quoterouter.domain.model.SwapRequest;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * Cross-venue view of one aggregation. Every quote answers the same input amount, so the spread of
 * output amounts is also the spread of rates.
 *
 * @param medianPrice  whole output tokens per whole input token
 * @param priceSpread  (highest - lowest) / average output, as a fraction
 */
public record MarketSummary(
        int quoteCount,
        BigInteger bestAmountOut,
        BigInteger medianAmountOut,
        BigInteger averageAmountOut,
        BigDecimal medianPrice,
        BigDecimal averagePrice,
        BigDecimal priceSpread
) {
    private static final int PRICE_SCALE = 8;
    private static final int SPREAD_SCALE = 6;

    public static MarketSummary of(SwapRequest request, List<RankedQuote> ranked) {
        if (ranked.isEmpty()) {
            return new MarketSummary(0, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO,
                    BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
        }
        List<BigInteger> amounts = ranked.stream().map(r -> r.quote().amountOut()).sorted().toList();
        int n = amounts.size();

        BigInteger median = n % 2 == 1
                ? amounts.get(n / 2)
                : amounts.get(n / 2 - 1).add(amounts.get(n / 2)).divide(BigInteger.TWO);
        BigInteger sum = amounts.stream().reduce(BigInteger.ZERO, BigInteger::add);
        BigInteger average = sum.divide(BigInteger.valueOf(n));

        BigDecimal spread = BigDecimal.ZERO.setScale(SPREAD_SCALE);
        if (sum.signum() > 0) {
            BigDecimal range = new BigDecimal(amounts.get(n - 1).subtract(amounts.get(0)));
            BigDecimal exactAverage = new BigDecimal(sum).divide(BigDecimal.valueOf(n), MathContext.DECIMAL64);
            spread = range.divide(exactAverage, MathContext.DECIMAL64).setScale(SPREAD_SCALE, RoundingMode.HALF_UP);
        }

        return new MarketSummary(
                n,
                amounts.get(n - 1),
                median,
                average,
                price(median, request),
                price(average, request),
                spread
        );
    }

    private static BigDecimal price(BigInteger amountOut, SwapRequest request) {
        BigDecimal in = new BigDecimal(request.amountIn()).movePointLeft(request.inputToken().decimals());
        BigDecimal out = new BigDecimal(amountOut).movePointLeft(request.outputToken().decimals());
        return out.divide(in, MathContext.DECIMAL64).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }
}
