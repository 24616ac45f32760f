/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.quoting;

import com.quoterouter.domain.model.Quote;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Risk of executing the best quote. Liquidity is not rated: no venue reports pool depth on its quote
 * call.
 */
public record RiskAssessment(
        RiskLevel slippageRisk,
        RiskLevel routeRisk,
        RiskLevel overallRisk,
        List<String> riskFactors
) {
    static final BigDecimal WIDE_SPREAD = new BigDecimal("0.05");

    public RiskAssessment {
        riskFactors = List.copyOf(riskFactors);
    }

    // null when nothing was quoted
    public static RiskAssessment of(List<RankedQuote> ranked, MarketSummary summary) {
        if (ranked.isEmpty()) return null;
        RankedQuote best = ranked.get(0);
        Quote quote = best.quote();
        List<String> factors = new ArrayList<>();

        RiskLevel slippage = RiskLevel.forImpact(quote.priceImpact());
        if (!quote.hasKnownPriceImpact()) {
            factors.add("Price impact could not be verified against a reference price");
        } else if (slippage == RiskLevel.HIGH) {
            factors.add("High price impact");
        } else if (slippage == RiskLevel.MEDIUM) {
            factors.add("Moderate price impact");
        }

        RiskLevel route = RiskLevel.forConfidence(quote.confidence());
        if (route != RiskLevel.LOW) {
            factors.add("Low route confidence");
        }

        if (summary.priceSpread().compareTo(WIDE_SPREAD) > 0) {
            factors.add("Wide price spread across venues");
        }
        if (summary.quoteCount() == 1) {
            factors.add("Only one venue quoted");
        }
        if (!best.costAdjusted()) {
            factors.add("Execution cost not deducted");
        }

        return new RiskAssessment(slippage, route, slippage.max(route), factors);
    }
}
