/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.quoting;

import com.quoterouter.domain.model.Quote;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * @param netOutput       output after fees and execution cost, smallest output units; may be negative
 * @param costInOutput    execution cost converted to output units, zero when not adjusted
 * @param costAdjusted    false when no usable price reference existed and the cost was ignored
 */
public record RankedQuote(
        Quote quote,
        BigInteger netOutput,
        BigInteger feeAmount,
        BigInteger costInOutput,
        boolean costAdjusted
) {
    // Best first: net output desc, confidence desc, execution cost asc, venue id.
    public static final Comparator<RankedQuote> RANKING = Comparator
            .comparing(RankedQuote::netOutput, Comparator.reverseOrder())
            .thenComparing(r -> r.quote().confidence(), Comparator.reverseOrder())
            .thenComparing(r -> r.quote().estimatedExecutionCost())
            .thenComparing(r -> r.quote().venueId());

    public RiskLevel riskLevel() {
        return RiskLevel.forImpact(quote.priceImpact()).max(RiskLevel.forConfidence(quote.confidence()));
    }
}
