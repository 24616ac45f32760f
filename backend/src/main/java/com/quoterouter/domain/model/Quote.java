/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.domain.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A venue's answer to a {@link SwapRequest}. Never mutated; a refreshed price is a new Quote.
 *
 * @param priceImpact fraction of value lost against the market rate, {@code null} while unknown
 */
public record Quote(
        UUID id,
        String venueId,
        BigInteger amountIn,
        BigInteger amountOut,
        BigDecimal priceImpact,
        long estimatedGas,
        BigInteger estimatedExecutionCost,
        List<RouteHop> route,
        double confidence,
        Instant quotedAt
) {
    public Quote {
        if (id == null) id = UUID.randomUUID();
        if (venueId == null || venueId.isBlank()) throw new IllegalArgumentException("venueId is required");
        if (amountIn == null || amountIn.signum() <= 0) throw new IllegalArgumentException("amountIn must be > 0");
        if (amountOut == null || amountOut.signum() < 0) throw new IllegalArgumentException("amountOut must be >= 0");
        if (priceImpact != null && priceImpact.signum() < 0) throw new IllegalArgumentException("priceImpact must be >= 0");
        if (estimatedGas < 0) throw new IllegalArgumentException("estimatedGas must be >= 0");
        if (estimatedExecutionCost == null) estimatedExecutionCost = BigInteger.ZERO;
        if (confidence < 0 || confidence > 1) throw new IllegalArgumentException("confidence must be within [0,1]");
        if (quotedAt == null) throw new IllegalArgumentException("quotedAt is required");
        route = route == null ? List.of() : List.copyOf(route);
        for (int i = 0; i + 1 < route.size(); i++) {
            if (!route.get(i).amountOut().equals(route.get(i + 1).amountIn())) {
                throw new IllegalArgumentException("route hop " + i + " output does not feed hop " + (i + 1));
            }
        }
    }

    public Quote withPriceImpact(BigDecimal impact) {
        return new Quote(id, venueId, amountIn, amountOut, impact, estimatedGas, estimatedExecutionCost, route, confidence, quotedAt);
    }

    public boolean hasKnownPriceImpact() {
        return priceImpact != null;
    }

    public Duration ageAt(Instant now) {
        return Duration.between(quotedAt, now);
    }

    public boolean isFreshAt(Instant now, Duration freshnessWindow) {
        return ageAt(now).compareTo(freshnessWindow) <= 0;
    }
}
