/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.quoting;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Read-only "price of one whole {@code base} token in whole {@code quote} tokens" lookup, fed by
 * the market-data component.
 */
public interface PriceReference {

    Optional<PricePoint> price(String chainId, String baseToken, String quoteToken);

    /**
     * @param observedAt {@code null} for static reference prices that never go stale
     */
    record PricePoint(BigDecimal price, Instant observedAt) {
        public boolean isStaleAt(Instant now, Duration maxAge) {
            return observedAt != null && Duration.between(observedAt, now).compareTo(maxAge) > 0;
        }
    }
}
