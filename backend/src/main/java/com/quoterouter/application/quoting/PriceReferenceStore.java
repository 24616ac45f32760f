/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.quoting;

import com.quoterouter.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process {@link PriceReference}. Seeded from {@code app.prices} (static, never stale) and
 * updated by pushes from the market-data feed. A missing direct pair is answered with the inverse
 * of the opposite pair.
 */
@Component
public class PriceReferenceStore implements PriceReference {
    private static final Logger log = LoggerFactory.getLogger(PriceReferenceStore.class);

    private final Map<String, PricePoint> prices = new ConcurrentHashMap<>();

    public PriceReferenceStore(AppProperties properties) {
        for (AppProperties.PriceEntry entry : properties.prices()) {
            if (entry.price() == null || entry.price().signum() <= 0) {
                throw new IllegalStateException("Configured price must be > 0 for " + entry.base() + "/" + entry.quote());
            }
            prices.put(key(entry.chainId(), entry.base(), entry.quote()), new PricePoint(entry.price(), null));
        }
    }

    @Override
    public Optional<PricePoint> price(String chainId, String baseToken, String quoteToken) {
        PricePoint direct = prices.get(key(chainId, baseToken, quoteToken));
        if (direct != null) return Optional.of(direct);
        PricePoint inverse = prices.get(key(chainId, quoteToken, baseToken));
        if (inverse == null) return Optional.empty();
        return Optional.of(new PricePoint(BigDecimal.ONE.divide(inverse.price(), MathContext.DECIMAL64), inverse.observedAt()));
    }

    public void update(String chainId, String baseToken, String quoteToken, BigDecimal price, Instant observedAt) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("price must be > 0");
        }
        if (observedAt == null) {
            throw new IllegalArgumentException("observedAt is required");
        }
        prices.put(key(chainId, baseToken, quoteToken), new PricePoint(price, observedAt));
        prices.remove(key(chainId, quoteToken, baseToken));
        log.debug("Price updated chain={} base={} quote={} price={}", chainId, baseToken, quoteToken, price);
    }

    private static String key(String chainId, String base, String quote) {
        return chainId + "|" + normalize(base) + "|" + normalize(quote);
    }

    private static String normalize(String token) {
        if (token == null) return "";
        String t = token.trim();
        return t.startsWith("0x") ? t.toLowerCase(Locale.ROOT) : t;
    }
}
