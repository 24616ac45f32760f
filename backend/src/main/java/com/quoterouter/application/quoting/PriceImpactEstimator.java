/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.quoting;

import com.quoterouter.config.AppProperties;
import com.quoterouter.domain.model.Quote;
import com.quoterouter.domain.model.SwapRequest;
import com.quoterouter.domain.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Checks a quoted rate against the reference price. The effective impact of a quote is the larger
 * of what the venue reported and the shortfall against the reference, so a venue that reports no
 * impact, or too little, cannot slip past the execution slippage check.
 */
@Component
public class PriceImpactEstimator {
    private static final Logger log = LoggerFactory.getLogger(PriceImpactEstimator.class);
    private static final int SCALE = 6;

    private final AppProperties properties;
    private final PriceReference priceReference;
    private final Clock clock;

    public PriceImpactEstimator(AppProperties properties, PriceReference priceReference, Clock clock) {
        this.properties = properties;
        this.priceReference = priceReference;
        this.clock = clock;
    }

    public Quote assess(Quote quote, SwapRequest request) {
        Optional<BigDecimal> reference = referenceImpact(quote, request);
        if (reference.isEmpty()) {
            if (!quote.hasKnownPriceImpact()) {
                log.info("Price impact unknown venue={} chain={}", quote.venueId(), request.chainId());
            }
            return quote;
        }
        BigDecimal reported = quote.priceImpact();
        if (reported != null && reported.compareTo(reference.get()) >= 0) {
            return quote;
        }
        return quote.withPriceImpact(reference.get());
    }

    /**
     * 1 - quotedOut / referenceOut, floored at zero. Empty when no fresh reference rate exists for
     * the pair, directly or through the chain's native token.
     */
    Optional<BigDecimal> referenceImpact(Quote quote, SwapRequest request) {
        Optional<BigDecimal> rate = rate(request.inputToken(), request.outputToken());
        if (rate.isEmpty() || rate.get().signum() <= 0) return Optional.empty();

        BigDecimal expectedOut = new BigDecimal(quote.amountIn())
                .movePointLeft(request.inputToken().decimals())
                .multiply(rate.get())
                .movePointRight(request.outputToken().decimals());
        if (expectedOut.signum() <= 0) return Optional.empty();

        BigDecimal impact = BigDecimal.ONE.subtract(
                new BigDecimal(quote.amountOut()).divide(expectedOut, MathContext.DECIMAL64));
        if (impact.signum() < 0) return Optional.of(BigDecimal.ZERO.setScale(SCALE));
        return Optional.of(impact.setScale(SCALE, RoundingMode.HALF_UP));
    }

    private Optional<BigDecimal> rate(Token input, Token output) {
        String chainId = output.chainId();
        Optional<BigDecimal> direct = freshPrice(chainId, input.address(), output.address());
        if (direct.isPresent()) return direct;

        AppProperties.Chain chain = properties.chains().get(chainId);
        if (chain == null || chain.nativeToken() == null) return Optional.empty();
        Optional<BigDecimal> nativeToOutput = freshPrice(chainId, chain.nativeToken(), output.address());
        Optional<BigDecimal> nativeToInput = freshPrice(chainId, chain.nativeToken(), input.address());
        if (nativeToOutput.isEmpty() || nativeToInput.isEmpty() || nativeToInput.get().signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(nativeToOutput.get().divide(nativeToInput.get(), MathContext.DECIMAL64));
    }

    private Optional<BigDecimal> freshPrice(String chainId, String base, String quote) {
        if (Token.normalize(base).equals(Token.normalize(quote))) return Optional.of(BigDecimal.ONE);
        Instant now = clock.instant();
        return priceReference.price(chainId, base, quote)
                .filter(p -> !p.isStaleAt(now, properties.quoting().priceMaxAge()))
                .map(PriceReference.PricePoint::price);
    }
}
