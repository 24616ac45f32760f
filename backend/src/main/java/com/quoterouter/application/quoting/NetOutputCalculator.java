/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.quoting;

import com.quoterouter.config.AppProperties;
import com.quoterouter.domain.model.Quote;
import com.quoterouter.domain.model.SwapRequest;
import com.quoterouter.domain.model.Token;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * netOutput = amountOut * (1 - platformFee - venueFee) - executionCost, with the cost converted
 * into output-token units through the price reference. Pure apart from reading the clock to judge
 * price staleness.
 */
@Component
public class NetOutputCalculator {
    private static final BigDecimal BPS = BigDecimal.valueOf(10_000);
    private static final BigDecimal PER_MILLE = BigDecimal.valueOf(1_000);

    private final AppProperties properties;
    private final PriceReference priceReference;
    private final Clock clock;

    public NetOutputCalculator(AppProperties properties, PriceReference priceReference, Clock clock) {
        this.properties = properties;
        this.priceReference = priceReference;
        this.clock = clock;
    }

    public RankedQuote rank(Quote quote, SwapRequest request, int venueFeePerMille) {
        BigDecimal feeRate = BigDecimal.valueOf(properties.quoting().platformFeeBps()).divide(BPS)
                .add(BigDecimal.valueOf(venueFeePerMille).divide(PER_MILLE));
        BigDecimal gross = new BigDecimal(quote.amountOut());
        BigDecimal afterFees = gross.multiply(BigDecimal.ONE.subtract(feeRate));
        BigInteger feeAmount = gross.subtract(afterFees).setScale(0, RoundingMode.CEILING).toBigInteger();

        Optional<BigDecimal> cost = costInOutput(quote.estimatedExecutionCost(), request.outputToken());
        BigDecimal net = afterFees.subtract(cost.orElse(BigDecimal.ZERO));

        return new RankedQuote(
                quote,
                net.setScale(0, RoundingMode.FLOOR).toBigInteger(),
                feeAmount,
                cost.map(c -> c.setScale(0, RoundingMode.CEILING).toBigInteger()).orElse(BigInteger.ZERO),
                cost.isPresent()
        );
    }

    Optional<BigDecimal> costInOutput(BigInteger nativeCost, Token output) {
        if (nativeCost == null || nativeCost.signum() == 0) return Optional.of(BigDecimal.ZERO);

        AppProperties.Chain chain = properties.chains().get(output.chainId());
        if (chain == null || chain.nativeToken() == null) return Optional.empty();

        if (normalize(chain.nativeToken()).equals(output.normalizedAddress())) {
            return Optional.of(new BigDecimal(nativeCost));
        }

        Optional<PriceReference.PricePoint> point = priceReference.price(output.chainId(), chain.nativeToken(), output.address());
        if (point.isEmpty() || point.get().isStaleAt(clock.instant(), properties.quoting().priceMaxAge())) {
            return Optional.empty();
        }

        BigDecimal wholeNative = new BigDecimal(nativeCost).movePointLeft(chain.nativeDecimals());
        return Optional.of(wholeNative.multiply(point.get().price()).movePointRight(output.decimals()));
    }

    private static String normalize(String address) {
        return address.startsWith("0x") ? address.toLowerCase(Locale.ROOT) : address;
    }
}
