/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.config;

import com.quoterouter.domain.model.LatencyClass;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
        Quoting quoting,
        Resilience resilience,
        Map<String, Chain> chains,
        List<Venue> venues,
        List<TokenEntry> tokens,
        List<PriceEntry> prices
) {
    public AppProperties {
        if (quoting == null) quoting = Quoting.defaults();
        if (resilience == null) resilience = Resilience.defaults();
        chains = chains == null ? Map.of() : Map.copyOf(chains);
        venues = venues == null ? List.of() : List.copyOf(venues);
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        prices = prices == null ? List.of() : List.copyOf(prices);
    }

    public record Quoting(
            int platformFeeBps,
            Duration freshnessWindow,
            Duration defaultDeadline,
            Duration maxDeadline,
            Duration priceMaxAge,
            double gasLimitMultiplier
    ) {
        public Quoting {
            if (freshnessWindow == null) freshnessWindow = Duration.ofMinutes(10);
            if (defaultDeadline == null) defaultDeadline = Duration.ofSeconds(3);
            if (maxDeadline == null) maxDeadline = Duration.ofSeconds(15);
            if (priceMaxAge == null) priceMaxAge = Duration.ofMinutes(5);
            if (gasLimitMultiplier <= 0) gasLimitMultiplier = 1.2;
        }

        public static Quoting defaults() {
            return new Quoting(5, null, null, null, null, 0);
        }
    }

    public record Resilience(
            int failureThreshold,
            Duration recoveryTimeout,
            Duration maxRecoveryTimeout,
            double backoffMultiplier,
            Duration failureDecay,
            Duration callTimeout,
            int rateLimitPerSecond,
            int retryMaxAttempts,
            Duration retryBaseDelay
    ) {
        public Resilience {
            if (failureThreshold <= 0) failureThreshold = 5;
            if (recoveryTimeout == null) recoveryTimeout = Duration.ofSeconds(30);
            if (maxRecoveryTimeout == null) maxRecoveryTimeout = Duration.ofMinutes(5);
            if (backoffMultiplier < 1) backoffMultiplier = 2.0;
            if (failureDecay == null) failureDecay = Duration.ofSeconds(60);
            if (callTimeout == null) callTimeout = Duration.ofSeconds(5);
            if (rateLimitPerSecond <= 0) rateLimitPerSecond = 10;
            if (retryMaxAttempts <= 0) retryMaxAttempts = 1;
            if (retryBaseDelay == null) retryBaseDelay = Duration.ofMillis(100);
        }

        public static Resilience defaults() {
            return new Resilience(0, null, null, 0, null, null, 0, 0, null);
        }
    }

    public record Chain(
            String nativeToken,
            int nativeDecimals,
            BigInteger gasPrice
    ) {
        public Chain {
            if (gasPrice == null) gasPrice = BigInteger.ZERO;
        }
    }

    public record Venue(
            String id,
            String displayName,
            int feePerMille,
            Set<String> supportedChains,
            Boolean active,
            long nominalGas,
            String baseUrl,
            String routerAddress,
            LatencyClass latencyClass,
            Duration recoveryTimeout,
            Integer rateLimitPerSecond,
            Map<String, String> config
    ) {}

    public record TokenEntry(
            String address,
            String chainId,
            int decimals,
            String symbol
    ) {}

    // one whole base token is worth price whole quote tokens
    public record PriceEntry(
            String chainId,
            String base,
            String quote,
            BigDecimal price
    ) {}
}
