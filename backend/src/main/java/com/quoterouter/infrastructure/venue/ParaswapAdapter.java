/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.infrastructure.venue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quoterouter.config.AppProperties;
import com.quoterouter.domain.model.Quote;
import com.quoterouter.domain.model.RouteHop;
import com.quoterouter.domain.model.SwapRequest;
import com.quoterouter.domain.model.VenueDescriptor;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class ParaswapAdapter extends HttpVenueAdapter {
    public static final String VENUE_ID = "paraswap";
    static final String DEFAULT_BASE_URL = "https://apiv5.paraswap.io";

    public ParaswapAdapter(WebClient venueWebClient, ObjectMapper objectMapper, AppProperties properties, Clock clock) {
        super(venueWebClient, objectMapper, properties, clock);
    }

    @Override
    public String venueId() {
        return VENUE_ID;
    }

    @Override
    public Quote quote(QuoteCommand command) {
        requireSupported(command);
        SwapRequest request = command.request();
        VenueDescriptor venue = command.venue();

        URI uri = UriComponentsBuilder.fromUriString(baseUrl(venue, DEFAULT_BASE_URL))
                .path("/prices")
                .queryParam("srcToken", request.inputToken().address())
                .queryParam("destToken", request.outputToken().address())
                .queryParam("amount", request.amountIn().toString())
                .queryParam("srcDecimals", request.inputToken().decimals())
                .queryParam("destDecimals", request.outputToken().decimals())
                .queryParam("side", "SELL")
                .queryParam("network", request.chainId())
                .build()
                .encode()
                .toUri();

        JsonNode body = getJson(uri, Map.of(), command.timeout());
        JsonNode priceRoute = body.path("priceRoute");
        if (!priceRoute.isObject()) {
            String error = body.path("error").asText("");
            if (isUnsupportedAnswer(400, error)) {
                throw new VenueException(venueId(), VenueErrorType.UNSUPPORTED, "No route for pair");
            }
            throw new VenueException(venueId(), VenueErrorType.UPSTREAM_ERROR, "Response missing priceRoute");
        }

        BigInteger amountOut = requiredAmount(priceRoute, "destAmount");
        BigInteger gasCost = optionalAmount(priceRoute, "gasCost");
        long gas = gasCost == null || gasCost.signum() <= 0 ? venue.nominalGas() : gasCost.longValueExact();

        BigDecimal impact = priceImpact(priceRoute);
        List<RouteHop> hops = sequentialHops(priceRoute.path("bestRoute"), venue);
        double confidence;
        if (hops.isEmpty()
                || !chained(hops)
                || !hops.get(0).amountIn().equals(request.amountIn())
                || !hops.get(hops.size() - 1).amountOut().equals(amountOut)) {
            hops = List.of(singleHop(VENUE_ID, request, amountOut, venue));
            confidence = 0.8;
        } else {
            confidence = 0.9;
        }
        if (impact == null) {
            confidence -= 0.05;
        }

        return new Quote(
                null,
                venue.id(),
                request.amountIn(),
                amountOut,
                impact,
                gas,
                executionCost(request.chainId(), gas),
                hops,
                confidence,
                now()
        );
    }

    private List<RouteHop> sequentialHops(JsonNode bestRoute, VenueDescriptor venue) {
        if (!bestRoute.isArray() || bestRoute.size() != 1) return List.of();
        List<RouteHop> hops = new ArrayList<>();
        for (JsonNode swap : bestRoute.get(0).path("swaps")) {
            BigInteger in = BigInteger.ZERO;
            BigInteger out = BigInteger.ZERO;
            List<String> exchanges = new ArrayList<>();
            for (JsonNode exchange : swap.path("swapExchanges")) {
                BigInteger src = optionalAmount(exchange, "srcAmount");
                BigInteger dest = optionalAmount(exchange, "destAmount");
                if (src == null || dest == null) return List.of();
                in = in.add(src);
                out = out.add(dest);
                exchanges.add(exchange.path("exchange").asText(VENUE_ID));
            }
            if (exchanges.isEmpty()) return List.of();
            hops.add(new RouteHop(
                    String.join("+", exchanges),
                    swap.path("srcToken").asText(),
                    swap.path("destToken").asText(),
                    in,
                    out,
                    venueFee(out, venue)
            ));
        }
        return hops;
    }

    // 1 - destUSD/srcUSD, floored at zero. Null when either USD value is absent.
    private static BigDecimal priceImpact(JsonNode priceRoute) {
        BigDecimal srcUsd = decimal(priceRoute.path("srcUSD"));
        BigDecimal destUsd = decimal(priceRoute.path("destUSD"));
        if (srcUsd == null || destUsd == null || srcUsd.signum() <= 0) return null;
        BigDecimal impact = BigDecimal.ONE.subtract(destUsd.divide(srcUsd, MathContext.DECIMAL64));
        if (impact.signum() < 0) return BigDecimal.ZERO;
        return impact.setScale(6, RoundingMode.HALF_UP);
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node.isMissingNode() || node.isNull() || node.asText().isBlank()) return null;
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
