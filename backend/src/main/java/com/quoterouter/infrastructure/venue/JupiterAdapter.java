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
import java.math.RoundingMode;
import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jupiter v6 quote API (Solana). Execution cost is the venue's nominal fee, Jupiter does not
 * estimate compute units on the quote call.
 */
@Service
public class JupiterAdapter extends HttpVenueAdapter {
    public static final String VENUE_ID = "jupiter";
    public static final String SOLANA = "solana";
    static final String DEFAULT_BASE_URL = "https://quote-api.jup.ag/v6";

    public JupiterAdapter(WebClient venueWebClient, ObjectMapper objectMapper, AppProperties properties, Clock clock) {
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
        if (!SOLANA.equals(request.chainId())) {
            throw new VenueException(venueId(), VenueErrorType.UNSUPPORTED, "Jupiter serves solana only");
        }

        int slippageBps = request.slippageTolerance() == null
                ? 50
                : request.slippageTolerance().movePointRight(4).setScale(0, RoundingMode.DOWN).intValue();

        URI uri = UriComponentsBuilder.fromUriString(baseUrl(venue, DEFAULT_BASE_URL))
                .path("/quote")
                .queryParam("inputMint", request.inputToken().address())
                .queryParam("outputMint", request.outputToken().address())
                .queryParam("amount", request.amountIn().toString())
                .queryParam("slippageBps", slippageBps)
                .build()
                .encode()
                .toUri();

        Map<String, String> headers = new LinkedHashMap<>();
        String apiKey = configValue(command.venueConfig(), "apiKey");
        if (apiKey != null) {
            headers.put("x-api-key", apiKey);
        }

        JsonNode body = getJson(uri, headers, command.timeout());
        if (body.hasNonNull("error")) {
            String error = body.path("error").asText("") + " " + body.path("errorCode").asText("");
            VenueErrorType type = isUnsupportedAnswer(400, error) ? VenueErrorType.UNSUPPORTED : VenueErrorType.UPSTREAM_ERROR;
            throw new VenueException(venueId(), type, "Venue rejected quote");
        }

        BigInteger amountOut = requiredAmount(body, "outAmount");
        BigDecimal impact = parseImpact(body.path("priceImpactPct"));

        List<RouteHop> hops = routePlanHops(body.path("routePlan"));
        double confidence;
        if (hops.isEmpty()
                || !chained(hops)
                || !hops.get(0).amountIn().equals(request.amountIn())
                || !hops.get(hops.size() - 1).amountOut().equals(amountOut)) {
            hops = List.of(singleHop(VENUE_ID, request, amountOut, venue));
            confidence = 0.85;
        } else {
            confidence = 0.95;
        }

        long gas = venue.nominalGas();
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

    // Hops only when every step carries the full amount (percent 100); split plans are collapsed.
    private List<RouteHop> routePlanHops(JsonNode routePlan) {
        if (!routePlan.isArray() || routePlan.isEmpty()) return List.of();
        List<RouteHop> hops = new ArrayList<>();
        for (JsonNode step : routePlan) {
            if (step.path("percent").asInt(100) != 100) return List.of();
            JsonNode info = step.path("swapInfo");
            BigInteger in = optionalAmount(info, "inAmount");
            BigInteger out = optionalAmount(info, "outAmount");
            if (in == null || out == null) return List.of();
            BigInteger fee = optionalAmount(info, "feeAmount");
            hops.add(new RouteHop(
                    info.path("label").asText(VENUE_ID),
                    info.path("inputMint").asText(),
                    info.path("outputMint").asText(),
                    in,
                    out,
                    fee == null ? BigInteger.ZERO : fee
            ));
        }
        return hops;
    }

    private static BigDecimal parseImpact(JsonNode node) {
        if (node.isMissingNode() || node.isNull() || node.asText().isBlank()) return null;
        try {
            BigDecimal impact = new BigDecimal(node.asText().trim()).abs();
            return impact.setScale(6, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
