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

import java.math.BigInteger;
import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 1inch Swap API v6 quote endpoint. 1inch reports neither per-hop amounts nor price impact, so the
 * route is always collapsed to one hop labelled with the protocols used and the impact is left for
 * the aggregator to derive from the reference price.
 */
@Service
public class OneInchAdapter extends HttpVenueAdapter {
    public static final String VENUE_ID = "oneinch";
    static final String DEFAULT_BASE_URL = "https://api.1inch.dev";
    private static final double CONFIDENCE = 0.85;

    public OneInchAdapter(WebClient venueWebClient, ObjectMapper objectMapper, AppProperties properties, Clock clock) {
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
        if (!request.chainId().chars().allMatch(Character::isDigit)) {
            throw new VenueException(venueId(), VenueErrorType.UNSUPPORTED, "1inch serves EVM chains only");
        }

        URI uri = UriComponentsBuilder.fromUriString(baseUrl(venue, DEFAULT_BASE_URL))
                .path("/swap/v6.0/{chain}/quote")
                .queryParam("src", request.inputToken().address())
                .queryParam("dst", request.outputToken().address())
                .queryParam("amount", request.amountIn().toString())
                .queryParam("includeGas", "true")
                .queryParam("includeProtocols", "true")
                .buildAndExpand(request.chainId())
                .encode()
                .toUri();

        Map<String, String> headers = new LinkedHashMap<>();
        String apiKey = configValue(command.venueConfig(), "apiKey");
        if (apiKey != null) {
            headers.put("Authorization", "Bearer " + apiKey);
        }

        JsonNode body = getJson(uri, headers, command.timeout());

        BigInteger amountOut = requiredAmount(body, "dstAmount");
        long gas = body.path("gas").asLong(0);
        if (gas <= 0) gas = venue.nominalGas();

        String label = protocolLabel(body.path("protocols"));
        RouteHop hop = singleHop(label, request, amountOut, venue);

        return new Quote(
                null,
                venue.id(),
                request.amountIn(),
                amountOut,
                null,
                gas,
                executionCost(request.chainId(), gas),
                List.of(hop),
                CONFIDENCE,
                now()
        );
    }

    // protocols is routes[] of hops[] of parts[]; the label is the distinct part names in order.
    private String protocolLabel(JsonNode protocols) {
        Set<String> names = new LinkedHashSet<>();
        if (protocols.isArray()) {
            for (JsonNode route : protocols) {
                for (JsonNode hop : route) {
                    for (JsonNode part : hop) {
                        String name = part.path("name").asText("");
                        if (!name.isBlank()) names.add(name);
                    }
                }
            }
        }
        return names.isEmpty() ? VENUE_ID : String.join("+", names);
    }
}
