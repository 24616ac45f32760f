/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.infrastructure.venue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quoterouter.config.AppProperties;
import com.quoterouter.domain.model.RouteHop;
import com.quoterouter.domain.model.SwapRequest;
import com.quoterouter.domain.model.VenueDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigInteger;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shared plumbing for venues reached over HTTP/JSON: one blocking GET bounded by the command's
 * timeout, status-code classification and a few JSON helpers.
 */
public abstract class HttpVenueAdapter implements VenueQuoteAdapter {
    private static final Logger log = LoggerFactory.getLogger(HttpVenueAdapter.class);

    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    protected final AppProperties properties;
    protected final Clock clock;

    protected HttpVenueAdapter(WebClient webClient, ObjectMapper objectMapper, AppProperties properties, Clock clock) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    protected void requireSupported(QuoteCommand command) {
        SwapRequest request = command.request();
        VenueDescriptor venue = command.venue();
        if (!venue.supportsChain(request.inputToken().chainId()) || !venue.supportsChain(request.outputToken().chainId())) {
            throw new VenueException(venueId(), VenueErrorType.UNSUPPORTED, "Chain " + request.chainId() + " not served");
        }
        if (request.amountIn() == null || request.amountIn().signum() <= 0) {
            throw new VenueException(venueId(), VenueErrorType.UNSUPPORTED, "Input amount must be positive");
        }
    }

    protected JsonNode getJson(URI uri, Map<String, String> headers, Duration timeout) {
        try {
            String body = webClient.get()
                    .uri(uri)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(h -> headers.forEach(h::set))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
            if (body == null || body.isBlank()) {
                throw new VenueException(venueId(), VenueErrorType.UPSTREAM_ERROR, "Empty response");
            }
            return objectMapper.readTree(body);
        } catch (VenueException e) {
            throw e;
        } catch (WebClientResponseException e) {
            throw mapStatus(e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (JsonProcessingException e) {
            throw new VenueException(venueId(), VenueErrorType.UPSTREAM_ERROR, "Malformed response", e);
        } catch (RuntimeException e) {
            if (causedBy(e, InterruptedException.class)) {
                Thread.currentThread().interrupt();
                throw new VenueException(venueId(), VenueErrorType.TIMEOUT, "Call cancelled", e);
            }
            if (isTimeout(e)) {
                throw new VenueException(venueId(), VenueErrorType.TIMEOUT, "No response within " + timeout.toMillis() + "ms", e);
            }
            log.warn("Venue transport error venue={} error={}", venueId(), e.toString());
            throw new VenueException(venueId(), VenueErrorType.UPSTREAM_ERROR, "Request failed", e);
        }
    }

    protected VenueException mapStatus(int status, String body) {
        VenueErrorType type;
        if (status == 429) type = VenueErrorType.RATE_LIMITED;
        else if (status == 408 || status == 504) type = VenueErrorType.TIMEOUT;
        else if (status >= 500) type = VenueErrorType.UPSTREAM_ERROR;
        else if (isUnsupportedAnswer(status, body)) type = VenueErrorType.UNSUPPORTED;
        else type = VenueErrorType.UPSTREAM_ERROR;

        if (type != VenueErrorType.UNSUPPORTED) {
            log.warn("Venue error venue={} type={} status={}", venueId(), type, status);
        }
        return new VenueException(venueId(), type, "Venue answered HTTP " + status);
    }

    protected boolean isUnsupportedAnswer(int status, String body) {
        if (status == 404) return true;
        if (status != 400 || body == null) return false;
        String b = body.toLowerCase(Locale.ROOT);
        return b.contains("route") || b.contains("liquidity") || b.contains("not supported")
                || b.contains("not tradable") || b.contains("unsupported");
    }

    protected BigInteger requiredAmount(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            throw new VenueException(venueId(), VenueErrorType.UPSTREAM_ERROR, "Response missing " + field);
        }
        try {
            BigInteger amount = new BigInteger(value.asText().trim());
            if (amount.signum() < 0) {
                throw new VenueException(venueId(), VenueErrorType.UPSTREAM_ERROR, "Negative " + field);
            }
            return amount;
        } catch (NumberFormatException e) {
            throw new VenueException(venueId(), VenueErrorType.UPSTREAM_ERROR, "Invalid " + field, e);
        }
    }

    protected BigInteger optionalAmount(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || value.asText().isBlank()) return null;
        try {
            return new BigInteger(value.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    protected BigInteger executionCost(String chainId, long gasUnits) {
        AppProperties.Chain chain = properties.chains().get(chainId);
        if (chain == null || gasUnits <= 0) return BigInteger.ZERO;
        return chain.gasPrice().multiply(BigInteger.valueOf(gasUnits));
    }

    protected BigInteger venueFee(BigInteger amountOut, VenueDescriptor venue) {
        return amountOut.multiply(BigInteger.valueOf(venue.feePerMille())).divide(BigInteger.valueOf(1000));
    }

    protected RouteHop singleHop(String label, SwapRequest request, BigInteger amountOut, VenueDescriptor venue) {
        return new RouteHop(
                label,
                request.inputToken().address(),
                request.outputToken().address(),
                request.amountIn(),
                amountOut,
                venueFee(amountOut, venue)
        );
    }

    protected static boolean chained(List<RouteHop> hops) {
        if (hops.isEmpty()) return false;
        for (int i = 0; i + 1 < hops.size(); i++) {
            if (!hops.get(i).amountOut().equals(hops.get(i + 1).amountIn())) return false;
        }
        return true;
    }

    protected String baseUrl(VenueDescriptor venue, String fallback) {
        String url = venue.baseUrl();
        if (url == null || url.isBlank()) url = fallback;
        return url.replaceAll("/+$", "");
    }

    protected String configValue(Map<String, String> cfg, String key) {
        if (cfg == null) return null;
        String value = cfg.get(key);
        return value == null || value.isBlank() ? null : value;
    }

    protected Instant now() {
        return clock.instant();
    }

    private static boolean isTimeout(Throwable e) {
        return causedBy(e, java.util.concurrent.TimeoutException.class)
                || causedBy(e, io.netty.handler.timeout.TimeoutException.class)
                || causedBy(e, io.netty.channel.ConnectTimeoutException.class);
    }

    private static boolean causedBy(Throwable e, Class<? extends Throwable> type) {
        Throwable t = e;
        while (t != null) {
            if (type.isInstance(t)) return true;
            t = t.getCause();
        }
        return false;
    }
}
