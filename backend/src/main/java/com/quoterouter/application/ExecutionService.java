/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quoterouter.api.ApiException;
import com.quoterouter.config.AppProperties;
import com.quoterouter.domain.model.ExecutionStatus;
import com.quoterouter.domain.model.Quote;
import com.quoterouter.domain.model.RouteHop;
import com.quoterouter.domain.model.SwapRequest;
import com.quoterouter.domain.model.VenueDescriptor;
import com.quoterouter.infrastructure.persistence.entity.ExecutionEntity;
import com.quoterouter.infrastructure.persistence.repository.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class ExecutionService {
    private static final Logger log = LoggerFactory.getLogger(ExecutionService.class);

    private final ExecutionRepository executionRepository;
    private final QuoteBook quoteBook;
    private final VenueRegistry venueRegistry;
    private final TokenDirectory tokenDirectory;
    private final AppProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ExecutionService(
            ExecutionRepository executionRepository,
            QuoteBook quoteBook,
            VenueRegistry venueRegistry,
            TokenDirectory tokenDirectory,
            AppProperties properties,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.executionRepository = executionRepository;
        this.quoteBook = quoteBook;
        this.venueRegistry = venueRegistry;
        this.tokenDirectory = tokenDirectory;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Idempotent per quote: a second call for the same quote returns the descriptor built by the first.
     *
     * @param slippageTolerance overrides the tolerance of the original request when not null
     */
    public ExecutionDescriptor buildExecution(UUID quoteId, BigDecimal slippageTolerance) {
        QuoteBook.Entry entry = quoteBook.find(quoteId)
                .orElseThrow(() -> new ApiException(HttpStatus.NOT_FOUND, "Quote not found"));
        Quote quote = entry.quote();
        SwapRequest request = entry.request();
        Instant now = clock.instant();

        if (!quote.isFreshAt(now, properties.quoting().freshnessWindow())) {
            log.info("Stale quote rejected quoteId={} ageMs={}", quoteId, quote.ageAt(now).toMillis());
            throw new ExecutionRejectedException(ExecutionErrorType.STALE_QUOTE,
                    "Quote is older than " + properties.quoting().freshnessWindow().toSeconds() + "s; request a new quote");
        }

        BigDecimal tolerance = slippageTolerance != null ? slippageTolerance : request.slippageTolerance();
        if (tolerance == null || tolerance.signum() < 0 || tolerance.compareTo(BigDecimal.ONE) >= 0) {
            throw new InvalidSwapRequestException("slippageTolerance must be within [0, 1)");
        }
        if (!quote.hasKnownPriceImpact()) {
            log.info("Unverified price impact rejected quoteId={} venue={}", quoteId, quote.venueId());
            throw new ExecutionRejectedException(ExecutionErrorType.PRICE_IMPACT_UNVERIFIED,
                    "Price impact of this quote could not be checked against a reference price");
        }
        if (quote.priceImpact().compareTo(tolerance) > 0) {
            throw new ExecutionRejectedException(ExecutionErrorType.SLIPPAGE_EXCEEDED,
                    "Price impact " + quote.priceImpact().toPlainString() + " exceeds tolerance " + tolerance.toPlainString());
        }

        Optional<ExecutionEntity> existing = executionRepository.findByQuoteId(quoteId);
        if (existing.isPresent()) {
            return ExecutionDescriptor.from(existing.get());
        }

        VenueDescriptor venue = venueRegistry.find(quote.venueId())
                .orElseThrow(() -> new ApiException(HttpStatus.CONFLICT, "Venue " + quote.venueId() + " is no longer registered"));
        if (venue.routerAddress() == null || venue.routerAddress().isBlank()) {
            throw new ApiException(HttpStatus.CONFLICT, "Venue " + venue.id() + " has no router address");
        }

        BigInteger minAmountOut = minAmountOut(quote.amountOut(), tolerance);
        Instant executeBy = quote.quotedAt().plus(properties.quoting().freshnessWindow());

        ExecutionEntity entity = new ExecutionEntity();
        entity.setQuoteId(quoteId);
        entity.setVenueId(venue.id());
        entity.setChainId(request.chainId());
        entity.setTarget(venue.routerAddress());
        entity.setPayload(payload(quote, request, minAmountOut, executeBy));
        entity.setValue((tokenDirectory.isNative(request.inputToken()) ? quote.amountIn() : BigInteger.ZERO).toString());
        entity.setGasLimit(gasLimit(quote.estimatedGas()));
        entity.setAmountIn(quote.amountIn().toString());
        entity.setExpectedAmountOut(quote.amountOut().toString());
        entity.setMinAmountOut(minAmountOut.toString());
        entity.setStatus(ExecutionStatus.PENDING);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);

        try {
            ExecutionEntity saved = executionRepository.saveAndFlush(entity);
            log.info("Execution built executionId={} quoteId={} venue={}", saved.getId(), quoteId, venue.id());
            return ExecutionDescriptor.from(saved);
        } catch (DataIntegrityViolationException e) {
            // concurrent build for the same quote won the unique index
            return executionRepository.findByQuoteId(quoteId)
                    .map(ExecutionDescriptor::from)
                    .orElseThrow(() -> e);
        }
    }

    @Transactional
    public ExecutionDescriptor transition(UUID executionId, ExecutionStatus next, String txReference) {
        if (next == null) {
            throw new IllegalArgumentException("status is required");
        }
        ExecutionEntity entity = executionRepository.findById(executionId)
                .orElseThrow(() -> new ApiException(HttpStatus.NOT_FOUND, "Execution not found"));
        ExecutionStatus current = entity.getStatus();
        if (!current.canTransitionTo(next)) {
            throw new ExecutionRejectedException(ExecutionErrorType.INVALID_STATUS_TRANSITION,
                    "Cannot move execution from " + current + " to " + next);
        }

        entity.setStatus(next);
        if (txReference != null && !txReference.isBlank()) {
            entity.setTxReference(txReference.trim());
        }
        entity.setUpdatedAt(clock.instant());
        ExecutionEntity saved = executionRepository.save(entity);
        log.info("Execution transition executionId={} from={} to={}", executionId, current, next);
        return ExecutionDescriptor.from(saved);
    }

    public Optional<ExecutionDescriptor> get(UUID executionId) {
        return executionRepository.findById(executionId).map(ExecutionDescriptor::from);
    }

    public List<ExecutionDescriptor> list(ExecutionStatus status) {
        return executionRepository.search(status).stream().map(ExecutionDescriptor::from).toList();
    }

    static BigInteger minAmountOut(BigInteger amountOut, BigDecimal tolerance) {
        return new BigDecimal(amountOut)
                .multiply(BigDecimal.ONE.subtract(tolerance))
                .setScale(0, RoundingMode.FLOOR)
                .toBigInteger();
    }

    private long gasLimit(long estimatedGas) {
        return BigDecimal.valueOf(estimatedGas)
                .multiply(BigDecimal.valueOf(properties.quoting().gasLimitMultiplier()))
                .setScale(0, RoundingMode.CEILING)
                .longValueExact();
    }

    // Hex of the UTF-8 JSON route instruction; keys are written in a fixed order.
    private String payload(Quote quote, SwapRequest request, BigInteger minAmountOut, Instant executeBy) {
        Map<String, Object> instruction = new LinkedHashMap<>();
        instruction.put("quoteId", quote.id().toString());
        instruction.put("venue", quote.venueId());
        instruction.put("chainId", request.chainId());
        instruction.put("inputToken", request.inputToken().address());
        instruction.put("outputToken", request.outputToken().address());
        instruction.put("amountIn", quote.amountIn().toString());
        instruction.put("amountOut", quote.amountOut().toString());
        instruction.put("minAmountOut", minAmountOut.toString());
        List<Map<String, Object>> hops = new ArrayList<>();
        for (RouteHop hop : quote.route()) {
            Map<String, Object> h = new LinkedHashMap<>();
            h.put("venue", hop.venueId());
            h.put("inputToken", hop.inputToken());
            h.put("outputToken", hop.outputToken());
            h.put("amountIn", hop.amountIn().toString());
            h.put("amountOut", hop.amountOut().toString());
            hops.add(h);
        }
        instruction.put("hops", hops);
        instruction.put("deadline", executeBy.getEpochSecond());
        try {
            byte[] json = objectMapper.writeValueAsString(instruction).getBytes(StandardCharsets.UTF_8);
            return "0x" + HexFormat.of().formatHex(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode execution payload", e);
        }
    }
}
