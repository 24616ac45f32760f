/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quoterouter.application.quoting.AggregationResult;
import com.quoterouter.application.quoting.QuoteAggregator;
import com.quoterouter.application.quoting.RankedQuote;
import com.quoterouter.application.quoting.VenueOutcome;
import com.quoterouter.config.AppProperties;
import com.quoterouter.domain.model.SwapRequest;
import com.quoterouter.domain.model.Token;
import com.quoterouter.infrastructure.persistence.entity.QuoteDecisionEntity;
import com.quoterouter.infrastructure.persistence.repository.QuoteDecisionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class QuoteService {
    private static final Logger log = LoggerFactory.getLogger(QuoteService.class);
    static final BigDecimal DEFAULT_SLIPPAGE = new BigDecimal("0.005");

    private final QuoteAggregator aggregator;
    private final TokenDirectory tokenDirectory;
    private final QuoteBook quoteBook;
    private final QuoteDecisionRepository decisionRepository;
    private final AppProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public QuoteService(
            QuoteAggregator aggregator,
            TokenDirectory tokenDirectory,
            QuoteBook quoteBook,
            QuoteDecisionRepository decisionRepository,
            AppProperties properties,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.aggregator = aggregator;
        this.tokenDirectory = tokenDirectory;
        this.quoteBook = quoteBook;
        this.decisionRepository = decisionRepository;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public AggregationResult getQuotes(QuoteQuery query, String requestId) {
        SwapRequest request = toSwapRequest(query);
        AggregationResult result = aggregator.aggregate(request, request.deadline());

        for (RankedQuote ranked : result.quotes()) {
            quoteBook.put(ranked.quote(), request);
        }
        recordDecision(result, requestId);
        return result;
    }

    SwapRequest toSwapRequest(QuoteQuery query) {
        if (query == null) throw new InvalidSwapRequestException("Request body is required");
        String chain = query.chain() == null ? null : query.chain().trim();
        if (chain == null || chain.isEmpty()) {
            throw new InvalidSwapRequestException("chain is required");
        }
        if (query.amount() == null || query.amount().signum() <= 0) {
            throw new InvalidSwapRequestException("amount must be > 0");
        }

        BigDecimal slippage = query.slippageTolerance() == null ? DEFAULT_SLIPPAGE : query.slippageTolerance();
        if (slippage.signum() < 0 || slippage.compareTo(BigDecimal.ONE) >= 0) {
            throw new InvalidSwapRequestException("slippageTolerance must be within [0, 1)");
        }

        Duration budget = query.deadlineMs() == null
                ? properties.quoting().defaultDeadline()
                : Duration.ofMillis(query.deadlineMs());
        if (budget.isNegative() || budget.isZero()) {
            throw new InvalidSwapRequestException("deadlineMs must be > 0");
        }
        if (budget.compareTo(properties.quoting().maxDeadline()) > 0) {
            throw new InvalidSwapRequestException("deadlineMs must not exceed " + properties.quoting().maxDeadline().toMillis());
        }

        Token input = tokenDirectory.resolve(query.inputToken(), chain, query.inputDecimals());
        Token output = tokenDirectory.resolve(query.outputToken(), chain, query.outputDecimals());
        if (input.sameAs(output)) {
            throw new InvalidSwapRequestException("inputToken and outputToken must differ");
        }

        Instant deadline = clock.instant().plus(budget);
        return new SwapRequest(input, output, query.amount(), slippage, deadline);
    }

    private void recordDecision(AggregationResult result, String requestId) {
        SwapRequest request = result.request();
        QuoteDecisionEntity decision = new QuoteDecisionEntity();
        decision.setChainId(request.chainId());
        decision.setInputToken(request.inputToken().address());
        decision.setOutputToken(request.outputToken().address());
        decision.setAmountIn(request.amountIn().toString());
        decision.setStatus(result.status().name());
        if (!result.quotes().isEmpty()) {
            RankedQuote best = result.quotes().get(0);
            decision.setBestVenueId(best.quote().venueId());
            decision.setBestQuoteId(best.quote().id());
        }
        decision.setOutcomesJson(outcomesJson(result));
        decision.setElapsedMs(result.elapsedMs());
        decision.setRequestId(requestId);
        decision.setCreatedAt(result.startedAt());
        try {
            decisionRepository.save(decision);
        } catch (DataAccessException e) {
            log.warn("Quote decision not recorded requestId={} error={}", requestId, e.getMessage());
        }
    }

    private String outcomesJson(AggregationResult result) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (VenueOutcome outcome : result.outcomes()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("venueId", outcome.venueId());
            row.put("kind", outcome.kind().name());
            row.put("latencyMs", outcome.latencyMs());
            result.quotes().stream()
                    .filter(r -> r.quote().venueId().equals(outcome.venueId()))
                    .findFirst()
                    .ifPresent(r -> {
                        row.put("amountOut", r.quote().amountOut().toString());
                        row.put("netOutput", r.netOutput().toString());
                        row.put("costAdjusted", r.costAdjusted());
                        row.put("priceImpact", r.quote().priceImpact() == null ? null : r.quote().priceImpact().toPlainString());
                        row.put("risk", r.riskLevel().name());
                    });
            if (outcome.message() != null) row.put("message", outcome.message());
            rows.add(row);
        }
        try {
            return objectMapper.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            return "[]";
        }
    }

    public record QuoteQuery(
            String inputToken,
            String outputToken,
            BigInteger amount,
            String chain,
            BigDecimal slippageTolerance,
            Long deadlineMs,
            Integer inputDecimals,
            Integer outputDecimals
    ) {}
}
