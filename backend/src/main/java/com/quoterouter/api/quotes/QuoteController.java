/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.api.quotes;

import com.quoterouter.application.QuoteService;
import com.quoterouter.application.quoting.AggregationResult;
import com.quoterouter.application.quoting.MarketSummary;
import com.quoterouter.application.quoting.RankedQuote;
import com.quoterouter.application.quoting.RiskAssessment;
import com.quoterouter.application.quoting.RiskLevel;
import com.quoterouter.application.quoting.VenueOutcome;
import com.quoterouter.config.AppProperties;
import com.quoterouter.config.RequestIdFilter;
import com.quoterouter.domain.model.Quote;
import com.quoterouter.domain.model.RouteHop;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.slf4j.MDC;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/quotes")
public class QuoteController {
    private final QuoteService quoteService;
    private final Duration freshnessWindow;

    public QuoteController(QuoteService quoteService, AppProperties properties) {
        this.quoteService = quoteService;
        this.freshnessWindow = properties.quoting().freshnessWindow();
    }

    /**
     * Always 200 once the request is valid; "no venue could quote" is status NO_QUOTES_AVAILABLE.
     */
    @PostMapping
    public QuoteResponse quote(@Valid @RequestBody QuoteRequest req) {
        AggregationResult result = quoteService.getQuotes(new QuoteService.QuoteQuery(
                req.inputToken(),
                req.outputToken(),
                req.amount(),
                req.chain(),
                req.slippageTolerance(),
                req.deadlineMs(),
                req.inputDecimals(),
                req.outputDecimals()
        ), MDC.get(RequestIdFilter.MDC_KEY));
        return QuoteResponse.from(result, freshnessWindow);
    }

    public record QuoteRequest(
            @NotBlank String inputToken,
            @NotBlank String outputToken,
            @NotNull BigInteger amount,
            @NotBlank String chain,
            BigDecimal slippageTolerance,
            Long deadlineMs,
            Integer inputDecimals,
            Integer outputDecimals
    ) {}

    public record QuoteResponse(
            AggregationResult.Status status,
            String chain,
            String inputToken,
            String outputToken,
            String amountIn,
            List<QuoteView> quotes,
            List<VenueOutcome> outcomes,
            SummaryView summary,
            RiskAssessment risk,
            long elapsedMs
    ) {
        static QuoteResponse from(AggregationResult result, Duration freshnessWindow) {
            var request = result.request();
            return new QuoteResponse(
                    result.status(),
                    request.chainId(),
                    request.inputToken().address(),
                    request.outputToken().address(),
                    request.amountIn().toString(),
                    result.quotes().stream().map(r -> QuoteView.from(r, freshnessWindow)).toList(),
                    result.outcomes(),
                    SummaryView.from(result.summary()),
                    result.risk(),
                    result.elapsedMs()
            );
        }
    }

    public record QuoteView(
            UUID quoteId,
            String venueId,
            String amountIn,
            String amountOut,
            String netOutput,
            String feeAmount,
            String executionCostInOutput,
            boolean costAdjusted,
            BigDecimal priceImpact,
            RiskLevel risk,
            long estimatedGas,
            String estimatedExecutionCost,
            double confidence,
            Instant quotedAt,
            Instant expiresAt,
            List<HopView> route
    ) {
        static QuoteView from(RankedQuote ranked, Duration freshnessWindow) {
            Quote q = ranked.quote();
            return new QuoteView(
                    q.id(),
                    q.venueId(),
                    q.amountIn().toString(),
                    q.amountOut().toString(),
                    ranked.netOutput().toString(),
                    ranked.feeAmount().toString(),
                    ranked.costInOutput().toString(),
                    ranked.costAdjusted(),
                    q.priceImpact(),
                    ranked.riskLevel(),
                    q.estimatedGas(),
                    q.estimatedExecutionCost().toString(),
                    q.confidence(),
                    q.quotedAt(),
                    q.quotedAt().plus(freshnessWindow),
                    q.route().stream().map(HopView::from).toList()
            );
        }
    }

    public record SummaryView(
            int quoteCount,
            String bestAmountOut,
            String medianAmountOut,
            String averageAmountOut,
            BigDecimal medianPrice,
            BigDecimal averagePrice,
            BigDecimal priceSpread
    ) {
        static SummaryView from(MarketSummary summary) {
            return new SummaryView(
                    summary.quoteCount(),
                    summary.bestAmountOut().toString(),
                    summary.medianAmountOut().toString(),
                    summary.averageAmountOut().toString(),
                    summary.medianPrice(),
                    summary.averagePrice(),
                    summary.priceSpread()
            );
        }
    }

    public record HopView(
            String venueId,
            String inputToken,
            String outputToken,
            String amountIn,
            String amountOut,
            String fee
    ) {
        static HopView from(RouteHop hop) {
            return new HopView(
                    hop.venueId(),
                    hop.inputToken(),
                    hop.outputToken(),
                    hop.amountIn().toString(),
                    hop.amountOut().toString(),
                    hop.fee() == null ? "0" : hop.fee().toString()
            );
        }
    }
}
