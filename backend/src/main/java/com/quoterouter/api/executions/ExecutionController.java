/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.api.executions;

import com.quoterouter.api.ApiException;
import com.quoterouter.application.ExecutionDescriptor;
import com.quoterouter.application.ExecutionService;
import com.quoterouter.domain.model.ExecutionStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/executions")
public class ExecutionController {
    private final ExecutionService executionService;

    public ExecutionController(ExecutionService executionService) {
        this.executionService = executionService;
    }

    @PostMapping
    public ExecutionResponse build(@Valid @RequestBody BuildExecutionRequest req) {
        return ExecutionResponse.from(executionService.buildExecution(req.quoteId(), req.slippageTolerance()));
    }

    @GetMapping("/{id}")
    public ExecutionResponse get(@PathVariable("id") UUID executionId) {
        return executionService.get(executionId)
                .map(ExecutionResponse::from)
                .orElseThrow(() -> new ApiException(HttpStatus.NOT_FOUND, "Execution not found"));
    }

    @GetMapping
    public List<ExecutionResponse> list(@RequestParam(value = "status", required = false) ExecutionStatus status) {
        return executionService.list(status).stream().map(ExecutionResponse::from).toList();
    }

    @PostMapping("/{id}/status")
    public ExecutionResponse transition(
            @PathVariable("id") UUID executionId,
            @Valid @RequestBody StatusUpdateRequest req
    ) {
        return ExecutionResponse.from(executionService.transition(executionId, req.status(), req.txReference()));
    }

    public record BuildExecutionRequest(
            @NotNull UUID quoteId,
            BigDecimal slippageTolerance
    ) {}

    public record StatusUpdateRequest(
            @NotNull ExecutionStatus status,
            @Size(max = 200) String txReference
    ) {}

    public record ExecutionResponse(
            UUID executionId,
            UUID quoteId,
            String venueId,
            String chainId,
            String target,
            String payload,
            String value,
            long gasLimit,
            String amountIn,
            String expectedAmountOut,
            String minAmountOut,
            ExecutionStatus status,
            String txReference,
            Instant createdAt,
            Instant updatedAt
    ) {
        static ExecutionResponse from(ExecutionDescriptor d) {
            return new ExecutionResponse(
                    d.id(),
                    d.quoteId(),
                    d.venueId(),
                    d.chainId(),
                    d.target(),
                    d.payload(),
                    d.value().toString(),
                    d.gasLimit(),
                    d.amountIn().toString(),
                    d.expectedAmountOut().toString(),
                    d.minAmountOut().toString(),
                    d.status(),
                    d.txReference(),
                    d.createdAt(),
                    d.updatedAt()
            );
        }
    }
}
