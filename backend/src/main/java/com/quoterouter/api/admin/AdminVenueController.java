/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.api.admin;

import com.quoterouter.application.VenueRegistry;
import com.quoterouter.application.resilience.VenueResilienceService;
import com.quoterouter.config.AppProperties;
import com.quoterouter.domain.model.LatencyClass;
import com.quoterouter.domain.model.VenueDescriptor;
import com.quoterouter.infrastructure.persistence.entity.QuoteDecisionEntity;
import com.quoterouter.infrastructure.persistence.repository.QuoteDecisionRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/admin")
@Validated
public class AdminVenueController {
    private final VenueRegistry venueRegistry;
    private final VenueResilienceService resilienceService;
    private final QuoteDecisionRepository quoteDecisionRepository;

    public AdminVenueController(
            VenueRegistry venueRegistry,
            VenueResilienceService resilienceService,
            QuoteDecisionRepository quoteDecisionRepository
    ) {
        this.venueRegistry = venueRegistry;
        this.resilienceService = resilienceService;
        this.quoteDecisionRepository = quoteDecisionRepository;
    }

    // Replaces the whole registry. Circuit state of venues that remain is kept.
    @PutMapping("/venues")
    public List<VenueDescriptor> replaceVenues(@RequestBody List<@Valid VenueDefinitionRequest> req) {
        if (req == null || req.isEmpty()) {
            throw new IllegalArgumentException("At least one venue is required");
        }
        List<VenueDescriptor> loaded = venueRegistry.replaceAll(req.stream().map(VenueDefinitionRequest::toDefinition).toList());
        resilienceService.reconfigure(loaded);
        return venueRegistry.all();
    }

    @PatchMapping("/venues/{id}")
    public VenueDescriptor toggle(@PathVariable("id") String venueId, @Valid @RequestBody ToggleVenueRequest req) {
        return venueRegistry.setActive(venueId, req.active());
    }

    @GetMapping("/quote-decisions")
    public List<QuoteDecisionEntity> decisions(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "chain", required = false) String chainId
    ) {
        return quoteDecisionRepository.search(from, to, chainId);
    }

    public record VenueDefinitionRequest(
            @NotBlank String id,
            String displayName,
            @Min(0) @Max(1000) int feePerMille,
            @NotEmpty Set<String> supportedChains,
            Boolean active,
            @Min(0) long nominalGas,
            String baseUrl,
            String routerAddress,
            LatencyClass latencyClass,
            Long recoveryTimeoutMs,
            Integer rateLimitPerSecond,
            Map<String, String> config
    ) {
        AppProperties.Venue toDefinition() {
            return new AppProperties.Venue(
                    id,
                    displayName,
                    feePerMille,
                    supportedChains,
                    active,
                    nominalGas,
                    baseUrl,
                    routerAddress,
                    latencyClass,
                    recoveryTimeoutMs == null ? null : Duration.ofMillis(recoveryTimeoutMs),
                    rateLimitPerSecond,
                    config
            );
        }
    }

    public record ToggleVenueRequest(@NotNull Boolean active) {}
}
