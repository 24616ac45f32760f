/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.api.venues;

import com.quoterouter.application.VenueAdapterRegistry;
import com.quoterouter.application.VenueRegistry;
import com.quoterouter.application.resilience.CircuitSnapshot;
import com.quoterouter.application.resilience.VenueResilienceService;
import com.quoterouter.domain.model.LatencyClass;
import com.quoterouter.domain.model.VenueDescriptor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

@RestController
@RequestMapping("/api/venues")
public class VenueStatusController {
    private final VenueRegistry venueRegistry;
    private final VenueAdapterRegistry adapterRegistry;
    private final VenueResilienceService resilienceService;

    public VenueStatusController(
            VenueRegistry venueRegistry,
            VenueAdapterRegistry adapterRegistry,
            VenueResilienceService resilienceService
    ) {
        this.venueRegistry = venueRegistry;
        this.adapterRegistry = adapterRegistry;
        this.resilienceService = resilienceService;
    }

    @GetMapping
    public List<VenueStatusView> list() {
        return venueRegistry.all().stream()
                .map(v -> VenueStatusView.from(
                        v,
                        adapterRegistry.find(v.id()).isPresent(),
                        resilienceService.snapshot(v.id())
                ))
                .toList();
    }

    public record VenueStatusView(
            String id,
            String displayName,
            int feePerMille,
            Set<String> supportedChains,
            boolean active,
            boolean adapterAvailable,
            LatencyClass latencyClass,
            long nominalGas,
            CircuitSnapshot circuit
    ) {
        static VenueStatusView from(VenueDescriptor v, boolean adapterAvailable, CircuitSnapshot circuit) {
            return new VenueStatusView(
                    v.id(),
                    v.displayName(),
                    v.feePerMille(),
                    new TreeSet<>(v.supportedChains()),
                    v.active(),
                    adapterAvailable,
                    v.latencyClass(),
                    v.nominalGas(),
                    circuit
            );
        }
    }
}
