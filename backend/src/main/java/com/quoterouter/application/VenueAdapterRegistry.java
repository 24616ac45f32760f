/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application;

import com.quoterouter.infrastructure.venue.VenueQuoteAdapter;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Component
public class VenueAdapterRegistry {

    private final List<VenueQuoteAdapter> adapters;
    private volatile Map<String, VenueQuoteAdapter> adaptersByVenue;

    public VenueAdapterRegistry(List<VenueQuoteAdapter> adapters) {
        this.adapters = adapters == null ? List.of() : List.copyOf(adapters);
    }

    public VenueQuoteAdapter getRequired(String venueId) {
        VenueQuoteAdapter adapter = ensureInitialized().get(venueId);
        if (adapter == null) {
            throw new IllegalArgumentException("No adapter registered for venue=" + venueId);
        }
        return adapter;
    }

    public Optional<VenueQuoteAdapter> find(String venueId) {
        return Optional.ofNullable(ensureInitialized().get(venueId));
    }

    public Set<String> registeredVenues() {
        return Collections.unmodifiableSet(ensureInitialized().keySet());
    }

    private Map<String, VenueQuoteAdapter> ensureInitialized() {
        Map<String, VenueQuoteAdapter> snapshot = adaptersByVenue;
        if (snapshot != null) {
            return snapshot;
        }
        synchronized (this) {
            if (adaptersByVenue == null) {
                adaptersByVenue = buildRegistry();
            }
            return adaptersByVenue;
        }
    }

    private Map<String, VenueQuoteAdapter> buildRegistry() {
        Map<String, VenueQuoteAdapter> registry = new HashMap<>();
        for (VenueQuoteAdapter adapter : adapters) {
            if (adapter == null) {
                throw new IllegalStateException("VenueQuoteAdapter list contains null");
            }

            String venueId = adapter.venueId();
            if (venueId == null || venueId.isBlank()) {
                throw new IllegalStateException(
                        "VenueQuoteAdapter " + adapter.getClass().getName() + " returned a blank venueId"
                );
            }

            VenueQuoteAdapter existing = registry.putIfAbsent(venueId, adapter);
            if (existing != null) {
                throw new IllegalStateException(
                        "Duplicate adapter for venue=" + venueId
                                + ". Existing=" + existing.getClass().getName()
                                + ", new=" + adapter.getClass().getName()
                );
            }
        }
        return Map.copyOf(registry);
    }
}
