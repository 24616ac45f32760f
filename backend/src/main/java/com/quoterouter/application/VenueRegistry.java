/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application;

import com.quoterouter.config.AppProperties;
import com.quoterouter.domain.model.VenueDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide venue metadata. Read-mostly: lookups take the read lock, a reload swaps the whole
 * table under the write lock.
 */
@Component
public class VenueRegistry {
    private static final Logger log = LoggerFactory.getLogger(VenueRegistry.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private Map<String, VenueDescriptor> venues = Map.of();
    private Map<String, Map<String, String>> settings = Map.of();

    public VenueRegistry(AppProperties properties) {
        replaceAll(properties.venues());
    }

    public List<VenueDescriptor> all() {
        lock.readLock().lock();
        try {
            return venues.values().stream()
                    .sorted(Comparator.comparing(VenueDescriptor::id))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<VenueDescriptor> find(String venueId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(venues.get(venueId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<VenueDescriptor> eligibleFor(String chainId) {
        return all().stream()
                .filter(VenueDescriptor::active)
                .filter(v -> v.supportsChain(chainId))
                .toList();
    }

    /**
     * Venue secrets and tuning (API keys and such), never exposed through {@link VenueDescriptor}.
     */
    public Map<String, String> settingsFor(String venueId) {
        lock.readLock().lock();
        try {
            return settings.getOrDefault(venueId, Map.of());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces every venue. An entry without a {@code config} map keeps the settings previously
     * held for the same id.
     */
    public List<VenueDescriptor> replaceAll(List<AppProperties.Venue> definitions) {
        Map<String, VenueDescriptor> nextVenues = new LinkedHashMap<>();
        Map<String, Map<String, String>> nextSettings = new HashMap<>();

        lock.writeLock().lock();
        try {
            for (AppProperties.Venue def : definitions) {
                VenueDescriptor descriptor = toDescriptor(def);
                if (nextVenues.putIfAbsent(descriptor.id(), descriptor) != null) {
                    throw new IllegalArgumentException("Duplicate venue id: " + descriptor.id());
                }
                Map<String, String> cfg = def.config() != null
                        ? Map.copyOf(def.config())
                        : settings.getOrDefault(descriptor.id(), Map.of());
                nextSettings.put(descriptor.id(), cfg);
            }
            venues = Map.copyOf(nextVenues);
            settings = Map.copyOf(nextSettings);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Venue registry loaded venues={}", nextVenues.keySet());
        return new ArrayList<>(nextVenues.values());
    }

    public VenueDescriptor setActive(String venueId, boolean active) {
        lock.writeLock().lock();
        try {
            VenueDescriptor current = venues.get(venueId);
            if (current == null) {
                throw new IllegalArgumentException("Unknown venue: " + venueId);
            }
            VenueDescriptor updated = current.withActive(active);
            Map<String, VenueDescriptor> next = new HashMap<>(venues);
            next.put(venueId, updated);
            venues = Map.copyOf(next);
            log.info("Venue toggled venue={} active={}", venueId, active);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    static VenueDescriptor toDescriptor(AppProperties.Venue def) {
        if (def == null) {
            throw new IllegalArgumentException("Venue definition is required");
        }
        return new VenueDescriptor(
                def.id() == null ? null : def.id().trim(),
                def.displayName(),
                def.feePerMille(),
                def.supportedChains(),
                def.active() == null || def.active(),
                def.nominalGas(),
                def.baseUrl(),
                def.routerAddress(),
                def.latencyClass(),
                def.recoveryTimeout(),
                def.rateLimitPerSecond()
        );
    }
}
