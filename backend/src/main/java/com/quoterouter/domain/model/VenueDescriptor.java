/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.domain.model;

import java.time.Duration;
import java.util.Set;

public record VenueDescriptor(
        String id,
        String displayName,
        int feePerMille,
        Set<String> supportedChains,
        boolean active,
        long nominalGas,
        String baseUrl,
        String routerAddress,
        LatencyClass latencyClass,
        Duration recoveryTimeout,
        Integer rateLimitPerSecond
) {
    public VenueDescriptor {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("venue id is required");
        if (feePerMille < 0 || feePerMille > 1000) throw new IllegalArgumentException("feePerMille out of range for venue " + id);
        supportedChains = supportedChains == null ? Set.of() : Set.copyOf(supportedChains);
        if (displayName == null || displayName.isBlank()) displayName = id;
        if (latencyClass == null) latencyClass = LatencyClass.STANDARD;
    }

    public boolean supportsChain(String chainId) {
        return chainId != null && supportedChains.contains(chainId);
    }

    public VenueDescriptor withActive(boolean value) {
        return new VenueDescriptor(id, displayName, feePerMille, supportedChains, value, nominalGas, baseUrl,
                routerAddress, latencyClass, recoveryTimeout, rateLimitPerSecond);
    }
}
