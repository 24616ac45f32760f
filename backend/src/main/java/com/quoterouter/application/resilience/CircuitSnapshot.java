/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.resilience;

import com.quoterouter.domain.model.CircuitState;

import java.time.Instant;

public record CircuitSnapshot(
        String venueId,
        CircuitState state,
        int failureCount,
        Instant lastFailureAt,
        Instant nextRetryAt,
        int consecutiveOpens,
        long totalCalls,
        long successes,
        long failures,
        long rejections
) {
    public static CircuitSnapshot initial(String venueId) {
        return new CircuitSnapshot(venueId, CircuitState.CLOSED, 0, null, null, 0, 0, 0, 0, 0);
    }
}
