/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.quoting;

public record VenueOutcome(
        String venueId,
        OutcomeKind kind,
        long latencyMs,
        String message
) {}
