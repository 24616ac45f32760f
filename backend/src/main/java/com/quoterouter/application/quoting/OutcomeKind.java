/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.quoting;

import com.quoterouter.infrastructure.venue.VenueErrorType;

public enum OutcomeKind {
    QUOTED,
    UNSUPPORTED,
    TIMEOUT,
    RATE_LIMITED,
    CIRCUIT_OPEN,
    UPSTREAM_ERROR,
    DEADLINE_EXCEEDED,
    CAPACITY_EXHAUSTED;

    public static OutcomeKind from(VenueErrorType type) {
        return switch (type) {
            case UNSUPPORTED -> UNSUPPORTED;
            case TIMEOUT -> TIMEOUT;
            case RATE_LIMITED -> RATE_LIMITED;
            case CIRCUIT_OPEN -> CIRCUIT_OPEN;
            case UPSTREAM_ERROR -> UPSTREAM_ERROR;
            case CAPACITY_EXHAUSTED -> CAPACITY_EXHAUSTED;
        };
    }
}
