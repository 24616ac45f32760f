/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.infrastructure.venue;

public enum VenueErrorType {
    UNSUPPORTED(false, false),
    TIMEOUT(true, true),
    RATE_LIMITED(true, true),
    UPSTREAM_ERROR(true, true),
    CIRCUIT_OPEN(true, false),
    CAPACITY_EXHAUSTED(false, false);

    private final boolean retryable;
    private final boolean countsAsFailure;

    VenueErrorType(boolean retryable, boolean countsAsFailure) {
        this.retryable = retryable;
        this.countsAsFailure = countsAsFailure;
    }

    public boolean isRetryable() {
        return retryable;
    }

    // Whether the error should move the venue's circuit toward OPEN. CIRCUIT_OPEN and
    // CAPACITY_EXHAUSTED are raised locally, UNSUPPORTED means the venue answered.
    public boolean countsAsFailure() {
        return countsAsFailure;
    }
}
