/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.domain.model;

public enum ExecutionStatus {
    PENDING,
    SUBMITTED,
    CONFIRMED,
    FAILED;

    public boolean isTerminal() {
        return this == CONFIRMED || this == FAILED;
    }

    // Status only moves forward: PENDING -> SUBMITTED -> {CONFIRMED | FAILED}.
    // PENDING -> FAILED covers a signer that declines before broadcasting.
    public boolean canTransitionTo(ExecutionStatus next) {
        if (next == null) return false;
        return switch (this) {
            case PENDING -> next == SUBMITTED || next == FAILED;
            case SUBMITTED -> next == CONFIRMED || next == FAILED;
            case CONFIRMED, FAILED -> false;
        };
    }
}
