/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application;

public enum ExecutionErrorType {
    STALE_QUOTE,
    SLIPPAGE_EXCEEDED,
    PRICE_IMPACT_UNVERIFIED,
    INVALID_STATUS_TRANSITION
}
