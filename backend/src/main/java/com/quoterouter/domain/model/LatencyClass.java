/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.domain.model;

public enum LatencyClass {
    FAST,
    STANDARD,
    SLOW
}
