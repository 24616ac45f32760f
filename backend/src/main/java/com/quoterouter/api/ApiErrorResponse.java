/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.api;

public record ApiErrorResponse(
        String status,
        String code,
        String message,
        String requestId
) {}
