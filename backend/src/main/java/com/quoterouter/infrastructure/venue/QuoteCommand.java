/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.infrastructure.venue;

import com.quoterouter.domain.model.SwapRequest;
import com.quoterouter.domain.model.VenueDescriptor;

import java.time.Duration;
import java.util.Map;

public record QuoteCommand(
        SwapRequest request,
        VenueDescriptor venue,
        Duration timeout,
        Map<String, String> venueConfig
) {}
