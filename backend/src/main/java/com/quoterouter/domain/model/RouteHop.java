/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.domain.model;

import java.math.BigInteger;

public record RouteHop(
        String venueId,
        String inputToken,
        String outputToken,
        BigInteger amountIn,
        BigInteger amountOut,
        BigInteger fee
) {}
