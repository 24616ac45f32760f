/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.domain.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

public record SwapRequest(
        Token inputToken,
        Token outputToken,
        BigInteger amountIn,
        BigDecimal slippageTolerance,
        Instant deadline
) {
    public String chainId() {
        return inputToken.chainId();
    }
}
