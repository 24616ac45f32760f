/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application.quoting;

import java.math.BigDecimal;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    static final BigDecimal MEDIUM_IMPACT = new BigDecimal("0.005");
    static final BigDecimal HIGH_IMPACT = new BigDecimal("0.02");
    static final double MEDIUM_CONFIDENCE = 0.8;
    static final double HIGH_CONFIDENCE = 0.6;

    // An impact nobody could verify is treated as the worst case.
    public static RiskLevel forImpact(BigDecimal impact) {
        if (impact == null || impact.compareTo(HIGH_IMPACT) > 0) return HIGH;
        if (impact.compareTo(MEDIUM_IMPACT) > 0) return MEDIUM;
        return LOW;
    }

    public static RiskLevel forConfidence(double confidence) {
        if (confidence < HIGH_CONFIDENCE) return HIGH;
        if (confidence < MEDIUM_CONFIDENCE) return MEDIUM;
        return LOW;
    }

    public RiskLevel max(RiskLevel other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
