/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application;

import com.quoterouter.domain.model.ExecutionStatus;
import com.quoterouter.infrastructure.persistence.entity.ExecutionEntity;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * What an external signer needs to carry out a chosen quote: call {@code target} with
 * {@code payload}, attaching {@code value}, within {@code gasLimit}.
 */
public record ExecutionDescriptor(
        UUID id,
        UUID quoteId,
        String venueId,
        String chainId,
        String target,
        String payload,
        BigInteger value,
        long gasLimit,
        BigInteger amountIn,
        BigInteger expectedAmountOut,
        BigInteger minAmountOut,
        ExecutionStatus status,
        String txReference,
        Instant createdAt,
        Instant updatedAt
) {
    public static ExecutionDescriptor from(ExecutionEntity e) {
        return new ExecutionDescriptor(
                e.getId(),
                e.getQuoteId(),
                e.getVenueId(),
                e.getChainId(),
                e.getTarget(),
                e.getPayload(),
                new BigInteger(e.getValue()),
                e.getGasLimit(),
                new BigInteger(e.getAmountIn()),
                new BigInteger(e.getExpectedAmountOut()),
                new BigInteger(e.getMinAmountOut()),
                e.getStatus(),
                e.getTxReference(),
                e.getCreatedAt(),
                e.getUpdatedAt()
        );
    }
}
