/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.infrastructure.persistence.entity;

import com.quoterouter.domain.model.ExecutionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * Amounts are kept as decimal strings: token amounts routinely exceed 64 bits.
 */
@Entity
@Table(name = "executions")
public class ExecutionEntity {
    @Id
    @JdbcTypeCode(SqlTypes.CHAR)
    @Column(name = "id", nullable = false, length = 36)
    private UUID id;

    @JdbcTypeCode(SqlTypes.CHAR)
    @Column(name = "quote_id", nullable = false, length = 36, unique = true)
    private UUID quoteId;

    @Column(name = "venue_id", nullable = false)
    private String venueId;

    @Column(name = "chain_id", nullable = false)
    private String chainId;

    @Column(name = "target", nullable = false)
    private String target;

    @Column(name = "payload", nullable = false)
    private String payload;

    @Column(name = "value_amount", nullable = false)
    private String value;

    @Column(name = "gas_limit", nullable = false)
    private long gasLimit;

    @Column(name = "amount_in", nullable = false)
    private String amountIn;

    @Column(name = "expected_amount_out", nullable = false)
    private String expectedAmountOut;

    @Column(name = "min_amount_out", nullable = false)
    private String minAmountOut;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private ExecutionStatus status;

    @Column(name = "tx_reference")
    private String txReference;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        if (id == null) id = UUID.randomUUID();
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = createdAt;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getQuoteId() {
        return quoteId;
    }

    public void setQuoteId(UUID quoteId) {
        this.quoteId = quoteId;
    }

    public String getVenueId() {
        return venueId;
    }

    public void setVenueId(String venueId) {
        this.venueId = venueId;
    }

    public String getChainId() {
        return chainId;
    }

    public void setChainId(String chainId) {
        this.chainId = chainId;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public long getGasLimit() {
        return gasLimit;
    }

    public void setGasLimit(long gasLimit) {
        this.gasLimit = gasLimit;
    }

    public String getAmountIn() {
        return amountIn;
    }

    public void setAmountIn(String amountIn) {
        this.amountIn = amountIn;
    }

    public String getExpectedAmountOut() {
        return expectedAmountOut;
    }

    public void setExpectedAmountOut(String expectedAmountOut) {
        this.expectedAmountOut = expectedAmountOut;
    }

    public String getMinAmountOut() {
        return minAmountOut;
    }

    public void setMinAmountOut(String minAmountOut) {
        this.minAmountOut = minAmountOut;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    public String getTxReference() {
        return txReference;
    }

    public void setTxReference(String txReference) {
        this.txReference = txReference;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
