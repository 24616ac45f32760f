/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "quote_decisions")
public class QuoteDecisionEntity {
    @Id
    @JdbcTypeCode(SqlTypes.CHAR)
    @Column(name = "id", nullable = false, length = 36)
    private UUID id;

    @Column(name = "chain_id", nullable = false)
    private String chainId;

    @Column(name = "input_token", nullable = false)
    private String inputToken;

    @Column(name = "output_token", nullable = false)
    private String outputToken;

    @Column(name = "amount_in", nullable = false)
    private String amountIn;

    @Column(name = "status", nullable = false)
    private String status;

    @Column(name = "best_venue_id")
    private String bestVenueId;

    @JdbcTypeCode(SqlTypes.CHAR)
    @Column(name = "best_quote_id", length = 36)
    private UUID bestQuoteId;

    @Column(name = "outcomes_json", nullable = false)
    private String outcomesJson;

    @Column(name = "elapsed_ms", nullable = false)
    private long elapsedMs;

    @Column(name = "request_id")
    private String requestId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (id == null) id = UUID.randomUUID();
        if (createdAt == null) createdAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getChainId() {
        return chainId;
    }

    public void setChainId(String chainId) {
        this.chainId = chainId;
    }

    public String getInputToken() {
        return inputToken;
    }

    public void setInputToken(String inputToken) {
        this.inputToken = inputToken;
    }

    public String getOutputToken() {
        return outputToken;
    }

    public void setOutputToken(String outputToken) {
        this.outputToken = outputToken;
    }

    public String getAmountIn() {
        return amountIn;
    }

    public void setAmountIn(String amountIn) {
        this.amountIn = amountIn;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getBestVenueId() {
        return bestVenueId;
    }

    public void setBestVenueId(String bestVenueId) {
        this.bestVenueId = bestVenueId;
    }

    public UUID getBestQuoteId() {
        return bestQuoteId;
    }

    public void setBestQuoteId(UUID bestQuoteId) {
        this.bestQuoteId = bestQuoteId;
    }

    public String getOutcomesJson() {
        return outcomesJson;
    }

    public void setOutcomesJson(String outcomesJson) {
        this.outcomesJson = outcomesJson;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public void setElapsedMs(long elapsedMs) {
        this.elapsedMs = elapsedMs;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
