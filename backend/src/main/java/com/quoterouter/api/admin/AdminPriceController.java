/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.api.admin;

import com.quoterouter.application.quoting.PriceReferenceStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

@RestController
@RequestMapping("/api/admin/prices")
public class AdminPriceController {
    private final PriceReferenceStore priceStore;
    private final Clock clock;

    public AdminPriceController(PriceReferenceStore priceStore, Clock clock) {
        this.priceStore = priceStore;
        this.clock = clock;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void push(@Valid @RequestBody PriceUpdateRequest req) {
        Instant observedAt = req.observedAt() == null ? clock.instant() : req.observedAt();
        priceStore.update(req.chainId(), req.base(), req.quote(), req.price(), observedAt);
    }

    public record PriceUpdateRequest(
            @NotBlank String chainId,
            @NotBlank String base,
            @NotBlank String quote,
            @NotNull @Positive BigDecimal price,
            Instant observedAt
    ) {}
}
