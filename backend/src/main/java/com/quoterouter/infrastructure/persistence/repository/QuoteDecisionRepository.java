/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.infrastructure.persistence.repository;

import com.quoterouter.infrastructure.persistence.entity.QuoteDecisionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface QuoteDecisionRepository extends JpaRepository<QuoteDecisionEntity, UUID> {
    @Query("""
            select d from QuoteDecisionEntity d
            where (:from is null or d.createdAt >= :from)
              and (:to is null or d.createdAt <= :to)
              and (:chainId is null or d.chainId = :chainId)
            order by d.createdAt desc
            """)
    List<QuoteDecisionEntity> search(
            @Param("from") Instant from,
            @Param("to") Instant to,
            @Param("chainId") String chainId
    );
}
