/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.infrastructure.persistence.repository;

import com.quoterouter.domain.model.ExecutionStatus;
import com.quoterouter.infrastructure.persistence.entity.ExecutionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ExecutionRepository extends JpaRepository<ExecutionEntity, UUID> {
    Optional<ExecutionEntity> findByQuoteId(UUID quoteId);

    @Query("""
            select e from ExecutionEntity e
            where (:status is null or e.status = :status)
            order by e.createdAt desc
            """)
    List<ExecutionEntity> search(@Param("status") ExecutionStatus status);
}
