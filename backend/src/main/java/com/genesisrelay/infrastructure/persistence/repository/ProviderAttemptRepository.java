/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.persistence.repository;

import com.genesisrelay.infrastructure.persistence.entity.ProviderAttemptEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface ProviderAttemptRepository extends JpaRepository<ProviderAttemptEntity, UUID> {
    @Query("""
            select a from ProviderAttemptEntity a
            where (:from is null or a.createdAt >= :from)
              and (:to is null or a.createdAt <= :to)
              and (:providerId is null or a.providerId = :providerId)
            order by a.createdAt desc
            """)
    List<ProviderAttemptEntity> search(
            @Param("from") Instant from,
            @Param("to") Instant to,
            @Param("providerId") String providerId,
            Pageable page
    );

    List<ProviderAttemptEntity> findByRequestIdOrderByCreatedAtAsc(String requestId);
}
