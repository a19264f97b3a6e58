/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.infrastructure.persistence.repository;

import com.providermanager.domain.model.HealthStatus;
import com.providermanager.infrastructure.persistence.entity.ProviderEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ProviderRepository extends JpaRepository<ProviderEntity, UUID> {
    Optional<ProviderEntity> findByName(String name);

    List<ProviderEntity> findAllByOrderByCreatedAtAscIdAsc();

    List<ProviderEntity> findByServiceTypeOrderByCreatedAtAscIdAsc(String serviceType);

    @Query("""
            select p from ProviderEntity p
            where p.nextHealthCheck is null
               or p.nextHealthCheck <= :now
            order by p.createdAt asc, p.id asc
            """)
    List<ProviderEntity> findDueForHealthCheck(@Param("now") Instant now);

    @Modifying
    @Query("""
            update ProviderEntity p
            set p.healthStatus = :status,
                p.consecutiveFailures = :consecutiveFailures,
                p.nextHealthCheck = :nextCheck
            where p.id = :id
            """)
    int updateHealthStatus(
            @Param("id") UUID id,
            @Param("status") HealthStatus status,
            @Param("consecutiveFailures") int consecutiveFailures,
            @Param("nextCheck") Instant nextCheck
    );
}
