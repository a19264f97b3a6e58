/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.infrastructure.persistence;

import com.providermanager.application.ProviderNotFoundException;
import com.providermanager.application.healthcheck.ProviderDirectory;
import com.providermanager.application.healthcheck.ProviderHealthRecord;
import com.providermanager.domain.model.HealthStatus;
import com.providermanager.infrastructure.persistence.entity.ProviderEntity;
import com.providermanager.infrastructure.persistence.repository.ProviderRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Component
public class JpaProviderDirectory implements ProviderDirectory {
    private final ProviderRepository providerRepository;

    public JpaProviderDirectory(ProviderRepository providerRepository) {
        this.providerRepository = providerRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProviderHealthRecord> listDueForHealthCheck(Instant now) {
        return providerRepository.findDueForHealthCheck(now).stream()
                .map(JpaProviderDirectory::toRecord)
                .toList();
    }

    @Override
    @Transactional
    public void updateHealthStatus(UUID id, HealthStatus status, int consecutiveFailures, Instant nextCheck) {
        int updated = providerRepository.updateHealthStatus(id, status, consecutiveFailures, nextCheck);
        if (updated == 0) {
            throw new ProviderNotFoundException(id);
        }
    }

    private static ProviderHealthRecord toRecord(ProviderEntity entity) {
        return new ProviderHealthRecord(
                entity.getId(),
                entity.getName(),
                entity.getEndpoint(),
                entity.getHealthStatus(),
                entity.getConsecutiveFailures(),
                entity.getNextHealthCheck()
        );
    }
}
