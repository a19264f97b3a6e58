/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.application.healthcheck;

import com.providermanager.application.ProviderNotFoundException;
import com.providermanager.domain.model.HealthStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Provider storage as seen by the health monitor.
 */
public interface ProviderDirectory {
    /**
     * Providers whose next check is unset or not after {@code now}.
     */
    List<ProviderHealthRecord> listDueForHealthCheck(Instant now);

    /**
     * Writes the three health fields of one provider in a single update.
     *
     * @throws ProviderNotFoundException if the provider no longer exists
     */
    void updateHealthStatus(UUID id, HealthStatus status, int consecutiveFailures, Instant nextCheck);
}
