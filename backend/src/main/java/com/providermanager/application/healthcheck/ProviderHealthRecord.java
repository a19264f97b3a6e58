/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.application.healthcheck;

import com.providermanager.domain.model.HealthStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * The slice of a provider the health monitor reads. {@code nextHealthCheck} is null until the first check.
 */
public record ProviderHealthRecord(
        UUID id,
        String name,
        String endpoint,
        HealthStatus healthStatus,
        int consecutiveFailures,
        Instant nextHealthCheck
) {}
