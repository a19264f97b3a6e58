/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
        @DefaultValue HealthCheck healthCheck
) {
    /**
     * Provider liveness checking. Read once at startup.
     *
     * @param interval               steady-state period between checks of a READY provider, and the scan period
     * @param timeout                upper bound for a single probe
     * @param maxConsecutiveFailures failures in a row after which a provider becomes NOT_READY
     * @param baseBackoffInterval    first delay after a provider becomes NOT_READY
     * @param maxBackoffInterval     ceiling for the backoff delay
     */
    public record HealthCheck(
            @DefaultValue("10s") Duration interval,
            @DefaultValue("5s") Duration timeout,
            @DefaultValue("3") int maxConsecutiveFailures,
            @DefaultValue("10s") Duration baseBackoffInterval,
            @DefaultValue("5m") Duration maxBackoffInterval
    ) {
        public HealthCheck {
            requirePositive("interval", interval);
            requirePositive("timeout", timeout);
            requirePositive("baseBackoffInterval", baseBackoffInterval);
            requirePositive("maxBackoffInterval", maxBackoffInterval);
            if (maxConsecutiveFailures < 1) {
                throw new IllegalArgumentException("app.health-check.max-consecutive-failures must be at least 1");
            }
        }

        private static void requirePositive(String name, Duration value) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException("app.health-check." + name + " must be a positive duration");
            }
        }
    }
}
