/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.application.healthcheck;

import com.providermanager.config.AppProperties;
import com.providermanager.domain.model.HealthStatus;

import java.time.Duration;
import java.time.Instant;

/**
 * Next-check scheduling policy.
 * <p>
 * READY providers are polled every {@code interval}. NOT_READY providers wait
 * {@code min(baseBackoffInterval * 2^(failures - maxConsecutiveFailures), maxBackoffInterval)},
 * so the failure that flips a provider to NOT_READY schedules exactly {@code baseBackoffInterval}.
 */
public final class BackoffCalculator {
    /**
     * Ceiling for the doubling exponent. Keeps the multiplier inside {@code long} range.
     */
    public static final int MAX_BACKOFF_EXPONENT = 10;

    private BackoffCalculator() {}

    public static Instant nextCheckTime(
            Instant now,
            HealthStatus status,
            int consecutiveFailures,
            AppProperties.HealthCheck config
    ) {
        if (status == HealthStatus.READY) {
            return now.plus(config.interval());
        }
        return now.plus(backoffDelay(consecutiveFailures, config));
    }

    static Duration backoffDelay(int consecutiveFailures, AppProperties.HealthCheck config) {
        int exponent = Math.max(0, consecutiveFailures - config.maxConsecutiveFailures());
        exponent = Math.min(exponent, MAX_BACKOFF_EXPONENT);
        long multiplier = 1L << exponent;

        Duration base = config.baseBackoffInterval();
        Duration max = config.maxBackoffInterval();
        if (base.compareTo(max.dividedBy(multiplier)) > 0) {
            return max;
        }
        return base.multipliedBy(multiplier);
    }
}
