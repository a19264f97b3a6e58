/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.config;

import com.providermanager.application.healthcheck.HealthMonitor;
import com.providermanager.application.healthcheck.LivenessProber;
import com.providermanager.application.healthcheck.ProviderDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class HealthCheckConfig {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.health-check", name = "enabled", havingValue = "true", matchIfMissing = true)
    public HealthMonitor healthMonitor(
            ProviderDirectory providerDirectory,
            LivenessProber livenessProber,
            AppProperties properties,
            Clock clock
    ) {
        AppProperties.HealthCheck settings = properties.healthCheck();
        if (settings.timeout().compareTo(settings.interval()) >= 0) {
            log.warn("app.health-check.timeout={} is not shorter than interval={}; a hung provider can stretch every scan",
                    settings.timeout(), settings.interval());
        }
        return new HealthMonitor(providerDirectory, livenessProber, settings, clock);
    }
}
