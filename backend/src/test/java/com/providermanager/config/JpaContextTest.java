/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.config;

import com.providermanager.application.healthcheck.HealthMonitor;
import com.providermanager.application.healthcheck.ProviderDirectory;
import com.providermanager.infrastructure.persistence.repository.ProviderRepository;
import jakarta.persistence.EntityManagerFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

@SpringBootTest
@ActiveProfiles("test")
class JpaContextTest {
    @Autowired
    private EntityManagerFactory entityManagerFactory;

    @Autowired
    private ProviderRepository providerRepository;

    @Autowired
    private ProviderDirectory providerDirectory;

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoadsWithJpa() {
        assertNotNull(entityManagerFactory);
        assertNotNull(providerRepository);
        assertNotNull(providerDirectory);
    }

    @Test
    void monitorIsNotCreatedWhenDisabled() {
        assertNull(context.getBeanProvider(HealthMonitor.class).getIfAvailable());
    }
}
