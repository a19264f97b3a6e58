/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ProviderManagerApplication {
    public static void main(String[] args) {
        SpringApplication.run(ProviderManagerApplication.class, args);
    }
}
