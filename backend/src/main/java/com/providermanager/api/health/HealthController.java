/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.api.health;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1alpha1/health")
public class HealthController {
    @GetMapping
    public HealthResponse health() {
        return new HealthResponse("ok", "health");
    }

    public record HealthResponse(String status, String path) {}
}
