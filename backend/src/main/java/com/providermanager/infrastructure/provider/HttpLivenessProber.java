/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.infrastructure.provider;

import com.providermanager.application.healthcheck.LivenessProber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;

@Component
public class HttpLivenessProber implements LivenessProber {
    private static final Logger log = LoggerFactory.getLogger(HttpLivenessProber.class);
    static final String HEALTH_PATH = "/health";

    private final WebClient healthCheckWebClient;

    public HttpLivenessProber(WebClient healthCheckWebClient) {
        this.healthCheckWebClient = healthCheckWebClient;
    }

    @Override
    public boolean probe(String endpoint, Duration timeout) {
        URI uri;
        try {
            uri = healthUri(endpoint);
        } catch (IllegalArgumentException e) {
            log.warn("Cannot build health check URL endpoint={}: {}", endpoint, e.getMessage());
            return false;
        }

        try {
            HttpStatusCode status = healthCheckWebClient.get()
                    .uri(uri)
                    .exchangeToMono(response -> response.releaseBody().thenReturn(response.statusCode()))
                    .timeout(timeout)
                    .block();
            if (status != null && status.is2xxSuccessful()) {
                return true;
            }
            log.warn("Health check failed url={} status={}", uri, status == null ? "none" : status.value());
            return false;
        } catch (Exception e) {
            log.warn("Health check failed url={} cause={}", uri, e.toString());
            return false;
        }
    }

    static URI healthUri(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint is empty");
        }
        String base = endpoint.trim();
        int end = base.length();
        while (end > 0 && base.charAt(end - 1) == '/') {
            end--;
        }
        URI uri = URI.create(base.substring(0, end) + HEALTH_PATH);
        if (!uri.isAbsolute() || uri.getHost() == null) {
            throw new IllegalArgumentException("endpoint is not an absolute URL");
        }
        return uri;
    }
}
