/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.api.providers;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.providermanager.application.ProviderService;
import com.providermanager.domain.model.HealthStatus;
import com.providermanager.domain.model.RegistrationStatus;
import com.providermanager.infrastructure.persistence.entity.ProviderEntity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1alpha1/providers")
public class ProviderController {
    private final ProviderService providerService;

    public ProviderController(ProviderService providerService) {
        this.providerService = providerService;
    }

    @PostMapping
    public ResponseEntity<ProviderDto> register(
            @RequestParam(name = "id", required = false) UUID id,
            @Valid @RequestBody ProviderRequest req
    ) {
        ProviderService.Registration registration = providerService.register(req.toDefinition(), id);
        HttpStatus status = registration.status() == RegistrationStatus.REGISTERED ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(toDto(registration.provider(), registration.status()));
    }

    @GetMapping
    public ProviderListResponse list(@RequestParam(name = "type", required = false) String type) {
        return new ProviderListResponse(providerService.list(type).stream().map(p -> toDto(p, null)).toList());
    }

    @GetMapping("/{id}")
    public ProviderDto get(@PathVariable("id") UUID id) {
        return toDto(providerService.get(id), null);
    }

    @PutMapping("/{id}")
    public ProviderDto apply(@PathVariable("id") UUID id, @Valid @RequestBody ProviderRequest req) {
        return toDto(providerService.update(id, req.toDefinition()), null);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") UUID id) {
        providerService.delete(id);
        return ResponseEntity.noContent().build();
    }

    private ProviderDto toDto(ProviderEntity entity, RegistrationStatus status) {
        return new ProviderDto(
                entity.getId(),
                entity.getName(),
                entity.getServiceType(),
                entity.getSchemaVersion(),
                entity.getEndpoint(),
                entity.getHealthStatus(),
                entity.getConsecutiveFailures(),
                entity.getNextHealthCheck(),
                entity.getCreatedAt(),
                entity.getUpdatedAt(),
                status
        );
    }

    public record ProviderRequest(
            UUID id,
            @NotBlank @Size(max = 255) String name,
            @NotBlank @Size(max = 255) String serviceType,
            @NotBlank @Size(max = 64) String schemaVersion,
            @NotBlank @Size(max = 2048) String endpoint
    ) {
        ProviderService.ProviderDefinition toDefinition() {
            return new ProviderService.ProviderDefinition(id, name, serviceType, schemaVersion, endpoint);
        }
    }

    public record ProviderDto(
            UUID id,
            String name,
            String serviceType,
            String schemaVersion,
            String endpoint,
            HealthStatus healthStatus,
            int consecutiveFailures,
            Instant nextHealthCheck,
            Instant createdAt,
            Instant updatedAt,
            @JsonInclude(JsonInclude.Include.NON_NULL) RegistrationStatus status
    ) {}

    public record ProviderListResponse(List<ProviderDto> providers) {}
}
