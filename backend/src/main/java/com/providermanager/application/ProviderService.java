/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.application;

import com.providermanager.api.ApiException;
import com.providermanager.domain.model.RegistrationStatus;
import com.providermanager.infrastructure.persistence.entity.ProviderEntity;
import com.providermanager.infrastructure.persistence.repository.ProviderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Provider registry. Writes here never touch the health fields; those belong to the health monitor.
 */
@Service
public class ProviderService {
    private static final Logger log = LoggerFactory.getLogger(ProviderService.class);

    private final ProviderRepository providerRepository;

    public ProviderService(ProviderRepository providerRepository) {
        this.providerRepository = providerRepository;
    }

    /**
     * Registers a provider, or updates the one already holding {@code definition.name()}.
     * The id may come from the body or from {@code queryId}; the body wins.
     */
    @Transactional
    public Registration register(ProviderDefinition request, UUID queryId) {
        ProviderDefinition definition = validate(request);
        UUID requestedId = definition.id() != null ? definition.id() : queryId;

        Optional<ProviderEntity> existing = providerRepository.findByName(definition.name());
        if (existing.isPresent()) {
            ProviderEntity entity = existing.get();
            if (requestedId != null && !requestedId.equals(entity.getId())) {
                throw new ApiException(HttpStatus.CONFLICT,
                        "name '" + definition.name() + "' already exists with a different provider ID");
            }
            apply(entity, definition);
            ProviderEntity saved = providerRepository.save(entity);
            log.info("Updated provider: {} ({})", saved.getName(), saved.getId());
            return new Registration(saved, RegistrationStatus.UPDATED);
        }

        if (requestedId != null && providerRepository.existsById(requestedId)) {
            throw new ApiException(HttpStatus.CONFLICT, "provider with ID '" + requestedId + "' already exists");
        }

        ProviderEntity entity = new ProviderEntity();
        entity.setId(requestedId != null ? requestedId : UUID.randomUUID());
        apply(entity, definition);
        ProviderEntity saved = providerRepository.save(entity);
        log.info("Created provider: {} ({})", saved.getName(), saved.getId());
        return new Registration(saved, RegistrationStatus.REGISTERED);
    }

    @Transactional(readOnly = true)
    public ProviderEntity get(UUID id) {
        return providerRepository.findById(id).orElseThrow(() -> new ProviderNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public List<ProviderEntity> list(String serviceType) {
        if (serviceType == null || serviceType.isBlank()) {
            return providerRepository.findAllByOrderByCreatedAtAscIdAsc();
        }
        return providerRepository.findByServiceTypeOrderByCreatedAtAscIdAsc(serviceType.trim());
    }

    @Transactional
    public ProviderEntity update(UUID id, ProviderDefinition request) {
        ProviderDefinition definition = validate(request);
        ProviderEntity entity = providerRepository.findById(id).orElseThrow(() -> new ProviderNotFoundException(id));

        if (!definition.name().equals(entity.getName())) {
            providerRepository.findByName(definition.name())
                    .filter(other -> !other.getId().equals(id))
                    .ifPresent(other -> {
                        throw new ApiException(HttpStatus.CONFLICT, "name '" + definition.name() + "' is already taken");
                    });
        }

        apply(entity, definition);
        ProviderEntity saved = providerRepository.save(entity);
        log.info("Updated provider: {} ({})", saved.getName(), saved.getId());
        return saved;
    }

    @Transactional
    public void delete(UUID id) {
        if (!providerRepository.existsById(id)) {
            throw new ProviderNotFoundException(id);
        }
        providerRepository.deleteById(id);
        log.info("Deleted provider: {}", id);
    }

    private void apply(ProviderEntity entity, ProviderDefinition definition) {
        entity.setName(definition.name());
        entity.setServiceType(definition.serviceType());
        entity.setSchemaVersion(definition.schemaVersion());
        entity.setEndpoint(definition.endpoint());
    }

    private ProviderDefinition validate(ProviderDefinition definition) {
        if (definition == null) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "provider body is required");
        }
        requireText("name", definition.name());
        requireText("serviceType", definition.serviceType());
        requireText("schemaVersion", definition.schemaVersion());
        requireText("endpoint", definition.endpoint());

        URI uri;
        try {
            uri = URI.create(definition.endpoint().trim());
        } catch (IllegalArgumentException e) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "endpoint is not a valid URL");
        }
        String scheme = uri.getScheme();
        if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "endpoint must be an absolute http(s) URL");
        }
        return definition.trimmed();
    }

    private void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ApiException(HttpStatus.BAD_REQUEST, field + " is required");
        }
    }

    public record ProviderDefinition(
            UUID id,
            String name,
            String serviceType,
            String schemaVersion,
            String endpoint
    ) {
        ProviderDefinition trimmed() {
            return new ProviderDefinition(id, name.trim(), serviceType.trim(), schemaVersion.trim(), endpoint.trim());
        }
    }

    public record Registration(
            ProviderEntity provider,
            RegistrationStatus status
    ) {}
}
