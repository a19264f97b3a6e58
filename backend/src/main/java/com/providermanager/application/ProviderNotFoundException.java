/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.application;

import java.util.UUID;

public class ProviderNotFoundException extends RuntimeException {
    private final UUID providerId;

    public ProviderNotFoundException(UUID providerId) {
        super("provider " + providerId + " not found");
        this.providerId = providerId;
    }

    public UUID getProviderId() {
        return providerId;
    }
}
