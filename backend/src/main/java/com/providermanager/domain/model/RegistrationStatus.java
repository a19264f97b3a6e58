/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of an idempotent provider registration.
 */
public enum RegistrationStatus {
    REGISTERED("registered"),
    UPDATED("updated");

    private final String value;

    RegistrationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
