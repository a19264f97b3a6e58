/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.domain.model;

public enum HealthStatus {
    READY,
    NOT_READY
}
