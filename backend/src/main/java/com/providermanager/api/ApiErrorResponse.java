/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.api;

public record ApiErrorResponse(
        String error,
        String code,
        String message
) {}
