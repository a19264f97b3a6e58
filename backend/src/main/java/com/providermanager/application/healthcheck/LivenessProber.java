/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.application.healthcheck;

import java.time.Duration;

public interface LivenessProber {
    /**
     * Calls {@code GET <endpoint>/health} and reports whether a 2xx answer arrived within {@code timeout}.
     * Never throws.
     */
    boolean probe(String endpoint, Duration timeout);
}
