/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.application.routing;

import com.aether.domain.model.HealthStatus;

public record ProviderHealthSnapshot(
        String provider,
        int recentFailures,
        int recentSuccesses,
        double failureRate,
        int priorityAdjustment,
        HealthStatus status
) {}
