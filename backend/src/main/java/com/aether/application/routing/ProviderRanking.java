/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.application.routing;

import com.aether.domain.model.HealthStatus;

public record ProviderRanking(
        String name,
        int basePriority,
        int adjustment,
        int effectivePriority,
        HealthStatus status,
        double failureRate
) {}
