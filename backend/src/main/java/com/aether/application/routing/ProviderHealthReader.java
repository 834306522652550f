/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.application.routing;

public interface ProviderHealthReader {
    /** Adjustments at or below this value take a provider out of automatic selection. */
    int USAGE_CUTOFF = -3;

    int getPriorityAdjustment(String providerName);

    ProviderHealthSnapshot getHealthStatus(String providerName);

    default boolean shouldUse(String providerName) {
        return isUsable(getPriorityAdjustment(providerName));
    }

    static boolean isUsable(int priorityAdjustment) {
        return priorityAdjustment > USAGE_CUTOFF;
    }
}
