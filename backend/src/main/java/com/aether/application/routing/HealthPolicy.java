/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.application.routing;

import java.time.Duration;

public record HealthPolicy(
        Duration failureWindow,
        int failureThreshold,
        Duration recoveryTime
) {
    public static final Duration DEFAULT_FAILURE_WINDOW = Duration.ofMinutes(5);
    public static final int DEFAULT_FAILURE_THRESHOLD = 3;
    public static final Duration DEFAULT_RECOVERY_TIME = Duration.ofMinutes(10);

    public HealthPolicy {
        requirePositive("failureWindow", failureWindow);
        requirePositive("recoveryTime", recoveryTime);
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive, was " + failureThreshold);
        }
    }

    public static HealthPolicy defaults() {
        return new HealthPolicy(DEFAULT_FAILURE_WINDOW, DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIME);
    }

    private static void requirePositive(String field, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(field + " must be a positive duration, was " + value);
        }
    }
}
