/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.config;

import com.aether.application.routing.HealthPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
        Health health
) {
    public AppProperties {
        if (health == null) health = new Health(null, null, null);
    }

    public record Health(Duration failureWindow, Integer failureThreshold, Duration recoveryTime) {
        public HealthPolicy toPolicy() {
            return new HealthPolicy(
                    failureWindow == null ? HealthPolicy.DEFAULT_FAILURE_WINDOW : failureWindow,
                    failureThreshold == null ? HealthPolicy.DEFAULT_FAILURE_THRESHOLD : failureThreshold,
                    recoveryTime == null ? HealthPolicy.DEFAULT_RECOVERY_TIME : recoveryTime
            );
        }
    }
}
