/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.config;

import com.aether.application.routing.ProviderHealthReader;
import com.aether.application.routing.ProviderHealthSnapshot;
import com.aether.application.routing.ProviderHealthTracker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exposes the tracked upstream providers through {@code /actuator/health}.
 *
 * <p>Reports DOWN only when every tracked provider has dropped out of automatic selection; a single
 * usable provider keeps the gateway serving.
 */
@Component
public class ProviderHealthIndicator implements HealthIndicator {
    private static final String DETAIL_KEY_TRACKED = "tracked";
    private static final String DETAIL_KEY_PROVIDERS = "providers";

    private final ProviderHealthTracker providerHealthTracker;

    public ProviderHealthIndicator(ProviderHealthTracker providerHealthTracker) {
        this.providerHealthTracker = providerHealthTracker;
    }

    @Override
    public Health health() {
        List<ProviderHealthSnapshot> snapshots = providerHealthTracker.getAllHealthStatuses();
        if (snapshots.isEmpty()) {
            return Health.up().withDetail(DETAIL_KEY_TRACKED, 0).build();
        }

        Map<String, Object> providers = new LinkedHashMap<>();
        boolean anyUsable = false;
        for (ProviderHealthSnapshot snapshot : snapshots) {
            anyUsable |= ProviderHealthReader.isUsable(snapshot.priorityAdjustment());
            providers.put(snapshot.provider(), Map.of(
                    "status", snapshot.status().label(),
                    "failureRate", snapshot.failureRate(),
                    "priorityAdjustment", snapshot.priorityAdjustment()
            ));
        }

        Health.Builder builder = anyUsable ? Health.up() : Health.down();
        return builder
                .withDetail(DETAIL_KEY_TRACKED, snapshots.size())
                .withDetail(DETAIL_KEY_PROVIDERS, providers)
                .build();
    }
}
