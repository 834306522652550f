/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.config;

import com.aether.application.routing.HealthPolicy;
import com.aether.application.routing.MonotonicClock;
import com.aether.application.routing.ProviderHealthTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HealthTrackingConfig {
    private static final Logger log = LoggerFactory.getLogger(HealthTrackingConfig.class);

    @Bean
    public MonotonicClock monotonicClock() {
        return MonotonicClock.system();
    }

    @Bean
    public ProviderHealthTracker providerHealthTracker(AppProperties properties, MonotonicClock monotonicClock) {
        HealthPolicy policy = properties.health().toPolicy();
        log.info("Provider health tracking failureWindow={} failureThreshold={} recoveryTime={}",
                policy.failureWindow(), policy.failureThreshold(), policy.recoveryTime());
        return new ProviderHealthTracker(policy, monotonicClock);
    }
}
