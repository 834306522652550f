/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AetherGatewayApplication {
    public static void main(String[] args) {
        SpringApplication.run(AetherGatewayApplication.class, args);
    }
}
