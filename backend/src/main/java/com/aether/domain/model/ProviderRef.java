/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.domain.model;

/**
 * Upstream provider candidate as handed over by the request dispatcher.
 * Providers are identified by {@code name}; {@code id} only breaks priority ties.
 */
public record ProviderRef(
        long id,
        String name,
        int priority
) {}
