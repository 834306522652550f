/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.infrastructure.provider;

import com.aether.domain.model.ProviderRef;

/**
 * One attempt against an upstream provider. Implementations signal upstream failures with
 * {@link ProviderException}.
 */
@FunctionalInterface
public interface ProviderCall<T> {
    T invoke(ProviderRef provider);
}
