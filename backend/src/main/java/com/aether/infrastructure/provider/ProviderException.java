/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.infrastructure.provider;

/**
 * Failure of an upstream provider call. The message never carries upstream payloads or keys.
 */
public class ProviderException extends RuntimeException {
    private final String provider;
    private final ProviderErrorType type;

    public ProviderException(String provider, ProviderErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.type = type == null ? ProviderErrorType.UNKNOWN : type;
    }

    public ProviderException(String provider, ProviderErrorType type, String message) {
        this(provider, type, message, null);
    }

    public String getProvider() {
        return provider;
    }

    public ProviderErrorType getType() {
        return type;
    }
}
