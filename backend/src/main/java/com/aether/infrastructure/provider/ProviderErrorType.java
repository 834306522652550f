/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.infrastructure.provider;

public enum ProviderErrorType {
    TIMEOUT,
    HTTP_5XX,
    VALIDATION,
    UNKNOWN
}
