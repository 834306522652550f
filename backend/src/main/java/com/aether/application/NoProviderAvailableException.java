/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.application;

public class NoProviderAvailableException extends RuntimeException {
    private final String reasonCode;

    public NoProviderAvailableException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
