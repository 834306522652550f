/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.application.routing;

/**
 * Non-decreasing time source for the health windows. Values are only meaningful
 * relative to each other.
 */
@FunctionalInterface
public interface MonotonicClock {
    long nanoTime();

    static MonotonicClock system() {
        return System::nanoTime;
    }
}
