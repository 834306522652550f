/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.application.routing;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable history of one provider. Guarded by its own monitor; callers must hold it.
 */
final class ProviderHealthRecord {
    private List<Long> failureTimestamps = new ArrayList<>();
    private List<Long> successTimestamps = new ArrayList<>();
    private int priorityAdjustment;

    List<Long> failureTimestamps() {
        return failureTimestamps;
    }

    List<Long> successTimestamps() {
        return successTimestamps;
    }

    void replaceTimestamps(List<Long> failures, List<Long> successes) {
        this.failureTimestamps = failures;
        this.successTimestamps = successes;
    }

    int priorityAdjustment() {
        return priorityAdjustment;
    }

    void priorityAdjustment(int value) {
        this.priorityAdjustment = value;
    }

    void clear() {
        this.failureTimestamps = new ArrayList<>();
        this.successTimestamps = new ArrayList<>();
        this.priorityAdjustment = 0;
    }
}
