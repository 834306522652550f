/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.application.routing;

import com.aether.domain.model.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Sliding-window success/failure history per upstream provider.
 *
 * <p>Reaching {@link HealthPolicy#failureThreshold()} failures inside the window lowers the
 * provider's priority adjustment by one step, with no floor. Each success observed while at least
 * {@value #RECOVERY_SUCCESSES} successes sit inside the window raises a negative adjustment by one
 * step. Stale timestamps are purged lazily whenever a provider is recorded or queried.
 *
 * <p>State for a provider is mutated under that provider's record monitor only; there is no lock
 * spanning several providers.
 */
public class ProviderHealthTracker implements ProviderHealthReader {
    private static final Logger log = LoggerFactory.getLogger(ProviderHealthTracker.class);

    static final int RECOVERY_SUCCESSES = 5;
    private static final double UNSTABLE_FAILURE_RATE = 0.5;
    private static final double WARNING_FAILURE_RATE = 0.1;

    private final HealthPolicy policy;
    private final MonotonicClock clock;
    private final long failureWindowNanos;
    private final long recoveryTimeNanos;
    private final ConcurrentMap<String, ProviderHealthRecord> records = new ConcurrentHashMap<>();

    public ProviderHealthTracker(HealthPolicy policy, MonotonicClock clock) {
        this.policy = policy == null ? HealthPolicy.defaults() : policy;
        this.clock = clock == null ? MonotonicClock.system() : clock;
        this.failureWindowNanos = this.policy.failureWindow().toNanos();
        this.recoveryTimeNanos = this.policy.recoveryTime().toNanos();
    }

    public HealthPolicy policy() {
        return policy;
    }

    public void recordSuccess(String providerName) {
        ProviderHealthRecord record = recordFor(providerName);
        synchronized (record) {
            long now = clock.nanoTime();
            record.successTimestamps().add(now);
            purge(providerName, record, now);

            int adjustment = record.priorityAdjustment();
            if (record.successTimestamps().size() >= RECOVERY_SUCCESSES && adjustment < 0) {
                record.priorityAdjustment(adjustment + 1);
                log.info("Provider {} recovering priorityAdjustment={} recentSuccesses={}",
                        providerName, adjustment + 1, record.successTimestamps().size());
            } else {
                log.debug("Provider {} success recorded recentSuccesses={}", providerName, record.successTimestamps().size());
            }
        }
    }

    public void recordFailure(String providerName) {
        ProviderHealthRecord record = recordFor(providerName);
        synchronized (record) {
            long now = clock.nanoTime();
            record.failureTimestamps().add(now);
            purge(providerName, record, now);

            int recentFailures = record.failureTimestamps().size();
            if (recentFailures >= policy.failureThreshold()) {
                int adjustment = record.priorityAdjustment() - 1;
                record.priorityAdjustment(adjustment);
                log.warn("Provider {} degraded priorityAdjustment={} recentFailures={}",
                        providerName, adjustment, recentFailures);
            } else {
                log.debug("Provider {} failure recorded recentFailures={}", providerName, recentFailures);
            }
        }
    }

    @Override
    public int getPriorityAdjustment(String providerName) {
        ProviderHealthRecord record = records.get(requireName(providerName));
        if (record == null) return 0;
        synchronized (record) {
            return record.priorityAdjustment();
        }
    }

    @Override
    public ProviderHealthSnapshot getHealthStatus(String providerName) {
        ProviderHealthRecord record = recordFor(providerName);
        synchronized (record) {
            purge(providerName, record, clock.nanoTime());

            int recentFailures = record.failureTimestamps().size();
            int recentSuccesses = record.successTimestamps().size();
            int total = recentFailures + recentSuccesses;
            double failureRate = total == 0 ? 0 : (double) recentFailures / (double) total;

            return new ProviderHealthSnapshot(
                    providerName,
                    recentFailures,
                    recentSuccesses,
                    failureRate,
                    record.priorityAdjustment(),
                    classify(failureRate, recentFailures)
            );
        }
    }

    public void reset(String providerName) {
        ProviderHealthRecord record = recordFor(providerName);
        synchronized (record) {
            record.clear();
        }
        log.info("Provider {} health reset", providerName);
    }

    public Set<String> trackedProviders() {
        return Set.copyOf(records.keySet());
    }

    public List<ProviderHealthSnapshot> getAllHealthStatuses() {
        List<ProviderHealthSnapshot> snapshots = new ArrayList<>();
        for (String providerName : records.keySet()) {
            snapshots.add(getHealthStatus(providerName));
        }
        snapshots.sort(Comparator.comparing(ProviderHealthSnapshot::provider));
        return snapshots;
    }

    HealthStatus classify(double failureRate, int recentFailures) {
        if (recentFailures >= policy.failureThreshold()) return HealthStatus.DEGRADED;
        if (failureRate > UNSTABLE_FAILURE_RATE) return HealthStatus.UNSTABLE;
        if (failureRate > WARNING_FAILURE_RATE) return HealthStatus.WARNING;
        return HealthStatus.HEALTHY;
    }

    /**
     * Drops timestamps outside the failure window. A negative adjustment is cleared once the window
     * holds no failures and every remaining success is older than the recovery time, which includes
     * the case of no successes at all.
     */
    private void purge(String providerName, ProviderHealthRecord record, long now) {
        List<Long> failures = withinWindow(record.failureTimestamps(), now);
        List<Long> successes = withinWindow(record.successTimestamps(), now);
        record.replaceTimestamps(failures, successes);

        if (failures.isEmpty() && record.priorityAdjustment() < 0) {
            boolean recovered = successes.stream().allMatch(t -> now - t > recoveryTimeNanos);
            if (recovered) {
                log.info("Provider {} quiet for the failure window, priorityAdjustment {} -> 0",
                        providerName, record.priorityAdjustment());
                record.priorityAdjustment(0);
            }
        }
    }

    private List<Long> withinWindow(List<Long> timestamps, long now) {
        List<Long> kept = new ArrayList<>(timestamps.size());
        for (Long t : timestamps) {
            if (now - t < failureWindowNanos) kept.add(t);
        }
        return kept;
    }

    private ProviderHealthRecord recordFor(String providerName) {
        return records.computeIfAbsent(requireName(providerName), k -> new ProviderHealthRecord());
    }

    private static String requireName(String providerName) {
        if (providerName == null) {
            throw new IllegalArgumentException("providerName must not be null");
        }
        return providerName;
    }
}
