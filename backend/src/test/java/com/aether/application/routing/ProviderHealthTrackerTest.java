/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.application.routing;

import com.aether.domain.model.HealthStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderHealthTrackerTest {
    private static final String PROVIDER = "anthropic-primary";

    private ManualClock clock;
    private ProviderHealthTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        tracker = new ProviderHealthTracker(HealthPolicy.defaults(), clock);
    }

    @Test
    void unseenProviderReportsEmptyHealthyState() {
        assertEquals(0, tracker.getPriorityAdjustment(PROVIDER));
        assertTrue(tracker.shouldUse(PROVIDER));
        assertTrue(tracker.trackedProviders().isEmpty());

        ProviderHealthSnapshot snapshot = tracker.getHealthStatus(PROVIDER);
        assertEquals(0, snapshot.recentFailures());
        assertEquals(0, snapshot.recentSuccesses());
        assertEquals(0.0, snapshot.failureRate());
        assertEquals(HealthStatus.HEALTHY, snapshot.status());
    }

    @Test
    void reachingFailureThresholdDegradesAndLowersAdjustmentByOne() {
        tracker.recordFailure(PROVIDER);
        tracker.recordFailure(PROVIDER);
        assertEquals(0, tracker.getPriorityAdjustment(PROVIDER));

        tracker.recordFailure(PROVIDER);

        ProviderHealthSnapshot snapshot = tracker.getHealthStatus(PROVIDER);
        assertEquals(-1, snapshot.priorityAdjustment());
        assertEquals(3, snapshot.recentFailures());
        assertEquals(1.0, snapshot.failureRate());
        assertEquals(HealthStatus.DEGRADED, snapshot.status());
    }

    @Test
    void everyFailureAboveThresholdCompoundsThePenalty() {
        for (int i = 0; i < 7; i++) {
            tracker.recordFailure(PROVIDER);
        }

        assertEquals(-5, tracker.getPriorityAdjustment(PROVIDER));
    }

    @Test
    void shouldUseTurnsFalseAtMinusThree() {
        for (int i = 0; i < 4; i++) {
            tracker.recordFailure(PROVIDER);
        }
        assertEquals(-2, tracker.getPriorityAdjustment(PROVIDER));
        assertTrue(tracker.shouldUse(PROVIDER));

        tracker.recordFailure(PROVIDER);
        assertEquals(-3, tracker.getPriorityAdjustment(PROVIDER));
        assertFalse(tracker.shouldUse(PROVIDER));
    }

    @Test
    void fifthSuccessInWindowRaisesNegativeAdjustmentByOnePerCall() {
        for (int i = 0; i < 4; i++) {
            tracker.recordFailure(PROVIDER);
        }
        clock.advance(Duration.ofSeconds(10));

        for (int i = 0; i < 4; i++) {
            tracker.recordSuccess(PROVIDER);
        }
        assertEquals(-2, tracker.getPriorityAdjustment(PROVIDER));

        tracker.recordSuccess(PROVIDER);
        assertEquals(-1, tracker.getPriorityAdjustment(PROVIDER));

        tracker.recordSuccess(PROVIDER);
        assertEquals(0, tracker.getPriorityAdjustment(PROVIDER));

        tracker.recordSuccess(PROVIDER);
        assertEquals(0, tracker.getPriorityAdjustment(PROVIDER));
    }

    @Test
    void successesNeverPushAdjustmentPositive() {
        for (int i = 0; i < 20; i++) {
            tracker.recordSuccess(PROVIDER);
        }

        assertEquals(0, tracker.getPriorityAdjustment(PROVIDER));
    }

    @Test
    void failuresOutsideWindowDoNotCountTowardsThreshold() {
        tracker.recordFailure(PROVIDER);
        tracker.recordFailure(PROVIDER);
        clock.advance(Duration.ofMinutes(5));

        tracker.recordFailure(PROVIDER);

        ProviderHealthSnapshot snapshot = tracker.getHealthStatus(PROVIDER);
        assertEquals(1, snapshot.recentFailures());
        assertEquals(0, snapshot.priorityAdjustment());
        assertEquals(HealthStatus.UNSTABLE, snapshot.status());
    }

    @Test
    void staleSuccessesAreDroppedFromCounts() {
        tracker.recordSuccess(PROVIDER);
        tracker.recordSuccess(PROVIDER);
        clock.advance(Duration.ofSeconds(299));
        tracker.recordSuccess(PROVIDER);
        clock.advance(Duration.ofSeconds(1));

        ProviderHealthSnapshot snapshot = tracker.getHealthStatus(PROVIDER);
        assertEquals(1, snapshot.recentSuccesses());
    }

    @Test
    void getPriorityAdjustmentDoesNotPurge() {
        for (int i = 0; i < 3; i++) {
            tracker.recordFailure(PROVIDER);
        }
        clock.advance(Duration.ofMinutes(6));

        assertEquals(-1, tracker.getPriorityAdjustment(PROVIDER));
        assertEquals(0, tracker.getHealthStatus(PROVIDER).priorityAdjustment());
    }

    @Test
    void quietWindowResetsNegativeAdjustmentEvenWithoutSuccesses() {
        for (int i = 0; i < 5; i++) {
            tracker.recordFailure(PROVIDER);
        }
        assertFalse(tracker.shouldUse(PROVIDER));
        clock.advance(Duration.ofMinutes(5));

        ProviderHealthSnapshot snapshot = tracker.getHealthStatus(PROVIDER);

        assertEquals(0, snapshot.priorityAdjustment());
        assertEquals(HealthStatus.HEALTHY, snapshot.status());
        assertTrue(tracker.shouldUse(PROVIDER));
    }

    @Test
    void recoveryResetRequiresEveryRemainingSuccessToBeOlderThanRecoveryTime() {
        HealthPolicy policy = new HealthPolicy(Duration.ofMinutes(10), 3, Duration.ofMinutes(1));
        ProviderHealthTracker shortRecovery = new ProviderHealthTracker(policy, clock);
        String other = "openai-backup";

        for (int i = 0; i < 3; i++) {
            shortRecovery.recordFailure(PROVIDER);
            shortRecovery.recordFailure(other);
        }
        clock.advance(Duration.ofSeconds(100));
        shortRecovery.recordSuccess(PROVIDER);
        clock.advance(Duration.ofSeconds(490));
        shortRecovery.recordSuccess(other);
        clock.advance(Duration.ofSeconds(11));

        assertEquals(0, shortRecovery.getHealthStatus(PROVIDER).priorityAdjustment());
        assertEquals(-1, shortRecovery.getHealthStatus(other).priorityAdjustment());
    }

    @Test
    void statusFollowsFailureRateBands() {
        tracker.recordFailure("unstable");
        tracker.recordFailure("unstable");
        tracker.recordSuccess("unstable");

        tracker.recordFailure("warning");
        for (int i = 0; i < 4; i++) tracker.recordSuccess("warning");

        tracker.recordFailure("edge");
        for (int i = 0; i < 9; i++) tracker.recordSuccess("edge");

        tracker.recordFailure("half");
        tracker.recordSuccess("half");

        assertEquals(HealthStatus.UNSTABLE, tracker.getHealthStatus("unstable").status());
        assertEquals(HealthStatus.WARNING, tracker.getHealthStatus("warning").status());
        assertEquals(HealthStatus.HEALTHY, tracker.getHealthStatus("edge").status());
        assertEquals(HealthStatus.WARNING, tracker.getHealthStatus("half").status());
        assertEquals(0.1, tracker.getHealthStatus("edge").failureRate(), 1e-9);
    }

    @Test
    void degradedTakesPrecedenceOverRateBands() {
        for (int i = 0; i < 3; i++) tracker.recordFailure(PROVIDER);
        for (int i = 0; i < 30; i++) tracker.recordSuccess(PROVIDER);

        ProviderHealthSnapshot snapshot = tracker.getHealthStatus(PROVIDER);
        assertTrue(snapshot.failureRate() < 0.1);
        assertEquals(HealthStatus.DEGRADED, snapshot.status());
    }

    @Test
    void resetClearsHistoryAndAdjustment() {
        for (int i = 0; i < 6; i++) tracker.recordFailure(PROVIDER);
        tracker.recordSuccess(PROVIDER);

        tracker.reset(PROVIDER);
        tracker.reset(PROVIDER);

        ProviderHealthSnapshot snapshot = tracker.getHealthStatus(PROVIDER);
        assertEquals(0, snapshot.priorityAdjustment());
        assertEquals(0, snapshot.recentFailures());
        assertEquals(0, snapshot.recentSuccesses());
        assertEquals(HealthStatus.HEALTHY, snapshot.status());
    }

    @Test
    void allHealthStatusesAreSortedByProviderName() {
        tracker.recordSuccess("zeta");
        tracker.recordFailure("alpha");

        List<ProviderHealthSnapshot> all = tracker.getAllHealthStatuses();

        assertEquals(List.of("alpha", "zeta"), all.stream().map(ProviderHealthSnapshot::provider).toList());
    }

    @Test
    void nullProviderNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> tracker.getPriorityAdjustment(null));
    }

    @Test
    void blankProviderNameIsAnOrdinaryKey() {
        for (int i = 0; i < 3; i++) tracker.recordFailure(" ");
        tracker.recordSuccess("");

        assertEquals(-1, tracker.getPriorityAdjustment(" "));
        assertEquals(HealthStatus.DEGRADED, tracker.getHealthStatus(" ").status());
        assertEquals(1, tracker.getHealthStatus("").recentSuccesses());
        assertEquals(0, tracker.getHealthStatus("").recentFailures());
    }

    @Test
    void concurrentSuccessesAreNeverLost() throws Exception {
        runConcurrently(8, 1000, () -> tracker.recordSuccess(PROVIDER));

        assertEquals(8000, tracker.getHealthStatus(PROVIDER).recentSuccesses());
    }

    @Test
    void concurrentFailuresApplyEachPenaltyExactlyOnce() throws Exception {
        runConcurrently(8, 100, () -> tracker.recordFailure(PROVIDER));

        ProviderHealthSnapshot snapshot = tracker.getHealthStatus(PROVIDER);
        assertEquals(800, snapshot.recentFailures());
        // The first two failures stay below the threshold; every later one lowers the adjustment.
        assertEquals(-798, snapshot.priorityAdjustment());
    }

    private static void runConcurrently(int threads, int iterations, Runnable action) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < iterations; i++) {
                        action.run();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
