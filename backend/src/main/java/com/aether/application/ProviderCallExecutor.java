/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.application;

import com.aether.application.routing.ProviderHealthTracker;
import com.aether.application.routing.ProviderSelector;
import com.aether.domain.model.ProviderRef;
import com.aether.infrastructure.provider.ProviderCall;
import com.aether.infrastructure.provider.ProviderErrorType;
import com.aether.infrastructure.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs an upstream call against the selected provider and feeds the outcome back into the health
 * tracker. Timeouts and 5xx responses get one instant fallback to the next eligible provider unless
 * the caller pinned a provider by name.
 */
@Service
public class ProviderCallExecutor {
    private static final Logger log = LoggerFactory.getLogger(ProviderCallExecutor.class);

    private final ProviderSelector providerSelector;
    private final ProviderHealthTracker providerHealthTracker;

    public ProviderCallExecutor(ProviderSelector providerSelector, ProviderHealthTracker providerHealthTracker) {
        this.providerSelector = providerSelector;
        this.providerHealthTracker = providerHealthTracker;
    }

    public <T> T execute(List<ProviderRef> providers, String override, ProviderCall<T> call) {
        ProviderSelector.SelectionResult routing = providerSelector.decide(providers, override);
        ProviderRef chosen = requireProvider(routing, override);

        try {
            return attempt(chosen, call);
        } catch (ProviderException ex) {
            boolean pinned = override != null && !override.isEmpty();
            if (pinned || !eligibleForInstantFallback(ex)) {
                throw ex;
            }

            List<ProviderRef> remaining = providers.stream()
                    .filter(p -> !p.name().equals(chosen.name()))
                    .toList();
            if (remaining.isEmpty()) {
                throw ex;
            }

            ProviderSelector.SelectionResult fallbackRouting = providerSelector.decide(remaining, null);
            ProviderRef fallback = requireProvider(fallbackRouting, null);
            log.warn("Provider {} failed type={} message={}, falling back to {} reasonCode={}",
                    ex.getProvider(), ex.getType(), ex.getMessage(), fallback.name(), fallbackRouting.reasonCode());
            try {
                return attempt(fallback, call);
            } catch (RuntimeException fallbackEx) {
                fallbackEx.addSuppressed(ex);
                throw fallbackEx;
            }
        }
    }

    private <T> T attempt(ProviderRef provider, ProviderCall<T> call) {
        long startedAt = System.nanoTime();
        try {
            T result = call.invoke(provider);
            providerHealthTracker.recordSuccess(provider.name());
            return result;
        } catch (RuntimeException e) {
            providerHealthTracker.recordFailure(provider.name());
            long latencyMs = (System.nanoTime() - startedAt) / 1_000_000;
            if (e instanceof ProviderException pe) {
                log.warn("Provider call failed provider={} type={} latencyMs={}", provider.name(), pe.getType(), latencyMs);
            } else {
                log.warn("Provider call failed provider={} latencyMs={}", provider.name(), latencyMs, e);
            }
            throw e;
        }
    }

    private static boolean eligibleForInstantFallback(ProviderException ex) {
        return ex.getType() == ProviderErrorType.TIMEOUT || ex.getType() == ProviderErrorType.HTTP_5XX;
    }

    private static ProviderRef requireProvider(ProviderSelector.SelectionResult routing, String override) {
        if (routing.provider() != null) {
            return routing.provider();
        }
        String message = ProviderSelector.REASON_OVERRIDE_NOT_FOUND.equals(routing.reasonCode())
                ? "Requested provider " + override + " is not among the candidates"
                : "No provider available";
        throw new NoProviderAvailableException(routing.reasonCode(), message);
    }
}
