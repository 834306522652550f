/*
 * Copyright (C) 2025 Aether Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.aether.application.routing;

import com.aether.domain.model.ProviderRef;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class ProviderSelector {
    private static final Logger log = LoggerFactory.getLogger(ProviderSelector.class);

    public static final String REASON_EXPLICIT_OVERRIDE = "EXPLICIT_OVERRIDE";
    public static final String REASON_OVERRIDE_NOT_FOUND = "OVERRIDE_NOT_FOUND";
    public static final String REASON_HEALTHY_PRIORITY = "HEALTHY_PRIORITY";
    public static final String REASON_HEALTH_DEGRADED_NO_ALTERNATIVE = "HEALTH_DEGRADED_NO_ALTERNATIVE";
    public static final String REASON_NO_CANDIDATES = "NO_CANDIDATES";

    // Effective priority first, then id; both descending.
    private static final Comparator<Candidate> SELECTION_ORDER = Comparator
            .comparingInt(Candidate::effectivePriority)
            .thenComparingLong(c -> c.provider().id())
            .reversed();

    private final ProviderHealthReader providerHealthReader;
    private final ObjectMapper objectMapper;

    public ProviderSelector(ProviderHealthReader providerHealthReader, ObjectMapper objectMapper) {
        this.providerHealthReader = providerHealthReader;
        this.objectMapper = objectMapper;
    }

    /**
     * Picks the provider that should serve the next request, or {@code null} when the list is empty
     * or the override names no candidate.
     */
    public ProviderRef select(List<ProviderRef> providers, String override) {
        return choose(providers, override).provider();
    }

    public SelectionResult decide(List<ProviderRef> providers, String override) {
        Choice choice = choose(providers, override);
        return toResult(choice.provider(), choice.reasonCode(), override, choice.ordered());
    }

    /**
     * Diagnostic view of the candidates ordered by effective priority. Ties keep input order.
     */
    public List<ProviderRanking> rank(List<ProviderRef> providers) {
        if (providers == null || providers.isEmpty()) return List.of();

        List<ProviderRanking> rankings = new ArrayList<>(providers.size());
        for (ProviderRef provider : providers) {
            ProviderHealthSnapshot health = providerHealthReader.getHealthStatus(provider.name());
            rankings.add(new ProviderRanking(
                    provider.name(),
                    provider.priority(),
                    health.priorityAdjustment(),
                    provider.priority() + health.priorityAdjustment(),
                    health.status(),
                    health.failureRate()
            ));
        }
        rankings.sort(Comparator.comparingInt(ProviderRanking::effectivePriority).reversed());
        return rankings;
    }

    private Choice choose(List<ProviderRef> providers, String override) {
        List<ProviderRef> candidates = providers == null ? List.of() : providers;

        if (override != null && !override.isEmpty()) {
            // Health is not consulted for an explicit override.
            ProviderRef chosen = candidates.stream()
                    .filter(p -> override.equals(p.name()))
                    .findFirst()
                    .orElse(null);
            return new Choice(chosen, chosen == null ? REASON_OVERRIDE_NOT_FOUND : REASON_EXPLICIT_OVERRIDE, List.of());
        }

        if (candidates.isEmpty()) {
            return new Choice(null, REASON_NO_CANDIDATES, List.of());
        }

        List<Candidate> ordered = snapshot(candidates);
        ordered.sort(SELECTION_ORDER);

        for (Candidate candidate : ordered) {
            if (candidate.usable()) {
                return new Choice(candidate.provider(), REASON_HEALTHY_PRIORITY, ordered);
            }
        }

        ProviderRef fallback = ordered.get(0).provider();
        log.warn("No healthy provider among {} candidates, falling back to {}", ordered.size(), fallback.name());
        return new Choice(fallback, REASON_HEALTH_DEGRADED_NO_ALTERNATIVE, ordered);
    }

    // One adjustment read per provider; usability derives from the same value.
    private List<Candidate> snapshot(List<ProviderRef> providers) {
        List<Candidate> candidates = new ArrayList<>(providers.size());
        for (ProviderRef provider : providers) {
            int adjustment = providerHealthReader.getPriorityAdjustment(provider.name());
            candidates.add(new Candidate(provider, adjustment));
        }
        return candidates;
    }

    private SelectionResult toResult(ProviderRef chosen, String reasonCode, String override, List<Candidate> candidates) {
        List<Map<String, Object>> candidateViews = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("id", c.provider().id());
            view.put("name", c.provider().name());
            view.put("basePriority", c.provider().priority());
            view.put("adjustment", c.adjustment());
            view.put("effectivePriority", c.effectivePriority());
            view.put("usable", c.usable());
            candidateViews.add(view);
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("chosen", chosen == null ? null : chosen.name());
        document.put("reasonCode", reasonCode);
        document.put("override", override == null || override.isEmpty() ? null : override);
        document.put("candidates", candidateViews);
        document.put("computedAt", Instant.now().toString());

        String json;
        try {
            json = objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize selection candidates reasonCode={}", reasonCode, e);
            json = "{\"error\":\"candidatesJson_failed\"}";
        }
        return new SelectionResult(chosen, reasonCode, json);
    }

    private record Candidate(ProviderRef provider, int adjustment) {
        int effectivePriority() {
            return provider.priority() + adjustment;
        }

        boolean usable() {
            return ProviderHealthReader.isUsable(adjustment);
        }
    }

    private record Choice(ProviderRef provider, String reasonCode, List<Candidate> ordered) {}

    public record SelectionResult(
            ProviderRef provider,
            String reasonCode,
            String candidatesJson
    ) {}
}
