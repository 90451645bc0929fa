package com.phillippitts.providerrouter.exception;

import java.util.List;

/**
 * Thrown when every primary, fallback and emergency candidate of a feature is unhealthy,
 * inactive, excluded or over the cost ceiling. Callers decide on degraded-mode behavior.
 */
public class RoutingExhaustedException extends ProviderRouterException {

    private final String feature;
    private final List<String> candidates;

    public RoutingExhaustedException(String feature, List<String> candidates) {
        super("No eligible provider for feature " + feature + " (candidates=" + candidates + ")");
        this.feature = feature;
        this.candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public String getFeature() {
        return feature;
    }

    public List<String> getCandidates() {
        return candidates;
    }
}
