package com.phillippitts.providerrouter.domain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Routing definition for one logical feature: a primary provider, ordered fallbacks, a retry cap
 * and an optional cost ceiling.
 *
 * <p>Instances are immutable. Updates produce a new instance via {@link #merge(FeatureConfigUpdate)},
 * so two features can never share mutable routing state.
 *
 * @param feature unique feature name (e.g. {@code "narration"})
 * @param primaryProviderId preferred provider
 * @param fallbackProviderIds fallbacks in preference order, possibly empty
 * @param maxRetries retries allowed after the first attempt, never negative
 * @param costCeiling maximum provider unit cost, or {@code null} when unbounded
 */
public record FeatureConfig(
        String feature,
        String primaryProviderId,
        List<String> fallbackProviderIds,
        int maxRetries,
        Double costCeiling
) {

    public static final int DEFAULT_MAX_RETRIES = 3;

    public FeatureConfig {
        if (feature == null || feature.isBlank()) {
            throw new IllegalArgumentException("feature must not be blank");
        }
        if (primaryProviderId == null || primaryProviderId.isBlank()) {
            throw new IllegalArgumentException("primaryProviderId must not be blank for feature " + feature);
        }
        if (fallbackProviderIds == null) {
            fallbackProviderIds = List.of();
        } else {
            for (String fallback : fallbackProviderIds) {
                if (fallback == null || fallback.isBlank()) {
                    throw new IllegalArgumentException("fallback provider ids must not be blank for feature " + feature);
                }
            }
            fallbackProviderIds = List.copyOf(fallbackProviderIds);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0 for feature " + feature);
        }
        if (costCeiling != null && (costCeiling < 0.0 || costCeiling.isNaN())) {
            throw new IllegalArgumentException("costCeiling must be >= 0 for feature " + feature);
        }
    }

    /**
     * Returns true when the given unit cost is allowed by this feature's ceiling.
     */
    public boolean allowsCost(double unitCost) {
        return costCeiling == null || unitCost <= costCeiling;
    }

    /**
     * Primary followed by fallbacks, in preference order, without duplicates.
     */
    public List<String> candidates() {
        Set<String> ordered = new LinkedHashSet<>();
        ordered.add(primaryProviderId);
        ordered.addAll(fallbackProviderIds);
        return new ArrayList<>(ordered);
    }

    /**
     * Applies a partial update. Absent fields keep their current value.
     *
     * @param update partial configuration
     * @return a new config carrying the merged values
     */
    public FeatureConfig merge(FeatureConfigUpdate update) {
        if (update == null) {
            return this;
        }
        Double ceiling = update.clearCostCeiling()
                ? null
                : (update.costCeiling() != null ? update.costCeiling() : costCeiling);
        return new FeatureConfig(
                feature,
                update.primaryProviderId() != null ? update.primaryProviderId() : primaryProviderId,
                update.fallbackProviderIds() != null ? update.fallbackProviderIds() : fallbackProviderIds,
                update.maxRetries() != null ? update.maxRetries() : maxRetries,
                ceiling
        );
    }
}
