package com.phillippitts.providerrouter.domain;

import java.util.List;

/**
 * Partial feature routing update. {@code null} fields are left unchanged when merged.
 *
 * @param primaryProviderId new primary, or null
 * @param fallbackProviderIds replacement fallback list, or null
 * @param maxRetries new retry cap, or null
 * @param costCeiling new cost ceiling, or null
 * @param clearCostCeiling when true the ceiling is removed regardless of {@code costCeiling}
 */
public record FeatureConfigUpdate(
        String primaryProviderId,
        List<String> fallbackProviderIds,
        Integer maxRetries,
        Double costCeiling,
        boolean clearCostCeiling
) {

    public static FeatureConfigUpdate primary(String primaryProviderId) {
        return new FeatureConfigUpdate(primaryProviderId, null, null, null, false);
    }

    public static FeatureConfigUpdate fallbacks(List<String> fallbackProviderIds) {
        return new FeatureConfigUpdate(null, fallbackProviderIds, null, null, false);
    }

    public static FeatureConfigUpdate costCeiling(double costCeiling) {
        return new FeatureConfigUpdate(null, null, null, costCeiling, false);
    }

    public static FeatureConfigUpdate withoutCostCeiling() {
        return new FeatureConfigUpdate(null, null, null, null, true);
    }
}
