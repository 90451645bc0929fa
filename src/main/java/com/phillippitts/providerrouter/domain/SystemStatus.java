package com.phillippitts.providerrouter.domain;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time routing overview for dashboards and health endpoints.
 */
public record SystemStatus(
        int totalProviders,
        int healthyCount,
        int unhealthyCount,
        Map<ProviderCategory, Integer> byCategory,
        Map<CostBucket, Integer> byCostBucket,
        Map<String, Integer> byVendor,
        Map<String, Double> averageCostByVendor,
        Instant generatedAt
) {

    public SystemStatus {
        byCategory = Map.copyOf(byCategory);
        byCostBucket = Map.copyOf(byCostBucket);
        byVendor = Map.copyOf(byVendor);
        averageCostByVendor = Map.copyOf(averageCostByVendor);
    }
}
