package com.phillippitts.providerrouter.domain;

import java.util.Objects;

/**
 * Immutable facts about one interchangeable backend provider.
 *
 * <p>{@code active} is the value loaded from configuration. Administrative toggles are held by
 * the catalog and do not produce a new {@code Provider} instance.
 *
 * @param id unique provider id (e.g. {@code "llama-3.3-70b-versatile"})
 * @param category capability category the provider serves
 * @param vendor vendor hosting the provider (e.g. {@code "Groq"})
 * @param unitCost relative cost per 1k units, never negative
 * @param capacityLimit maximum units per request, always positive
 * @param priorityRank lower is preferred when listing by category
 * @param active whether the provider is enabled at load time
 */
public record Provider(
        String id,
        ProviderCategory category,
        String vendor,
        double unitCost,
        int capacityLimit,
        int priorityRank,
        boolean active
) {

    public Provider {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        Objects.requireNonNull(category, "category");
        if (vendor == null || vendor.isBlank()) {
            vendor = "unknown";
        }
        if (unitCost < 0.0 || Double.isNaN(unitCost)) {
            throw new IllegalArgumentException("unitCost must be >= 0 for provider " + id);
        }
        if (capacityLimit <= 0) {
            throw new IllegalArgumentException("capacityLimit must be > 0 for provider " + id);
        }
    }

    public CostBucket costBucket() {
        return CostBucket.of(unitCost);
    }
}
