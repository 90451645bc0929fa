package com.phillippitts.providerrouter.service.routing;

import com.phillippitts.providerrouter.domain.FeatureConfig;
import com.phillippitts.providerrouter.domain.FeatureConfigUpdate;
import com.phillippitts.providerrouter.exception.ConfigException;
import com.phillippitts.providerrouter.service.catalog.ProviderCatalog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Feature name to routing chain mapping, mutable at runtime.
 *
 * <p>Each feature maps to its own immutable {@link FeatureConfig}; an update replaces that one
 * value atomically and never touches another feature. Every provider id referenced by a config
 * must exist in the {@link ProviderCatalog}.
 */
public class FeatureRoutingTable {

    private static final Logger LOG = LogManager.getLogger(FeatureRoutingTable.class);

    private final ConcurrentMap<String, FeatureConfig> configs = new ConcurrentHashMap<>();
    private final ProviderCatalog catalog;
    private final boolean allowFeatureCreation;

    /**
     * @param catalog catalog used to validate provider references
     * @param initial startup configuration
     * @param allowFeatureCreation whether {@link #update} may create unknown features
     * @throws ConfigException on duplicate features or unknown provider references
     */
    public FeatureRoutingTable(ProviderCatalog catalog, Collection<FeatureConfig> initial,
                               boolean allowFeatureCreation) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.allowFeatureCreation = allowFeatureCreation;
        for (FeatureConfig config : initial) {
            validate(config);
            if (configs.putIfAbsent(config.feature(), config) != null) {
                throw ConfigException.invalid(config.feature(), "duplicate feature");
            }
        }
        LOG.info("Feature routing table loaded: features={}", features());
    }

    /**
     * @throws ConfigException if the feature is unknown
     */
    public FeatureConfig get(String feature) {
        FeatureConfig config = feature == null ? null : configs.get(feature);
        if (config == null) {
            throw ConfigException.unknownFeature(feature);
        }
        return config;
    }

    public Optional<FeatureConfig> find(String feature) {
        return Optional.ofNullable(feature == null ? null : configs.get(feature));
    }

    /** Configured feature names, sorted. */
    public SortedSet<String> features() {
        return new TreeSet<>(configs.keySet());
    }

    /**
     * Merges a partial update into a feature's config.
     *
     * <p>The update is all-or-nothing: on any validation failure the previous config stays in
     * place.
     *
     * @param feature feature to update
     * @param update fields to change
     * @return the config now in effect
     * @throws ConfigException if the feature is unknown (and creation is not allowed), or the
     *                         merged config is invalid
     */
    public FeatureConfig update(String feature, FeatureConfigUpdate update) {
        Objects.requireNonNull(update, "update");
        if (feature == null || feature.isBlank()) {
            throw ConfigException.invalid(String.valueOf(feature), "feature name must not be blank");
        }
        FeatureConfig updated = configs.compute(feature, (name, existing) -> {
            FeatureConfig merged = existing == null ? create(name, update) : merge(existing, update);
            validate(merged);
            return merged;
        });
        LOG.info("Feature {} routing updated: primary={}, fallbacks={}, maxRetries={}, costCeiling={}",
                feature, updated.primaryProviderId(), updated.fallbackProviderIds(),
                updated.maxRetries(), updated.costCeiling());
        return updated;
    }

    private FeatureConfig create(String feature, FeatureConfigUpdate update) {
        if (!allowFeatureCreation) {
            throw ConfigException.unknownFeature(feature);
        }
        if (update.primaryProviderId() == null) {
            throw ConfigException.invalid(feature, "a primary provider is required to create a feature");
        }
        try {
            return new FeatureConfig(
                    feature,
                    update.primaryProviderId(),
                    update.fallbackProviderIds(),
                    update.maxRetries() != null ? update.maxRetries() : FeatureConfig.DEFAULT_MAX_RETRIES,
                    update.clearCostCeiling() ? null : update.costCeiling());
        } catch (IllegalArgumentException e) {
            throw ConfigException.invalid(feature, e.getMessage());
        }
    }

    private static FeatureConfig merge(FeatureConfig existing, FeatureConfigUpdate update) {
        try {
            return existing.merge(update);
        } catch (IllegalArgumentException e) {
            throw ConfigException.invalid(existing.feature(), e.getMessage());
        }
    }

    private void validate(FeatureConfig config) {
        for (String providerId : config.candidates()) {
            if (!catalog.contains(providerId)) {
                throw ConfigException.invalid(config.feature(), "unknown provider " + providerId);
            }
        }
    }
}
