package com.phillippitts.providerrouter.service.routing;

import com.phillippitts.providerrouter.domain.FeatureConfig;
import com.phillippitts.providerrouter.domain.Provider;
import com.phillippitts.providerrouter.exception.RoutingExhaustedException;
import com.phillippitts.providerrouter.service.catalog.ProviderCatalog;
import com.phillippitts.providerrouter.service.health.HealthMonitor;
import com.phillippitts.providerrouter.service.metrics.RoutingMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Default {@link ProviderRouter} reading the routing table, the catalog and the health monitor.
 *
 * <p>Gates are evaluated cheapest first: exclusion, active flag, cost ceiling, then health.
 * The health check comes last because it may heal a provider whose short cooldown elapsed;
 * only candidates that would otherwise be eligible trigger that recovery.
 */
public class DefaultProviderRouter implements ProviderRouter {

    private static final Logger LOG = LogManager.getLogger(DefaultProviderRouter.class);

    private final FeatureRoutingTable routingTable;
    private final ProviderCatalog catalog;
    private final HealthMonitor healthMonitor;
    private final RoutingMetrics metrics;
    private final String emergencyDefaultProviderId;

    /**
     * @param emergencyDefaultProviderId last-resort provider, or null when none is configured
     */
    public DefaultProviderRouter(FeatureRoutingTable routingTable,
                                 ProviderCatalog catalog,
                                 HealthMonitor healthMonitor,
                                 RoutingMetrics metrics,
                                 String emergencyDefaultProviderId) {
        this.routingTable = Objects.requireNonNull(routingTable, "routingTable");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.emergencyDefaultProviderId =
                (emergencyDefaultProviderId == null || emergencyDefaultProviderId.isBlank())
                        ? null : emergencyDefaultProviderId;
    }

    @Override
    public String selectProvider(String feature, Set<String> excludedProviderIds) {
        FeatureConfig config = routingTable.get(feature);
        Set<String> excluded = excludedProviderIds == null ? Set.of() : excludedProviderIds;

        String primary = config.primaryProviderId();
        if (isEligible(config, primary, excluded)) {
            metrics.recordSelection(feature, primary, SelectionTier.PRIMARY);
            return primary;
        }

        for (String fallback : config.fallbackProviderIds()) {
            if (isEligible(config, fallback, excluded)) {
                LOG.warn("Primary {} unavailable for feature {}, using fallback {}", primary, feature, fallback);
                metrics.recordSelection(feature, fallback, SelectionTier.FALLBACK);
                return fallback;
            }
        }

        if (emergencyDefaultProviderId != null && !excluded.contains(emergencyDefaultProviderId)) {
            LOG.warn("All preferred providers unavailable for feature {}, using emergency default {}",
                    feature, emergencyDefaultProviderId);
            metrics.recordSelection(feature, emergencyDefaultProviderId, SelectionTier.EMERGENCY);
            return emergencyDefaultProviderId;
        }

        LOG.error("Routing exhausted for feature {}: candidates={}, excluded={}",
                feature, config.candidates(), excluded);
        metrics.recordExhausted(feature);
        throw new RoutingExhaustedException(feature, config.candidates());
    }

    public Optional<String> getEmergencyDefaultProviderId() {
        return Optional.ofNullable(emergencyDefaultProviderId);
    }

    private boolean isEligible(FeatureConfig config, String providerId, Set<String> excluded) {
        if (excluded.contains(providerId)) {
            LOG.debug("Skipping provider {} for feature {}: excluded", providerId, config.feature());
            return false;
        }
        if (!catalog.isActive(providerId)) {
            LOG.debug("Skipping provider {} for feature {}: inactive", providerId, config.feature());
            return false;
        }
        Provider provider = catalog.get(providerId);
        if (!config.allowsCost(provider.unitCost())) {
            LOG.debug("Skipping provider {} for feature {}: unitCost {} above ceiling {}",
                    providerId, config.feature(), provider.unitCost(), config.costCeiling());
            return false;
        }
        if (!healthMonitor.isHealthy(providerId)) {
            LOG.debug("Skipping provider {} for feature {}: unhealthy", providerId, config.feature());
            return false;
        }
        return true;
    }
}
