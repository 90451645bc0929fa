package com.phillippitts.providerrouter.service.routing;

import com.phillippitts.providerrouter.domain.CostBucket;
import com.phillippitts.providerrouter.domain.FeatureConfig;
import com.phillippitts.providerrouter.domain.FeatureConfigUpdate;
import com.phillippitts.providerrouter.domain.HealthRecord;
import com.phillippitts.providerrouter.domain.Provider;
import com.phillippitts.providerrouter.domain.ProviderCategory;
import com.phillippitts.providerrouter.domain.SystemStatus;
import com.phillippitts.providerrouter.service.catalog.ProviderCatalog;
import com.phillippitts.providerrouter.service.health.HealthMonitor;
import com.phillippitts.providerrouter.service.recovery.RecoverySweeper;
import com.phillippitts.providerrouter.service.report.OutcomeReporter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * Entry point of the routing core for UI and orchestration layers.
 *
 * <p>One instance is constructed explicitly and passed to every caller; there is no static
 * accessor. Typical request flow:
 * <pre>{@code
 * String providerId = engine.selectProvider("narration");
 * long start = System.nanoTime();
 * try {
 *     speechClient.synthesize(providerId, text);
 *     engine.report(providerId, true, (System.nanoTime() - start) / 1_000_000.0);
 * } catch (IOException e) {
 *     engine.report(providerId, false);
 * }
 * }</pre>
 *
 * <p>Lifecycle: {@link #start()} starts the recovery sweeper (when enabled) and
 * {@link #shutdown()} stops it, letting an in-flight sweep finish. Inside a Spring context both
 * are driven by {@link SmartLifecycle}.
 */
public class RoutingEngine implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(RoutingEngine.class);

    private final ProviderRouter router;
    private final OutcomeReporter reporter;
    private final FeatureRoutingTable routingTable;
    private final ProviderCatalog catalog;
    private final HealthMonitor healthMonitor;
    private final RecoverySweeper sweeper;
    private final Clock clock;
    private final boolean sweeperEnabled;

    private volatile boolean running;

    public RoutingEngine(ProviderRouter router,
                         OutcomeReporter reporter,
                         FeatureRoutingTable routingTable,
                         ProviderCatalog catalog,
                         HealthMonitor healthMonitor,
                         RecoverySweeper sweeper,
                         Clock clock,
                         boolean sweeperEnabled) {
        this.router = Objects.requireNonNull(router, "router");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.routingTable = Objects.requireNonNull(routingTable, "routingTable");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
        this.sweeper = Objects.requireNonNull(sweeper, "sweeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sweeperEnabled = sweeperEnabled;
    }

    public String selectProvider(String feature) {
        return router.selectProvider(feature);
    }

    public String selectProvider(String feature, Set<String> excludedProviderIds) {
        return router.selectProvider(feature, excludedProviderIds);
    }

    public void report(String providerId, boolean success, Double latencyMs) {
        reporter.report(providerId, success, latencyMs);
    }

    public void report(String providerId, boolean success) {
        reporter.report(providerId, success);
    }

    public FeatureConfig getFeatureConfig(String feature) {
        return routingTable.get(feature);
    }

    public FeatureConfig updateFeatureConfig(String feature, FeatureConfigUpdate update) {
        return routingTable.update(feature, update);
    }

    public SortedSet<String> getFeatures() {
        return routingTable.features();
    }

    public void setProviderActive(String providerId, boolean active) {
        catalog.setActive(providerId, active);
    }

    public List<Provider> getProvidersByCategory(ProviderCategory category) {
        return catalog.listByCategory(category);
    }

    public double estimateCost(String providerId, long units) {
        return catalog.estimateCost(providerId, units);
    }

    public Optional<HealthRecord> getHealth(String providerId) {
        return healthMonitor.snapshot(providerId);
    }

    /**
     * Builds a status snapshot over the whole catalog. Health is evaluated read-only, so this
     * never heals a provider.
     */
    public SystemStatus getSystemStatus() {
        List<Provider> providers = catalog.all();
        Map<ProviderCategory, Integer> byCategory = new EnumMap<>(ProviderCategory.class);
        Map<CostBucket, Integer> byCostBucket = new EnumMap<>(CostBucket.class);
        Map<String, Integer> byVendor = new TreeMap<>();
        Map<String, Double> costSumByVendor = new TreeMap<>();
        int healthy = 0;

        for (Provider p : providers) {
            if (healthMonitor.peekHealthy(p.id())) {
                healthy++;
            }
            byCategory.merge(p.category(), 1, Integer::sum);
            byCostBucket.merge(p.costBucket(), 1, Integer::sum);
            byVendor.merge(p.vendor(), 1, Integer::sum);
            costSumByVendor.merge(p.vendor(), p.unitCost(), Double::sum);
        }

        Map<String, Double> averageCostByVendor = new TreeMap<>();
        costSumByVendor.forEach((vendor, sum) -> averageCostByVendor.put(vendor, sum / byVendor.get(vendor)));

        return new SystemStatus(
                providers.size(),
                healthy,
                providers.size() - healthy,
                byCategory,
                byCostBucket,
                byVendor,
                averageCostByVendor,
                clock.instant());
    }

    @Override
    public void start() {
        if (sweeperEnabled) {
            sweeper.start();
        } else {
            LOG.info("Recovery sweeper disabled; providers recover only on read or success");
        }
        running = true;
    }

    @Override
    public void stop() {
        sweeper.stop();
        running = false;
    }

    /**
     * Stops background recovery. Routing and reporting keep working afterwards.
     */
    public void shutdown() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
