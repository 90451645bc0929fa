package com.phillippitts.providerrouter.config.properties;

import com.phillippitts.providerrouter.domain.FeatureConfig;
import com.phillippitts.providerrouter.domain.Provider;
import com.phillippitts.providerrouter.domain.ProviderCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the provider routing engine (prefix {@code routing}).
 *
 * <p>Supplies the provider catalog, the feature routing table, health thresholds and the
 * recovery sweeper schedule. Loaded once at startup; feature routing may later be changed at
 * runtime through the routing engine, which does not write back to these properties.
 */
@Validated
@ConfigurationProperties(prefix = "routing")
public class RoutingProperties {

    @Valid
    private Health health = new Health();

    @Valid
    private Sweeper sweeper = new Sweeper();

    @Valid
    private List<ProviderDefinition> providers = new ArrayList<>();

    @Valid
    private Map<String, FeatureDefinition> features = new LinkedHashMap<>();

    /** Last-resort provider returned when every candidate of a feature is ineligible. */
    private String emergencyDefaultProvider;

    /** Whether updates for an unknown feature may create it. */
    private boolean allowFeatureCreation = false;

    public Health getHealth() {
        return health;
    }

    public void setHealth(Health health) {
        this.health = health;
    }

    public Sweeper getSweeper() {
        return sweeper;
    }

    public void setSweeper(Sweeper sweeper) {
        this.sweeper = sweeper;
    }

    public List<ProviderDefinition> getProviders() {
        return providers;
    }

    public void setProviders(List<ProviderDefinition> providers) {
        this.providers = providers;
    }

    public Map<String, FeatureDefinition> getFeatures() {
        return features;
    }

    public void setFeatures(Map<String, FeatureDefinition> features) {
        this.features = features;
    }

    public String getEmergencyDefaultProvider() {
        return emergencyDefaultProvider;
    }

    public void setEmergencyDefaultProvider(String emergencyDefaultProvider) {
        this.emergencyDefaultProvider = emergencyDefaultProvider;
    }

    public boolean isAllowFeatureCreation() {
        return allowFeatureCreation;
    }

    public void setAllowFeatureCreation(boolean allowFeatureCreation) {
        this.allowFeatureCreation = allowFeatureCreation;
    }

    /**
     * Converts provider definitions to immutable catalog entries, in declaration order.
     */
    public List<Provider> toProviders() {
        List<Provider> result = new ArrayList<>(providers.size());
        for (ProviderDefinition def : providers) {
            result.add(def.toProvider());
        }
        return result;
    }

    /**
     * Converts feature definitions to routing configs; the map key is the feature name.
     */
    public List<FeatureConfig> toFeatureConfigs() {
        List<FeatureConfig> result = new ArrayList<>(features.size());
        for (Map.Entry<String, FeatureDefinition> entry : features.entrySet()) {
            result.add(entry.getValue().toFeatureConfig(entry.getKey()));
        }
        return result;
    }

    /**
     * Health thresholds.
     */
    public static class Health {

        /** Consecutive failures that mark a provider unhealthy. */
        @Positive(message = "Failure threshold must be positive")
        private int failureThreshold = 3;

        /** Cooldown after which a queried unhealthy provider heals on read. */
        @NotNull
        private Duration shortRecovery = Duration.ofMinutes(10);

        /** Cooldown after which the sweeper heals an unhealthy provider. */
        @NotNull
        private Duration longRecovery = Duration.ofMinutes(30);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getShortRecovery() {
            return shortRecovery;
        }

        public void setShortRecovery(Duration shortRecovery) {
            this.shortRecovery = shortRecovery;
        }

        public Duration getLongRecovery() {
            return longRecovery;
        }

        public void setLongRecovery(Duration longRecovery) {
            this.longRecovery = longRecovery;
        }
    }

    /**
     * Recovery sweeper schedule.
     */
    public static class Sweeper {

        /** Start the sweeper with the application context. */
        private boolean enabled = true;

        /** Delay between two sweeps. */
        @NotNull
        private Duration interval = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    /**
     * One catalog entry.
     */
    public static class ProviderDefinition {

        @NotBlank(message = "Provider id must not be blank")
        private String id;

        @NotNull(message = "Provider category is required")
        private ProviderCategory category;

        private String vendor;

        @PositiveOrZero(message = "Unit cost must not be negative")
        private double unitCost = 0.0;

        @Positive(message = "Capacity limit must be positive")
        private int capacityLimit = 8192;

        private int priorityRank = 1;

        private boolean active = true;

        Provider toProvider() {
            return new Provider(id, category, vendor, unitCost, capacityLimit, priorityRank, active);
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public ProviderCategory getCategory() {
            return category;
        }

        public void setCategory(ProviderCategory category) {
            this.category = category;
        }

        public String getVendor() {
            return vendor;
        }

        public void setVendor(String vendor) {
            this.vendor = vendor;
        }

        public double getUnitCost() {
            return unitCost;
        }

        public void setUnitCost(double unitCost) {
            this.unitCost = unitCost;
        }

        public int getCapacityLimit() {
            return capacityLimit;
        }

        public void setCapacityLimit(int capacityLimit) {
            this.capacityLimit = capacityLimit;
        }

        public int getPriorityRank() {
            return priorityRank;
        }

        public void setPriorityRank(int priorityRank) {
            this.priorityRank = priorityRank;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }
    }

    /**
     * Routing of one feature.
     */
    public static class FeatureDefinition {

        @NotBlank(message = "Feature primary provider must not be blank")
        private String primary;

        private List<String> fallbacks = new ArrayList<>();

        @PositiveOrZero(message = "Max retries must not be negative")
        private int maxRetries = FeatureConfig.DEFAULT_MAX_RETRIES;

        @PositiveOrZero(message = "Cost ceiling must not be negative")
        private Double costCeiling;

        FeatureConfig toFeatureConfig(String feature) {
            return new FeatureConfig(feature, primary, fallbacks, maxRetries, costCeiling);
        }

        public String getPrimary() {
            return primary;
        }

        public void setPrimary(String primary) {
            this.primary = primary;
        }

        public List<String> getFallbacks() {
            return fallbacks;
        }

        public void setFallbacks(List<String> fallbacks) {
            this.fallbacks = fallbacks;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Double getCostCeiling() {
            return costCeiling;
        }

        public void setCostCeiling(Double costCeiling) {
            this.costCeiling = costCeiling;
        }
    }
}
