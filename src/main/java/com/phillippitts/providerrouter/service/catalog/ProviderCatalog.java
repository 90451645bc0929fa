package com.phillippitts.providerrouter.service.catalog;

import com.phillippitts.providerrouter.domain.Provider;
import com.phillippitts.providerrouter.domain.ProviderCategory;
import com.phillippitts.providerrouter.exception.ConfigException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Read-mostly lookup of provider facts, loaded once at startup.
 *
 * <p>Provider facts never change after load. The one exception is the active flag, which
 * operators may toggle at runtime; toggles are kept as overrides and are visible to the very
 * next routing decision.
 */
public class ProviderCatalog {

    private static final Logger LOG = LogManager.getLogger(ProviderCatalog.class);

    private final Map<String, Provider> providersById;
    private final ConcurrentMap<String, Boolean> activeOverrides = new ConcurrentHashMap<>();

    /**
     * @param providers catalog entries; ids must be unique
     * @throws ConfigException if two entries share an id
     */
    public ProviderCatalog(Collection<Provider> providers) {
        Map<String, Provider> byId = new LinkedHashMap<>();
        for (Provider p : providers) {
            if (byId.putIfAbsent(p.id(), p) != null) {
                throw ConfigException.invalid(p.id(), "duplicate provider id");
            }
        }
        this.providersById = Collections.unmodifiableMap(byId);
        LOG.info("Provider catalog loaded: {} providers", providersById.size());
    }

    /**
     * @throws ConfigException if the provider is unknown
     */
    public Provider get(String providerId) {
        Provider provider = providersById.get(providerId);
        if (provider == null) {
            throw ConfigException.unknownProvider(providerId);
        }
        return provider;
    }

    public Optional<Provider> find(String providerId) {
        return Optional.ofNullable(providerId == null ? null : providersById.get(providerId));
    }

    public boolean contains(String providerId) {
        return providerId != null && providersById.containsKey(providerId);
    }

    /** Every provider, in load order, regardless of the active flag. */
    public List<Provider> all() {
        return List.copyOf(providersById.values());
    }

    public int size() {
        return providersById.size();
    }

    /**
     * Active providers of a category, most preferred first (ascending priority rank).
     */
    public List<Provider> listByCategory(ProviderCategory category) {
        return providersById.values().stream()
                .filter(p -> p.category() == category)
                .filter(p -> isActive(p.id()))
                .sorted(Comparator.comparingInt(Provider::priorityRank))
                .toList();
    }

    /**
     * Effective active flag. Unknown providers are never active.
     */
    public boolean isActive(String providerId) {
        Provider provider = providerId == null ? null : providersById.get(providerId);
        if (provider == null) {
            return false;
        }
        return activeOverrides.getOrDefault(providerId, provider.active());
    }

    /**
     * Administratively enables or disables a provider.
     *
     * @throws ConfigException if the provider is unknown
     */
    public void setActive(String providerId, boolean active) {
        get(providerId);
        Boolean previous = activeOverrides.put(providerId, active);
        if (previous == null || previous != active) {
            LOG.info("Provider {} administratively {}", providerId, active ? "enabled" : "disabled");
        }
    }

    /**
     * Estimated cost of a request: unit cost is expressed per 1k units.
     *
     * @param providerId provider to price
     * @param units estimated units (tokens, characters) of the request
     * @return estimated cost in the catalog's relative currency
     */
    public double estimateCost(String providerId, long units) {
        if (units < 0) {
            throw new IllegalArgumentException("units must be >= 0");
        }
        return get(providerId).unitCost() * units / 1000.0;
    }
}
