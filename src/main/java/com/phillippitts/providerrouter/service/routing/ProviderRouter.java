package com.phillippitts.providerrouter.service.routing;

import com.phillippitts.providerrouter.exception.ConfigException;
import com.phillippitts.providerrouter.exception.RoutingExhaustedException;

import java.util.Set;

/**
 * Picks the provider to call right now for a feature.
 *
 * <p>Selection order:
 * <ol>
 *   <li>The feature's primary provider, if eligible.</li>
 *   <li>The first eligible fallback, in configured order.</li>
 *   <li>The emergency default provider, if one is configured.</li>
 * </ol>
 * A provider is eligible when it is active in the catalog, within the feature's cost ceiling
 * (if any) and healthy. Order in configuration is the only preference signal; fallbacks are
 * never reordered by latency or cost.
 *
 * <p>Implementations are synchronous and never perform I/O.
 */
public interface ProviderRouter {

    /**
     * @param feature feature to route
     * @return id of the provider to call
     * @throws ConfigException if the feature is unknown
     * @throws RoutingExhaustedException if no candidate is eligible and no emergency default exists
     */
    default String selectProvider(String feature) {
        return selectProvider(feature, Set.of());
    }

    /**
     * Same as {@link #selectProvider(String)} but never returns one of {@code excludedProviderIds},
     * including the emergency default.
     *
     * @param feature feature to route
     * @param excludedProviderIds providers to skip (e.g. already tried for this request)
     * @return id of the provider to call
     */
    String selectProvider(String feature, Set<String> excludedProviderIds);
}
