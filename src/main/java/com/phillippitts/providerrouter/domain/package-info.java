/**
 * Core domain value types for provider routing.
 *
 * <p>Domain objects are immutable records:
 * <ul>
 *   <li>{@link com.phillippitts.providerrouter.domain.Provider} - catalog facts about a backend</li>
 *   <li>{@link com.phillippitts.providerrouter.domain.FeatureConfig} - primary/fallback chain of
 *       one feature</li>
 *   <li>{@link com.phillippitts.providerrouter.domain.HealthRecord} - per-provider trust state</li>
 *   <li>{@link com.phillippitts.providerrouter.domain.SystemStatus} - dashboard snapshot</li>
 * </ul>
 *
 * <p>This package has no Spring dependencies.
 *
 * @since 1.0
 */
package com.phillippitts.providerrouter.domain;
