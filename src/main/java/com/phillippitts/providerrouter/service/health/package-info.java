/**
 * Per-provider health tracking and recovery.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.phillippitts.providerrouter.service.health.HealthMonitor HealthMonitor} -
 *       keeps one immutable {@link com.phillippitts.providerrouter.domain.HealthRecord HealthRecord}
 *       per provider and applies reported outcomes</li>
 *   <li>{@link com.phillippitts.providerrouter.service.health.ProviderRoutingHealthIndicator
 *       ProviderRoutingHealthIndicator} - exposes pool availability via /actuator/health</li>
 * </ul>
 *
 * <h2>State Machine</h2>
 * <p>A provider starts healthy. Three consecutive failures (configurable) mark it unhealthy; any
 * success resets the counter and restores it. An unhealthy provider heals lazily when it is read
 * after the short recovery window (10 minutes), or in the background by the
 * {@link com.phillippitts.providerrouter.service.recovery.RecoverySweeper RecoverySweeper} after
 * the long window (30 minutes).</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Records are replaced through {@code ConcurrentHashMap.compute}, so every read-modify-write
 * on one provider is atomic. Transition events are published after the update, outside the
 * per-key critical section.</p>
 *
 * @since 1.0
 */
package com.phillippitts.providerrouter.service.health;
