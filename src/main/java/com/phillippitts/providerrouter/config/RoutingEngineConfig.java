package com.phillippitts.providerrouter.config;

import com.phillippitts.providerrouter.config.properties.RoutingProperties;
import com.phillippitts.providerrouter.exception.ConfigException;
import com.phillippitts.providerrouter.service.catalog.ProviderCatalog;
import com.phillippitts.providerrouter.service.execution.FallbackExecutor;
import com.phillippitts.providerrouter.service.health.HealthMonitor;
import com.phillippitts.providerrouter.service.metrics.RoutingMetrics;
import com.phillippitts.providerrouter.service.recovery.RecoverySweeper;
import com.phillippitts.providerrouter.service.report.HealthMonitorOutcomeReporter;
import com.phillippitts.providerrouter.service.report.OutcomeReporter;
import com.phillippitts.providerrouter.service.routing.DefaultProviderRouter;
import com.phillippitts.providerrouter.service.routing.FeatureRoutingTable;
import com.phillippitts.providerrouter.service.routing.ProviderRouter;
import com.phillippitts.providerrouter.service.routing.RoutingEngine;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;

/**
 * Wires the routing core explicitly from {@link RoutingProperties}.
 *
 * <p>Core classes carry no stereotype annotations; every instance is created here so the object
 * graph (catalog, routing table, health monitor, router, reporter, sweeper, engine) is visible in
 * one place.
 */
@Configuration
public class RoutingEngineConfig {

    private final RoutingProperties routingProperties;

    public RoutingEngineConfig(RoutingProperties routingProperties) {
        this.routingProperties = routingProperties;
    }

    /**
     * Time source for health bookkeeping. Tests replace it with a controllable clock.
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProviderCatalog providerCatalog() {
        ProviderCatalog catalog = new ProviderCatalog(routingProperties.toProviders());
        String emergency = routingProperties.getEmergencyDefaultProvider();
        if (emergency != null && !emergency.isBlank() && !catalog.contains(emergency)) {
            throw ConfigException.invalid("routing.emergency-default-provider", "unknown provider " + emergency);
        }
        return catalog;
    }

    @Bean
    public FeatureRoutingTable featureRoutingTable(ProviderCatalog providerCatalog) {
        return new FeatureRoutingTable(providerCatalog, routingProperties.toFeatureConfigs(),
                routingProperties.isAllowFeatureCreation());
    }

    @Bean
    public HealthMonitor healthMonitor(Clock clock, ApplicationEventPublisher publisher) {
        RoutingProperties.Health health = routingProperties.getHealth();
        return new HealthMonitor(clock, health.getFailureThreshold(), health.getShortRecovery(),
                health.getLongRecovery(), publisher);
    }

    @Bean
    public ProviderRouter providerRouter(FeatureRoutingTable featureRoutingTable,
                                         ProviderCatalog providerCatalog,
                                         HealthMonitor healthMonitor,
                                         RoutingMetrics routingMetrics) {
        return new DefaultProviderRouter(featureRoutingTable, providerCatalog, healthMonitor, routingMetrics,
                routingProperties.getEmergencyDefaultProvider());
    }

    @Bean
    public OutcomeReporter outcomeReporter(ProviderCatalog providerCatalog,
                                           HealthMonitor healthMonitor,
                                           RoutingMetrics routingMetrics) {
        return new HealthMonitorOutcomeReporter(providerCatalog, healthMonitor, routingMetrics);
    }

    @Bean
    public RecoverySweeper recoverySweeper(HealthMonitor healthMonitor,
                                           @Qualifier("recoveryTaskScheduler") TaskScheduler recoveryTaskScheduler,
                                           Clock clock) {
        return new RecoverySweeper(healthMonitor, recoveryTaskScheduler, clock,
                routingProperties.getSweeper().getInterval(), ThreadPoolConfig.threadContextPropagatingDecorator());
    }

    /**
     * Routing facade. Started and stopped with the application context.
     */
    @Bean
    public RoutingEngine routingEngine(ProviderRouter providerRouter,
                                       OutcomeReporter outcomeReporter,
                                       FeatureRoutingTable featureRoutingTable,
                                       ProviderCatalog providerCatalog,
                                       HealthMonitor healthMonitor,
                                       RecoverySweeper recoverySweeper,
                                       Clock clock) {
        return new RoutingEngine(providerRouter, outcomeReporter, featureRoutingTable, providerCatalog,
                healthMonitor, recoverySweeper, clock, routingProperties.getSweeper().isEnabled());
    }

    @Bean
    public FallbackExecutor fallbackExecutor(ProviderRouter providerRouter,
                                             OutcomeReporter outcomeReporter,
                                             FeatureRoutingTable featureRoutingTable) {
        return new FallbackExecutor(providerRouter, outcomeReporter, featureRoutingTable);
    }
}
