package com.phillippitts.providerrouter.service.execution;

import com.phillippitts.providerrouter.domain.FeatureConfig;
import com.phillippitts.providerrouter.exception.ProviderCallException;
import com.phillippitts.providerrouter.exception.RoutingExhaustedException;
import com.phillippitts.providerrouter.service.report.OutcomeReporter;
import com.phillippitts.providerrouter.service.routing.FeatureRoutingTable;
import com.phillippitts.providerrouter.service.routing.ProviderRouter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Caller-side helper that runs a provider call through select, invoke and report, moving on to
 * the next eligible provider when an attempt fails.
 *
 * <p>At most {@code 1 + maxRetries} providers are attempted per call, each one at most once.
 * Every attempt is reported, so failures still drive provider health.
 */
public class FallbackExecutor {

    private static final Logger LOG = LogManager.getLogger(FallbackExecutor.class);

    private final ProviderRouter router;
    private final OutcomeReporter reporter;
    private final FeatureRoutingTable routingTable;

    public FallbackExecutor(ProviderRouter router, OutcomeReporter reporter, FeatureRoutingTable routingTable) {
        this.router = Objects.requireNonNull(router, "router");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.routingTable = Objects.requireNonNull(routingTable, "routingTable");
    }

    /**
     * @param feature feature to serve
     * @param call provider call
     * @return result of the first successful attempt
     * @throws RoutingExhaustedException if no provider could be selected for a first attempt
     * @throws ProviderCallException if every attempted provider failed
     */
    public <T> T execute(String feature, ProviderCall<T> call) {
        Objects.requireNonNull(call, "call");
        FeatureConfig config = routingTable.get(feature);
        int maxAttempts = 1 + config.maxRetries();
        Set<String> attempted = new LinkedHashSet<>();
        Exception lastFailure = null;

        while (attempted.size() < maxAttempts) {
            String providerId;
            try {
                providerId = router.selectProvider(feature, attempted);
            } catch (RoutingExhaustedException e) {
                if (lastFailure == null) {
                    throw e;
                }
                LOG.debug("No untried provider left for feature {} after {}", feature, attempted);
                break;
            }
            attempted.add(providerId);

            long startNanos = System.nanoTime();
            try {
                T result = call.invoke(providerId);
                reporter.report(providerId, true, (System.nanoTime() - startNanos) / 1_000_000.0);
                if (attempted.size() > 1) {
                    LOG.info("Feature {} served by {} after {} attempt(s)", feature, providerId, attempted.size());
                }
                return result;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                reporter.report(providerId, false);
                throw new ProviderCallException(feature, List.copyOf(attempted), e);
            } catch (Exception e) {
                lastFailure = e;
                reporter.report(providerId, false);
                LOG.warn("Provider {} failed for feature {} (attempt {}/{}): {}",
                        providerId, feature, attempted.size(), maxAttempts, e.toString());
            }
        }

        LOG.error("All attempts failed for feature {}: attempted={}", feature, attempted);
        throw new ProviderCallException(feature, List.copyOf(attempted), lastFailure);
    }
}
