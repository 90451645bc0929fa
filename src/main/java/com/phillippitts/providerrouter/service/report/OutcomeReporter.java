package com.phillippitts.providerrouter.service.report;

import com.phillippitts.providerrouter.exception.ConfigException;

/**
 * Callback surface used after a provider call to feed its result back into routing.
 *
 * <p>Callers report every attempt, successful or not. A failed call is never an error from the
 * router's point of view; it only affects future routing decisions.
 */
public interface OutcomeReporter {

    /**
     * Reports the result of one provider call.
     *
     * @param providerId provider that was called (as returned by the router)
     * @param success whether the call succeeded
     * @param latencyMs observed latency in milliseconds, or null when not measured
     * @throws ConfigException if the provider is unknown
     */
    void report(String providerId, boolean success, Double latencyMs);

    default void report(String providerId, boolean success) {
        report(providerId, success, null);
    }
}
