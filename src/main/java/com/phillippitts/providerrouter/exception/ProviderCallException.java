package com.phillippitts.providerrouter.exception;

import java.util.List;

/**
 * Thrown by the fallback executor once every attempted provider failed and no further
 * attempt is allowed. The last provider failure is kept as the cause.
 */
public class ProviderCallException extends ProviderRouterException {

    private final String feature;
    private final List<String> attemptedProviders;

    public ProviderCallException(String feature, List<String> attemptedProviders, Throwable cause) {
        super("All provider attempts failed for feature " + feature
                + " (attempted=" + attemptedProviders + ")", cause);
        this.feature = feature;
        this.attemptedProviders = List.copyOf(attemptedProviders);
    }

    public String getFeature() {
        return feature;
    }

    public List<String> getAttemptedProviders() {
        return attemptedProviders;
    }
}
