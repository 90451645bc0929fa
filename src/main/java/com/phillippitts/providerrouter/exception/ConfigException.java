package com.phillippitts.providerrouter.exception;

/**
 * Thrown when a call references an unknown feature or provider, or when a routing
 * configuration (initial or updated) is invalid. Never retried internally.
 */
public class ConfigException extends ProviderRouterException {

    /** What kind of configuration key the error refers to. */
    public enum Kind { UNKNOWN_FEATURE, UNKNOWN_PROVIDER, INVALID_CONFIG }

    private final Kind kind;
    private final String key;

    public ConfigException(Kind kind, String key, String message) {
        super(message);
        this.kind = kind;
        this.key = key;
    }

    public static ConfigException unknownFeature(String feature) {
        return new ConfigException(Kind.UNKNOWN_FEATURE, feature, "unknown feature: " + feature);
    }

    public static ConfigException unknownProvider(String providerId) {
        return new ConfigException(Kind.UNKNOWN_PROVIDER, providerId, "unknown provider: " + providerId);
    }

    public static ConfigException invalid(String key, String reason) {
        return new ConfigException(Kind.INVALID_CONFIG, key, "invalid configuration for " + key + ": " + reason);
    }

    public Kind getKind() {
        return kind;
    }

    public String getKey() {
        return key;
    }
}
