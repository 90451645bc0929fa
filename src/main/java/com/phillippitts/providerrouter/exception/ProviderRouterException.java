package com.phillippitts.providerrouter.exception;

/**
 * Base exception for all provider routing errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class ProviderRouterException extends RuntimeException {

    public ProviderRouterException(String message) {
        super(message);
    }

    public ProviderRouterException(String message, Throwable cause) {
        super(message, cause);
    }

    public ProviderRouterException(Throwable cause) {
        super(cause);
    }
}
