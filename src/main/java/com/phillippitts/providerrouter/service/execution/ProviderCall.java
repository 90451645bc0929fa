package com.phillippitts.providerrouter.service.execution;

/**
 * A call against one provider, supplied by the caller (HTTP request to a model, TTS or
 * translation backend). Throwing any exception counts as a failed attempt.
 *
 * @param <T> call result type
 */
@FunctionalInterface
public interface ProviderCall<T> {

    T invoke(String providerId) throws Exception;
}
