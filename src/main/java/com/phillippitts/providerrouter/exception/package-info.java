/**
 * Provider routing exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.providerrouter.exception.ProviderRouterException} - Base exception
 *       for all routing errors</li>
 *   <li>{@link com.phillippitts.providerrouter.exception.ConfigException} - Unknown feature or
 *       provider, or invalid routing configuration</li>
 *   <li>{@link com.phillippitts.providerrouter.exception.RoutingExhaustedException} - No eligible
 *       provider remains for a feature</li>
 *   <li>{@link com.phillippitts.providerrouter.exception.ProviderCallException} - Fallback executor
 *       ran out of attempts</li>
 * </ul>
 *
 * <p>A single failed provider call is never an exception inside the routing core. It is reported
 * as an outcome and only influences future routing decisions.
 *
 * @see com.phillippitts.providerrouter.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.providerrouter.exception;
