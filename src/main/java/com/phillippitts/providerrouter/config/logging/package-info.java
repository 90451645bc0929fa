/**
 * Request-scoped logging context (Log4j2 ThreadContext).
 */
package com.phillippitts.providerrouter.config.logging;
