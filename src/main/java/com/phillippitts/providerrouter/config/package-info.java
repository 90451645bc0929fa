/**
 * Spring configuration: explicit bean wiring of the routing core and the recovery scheduler.
 */
package com.phillippitts.providerrouter.config;
