/**
 * Feature routing: the feature table, the selection algorithm and the
 * {@link com.phillippitts.providerrouter.service.routing.RoutingEngine RoutingEngine} facade.
 *
 * <p>Selection walks primary, fallbacks in configured order, then the emergency default. A
 * candidate is eligible when it is not excluded, active, within the feature's cost ceiling and
 * healthy.
 */
package com.phillippitts.providerrouter.service.routing;
