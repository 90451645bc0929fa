package com.phillippitts.providerrouter.service.routing;

/**
 * Part of a feature's routing chain that served a decision.
 */
public enum SelectionTier {
    PRIMARY,
    FALLBACK,
    EMERGENCY
}
