package com.phillippitts.providerrouter.domain;

/**
 * Coarse grouping of provider unit costs used by status dashboards.
 *
 * <p>Boundaries are inclusive on the upper end: a unit cost of exactly {@code 0.5} is
 * {@link #LOW}, exactly {@code 2.0} is {@link #MEDIUM}.
 */
public enum CostBucket {
    FREE,
    LOW,
    MEDIUM,
    HIGH;

    static final double LOW_MAX = 0.5;
    static final double MEDIUM_MAX = 2.0;

    /**
     * Maps a relative unit cost to its bucket.
     *
     * @param unitCost cost per 1k units, must be non-negative
     * @return bucket for the cost
     */
    public static CostBucket of(double unitCost) {
        if (unitCost <= 0.0) {
            return FREE;
        }
        if (unitCost <= LOW_MAX) {
            return LOW;
        }
        if (unitCost <= MEDIUM_MAX) {
            return MEDIUM;
        }
        return HIGH;
    }
}
