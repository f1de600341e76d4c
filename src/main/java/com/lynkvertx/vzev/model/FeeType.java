package com.lynkvertx.vzev.model;

/**
 * Kinds of per-member custom fees.
 */
public enum FeeType {
    /** Yearly amount, charged pro rata per month of the billing period */
    YEARLY,
    /** Amount per kWh of local solar or grid consumption */
    PER_KWH,
    /** Percentage of the energy cost plus the fees listed before it */
    PERCENT
}
