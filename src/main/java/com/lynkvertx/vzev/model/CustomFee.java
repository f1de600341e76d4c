package com.lynkvertx.vzev.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A configured fee line of a member. Fees are applied in list order.
 */
@Value
@Builder
public class CustomFee {

    String name;
    FeeType type;
    BigDecimal value;
    /** Only used by per-kWh fees; grid when absent */
    FeeBasis basis;

    public FeeBasis getEffectiveBasis() {
        return basis != null ? basis : FeeBasis.GRID;
    }
}
