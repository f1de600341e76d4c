package com.lynkvertx.vzev.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A custom fee as charged on a bill.
 */
@Value
@Builder
public class CalculatedFee {

    String name;
    FeeType type;
    BigDecimal value;
    /** Null unless the fee is per kWh */
    FeeBasis basis;
    BigDecimal amount;
}
