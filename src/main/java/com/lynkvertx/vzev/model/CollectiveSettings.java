package com.lynkvertx.vzev.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Immutable per-collective settings, passed explicitly to every engine call.
 */
@Value
@Builder
public class CollectiveSettings {

    Long collectiveId;
    String name;
    ZoneId zone;
    /** Rate members pay for local solar energy, also the rate producers earn for it */
    BigDecimal localRate;
    /** Grid purchase rate */
    BigDecimal bkwBuyRate;
    /** Grid feed-in rate */
    BigDecimal bkwSellRate;
    BillingInterval billingInterval;
    /** Inclusive */
    LocalDate periodStart;
    /** Exclusive */
    LocalDate periodEnd;
    boolean showDailyDetail;
    String currency;
}
