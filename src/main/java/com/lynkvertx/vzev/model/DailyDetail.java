package com.lynkvertx.vzev.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One day of a bill, summed over the local civil day.
 */
@Value
@Builder
public class DailyDetail {

    LocalDate day;
    BigDecimal consumptionKwh;
    BigDecimal localSolarKwh;
    BigDecimal gridKwh;
    BigDecimal productionKwh;
    BigDecimal localSoldKwh;
    BigDecimal exportKwh;
    BigDecimal localCost;
    BigDecimal gridCost;
    BigDecimal totalCost;
    BigDecimal localSellRevenue;
    BigDecimal exportRevenue;
    BigDecimal totalRevenue;
}
