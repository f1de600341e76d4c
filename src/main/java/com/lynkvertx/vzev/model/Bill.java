package com.lynkvertx.vzev.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Bill of one member for one billing period.
 *
 * Sign convention: {@code netAmount = totalCost + totalFees - totalRevenue}. A positive net amount
 * is owed by the member, a negative one is paid out to the member.
 */
@Value
@Builder
public class Bill {

    Long memberId;
    String firstName;
    String lastName;
    String street;
    String zip;
    String city;
    boolean host;
    boolean producer;
    BillingPeriod period;
    String currency;

    // Energy (kWh)
    BigDecimal consumptionKwh;
    BigDecimal localSolarKwh;
    BigDecimal gridKwh;
    BigDecimal productionKwh;
    BigDecimal localSoldKwh;
    BigDecimal exportKwh;

    // Rates applied
    /** 0 for the host */
    BigDecimal localRate;
    BigDecimal localSellRate;
    BigDecimal bkwBuyRate;
    BigDecimal bkwSellRate;

    // Amounts
    BigDecimal localCost;
    BigDecimal gridCost;
    BigDecimal totalCost;
    BigDecimal localSellRevenue;
    BigDecimal exportRevenue;
    BigDecimal totalRevenue;

    // Custom fees, in configured order
    List<CalculatedFee> calculatedFees;
    BigDecimal totalFees;

    BigDecimal netAmount;

    List<DailyDetail> dailyDetails;
}
