package com.lynkvertx.vzev.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one billing run: every billable bill plus the explicit list of what was
 * excluded and why.
 */
@Value
@Builder
public class BillingRun {

    List<MonthStatus> monthStatuses;
    List<Bill> bills;
    /** One flat key/value row per bill, same order as {@link #bills} */
    List<Map<String, String>> exportRows;
    List<ExcludedMonth> excludedMonths;
    List<ExcludedPeriod> excludedPeriods;
    List<String> warnings;
}
