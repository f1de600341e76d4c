package com.lynkvertx.vzev.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;

/**
 * Allocation of a billable month with collective totals and cross-check warnings.
 */
@Value
@Builder
public class MonthAllocation {

    YearMonth month;
    List<SlotAllocation> allocations;
    BigDecimal totalLocallyConsumedKwh;
    BigDecimal totalGridKwh;
    BigDecimal totalExportKwh;
    List<String> warnings;
}
