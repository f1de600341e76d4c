package com.lynkvertx.vzev.exception;

import com.lynkvertx.vzev.model.BillingPeriod;
import lombok.Getter;

import java.time.YearMonth;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A bill was requested for a period that still contains non-billable months.
 *
 * Recoverable: the same request succeeds once the missing readings are imported.
 */
@Getter
public class NonBillablePeriodException extends BillingEngineException {

    private final BillingPeriod period;
    private final List<YearMonth> nonBillableMonths;

    public NonBillablePeriodException(BillingPeriod period, List<YearMonth> nonBillableMonths) {
        super(String.format("Billing period %s is not billable, incomplete month(s): %s",
            period.getLabel(),
            nonBillableMonths.stream().map(YearMonth::toString).collect(Collectors.joining(", "))));
        this.period = period;
        this.nonBillableMonths = List.copyOf(nonBillableMonths);
    }
}
