package com.lynkvertx.vzev.model;

import lombok.Value;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

/**
 * A billing period over [start, end). Lists every calendar month it overlaps.
 */
@Value
public class BillingPeriod {

    BillingInterval interval;
    LocalDate start;
    LocalDate end;
    List<YearMonth> months;
    String label;

    public boolean contains(LocalDate day) {
        return !day.isBefore(start) && day.isBefore(end);
    }
}
