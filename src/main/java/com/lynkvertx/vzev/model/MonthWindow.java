package com.lynkvertx.vzev.model;

import lombok.Value;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * A calendar month clipped to the configured billing range, [start, end).
 */
@Value
public class MonthWindow {

    YearMonth month;
    LocalDate start;
    LocalDate end;

    public static MonthWindow of(YearMonth month) {
        return new MonthWindow(month, month.atDay(1), month.plusMonths(1).atDay(1));
    }

    public boolean isFullMonth() {
        return start.equals(month.atDay(1)) && end.equals(month.plusMonths(1).atDay(1));
    }
}
