package com.lynkvertx.vzev.model;

import java.time.LocalDate;

/**
 * Billing interval kinds. Buckets are aligned to the calendar year.
 */
public enum BillingInterval {
    MONTHLY(1),
    QUARTERLY(3),
    SEMI_ANNUAL(6),
    ANNUAL(12);

    private final int months;

    BillingInterval(int months) {
        this.months = months;
    }

    public int getMonths() {
        return months;
    }

    /** First day of the calendar-aligned bucket containing the given date */
    public LocalDate bucketStart(LocalDate date) {
        int firstMonth = ((date.getMonthValue() - 1) / months) * months + 1;
        return LocalDate.of(date.getYear(), firstMonth, 1);
    }

    /** Exclusive end of the calendar-aligned bucket containing the given date */
    public LocalDate bucketEnd(LocalDate date) {
        return bucketStart(date).plusMonths(months);
    }

    /** Label of the bucket starting at the given date, e.g. 2024-03, 2024-Q1, 2024-H2, 2024 */
    public String label(LocalDate bucketStart) {
        int year = bucketStart.getYear();
        int index = (bucketStart.getMonthValue() - 1) / months + 1;
        switch (this) {
            case MONTHLY:
                return String.format("%d-%02d", year, bucketStart.getMonthValue());
            case QUARTERLY:
                return year + "-Q" + index;
            case SEMI_ANNUAL:
                return year + "-H" + index;
            default:
                return String.valueOf(year);
        }
    }
}
