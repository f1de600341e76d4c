package com.lynkvertx.vzev.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Month availability overview entry
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthAvailabilityDTO {

    /** yyyy-MM */
    private String month;
    private LocalDate windowStart;
    private LocalDate windowEnd;
    private boolean billable;
    private int expectedSlots;
    /** Meter external id to missing slot count */
    private Map<String, Integer> missing;
    private List<String> reasons;
}
