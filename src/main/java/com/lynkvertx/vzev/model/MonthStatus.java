package com.lynkvertx.vzev.model;

import lombok.Builder;
import lombok.Value;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Completeness verdict for one month.
 */
@Value
@Builder
public class MonthStatus {

    YearMonth month;
    MonthWindow window;
    boolean billable;
    int expectedSlots;
    /** Physical meter external id to number of missing slots; only meters with gaps */
    Map<String, Integer> missing;
    /** Physical meter external id to the missing slots in time order */
    Map<String, List<Slot>> gaps;
    List<String> warnings;

    /** Why the month is excluded from billing; empty when billable */
    public List<String> exclusionReasons() {
        List<String> reasons = new ArrayList<>();
        if (billable) {
            return reasons;
        }
        if (missing.isEmpty()) {
            reasons.add("no physical meters to check");
        }
        missing.forEach((meter, count) ->
            reasons.add(String.format("meter %s is missing %d of %d slot(s)", meter, count, expectedSlots)));
        return reasons;
    }
}
