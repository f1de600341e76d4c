package com.lynkvertx.vzev.service;

import com.lynkvertx.vzev.config.BillingEngineConfig;
import com.lynkvertx.vzev.exception.InvalidRangeException;
import com.lynkvertx.vzev.model.BillingInterval;
import com.lynkvertx.vzev.model.BillingPeriod;
import com.lynkvertx.vzev.model.MonthWindow;
import com.lynkvertx.vzev.model.Slot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Calendar Engine
 *
 * Expected measurement slots and billing period boundaries. All daylight-saving handling
 * of the engine lives here: slots are generated by stepping in physical time between local
 * midnights, so a spring-forward day yields 92 slots and a fall-back day 100 slots
 * (Europe/Zurich), never a fixed 96.
 */
@Service
@RequiredArgsConstructor
public class CalendarEngine {

    private final BillingEngineConfig config;

    /**
     * Enumerate every slot start in [start, end) at local civil time of the given zone.
     *
     * @param start first day (inclusive)
     * @param end   last day (exclusive)
     * @param zone  civil time zone of the collective
     * @return slots in ascending time order
     * @throws InvalidRangeException if start is not before end
     */
    public List<Slot> expectedSlots(LocalDate start, LocalDate end, ZoneId zone) {
        requireRange(start, end);
        Duration step = Duration.ofMinutes(config.getSlotMinutes());
        Instant cursor = start.atStartOfDay(zone).toInstant();
        Instant stop = end.atStartOfDay(zone).toInstant();

        List<Slot> slots = new ArrayList<>();
        while (cursor.isBefore(stop)) {
            slots.add(Slot.of(cursor, zone));
            cursor = cursor.plus(step);
        }
        return slots;
    }

    /**
     * All slots of a calendar month.
     */
    public List<Slot> expectedSlots(YearMonth month, ZoneId zone) {
        return expectedSlots(month.atDay(1), month.plusMonths(1).atDay(1), zone);
    }

    public List<Slot> expectedSlots(MonthWindow window, ZoneId zone) {
        return expectedSlots(window.getStart(), window.getEnd(), zone);
    }

    /**
     * Split [periodStart, periodEnd) into calendar-aligned billing periods.
     *
     * The first period starts at periodStart even if that is inside a bucket; the last
     * period is cut at periodEnd. Periods that match a full bucket are labelled by the
     * bucket (2024-Q1), cut ones by their ISO range (2024-02-15/2024-04-01).
     */
    public List<BillingPeriod> partition(LocalDate periodStart, LocalDate periodEnd, BillingInterval kind) {
        requireRange(periodStart, periodEnd);

        List<BillingPeriod> periods = new ArrayList<>();
        LocalDate cursor = periodStart;
        while (cursor.isBefore(periodEnd)) {
            LocalDate boundary = kind.bucketEnd(cursor);
            LocalDate end = boundary.isAfter(periodEnd) ? periodEnd : boundary;
            periods.add(period(cursor, end, kind));
            cursor = end;
        }
        return periods;
    }

    /**
     * A single period over an explicit range, labelled like {@link #partition} would.
     */
    public BillingPeriod period(LocalDate start, LocalDate end, BillingInterval kind) {
        requireRange(start, end);
        String label = isFullBucket(start, end, kind)
            ? kind.label(start)
            : start + "/" + end;
        return new BillingPeriod(kind, start, end, monthsOverlapping(start, end), label);
    }

    /**
     * The calendar months overlapped by [start, end), each clipped to the range.
     */
    public List<MonthWindow> monthWindows(LocalDate start, LocalDate end) {
        return partition(start, end, BillingInterval.MONTHLY).stream()
            .map(p -> new MonthWindow(YearMonth.from(p.getStart()), p.getStart(), p.getEnd()))
            .collect(Collectors.toList());
    }

    public int slotMinutes() {
        return config.getSlotMinutes();
    }

    List<YearMonth> monthsOverlapping(LocalDate start, LocalDate end) {
        List<YearMonth> months = new ArrayList<>();
        YearMonth last = YearMonth.from(end.minusDays(1));
        for (YearMonth m = YearMonth.from(start); !m.isAfter(last); m = m.plusMonths(1)) {
            months.add(m);
        }
        return months;
    }

    private boolean isFullBucket(LocalDate start, LocalDate end, BillingInterval kind) {
        return start.equals(kind.bucketStart(start)) && end.equals(kind.bucketEnd(start));
    }

    private void requireRange(LocalDate start, LocalDate end) {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new InvalidRangeException(start, end);
        }
    }
}
