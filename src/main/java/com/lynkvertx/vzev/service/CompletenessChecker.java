package com.lynkvertx.vzev.service;

import com.lynkvertx.vzev.exception.DuplicateReadingException;
import com.lynkvertx.vzev.model.MeterInfo;
import com.lynkvertx.vzev.model.MonthStatus;
import com.lynkvertx.vzev.model.MonthWindow;
import com.lynkvertx.vzev.model.Reading;
import com.lynkvertx.vzev.model.Slot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Quality and Completeness Checker
 *
 * Decides per month whether every physical meter has a valid reading for every expected
 * slot. Incomplete months are reported in the returned {@link MonthStatus}, never thrown;
 * only duplicate readings (a setup defect) raise an exception.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompletenessChecker {

    private static final int MAX_REPORTED_GAPS = 5;
    private static final DateTimeFormatter GAP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final CalendarEngine calendar;

    /**
     * Check a whole calendar month.
     */
    public MonthStatus checkMonth(YearMonth month, List<MeterInfo> meters,
                                  Map<String, List<Reading>> readingsByMeter, ZoneId zone) {
        return checkWindow(MonthWindow.of(month), meters, readingsByMeter, zone);
    }

    /**
     * Check a month clipped to the configured billing range.
     *
     * @param window          month window to check
     * @param meters          all meters of the collective; virtual ones only produce warnings
     * @param readingsByMeter readings keyed by meter external id
     * @param zone            civil time zone of the collective
     * @return billable verdict with missing counts and gap slots per physical meter
     * @throws DuplicateReadingException if a meter has two readings for one slot
     */
    public MonthStatus checkWindow(MonthWindow window, List<MeterInfo> meters,
                                   Map<String, List<Reading>> readingsByMeter, ZoneId zone) {
        List<Slot> expected = calendar.expectedSlots(window, zone);
        Set<Instant> expectedStarts = expected.stream().map(Slot::getStart).collect(Collectors.toSet());
        Instant windowStart = expected.get(0).getStart();
        Instant windowEnd = window.getEnd().atStartOfDay(zone).toInstant();

        Map<String, Integer> missing = new TreeMap<>();
        Map<String, List<Slot>> gaps = new TreeMap<>();
        List<String> warnings = new ArrayList<>();
        boolean hasPhysicalMeter = false;

        List<MeterInfo> ordered = new ArrayList<>(meters);
        ordered.sort(Comparator.comparing(MeterInfo::getExternalId));

        for (MeterInfo meter : ordered) {
            List<Reading> readings = readingsByMeter.getOrDefault(meter.getExternalId(), Collections.emptyList());
            Set<Instant> present = presentSlots(meter, readings, expectedStarts, windowStart, windowEnd, warnings);

            List<Slot> meterGaps = expected.stream()
                .filter(slot -> !present.contains(slot.getStart()))
                .collect(Collectors.toList());

            if (meter.isVirtual()) {
                if (!meterGaps.isEmpty()) {
                    warnings.add(String.format("%s: virtual meter '%s' (%s) is missing %d slot(s), cross-check is unreliable",
                        window.getMonth(), meter.getName(), meter.getExternalId(), meterGaps.size()));
                }
                continue;
            }

            hasPhysicalMeter = true;
            if (!meterGaps.isEmpty()) {
                missing.put(meter.getExternalId(), meterGaps.size());
                gaps.put(meter.getExternalId(), Collections.unmodifiableList(meterGaps));
                warnings.add(String.format("%s: meter '%s' (%s) has %d missing slot(s): %s",
                    window.getMonth(), meter.getName(), meter.getExternalId(), meterGaps.size(),
                    describeGaps(meterGaps)));
            }
        }

        boolean billable = hasPhysicalMeter && missing.isEmpty();
        if (billable) {
            log.debug("Month {} complete: {} slots for {} meter(s)", window.getMonth(), expected.size(), ordered.size());
        }

        return MonthStatus.builder()
            .month(window.getMonth())
            .window(window)
            .billable(billable)
            .expectedSlots(expected.size())
            .missing(Collections.unmodifiableMap(missing))
            .gaps(Collections.unmodifiableMap(gaps))
            .warnings(Collections.unmodifiableList(warnings))
            .build();
    }

    /**
     * Collect the slot starts covered by valid readings of one meter.
     * Readings outside the window are ignored; readings off the slot grid are reported.
     */
    private Set<Instant> presentSlots(MeterInfo meter, List<Reading> readings, Set<Instant> expectedStarts,
                                      Instant windowStart, Instant windowEnd, List<String> warnings) {
        Set<Instant> seen = new HashSet<>();
        Set<Instant> present = new HashSet<>();
        int offGrid = 0;

        for (Reading reading : readings) {
            Instant start = reading.getSlotStart();
            if (start.isBefore(windowStart) || !start.isBefore(windowEnd)) {
                continue;
            }
            if (!seen.add(start)) {
                throw new DuplicateReadingException(meter.getExternalId(), start);
            }
            if (!expectedStarts.contains(start)) {
                offGrid++;
                continue;
            }
            if (reading.isValid()) {
                present.add(start);
            }
        }

        if (offGrid > 0) {
            warnings.add(String.format("meter '%s' (%s) has %d reading(s) not aligned to the slot grid",
                meter.getName(), meter.getExternalId(), offGrid));
        }
        return present;
    }

    /**
     * Collapse missing slots into consecutive runs, e.g. "2024-03-05 10:15 (3 slots)".
     */
    String describeGaps(List<Slot> gapSlots) {
        Map<Slot, Integer> runs = new LinkedHashMap<>();
        Slot runStart = null;
        Slot previous = null;
        for (Slot slot : gapSlots) {
            if (previous == null || !isNext(previous, slot)) {
                runStart = slot;
                runs.put(runStart, 0);
            }
            runs.merge(runStart, 1, Integer::sum);
            previous = slot;
        }

        List<String> parts = runs.entrySet().stream()
            .limit(MAX_REPORTED_GAPS)
            .map(e -> String.format("%s (%d slot%s)",
                e.getKey().getLocalStart().format(GAP_FORMAT), e.getValue(), e.getValue() == 1 ? "" : "s"))
            .collect(Collectors.toList());

        String detail = String.join(", ", parts);
        if (runs.size() > MAX_REPORTED_GAPS) {
            detail += String.format(" (and %d more)", runs.size() - MAX_REPORTED_GAPS);
        }
        return detail;
    }

    private boolean isNext(Slot previous, Slot slot) {
        return previous.getStart().plusSeconds(60L * calendar.slotMinutes()).equals(slot.getStart());
    }
}
