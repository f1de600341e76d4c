package com.lynkvertx.vzev.service;

import com.lynkvertx.vzev.model.Bill;
import com.lynkvertx.vzev.model.BillingPeriod;
import com.lynkvertx.vzev.model.BillingRun;
import com.lynkvertx.vzev.model.CollectiveSettings;
import com.lynkvertx.vzev.model.ExcludedMonth;
import com.lynkvertx.vzev.model.ExcludedPeriod;
import com.lynkvertx.vzev.model.MemberInfo;
import com.lynkvertx.vzev.model.MeterInfo;
import com.lynkvertx.vzev.model.MonthAllocation;
import com.lynkvertx.vzev.model.MonthStatus;
import com.lynkvertx.vzev.model.MonthWindow;
import com.lynkvertx.vzev.model.Reading;
import com.lynkvertx.vzev.model.SlotAllocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Billing Pipeline
 *
 * Calendar → completeness check → (gate) → allocation → aggregation, over in-memory data
 * fetched through an {@link IntervalStoreAdapter}. Every month is checked and allocated
 * from its own readings only. Incomplete months and the periods containing them are
 * excluded with a reason; the run itself only fails on input errors.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BillingPipeline {

    private final CalendarEngine calendar;
    private final CompletenessChecker checker;
    private final SolarAllocationEngine allocationEngine;
    private final BillingAggregator aggregator;

    /**
     * Run the full pipeline over the configured period.
     *
     * @param settings collective settings (period bounds, rates, interval kind)
     * @param members  validated member/meter graph
     * @param store    reading source
     * @return bills of all billable periods plus the excluded months and periods
     */
    public BillingRun run(CollectiveSettings settings, List<MemberInfo> members, IntervalStoreAdapter store) {
        log.info("Billing run for '{}' from {} to {} ({})", settings.getName(),
            settings.getPeriodStart(), settings.getPeriodEnd(), settings.getBillingInterval());

        MonthProcessing processing = processMonths(settings, members, store,
            settings.getPeriodStart(), settings.getPeriodEnd());

        List<Bill> bills = new ArrayList<>();
        List<Map<String, String>> exportRows = new ArrayList<>();
        List<ExcludedPeriod> excludedPeriods = new ArrayList<>();

        List<BillingPeriod> periods = calendar.partition(
            settings.getPeriodStart(), settings.getPeriodEnd(), settings.getBillingInterval());
        for (BillingPeriod period : periods) {
            List<YearMonth> nonBillable = period.getMonths().stream()
                .filter(m -> !processing.isBillable(m))
                .collect(Collectors.toList());
            if (!nonBillable.isEmpty()) {
                log.warn("Period {} excluded from billing, incomplete month(s): {}", period.getLabel(), nonBillable);
                excludedPeriods.add(new ExcludedPeriod(period, nonBillable));
                continue;
            }

            List<Bill> periodBills = billPeriod(settings, members, period, processing);
            bills.addAll(periodBills);
            periodBills.forEach(bill -> exportRows.add(aggregator.toExportRow(bill)));
        }

        log.info("Billing run for '{}' finished: {} bill(s), {} excluded month(s), {} excluded period(s)",
            settings.getName(), bills.size(), processing.excludedMonths.size(), excludedPeriods.size());

        return BillingRun.builder()
            .monthStatuses(List.copyOf(processing.statuses.values()))
            .bills(Collections.unmodifiableList(bills))
            .exportRows(Collections.unmodifiableList(exportRows))
            .excludedMonths(Collections.unmodifiableList(processing.excludedMonths))
            .excludedPeriods(Collections.unmodifiableList(excludedPeriods))
            .warnings(Collections.unmodifiableList(processing.warnings))
            .build();
    }

    /**
     * Bill one explicit period.
     *
     * @throws com.lynkvertx.vzev.exception.NonBillablePeriodException if any month of the period is incomplete
     */
    public List<Bill> billPeriod(CollectiveSettings settings, List<MemberInfo> members,
                                 IntervalStoreAdapter store, LocalDate start, LocalDate end) {
        BillingPeriod period = calendar.period(start, end, settings.getBillingInterval());
        MonthProcessing processing = processMonths(settings, members, store, start, end);
        return billPeriod(settings, members, period, processing);
    }

    /**
     * Completeness verdict of every month of the configured period, without allocating.
     */
    public List<MonthStatus> checkMonths(CollectiveSettings settings, List<MemberInfo> members, IntervalStoreAdapter store) {
        List<MeterInfo> meters = meters(members);
        List<MonthStatus> statuses = new ArrayList<>();
        for (MonthWindow window : calendar.monthWindows(settings.getPeriodStart(), settings.getPeriodEnd())) {
            Map<String, List<Reading>> readings = fetch(store, meters, window, settings.getZone());
            statuses.add(checker.checkWindow(window, meters, readings, settings.getZone()));
        }
        return statuses;
    }

    private List<Bill> billPeriod(CollectiveSettings settings, List<MemberInfo> members,
                                  BillingPeriod period, MonthProcessing processing) {
        List<SlotAllocation> allocations = period.getMonths().stream()
            .map(m -> processing.allocations.getOrDefault(m, Collections.emptyList()))
            .flatMap(List::stream)
            .collect(Collectors.toList());

        List<Bill> bills = new ArrayList<>();
        for (MemberInfo member : sortedById(members)) {
            bills.add(aggregator.aggregate(member, period, allocations, processing.statuses, settings));
        }
        log.info("Period {}: {} bill(s)", period.getLabel(), bills.size());
        return bills;
    }

    private MonthProcessing processMonths(CollectiveSettings settings, List<MemberInfo> members,
                                          IntervalStoreAdapter store, LocalDate start, LocalDate end) {
        ZoneId zone = settings.getZone();
        List<MeterInfo> meters = meters(members);
        MonthProcessing processing = new MonthProcessing();

        for (MonthWindow window : calendar.monthWindows(start, end)) {
            Map<String, List<Reading>> readings = fetch(store, meters, window, zone);
            MonthStatus status = checker.checkWindow(window, meters, readings, zone);
            processing.statuses.put(window.getMonth(), status);
            processing.warnings.addAll(status.getWarnings());

            if (!status.isBillable()) {
                List<String> reasons = status.exclusionReasons();
                log.warn("Month {} excluded from billing ({})", window.getMonth(), String.join("; ", reasons));
                processing.excludedMonths.add(new ExcludedMonth(window.getMonth(), reasons));
                continue;
            }

            MonthAllocation allocation = allocationEngine.allocateMonth(window, members, readings, zone);
            processing.allocations.put(window.getMonth(), allocation.getAllocations());
            processing.warnings.addAll(allocation.getWarnings());
        }

        List<YearMonth> billable = processing.statuses.values().stream()
            .filter(MonthStatus::isBillable)
            .map(MonthStatus::getMonth)
            .collect(Collectors.toList());
        if (billable.isEmpty()) {
            log.warn("No months qualify for billing");
        } else {
            log.info("Billable months: {}", billable);
        }
        return processing;
    }

    private Map<String, List<Reading>> fetch(IntervalStoreAdapter store, List<MeterInfo> meters,
                                             MonthWindow window, ZoneId zone) {
        Instant from = window.getStart().atStartOfDay(zone).toInstant();
        Instant to = window.getEnd().atStartOfDay(zone).toInstant();
        Map<String, List<Reading>> readings = new LinkedHashMap<>();
        for (MeterInfo meter : meters) {
            readings.put(meter.getExternalId(), store.readings(meter.getExternalId(), from, to));
        }
        return readings;
    }

    private static List<MeterInfo> meters(List<MemberInfo> members) {
        return members.stream()
            .flatMap(m -> m.getMeters().stream())
            .sorted(Comparator.comparing(MeterInfo::getExternalId))
            .collect(Collectors.toList());
    }

    private static List<MemberInfo> sortedById(List<MemberInfo> members) {
        return members.stream()
            .sorted(Comparator.comparing(MemberInfo::getId))
            .collect(Collectors.toList());
    }

    /** Per-run month state; never shared between runs */
    private static class MonthProcessing {
        final Map<YearMonth, MonthStatus> statuses = new TreeMap<>();
        final Map<YearMonth, List<SlotAllocation>> allocations = new TreeMap<>();
        final List<ExcludedMonth> excludedMonths = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();

        boolean isBillable(YearMonth month) {
            MonthStatus status = statuses.get(month);
            return status != null && status.isBillable();
        }
    }
}
