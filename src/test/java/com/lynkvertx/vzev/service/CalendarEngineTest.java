package com.lynkvertx.vzev.service;

import com.lynkvertx.vzev.config.BillingEngineConfig;
import com.lynkvertx.vzev.exception.InvalidRangeException;
import com.lynkvertx.vzev.model.BillingInterval;
import com.lynkvertx.vzev.model.BillingPeriod;
import com.lynkvertx.vzev.model.MonthWindow;
import com.lynkvertx.vzev.model.Slot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static com.lynkvertx.vzev.service.CollectiveFixture.ZURICH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalendarEngineTest {

    private CalendarEngine calendar;

    @BeforeEach
    void setUp() {
        calendar = new CalendarEngine(new BillingEngineConfig());
    }

    @Test
    void regularDayHas96Slots() {
        List<Slot> slots = calendar.expectedSlots(LocalDate.of(2024, 6, 12), LocalDate.of(2024, 6, 13), ZURICH);

        assertThat(slots).hasSize(96);
        assertThat(slots.get(0).getLocalStart()).isEqualTo(LocalDateTime.of(2024, 6, 12, 0, 0));
        assertThat(slots.get(95).getLocalStart()).isEqualTo(LocalDateTime.of(2024, 6, 12, 23, 45));
    }

    @Test
    void springForwardDayHas92Slots() {
        List<Slot> slots = calendar.expectedSlots(LocalDate.of(2024, 3, 31), LocalDate.of(2024, 4, 1), ZURICH);

        assertThat(slots).hasSize(92);
        assertThat(slots).noneMatch(s -> s.getLocalStart().getHour() == 2);
    }

    @Test
    void fallBackDayHas100Slots() {
        List<Slot> slots = calendar.expectedSlots(LocalDate.of(2024, 10, 27), LocalDate.of(2024, 10, 28), ZURICH);

        assertThat(slots).hasSize(100);
        // 02:00-02:45 local occurs twice, at distinct instants
        List<Slot> repeated = slots.stream()
            .filter(s -> s.getLocalStart().getHour() == 2)
            .collect(Collectors.toList());
        assertThat(repeated).hasSize(8);
        assertThat(repeated.stream().map(Slot::getStart).distinct()).hasSize(8);
    }

    @Test
    void monthSlotCountsFollowDaylightSaving() {
        assertThat(calendar.expectedSlots(YearMonth.of(2024, 3), ZURICH)).hasSize(31 * 96 - 4);
        assertThat(calendar.expectedSlots(YearMonth.of(2024, 10), ZURICH)).hasSize(31 * 96 + 4);
        assertThat(calendar.expectedSlots(YearMonth.of(2024, 2), ZURICH)).hasSize(29 * 96);
    }

    @Test
    void fixedOffsetZoneAlwaysHas96SlotsPerDay() {
        assertThat(calendar.expectedSlots(LocalDate.of(2024, 3, 31), LocalDate.of(2024, 4, 1), ZoneOffset.UTC))
            .hasSize(96);
    }

    @Test
    void slotsAreStrictlyIncreasing() {
        List<Slot> slots = calendar.expectedSlots(LocalDate.of(2024, 10, 26), LocalDate.of(2024, 10, 29), ZURICH);

        for (int i = 1; i < slots.size(); i++) {
            assertThat(slots.get(i)).isGreaterThan(slots.get(i - 1));
        }
    }

    @Test
    void rejectsEmptyOrReversedRange() {
        LocalDate day = LocalDate.of(2024, 1, 1);

        assertThatThrownBy(() -> calendar.expectedSlots(day, day, ZURICH))
            .isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> calendar.partition(day.plusDays(1), day, BillingInterval.MONTHLY))
            .isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> calendar.partition(null, day, BillingInterval.MONTHLY))
            .isInstanceOf(InvalidRangeException.class);
    }

    @Test
    void partitionsFullYearIntoLabelledQuarters() {
        List<BillingPeriod> periods = calendar.partition(
            LocalDate.of(2024, 1, 1), LocalDate.of(2025, 1, 1), BillingInterval.QUARTERLY);

        assertThat(periods).extracting(BillingPeriod::getLabel)
            .containsExactly("2024-Q1", "2024-Q2", "2024-Q3", "2024-Q4");
        assertThat(periods.get(1).getMonths())
            .containsExactly(YearMonth.of(2024, 4), YearMonth.of(2024, 5), YearMonth.of(2024, 6));
    }

    @Test
    void partitionTruncatesFirstAndLastPeriod() {
        List<BillingPeriod> periods = calendar.partition(
            LocalDate.of(2024, 2, 15), LocalDate.of(2024, 8, 10), BillingInterval.QUARTERLY);

        assertThat(periods).hasSize(3);
        assertThat(periods.get(0).getStart()).isEqualTo(LocalDate.of(2024, 2, 15));
        assertThat(periods.get(0).getEnd()).isEqualTo(LocalDate.of(2024, 4, 1));
        assertThat(periods.get(0).getLabel()).isEqualTo("2024-02-15/2024-04-01");
        assertThat(periods.get(0).getMonths()).containsExactly(YearMonth.of(2024, 2), YearMonth.of(2024, 3));
        assertThat(periods.get(1).getLabel()).isEqualTo("2024-Q2");
        assertThat(periods.get(2).getEnd()).isEqualTo(LocalDate.of(2024, 8, 10));
        assertThat(periods.get(2).getLabel()).isEqualTo("2024-07-01/2024-08-10");
    }

    @Test
    void labelsSemiAnnualAnnualAndMonthlyBuckets() {
        assertThat(calendar.partition(LocalDate.of(2024, 1, 1), LocalDate.of(2025, 1, 1), BillingInterval.SEMI_ANNUAL))
            .extracting(BillingPeriod::getLabel)
            .containsExactly("2024-H1", "2024-H2");
        assertThat(calendar.partition(LocalDate.of(2024, 1, 1), LocalDate.of(2026, 1, 1), BillingInterval.ANNUAL))
            .extracting(BillingPeriod::getLabel)
            .containsExactly("2024", "2025");
        assertThat(calendar.partition(LocalDate.of(2024, 11, 1), LocalDate.of(2025, 2, 1), BillingInterval.MONTHLY))
            .extracting(BillingPeriod::getLabel)
            .containsExactly("2024-11", "2024-12", "2025-01");
    }

    @Test
    void monthWindowsAreClippedToRange() {
        List<MonthWindow> windows = calendar.monthWindows(LocalDate.of(2024, 1, 15), LocalDate.of(2024, 3, 10));

        assertThat(windows).extracting(MonthWindow::getMonth)
            .containsExactly(YearMonth.of(2024, 1), YearMonth.of(2024, 2), YearMonth.of(2024, 3));
        assertThat(windows.get(0).getStart()).isEqualTo(LocalDate.of(2024, 1, 15));
        assertThat(windows.get(0).isFullMonth()).isFalse();
        assertThat(windows.get(1).isFullMonth()).isTrue();
        assertThat(windows.get(2).getEnd()).isEqualTo(LocalDate.of(2024, 3, 10));
    }
}
