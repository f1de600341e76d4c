package com.lynkvertx.vzev.service;

import com.lynkvertx.vzev.config.BillingEngineConfig;
import com.lynkvertx.vzev.exception.NonBillablePeriodException;
import com.lynkvertx.vzev.model.Bill;
import com.lynkvertx.vzev.model.BillingInterval;
import com.lynkvertx.vzev.model.BillingRun;
import com.lynkvertx.vzev.model.CollectiveSettings;
import com.lynkvertx.vzev.model.MonthStatus;
import com.lynkvertx.vzev.model.Reading;
import com.lynkvertx.vzev.model.Slot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.lynkvertx.vzev.service.CollectiveFixture.ZURICH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BillingPipelineTest {

    private static final LocalDate START = LocalDate.of(2024, 5, 30);
    private static final LocalDate JUNE_FIRST = LocalDate.of(2024, 6, 1);
    private static final LocalDate END = LocalDate.of(2024, 6, 3);

    private BillingPipeline pipeline;
    private CollectiveSettings settings;
    private Map<String, List<Reading>> readings;

    @BeforeEach
    void setUp() {
        BillingEngineConfig config = new BillingEngineConfig();
        CalendarEngine calendar = new CalendarEngine(config);
        pipeline = new BillingPipeline(calendar, new CompletenessChecker(calendar),
            new SolarAllocationEngine(config, calendar), new BillingAggregator(config));
        settings = CollectiveFixture.settings(START, END, BillingInterval.MONTHLY);

        List<Slot> slots = calendar.expectedSlots(START, END, ZURICH);
        readings = CollectiveFixture.scenarioReadings(slots);
    }

    @Test
    void completeRangeBillsEveryMemberPerPeriod() {
        BillingRun run = pipeline.run(settings, CollectiveFixture.members(), store());

        assertThat(run.getExcludedMonths()).isEmpty();
        assertThat(run.getExcludedPeriods()).isEmpty();
        assertThat(run.getBills()).hasSize(4);
        assertThat(run.getExportRows()).hasSize(4);
        assertThat(run.getBills()).extracting(b -> b.getPeriod().getLabel())
            .containsExactly("2024-05-30/2024-06-01", "2024-05-30/2024-06-01",
                "2024-06-01/2024-06-03", "2024-06-01/2024-06-03");

        Bill member = run.getBills().get(3);
        assertThat(member.getMemberId()).isEqualTo(CollectiveFixture.MEMBER_ID);
        assertThat(member.getConsumptionKwh()).isEqualByComparingTo("1152");
        assertThat(member.getLocalCost()).isEqualByComparingTo("230.40");
        assertThat(member.getDailyDetails()).hasSize(2);

        Bill host = run.getBills().get(2);
        assertThat(host.getMemberId()).isEqualTo(CollectiveFixture.HOST_ID);
        assertThat(host.getLocalSellRevenue()).isEqualByComparingTo("230.40");
        assertThat(host.getGridKwh()).isEqualByComparingTo("0");
    }

    @Test
    void monthWithOneMissingSlotIsExcludedAndOthersStillBilled() {
        List<Reading> memberReadings = new ArrayList<>(readings.get("M-C"));
        memberReadings.remove(17);
        readings.put("M-C", memberReadings);

        BillingRun run = pipeline.run(settings, CollectiveFixture.members(), store());

        assertThat(run.getExcludedMonths()).hasSize(1);
        assertThat(run.getExcludedMonths().get(0).getMonth()).isEqualTo(YearMonth.of(2024, 5));
        assertThat(run.getExcludedMonths().get(0).getReasons()).containsExactly("meter M-C is missing 1 of 192 slot(s)");
        assertThat(run.getExcludedPeriods()).hasSize(1);
        assertThat(run.getExcludedPeriods().get(0).getNonBillableMonths()).containsExactly(YearMonth.of(2024, 5));

        assertThat(run.getBills()).hasSize(2)
            .allMatch(b -> b.getPeriod().getStart().equals(JUNE_FIRST));
        assertThat(run.getMonthStatuses()).extracting(MonthStatus::isBillable).containsExactly(false, true);
    }

    @Test
    void rerunningProducesIdenticalBills() {
        BillingRun first = pipeline.run(settings, CollectiveFixture.members(), store());
        BillingRun second = pipeline.run(settings, CollectiveFixture.members(), store());

        assertThat(second.getBills()).isEqualTo(first.getBills());
        assertThat(second.getExportRows()).isEqualTo(first.getExportRows());
    }

    @Test
    void explicitPeriodIsBilledWhenComplete() {
        List<Bill> bills = pipeline.billPeriod(settings, CollectiveFixture.members(), store(), JUNE_FIRST, END);

        assertThat(bills).extracting(Bill::getMemberId)
            .containsExactly(CollectiveFixture.HOST_ID, CollectiveFixture.MEMBER_ID);
    }

    @Test
    void explicitPeriodOverIncompleteMonthIsRefused() {
        readings.put("H-P", List.of());

        assertThatThrownBy(() -> pipeline.billPeriod(settings, CollectiveFixture.members(), store(), START, END))
            .isInstanceOfSatisfying(NonBillablePeriodException.class,
                ex -> assertThat(ex.getNonBillableMonths())
                    .containsExactly(YearMonth.of(2024, 5), YearMonth.of(2024, 6)));
    }

    @Test
    void checkMonthsReportsEveryWindow() {
        readings.put("M-C", List.of());

        List<MonthStatus> statuses = pipeline.checkMonths(settings, CollectiveFixture.members(), store());

        assertThat(statuses).hasSize(2);
        assertThat(statuses.get(0).getExpectedSlots()).isEqualTo(192);
        assertThat(statuses.get(1).getMissing()).containsEntry("M-C", 192);
        assertThat(statuses).noneMatch(MonthStatus::isBillable);
    }

    private IntervalStoreAdapter store() {
        return new CollectiveFixture.InMemoryIntervalStore(readings);
    }
}
