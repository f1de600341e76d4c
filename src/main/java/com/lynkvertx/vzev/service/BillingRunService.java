package com.lynkvertx.vzev.service;

import com.lynkvertx.vzev.dto.BillingRunResultDTO;
import com.lynkvertx.vzev.dto.MonthAvailabilityDTO;
import com.lynkvertx.vzev.model.Bill;
import com.lynkvertx.vzev.model.BillingRun;
import com.lynkvertx.vzev.model.CollectiveGraph;
import com.lynkvertx.vzev.model.CollectiveSettings;
import com.lynkvertx.vzev.model.ExcludedPeriod;
import com.lynkvertx.vzev.model.MonthStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Billing Run Service
 * Loads a collective from the database and drives the {@link BillingPipeline} over it
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BillingRunService {

    private final CollectiveConfigurationService configurationService;
    private final BillingPipeline pipeline;
    private final IntervalStoreAdapter intervalStore;

    /**
     * Bill every complete period of the collective's configured range
     */
    @Transactional(readOnly = true)
    public BillingRunResultDTO run(Long collectiveId) {
        CollectiveGraph graph = configurationService.load(collectiveId);
        CollectiveSettings settings = graph.getSettings();

        BillingRun run = pipeline.run(settings, graph.getMembers(), intervalStore);

        return BillingRunResultDTO.builder()
            .collectiveId(settings.getCollectiveId())
            .collectiveName(settings.getName())
            .billingInterval(settings.getBillingInterval())
            .bills(run.getBills())
            .exportRows(run.getExportRows())
            .months(run.getMonthStatuses().stream().map(this::toMonthDTO).collect(Collectors.toList()))
            .excludedPeriods(run.getExcludedPeriods().stream().map(this::toExcludedDTO).collect(Collectors.toList()))
            .warnings(run.getWarnings())
            .build();
    }

    /**
     * Bill one explicit period [start, end)
     *
     * @throws com.lynkvertx.vzev.exception.NonBillablePeriodException if a month of the period is incomplete
     */
    @Transactional(readOnly = true)
    public List<Bill> billForPeriod(Long collectiveId, LocalDate start, LocalDate end) {
        CollectiveGraph graph = configurationService.load(collectiveId);
        log.info("Billing collective {} for {} to {}", collectiveId, start, end);
        return pipeline.billPeriod(graph.getSettings(), graph.getMembers(), intervalStore, start, end);
    }

    /**
     * Completeness overview of every month of the configured range
     */
    @Transactional(readOnly = true)
    public List<MonthAvailabilityDTO> monthOverview(Long collectiveId) {
        CollectiveGraph graph = configurationService.load(collectiveId);
        return pipeline.checkMonths(graph.getSettings(), graph.getMembers(), intervalStore).stream()
            .map(this::toMonthDTO)
            .collect(Collectors.toList());
    }

    private MonthAvailabilityDTO toMonthDTO(MonthStatus status) {
        return MonthAvailabilityDTO.builder()
            .month(status.getMonth().toString())
            .windowStart(status.getWindow().getStart())
            .windowEnd(status.getWindow().getEnd())
            .billable(status.isBillable())
            .expectedSlots(status.getExpectedSlots())
            .missing(status.getMissing())
            .reasons(status.exclusionReasons())
            .build();
    }

    private BillingRunResultDTO.ExcludedPeriodDTO toExcludedDTO(ExcludedPeriod excluded) {
        return new BillingRunResultDTO.ExcludedPeriodDTO(
            excluded.getPeriod().getLabel(),
            excluded.getNonBillableMonths().stream().map(YearMonth::toString).collect(Collectors.toList()));
    }
}
