package com.lynkvertx.vzev.service;

import com.lynkvertx.vzev.config.BillingEngineConfig;
import com.lynkvertx.vzev.exception.NonBillablePeriodException;
import com.lynkvertx.vzev.model.Bill;
import com.lynkvertx.vzev.model.BillingPeriod;
import com.lynkvertx.vzev.model.CalculatedFee;
import com.lynkvertx.vzev.model.CollectiveSettings;
import com.lynkvertx.vzev.model.CustomFee;
import com.lynkvertx.vzev.model.DailyDetail;
import com.lynkvertx.vzev.model.FeeBasis;
import com.lynkvertx.vzev.model.FeeType;
import com.lynkvertx.vzev.model.MemberInfo;
import com.lynkvertx.vzev.model.MonthStatus;
import com.lynkvertx.vzev.model.SlotAllocation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Billing Aggregator
 *
 * Sums a member's slot allocations over a billing period and prices them:
 * <pre>
 *   localCost        = localSolar × localRate   (0 for the host)
 *   gridCost         = grid × bkwBuyRate
 *   localSellRevenue = localSold × localRate   (producers only)
 *   exportRevenue    = export × bkwSellRate    (producers only)
 *   netAmount        = totalCost + totalFees - totalRevenue
 * </pre>
 * Custom fees are applied in configured order. A percent fee is taken of the energy cost
 * plus every fee before it.
 * Money lines are rounded half-up to the configured scale before totals are formed,
 * so the printed lines always add up to the printed totals.
 */
@Service
@RequiredArgsConstructor
public class BillingAggregator {

    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BillingEngineConfig config;

    /**
     * Build the bill of one member for one period.
     *
     * @param member      the member to bill
     * @param period      the billing period
     * @param allocations slot allocations covering the period (other members and slots are ignored)
     * @param statuses    completeness verdicts by month
     * @param settings    collective rates and options
     * @return the bill
     * @throws NonBillablePeriodException if any month of the period is unchecked or incomplete
     */
    public Bill aggregate(MemberInfo member, BillingPeriod period, List<SlotAllocation> allocations,
                          Map<YearMonth, MonthStatus> statuses, CollectiveSettings settings) {
        requireBillable(period, statuses);

        List<SlotAllocation> own = allocations.stream()
            .filter(a -> Objects.equals(a.getMemberId(), member.getId()))
            .filter(a -> period.contains(a.getSlot().getLocalStart().toLocalDate()))
            .collect(Collectors.toList());

        boolean producer = member.isProducer();
        BigDecimal localRate = member.isHost() ? BigDecimal.ZERO : settings.getLocalRate();
        Totals totals = Totals.of(own);
        Amounts amounts = price(totals, localRate, producer, settings);
        List<CalculatedFee> fees = calculateFees(member, period, totals, amounts.totalCost());
        BigDecimal totalFees = fees.stream()
            .map(CalculatedFee::getAmount)
            .reduce(money(BigDecimal.ZERO), BigDecimal::add);

        List<DailyDetail> dailyDetails = settings.isShowDailyDetail()
            ? dailyDetails(own, localRate, producer, settings)
            : Collections.emptyList();

        return Bill.builder()
            .memberId(member.getId())
            .firstName(member.getFirstName())
            .lastName(member.getLastName())
            .street(member.getStreet())
            .zip(member.getZip())
            .city(member.getCity())
            .host(member.isHost())
            .producer(producer)
            .period(period)
            .currency(settings.getCurrency())
            .consumptionKwh(kwh(totals.consumption))
            .localSolarKwh(kwh(totals.localSolar))
            .gridKwh(kwh(totals.grid))
            .productionKwh(kwh(totals.production))
            .localSoldKwh(kwh(producer ? totals.localSold : BigDecimal.ZERO))
            .exportKwh(kwh(producer ? totals.export : BigDecimal.ZERO))
            .localRate(localRate)
            .localSellRate(settings.getLocalRate())
            .bkwBuyRate(settings.getBkwBuyRate())
            .bkwSellRate(settings.getBkwSellRate())
            .localCost(amounts.localCost)
            .gridCost(amounts.gridCost)
            .totalCost(amounts.totalCost())
            .localSellRevenue(amounts.localSellRevenue)
            .exportRevenue(amounts.exportRevenue)
            .totalRevenue(amounts.totalRevenue())
            .calculatedFees(fees)
            .totalFees(totalFees)
            .netAmount(amounts.totalCost().add(totalFees).subtract(amounts.totalRevenue()))
            .dailyDetails(dailyDetails)
            .build();
    }

    /**
     * Flatten a bill into an ordered key/value row for CSV-style export.
     * Values are plain decimal strings; rates that are zero are left empty.
     */
    public Map<String, String> toExportRow(Bill bill) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("period", bill.getPeriod().getLabel());
        row.put("period_start", bill.getPeriod().getStart().toString());
        row.put("period_end", bill.getPeriod().getEnd().toString());
        row.put("member_id", String.valueOf(bill.getMemberId()));
        row.put("first_name", nullToEmpty(bill.getFirstName()));
        row.put("last_name", nullToEmpty(bill.getLastName()));
        row.put("address", nullToEmpty(bill.getStreet()));
        row.put("city", (nullToEmpty(bill.getZip()) + " " + nullToEmpty(bill.getCity())).trim());
        row.put("total_consumption_kwh", bill.getConsumptionKwh().toPlainString());
        row.put("local_consumption_kwh", bill.getLocalSolarKwh().toPlainString());
        row.put("bkw_consumption_kwh", bill.getGridKwh().toPlainString());
        row.put("local_rate", rate(bill.getLocalRate()));
        row.put("bkw_rate", rate(bill.getBkwBuyRate()));
        row.put("local_cost", bill.getLocalCost().toPlainString());
        row.put("bkw_cost", bill.getGridCost().toPlainString());
        row.put("total_cost", bill.getTotalCost().toPlainString());
        row.put("total_production_kwh", bill.getProductionKwh().toPlainString());
        row.put("local_sell_kwh", bill.getLocalSoldKwh().toPlainString());
        row.put("bkw_export_kwh", bill.getExportKwh().toPlainString());
        row.put("bkw_sell_rate", bill.isProducer() ? rate(bill.getBkwSellRate()) : "");
        row.put("local_sell_revenue", bill.getLocalSellRevenue().toPlainString());
        row.put("bkw_export_revenue", bill.getExportRevenue().toPlainString());
        row.put("total_revenue", bill.getTotalRevenue().toPlainString());
        row.put("fees", bill.getCalculatedFees().stream()
            .map(fee -> fee.getName() + ": " + fee.getAmount().toPlainString())
            .collect(Collectors.joining("; ")));
        row.put("total_fees", bill.getTotalFees().toPlainString());
        row.put("net_amount", bill.getNetAmount().toPlainString());
        row.put("currency", nullToEmpty(bill.getCurrency()));
        return row;
    }

    /**
     * Price the member's custom fee lines. Each line is rounded before the next one sees it.
     */
    private List<CalculatedFee> calculateFees(MemberInfo member, BillingPeriod period,
                                              Totals totals, BigDecimal totalCost) {
        List<CalculatedFee> fees = new ArrayList<>(member.getFees().size());
        BigDecimal runningTotal = totalCost;
        for (CustomFee fee : member.getFees()) {
            BigDecimal amount;
            switch (fee.getType()) {
                case YEARLY:
                    amount = fee.getValue().multiply(BigDecimal.valueOf(period.getMonths().size()))
                        .divide(MONTHS_PER_YEAR, config.getMoneyScale(), RoundingMode.HALF_UP);
                    break;
                case PER_KWH:
                    BigDecimal basis = fee.getEffectiveBasis() == FeeBasis.LOCAL ? totals.localSolar : totals.grid;
                    amount = money(fee.getValue().multiply(basis));
                    break;
                default:
                    amount = runningTotal.multiply(fee.getValue())
                        .divide(HUNDRED, config.getMoneyScale(), RoundingMode.HALF_UP);
                    break;
            }
            runningTotal = runningTotal.add(amount);
            fees.add(CalculatedFee.builder()
                .name(fee.getName())
                .type(fee.getType())
                .value(fee.getValue())
                .basis(fee.getType() == FeeType.PER_KWH ? fee.getEffectiveBasis() : null)
                .amount(amount)
                .build());
        }
        return Collections.unmodifiableList(fees);
    }

    private void requireBillable(BillingPeriod period, Map<YearMonth, MonthStatus> statuses) {
        List<YearMonth> nonBillable = period.getMonths().stream()
            .filter(m -> statuses.get(m) == null || !statuses.get(m).isBillable())
            .collect(Collectors.toList());
        if (!nonBillable.isEmpty()) {
            throw new NonBillablePeriodException(period, nonBillable);
        }
    }

    private List<DailyDetail> dailyDetails(List<SlotAllocation> own, BigDecimal localRate,
                                           boolean producer, CollectiveSettings settings) {
        Map<LocalDate, List<SlotAllocation>> byDay = own.stream()
            .collect(Collectors.groupingBy(a -> a.getSlot().getLocalStart().toLocalDate(), TreeMap::new, Collectors.toList()));

        List<DailyDetail> details = new ArrayList<>(byDay.size());
        byDay.forEach((day, slots) -> {
            Totals totals = Totals.of(slots);
            Amounts amounts = price(totals, localRate, producer, settings);
            details.add(DailyDetail.builder()
                .day(day)
                .consumptionKwh(kwh(totals.consumption))
                .localSolarKwh(kwh(totals.localSolar))
                .gridKwh(kwh(totals.grid))
                .productionKwh(kwh(totals.production))
                .localSoldKwh(kwh(producer ? totals.localSold : BigDecimal.ZERO))
                .exportKwh(kwh(producer ? totals.export : BigDecimal.ZERO))
                .localCost(amounts.localCost)
                .gridCost(amounts.gridCost)
                .totalCost(amounts.totalCost())
                .localSellRevenue(amounts.localSellRevenue)
                .exportRevenue(amounts.exportRevenue)
                .totalRevenue(amounts.totalRevenue())
                .build());
        });
        return Collections.unmodifiableList(details);
    }

    private Amounts price(Totals totals, BigDecimal localRate, boolean producer, CollectiveSettings settings) {
        BigDecimal localCost = money(totals.localSolar.multiply(localRate));
        BigDecimal gridCost = money(totals.grid.multiply(settings.getBkwBuyRate()));
        BigDecimal localSellRevenue = producer
            ? money(totals.localSold.multiply(settings.getLocalRate()))
            : money(BigDecimal.ZERO);
        BigDecimal exportRevenue = producer
            ? money(totals.export.multiply(settings.getBkwSellRate()))
            : money(BigDecimal.ZERO);
        return new Amounts(localCost, gridCost, localSellRevenue, exportRevenue);
    }

    private BigDecimal money(BigDecimal value) {
        return value.setScale(config.getMoneyScale(), RoundingMode.HALF_UP);
    }

    private BigDecimal kwh(BigDecimal value) {
        return value.setScale(config.getEnergyScale(), RoundingMode.HALF_UP);
    }

    private static String rate(BigDecimal rate) {
        return rate == null || rate.signum() == 0 ? "" : rate.setScale(4, RoundingMode.HALF_UP).toPlainString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /** Unrounded energy sums of a set of slot allocations */
    static class Totals {
        BigDecimal consumption = BigDecimal.ZERO;
        BigDecimal localSolar = BigDecimal.ZERO;
        BigDecimal grid = BigDecimal.ZERO;
        BigDecimal production = BigDecimal.ZERO;
        BigDecimal localSold = BigDecimal.ZERO;
        BigDecimal export = BigDecimal.ZERO;

        static Totals of(List<SlotAllocation> allocations) {
            Totals totals = new Totals();
            for (SlotAllocation a : allocations) {
                totals.consumption = totals.consumption.add(a.getConsumptionKwh());
                totals.localSolar = totals.localSolar.add(a.getLocalSolarKwh());
                totals.grid = totals.grid.add(a.getGridKwh());
                totals.production = totals.production.add(a.getProductionKwh());
                totals.localSold = totals.localSold.add(a.getLocalSoldKwh());
                totals.export = totals.export.add(a.getExportKwh());
            }
            return totals;
        }
    }

    /** Rounded money lines */
    static class Amounts {
        final BigDecimal localCost;
        final BigDecimal gridCost;
        final BigDecimal localSellRevenue;
        final BigDecimal exportRevenue;

        Amounts(BigDecimal localCost, BigDecimal gridCost, BigDecimal localSellRevenue, BigDecimal exportRevenue) {
            this.localCost = localCost;
            this.gridCost = gridCost;
            this.localSellRevenue = localSellRevenue;
            this.exportRevenue = exportRevenue;
        }

        BigDecimal totalCost() {
            return localCost.add(gridCost);
        }

        BigDecimal totalRevenue() {
            return localSellRevenue.add(exportRevenue);
        }
    }
}
