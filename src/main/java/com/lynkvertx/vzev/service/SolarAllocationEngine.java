package com.lynkvertx.vzev.service;

import com.lynkvertx.vzev.config.BillingEngineConfig;
import com.lynkvertx.vzev.exception.AllocationInvariantException;
import com.lynkvertx.vzev.exception.InvalidReadingException;
import com.lynkvertx.vzev.model.MemberInfo;
import com.lynkvertx.vzev.model.MeterInfo;
import com.lynkvertx.vzev.model.MonthAllocation;
import com.lynkvertx.vzev.model.MonthWindow;
import com.lynkvertx.vzev.model.Reading;
import com.lynkvertx.vzev.model.Slot;
import com.lynkvertx.vzev.model.SlotAllocation;
import com.lynkvertx.vzev.model.SlotAllocationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Solar Allocation Engine
 *
 * Splits the collective's solar production of every slot between consumers and the grid.
 *
 * Per slot:
 * 1. P = total production, C = total consumption (physical meters only).
 * 2. Locally consumed L = min(P, C), or 0 when C = 0.
 * 3. Each consumption meter gets L × c / C, its grid draw is c minus that share.
 * 4. Surplus E = P - L is attributed to production meters by p / P.
 * 5. Each production meter supplies L × p / P locally; the part of it not consumed by
 *    the owning member is sold to other members.
 *
 * Shares are BigDecimal at a fixed scale. The rounding remainder of every split goes to
 * the holder with the largest weight (first external id on ties), so shares always sum
 * exactly to their total and never go negative.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SolarAllocationEngine {

    private final BillingEngineConfig config;
    private final CalendarEngine calendar;

    /**
     * Allocate every slot of a billable month.
     *
     * @param window          the (possibly clipped) month
     * @param members         members of the collective with their meters
     * @param readingsByMeter valid readings keyed by meter external id
     * @param zone            civil time zone of the collective
     * @return per member and slot allocations plus month totals and cross-check warnings
     * @throws InvalidReadingException if a physical meter has no valid reading for a slot
     */
    public MonthAllocation allocateMonth(MonthWindow window, List<MemberInfo> members,
                                         Map<String, List<Reading>> readingsByMeter, ZoneId zone) {
        List<MeterInfo> physicalMeters = members.stream()
            .flatMap(m -> m.getMeters().stream())
            .filter(MeterInfo::isPhysical)
            .sorted(Comparator.comparing(MeterInfo::getExternalId))
            .collect(Collectors.toList());

        Map<String, Long> memberByMeter = new HashMap<>();
        Map<String, Map<Instant, BigDecimal>> energyByMeter = new HashMap<>();
        for (MeterInfo meter : physicalMeters) {
            memberByMeter.put(meter.getExternalId(), meter.getMemberId());
            energyByMeter.put(meter.getExternalId(), indexValid(readingsByMeter.get(meter.getExternalId())));
        }

        List<SlotAllocation> allocations = new ArrayList<>();
        BigDecimal totalLocal = BigDecimal.ZERO;
        BigDecimal totalGrid = BigDecimal.ZERO;
        BigDecimal totalExport = BigDecimal.ZERO;

        for (Slot slot : calendar.expectedSlots(window, zone)) {
            SortedMap<String, BigDecimal> consumption = new TreeMap<>();
            SortedMap<String, BigDecimal> production = new TreeMap<>();
            for (MeterInfo meter : physicalMeters) {
                BigDecimal kwh = energyByMeter.get(meter.getExternalId()).get(slot.getStart());
                if (kwh == null) {
                    throw new InvalidReadingException(String.format(
                        "No valid reading for meter '%s' at %s, month %s must pass the completeness check first",
                        meter.getExternalId(), slot.getLocalStart(), window.getMonth()));
                }
                (meter.isProduction() ? production : consumption).put(meter.getExternalId(), kwh);
            }

            SlotAllocationResult result = allocateSlot(slot, consumption, production, memberByMeter);
            allocations.addAll(result.getMemberAllocations());
            totalLocal = totalLocal.add(result.getLocallyConsumedKwh());
            totalExport = totalExport.add(result.getSurplusExportKwh());
            totalGrid = totalGrid.add(result.getTotalConsumptionKwh().subtract(result.getLocallyConsumedKwh()));
        }

        List<String> warnings = crossCheckVirtualMeters(window, members, readingsByMeter, totalGrid, totalExport);

        log.info("Allocated {}: local {} kWh, grid {} kWh, export {} kWh",
            window.getMonth(), totalLocal.stripTrailingZeros().toPlainString(),
            totalGrid.stripTrailingZeros().toPlainString(), totalExport.stripTrailingZeros().toPlainString());

        return MonthAllocation.builder()
            .month(window.getMonth())
            .allocations(Collections.unmodifiableList(allocations))
            .totalLocallyConsumedKwh(totalLocal)
            .totalGridKwh(totalGrid)
            .totalExportKwh(totalExport)
            .warnings(warnings)
            .build();
    }

    /**
     * Allocate one slot.
     *
     * @param slot               the slot
     * @param consumptionByMeter consumption per physical consumption meter (kWh)
     * @param productionByMeter  production per physical production meter (kWh)
     * @param memberByMeter      owning member of every meter
     * @return shares per meter and the resulting per-member allocation
     */
    public SlotAllocationResult allocateSlot(Slot slot, Map<String, BigDecimal> consumptionByMeter,
                                             Map<String, BigDecimal> productionByMeter,
                                             Map<String, Long> memberByMeter) {
        SortedMap<String, BigDecimal> consumption = new TreeMap<>(consumptionByMeter);
        SortedMap<String, BigDecimal> production = new TreeMap<>(productionByMeter);
        requireNonNegative(slot, consumption);
        requireNonNegative(slot, production);

        BigDecimal totalProduction = sum(production);
        BigDecimal totalConsumption = sum(consumption);
        BigDecimal locallyConsumed = totalConsumption.signum() == 0
            ? BigDecimal.ZERO
            : totalProduction.min(totalConsumption);
        BigDecimal surplusExport = totalProduction.subtract(locallyConsumed);

        Map<String, BigDecimal> localShares = apportion(locallyConsumed, consumption, totalConsumption);
        Map<String, BigDecimal> exportShares = apportion(surplusExport, production, totalProduction);
        Map<String, BigDecimal> suppliedLocal = apportion(locallyConsumed, production, totalProduction);

        verifyConservation(slot, "local solar", localShares, locallyConsumed);
        verifyConservation(slot, "export", exportShares, surplusExport);

        List<SlotAllocation> memberAllocations = toMemberAllocations(slot, consumption, production,
            localShares, exportShares, suppliedLocal, locallyConsumed, memberByMeter);

        return SlotAllocationResult.builder()
            .slot(slot)
            .totalProductionKwh(totalProduction)
            .totalConsumptionKwh(totalConsumption)
            .locallyConsumedKwh(locallyConsumed)
            .surplusExportKwh(surplusExport)
            .localShares(Collections.unmodifiableMap(localShares))
            .exportShares(Collections.unmodifiableMap(exportShares))
            .suppliedLocal(Collections.unmodifiableMap(suppliedLocal))
            .memberAllocations(memberAllocations)
            .build();
    }

    /**
     * Split {@code target} proportionally to {@code weights}.
     *
     * Holders are visited in key order. A positive rounding remainder goes to the holder
     * with the largest weight, the first key on equal weights. A negative remainder is taken
     * from holders in that same order, never below zero. Zero-weight holders always get zero.
     */
    Map<String, BigDecimal> apportion(BigDecimal target, SortedMap<String, BigDecimal> weights, BigDecimal totalWeight) {
        Map<String, BigDecimal> shares = new TreeMap<>();
        if (target.signum() == 0 || totalWeight.signum() == 0) {
            weights.keySet().forEach(key -> shares.put(key, BigDecimal.ZERO));
            return shares;
        }

        BigDecimal allocated = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> entry : weights.entrySet()) {
            BigDecimal share = target.multiply(entry.getValue())
                .divide(totalWeight, config.getAllocationScale(), config.getAllocationRounding());
            shares.put(entry.getKey(), share);
            allocated = allocated.add(share);
        }

        BigDecimal remainder = target.subtract(allocated);
        if (remainder.signum() == 0) {
            return shares;
        }
        List<String> byWeight = weights.entrySet().stream()
            .filter(entry -> entry.getValue().signum() > 0)
            .sorted(Map.Entry.<String, BigDecimal>comparingByValue().reversed()
                .thenComparing(Map.Entry.<String, BigDecimal>comparingByKey()))
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
        if (remainder.signum() > 0) {
            String largestHolder = byWeight.get(0);
            shares.put(largestHolder, shares.get(largestHolder).add(remainder));
            return shares;
        }

        BigDecimal excess = remainder.negate();
        for (String holder : byWeight) {
            if (excess.signum() == 0) {
                break;
            }
            BigDecimal share = shares.get(holder);
            BigDecimal taken = share.min(excess);
            shares.put(holder, share.subtract(taken));
            excess = excess.subtract(taken);
        }
        return shares;
    }

    private List<SlotAllocation> toMemberAllocations(Slot slot,
                                                     Map<String, BigDecimal> consumption,
                                                     Map<String, BigDecimal> production,
                                                     Map<String, BigDecimal> localShares,
                                                     Map<String, BigDecimal> exportShares,
                                                     Map<String, BigDecimal> suppliedLocal,
                                                     BigDecimal locallyConsumed,
                                                     Map<String, Long> memberByMeter) {
        Map<Long, BigDecimal> memberConsumption = sumByMember(consumption, memberByMeter);
        Map<Long, BigDecimal> memberLocal = sumByMember(localShares, memberByMeter);
        Map<Long, BigDecimal> memberProduction = sumByMember(production, memberByMeter);
        Map<Long, BigDecimal> memberExport = sumByMember(exportShares, memberByMeter);
        Map<Long, BigDecimal> memberSupplied = sumByMember(suppliedLocal, memberByMeter);

        TreeSet<Long> memberIds = new TreeSet<>(memberConsumption.keySet());
        memberIds.addAll(memberProduction.keySet());

        List<SlotAllocation> result = new ArrayList<>(memberIds.size());
        for (Long memberId : memberIds) {
            BigDecimal consumed = memberConsumption.getOrDefault(memberId, BigDecimal.ZERO);
            BigDecimal local = memberLocal.getOrDefault(memberId, BigDecimal.ZERO);
            BigDecimal supplied = memberSupplied.getOrDefault(memberId, BigDecimal.ZERO);

            BigDecimal soldToOthers = BigDecimal.ZERO;
            if (supplied.signum() > 0 && locallyConsumed.signum() > 0) {
                soldToOthers = supplied.multiply(locallyConsumed.subtract(local))
                    .divide(locallyConsumed, config.getAllocationScale(), config.getAllocationRounding());
            }

            result.add(SlotAllocation.builder()
                .memberId(memberId)
                .slot(slot)
                .consumptionKwh(consumed)
                .localSolarKwh(local)
                .gridKwh(consumed.subtract(local))
                .productionKwh(memberProduction.getOrDefault(memberId, BigDecimal.ZERO))
                .localSoldKwh(soldToOthers)
                .exportKwh(memberExport.getOrDefault(memberId, BigDecimal.ZERO))
                .build());
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Compare the month's computed grid flows with the virtual (grid-level) meters.
     * Deviations only produce warnings.
     */
    private List<String> crossCheckVirtualMeters(MonthWindow window, List<MemberInfo> members,
                                                 Map<String, List<Reading>> readingsByMeter,
                                                 BigDecimal totalGrid, BigDecimal totalExport) {
        List<String> warnings = new ArrayList<>();
        List<MeterInfo> virtualMeters = members.stream()
            .flatMap(m -> m.getMeters().stream())
            .filter(MeterInfo::isVirtual)
            .sorted(Comparator.comparing(MeterInfo::getExternalId))
            .collect(Collectors.toList());

        for (MeterInfo meter : virtualMeters) {
            List<Reading> readings = readingsByMeter.getOrDefault(meter.getExternalId(), Collections.emptyList());
            if (readings.isEmpty()) {
                log.debug("No readings for virtual meter {} in {}, cross-check skipped", meter.getExternalId(), window.getMonth());
                continue;
            }
            BigDecimal measured = readings.stream()
                .filter(Reading::isValid)
                .map(Reading::getEnergyKwh)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal computed = meter.isProduction() ? totalExport : totalGrid;
            BigDecimal deviation = measured.subtract(computed).abs();

            if (deviation.compareTo(config.getCrossCheckToleranceKwh()) > 0) {
                String warning = String.format("%s: virtual %s meter '%s' reports %s kWh, allocation computed %s kWh (deviation %s kWh)",
                    window.getMonth(), meter.isProduction() ? "production" : "consumption", meter.getExternalId(),
                    plain(measured), plain(computed), plain(deviation));
                log.warn(warning);
                warnings.add(warning);
            }
        }
        return Collections.unmodifiableList(warnings);
    }

    private void verifyConservation(Slot slot, String kind, Map<String, BigDecimal> shares, BigDecimal expected) {
        BigDecimal error = sum(shares).subtract(expected).abs();
        if (error.compareTo(config.getToleranceKwh()) > 0) {
            throw new AllocationInvariantException(String.format(
                "%s shares at %s sum to %s kWh instead of %s kWh",
                kind, slot.getStart(), plain(sum(shares)), plain(expected)));
        }
    }

    private void requireNonNegative(Slot slot, Map<String, BigDecimal> energy) {
        energy.forEach((meter, kwh) -> {
            if (kwh == null || kwh.signum() < 0) {
                throw new InvalidReadingException(String.format(
                    "Invalid energy %s kWh for meter '%s' at %s", kwh, meter, slot.getStart()));
            }
        });
    }

    private Map<Instant, BigDecimal> indexValid(List<Reading> readings) {
        Map<Instant, BigDecimal> index = new HashMap<>();
        if (readings == null) {
            return index;
        }
        for (Reading reading : readings) {
            if (reading.isValid()) {
                index.put(reading.getSlotStart(), reading.getEnergyKwh());
            }
        }
        return index;
    }

    private static Map<Long, BigDecimal> sumByMember(Map<String, BigDecimal> byMeter, Map<String, Long> memberByMeter) {
        Map<Long, BigDecimal> byMember = new TreeMap<>();
        byMeter.forEach((meter, kwh) -> {
            Long memberId = memberByMeter.get(meter);
            if (memberId == null) {
                throw new InvalidReadingException("Meter '" + meter + "' has no owning member");
            }
            byMember.merge(memberId, kwh, BigDecimal::add);
        });
        return byMember;
    }

    private static BigDecimal sum(Map<String, BigDecimal> values) {
        return values.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
