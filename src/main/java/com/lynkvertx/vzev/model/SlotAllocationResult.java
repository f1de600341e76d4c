package com.lynkvertx.vzev.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Full allocation of one slot: collective totals, per-meter shares, per-member results.
 */
@Value
@Builder
public class SlotAllocationResult {

    Slot slot;
    BigDecimal totalProductionKwh;
    BigDecimal totalConsumptionKwh;
    BigDecimal locallyConsumedKwh;
    BigDecimal surplusExportKwh;
    /** Consumption meter external id to its local solar share */
    Map<String, BigDecimal> localShares;
    /** Production meter external id to its attributed export */
    Map<String, BigDecimal> exportShares;
    /** Production meter external id to the part of its production consumed locally */
    Map<String, BigDecimal> suppliedLocal;
    List<SlotAllocation> memberAllocations;
}
