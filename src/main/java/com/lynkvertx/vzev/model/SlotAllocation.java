package com.lynkvertx.vzev.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Allocated energy of one member in one slot (kWh).
 */
@Value
@Builder
public class SlotAllocation {

    Long memberId;
    Slot slot;
    BigDecimal consumptionKwh;
    /** Share of local solar production consumed by this member */
    BigDecimal localSolarKwh;
    /** consumption - localSolar */
    BigDecimal gridKwh;
    BigDecimal productionKwh;
    /** Part of this member's production consumed locally by other members */
    BigDecimal localSoldKwh;
    /** Part of the surplus export attributed to this member's production */
    BigDecimal exportKwh;
}
