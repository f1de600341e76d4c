package com.lynkvertx.vzev.model;

import lombok.Builder;
import lombok.Value;

/**
 * Engine view of a meter.
 */
@Value
@Builder
public class MeterInfo {

    String externalId;
    String name;
    Long memberId;
    boolean production;
    boolean virtual;

    public boolean isPhysical() {
        return !virtual;
    }

    public boolean isPhysicalConsumption() {
        return !virtual && !production;
    }

    public boolean isPhysicalProduction() {
        return !virtual && production;
    }
}
