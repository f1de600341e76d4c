package com.lynkvertx.vzev.model;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A single 15-minute reading. The energy is consumption for a consumption meter and
 * production for a production meter.
 */
@Value
public class Reading {

    String meterExternalId;
    Instant slotStart;
    BigDecimal energyKwh;
    ReadingQuality quality;

    public static Reading valid(String meterExternalId, Instant slotStart, BigDecimal energyKwh) {
        return new Reading(meterExternalId, slotStart, energyKwh, ReadingQuality.VALID);
    }

    public boolean isValid() {
        return quality == ReadingQuality.VALID;
    }
}
