package com.lynkvertx.vzev.exception;

import lombok.Getter;

import java.time.Instant;

/**
 * Two readings were supplied for the same meter and slot.
 */
@Getter
public class DuplicateReadingException extends BillingEngineException {

    private final String meterExternalId;
    private final Instant slotStart;

    public DuplicateReadingException(String meterExternalId, Instant slotStart) {
        super(String.format("Duplicate reading for meter '%s' at %s", meterExternalId, slotStart));
        this.meterExternalId = meterExternalId;
        this.slotStart = slotStart;
    }
}
