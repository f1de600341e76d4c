package com.lynkvertx.vzev.exception;

/**
 * Allocated shares do not add up to the slot totals.
 */
public class AllocationInvariantException extends BillingEngineException {

    public AllocationInvariantException(String message) {
        super(message);
    }
}
