package com.lynkvertx.vzev.exception;

/**
 * Base class of all billing engine failures.
 *
 * Subclasses other than {@link NonBillablePeriodException} denote setup or input defects
 * that abort a billing run.
 */
public class BillingEngineException extends RuntimeException {

    public BillingEngineException(String message) {
        super(message);
    }

    public BillingEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
