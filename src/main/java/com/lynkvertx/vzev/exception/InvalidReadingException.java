package com.lynkvertx.vzev.exception;

/**
 * A reading that cannot take part in allocation (negative energy, missing value).
 */
public class InvalidReadingException extends BillingEngineException {

    public InvalidReadingException(String message) {
        super(message);
    }
}
