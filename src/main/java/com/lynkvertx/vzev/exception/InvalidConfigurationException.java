package com.lynkvertx.vzev.exception;

/**
 * Collective configuration is missing required fields or violates the member/meter rules.
 */
public class InvalidConfigurationException extends BillingEngineException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
