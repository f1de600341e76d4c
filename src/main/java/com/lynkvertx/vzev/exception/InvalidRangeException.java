package com.lynkvertx.vzev.exception;

import java.time.LocalDate;

/**
 * Thrown when a date range is empty, reversed or incomplete.
 */
public class InvalidRangeException extends BillingEngineException {

    public InvalidRangeException(LocalDate start, LocalDate end) {
        super(String.format("Invalid date range: start=%s, end=%s (start must be before end)", start, end));
    }
}
