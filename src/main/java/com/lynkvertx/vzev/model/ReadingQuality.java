package com.lynkvertx.vzev.model;

import java.util.Arrays;

/**
 * Measurement quality flag as delivered by the metering point operator.
 * Only {@link #VALID} readings take part in completeness checks and allocation.
 */
public enum ReadingQuality {
    VALID("W"),
    SUBSTITUTED("V"),
    ESTIMATED("E"),
    INVALID("F");

    private final String code;

    ReadingQuality(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolve a flag from its operator code or enum name. Blank input means VALID.
     */
    public static ReadingQuality fromCode(String code) {
        if (code == null || code.isBlank()) {
            return VALID;
        }
        String trimmed = code.trim();
        return Arrays.stream(values())
            .filter(q -> q.code.equalsIgnoreCase(trimmed) || q.name().equalsIgnoreCase(trimmed))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown reading quality flag: " + code));
    }
}
