package com.lynkvertx.vzev.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Normalized interval reading as produced by the CSV importer
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntervalReadingDTO {

    @NotBlank(message = "Meter external id is required")
    private String meterExternalId;

    /** Slot start with offset, unambiguous on fall-back days */
    @NotNull(message = "Slot start is required")
    private OffsetDateTime slotStart;

    @NotNull(message = "Energy is required")
    private BigDecimal energyKwh;

    /** Operator quality flag (W, V, E, F); blank means W */
    private String quality;

    /**
     * Batch import wrapper
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BatchDTO {

        @Valid
        @NotEmpty(message = "At least one reading is required")
        private List<IntervalReadingDTO> readings;
    }

    /**
     * Result of a batch import
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImportResultDTO {
        private int imported;
        /** Stored but not used for billing (quality other than W) */
        private int notValid;
    }
}
