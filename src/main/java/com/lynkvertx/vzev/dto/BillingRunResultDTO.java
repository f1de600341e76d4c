package com.lynkvertx.vzev.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.lynkvertx.vzev.model.Bill;
import com.lynkvertx.vzev.model.BillingInterval;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Result DTO of a billing run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillingRunResultDTO {

    private Long collectiveId;
    private String collectiveName;
    private BillingInterval billingInterval;

    /** One bill per member and billable period; net amount = cost - revenue */
    private List<Bill> bills;

    /** Flat key/value rows for export, one per bill */
    private List<Map<String, String>> exportRows;

    private List<MonthAvailabilityDTO> months;

    private List<ExcludedPeriodDTO> excludedPeriods;

    /** Carried in the response envelope */
    @JsonIgnore
    private List<String> warnings;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExcludedPeriodDTO {
        private String period;
        private List<String> nonBillableMonths;
    }
}
