package com.lynkvertx.vzev.dto;

import com.lynkvertx.vzev.model.BillingInterval;
import com.lynkvertx.vzev.model.FeeBasis;
import com.lynkvertx.vzev.model.FeeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Collective Data Transfer Object, including its members and their meters
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollectiveDTO {

    private Long id;

    @NotBlank(message = "Collective name is required")
    @Size(max = 255, message = "Collective name must not exceed 255 characters")
    private String name;

    /** IANA zone id; defaults to the engine's configured zone */
    private String zoneId;

    @Size(max = 3, message = "Currency must be an ISO 4217 code")
    private String currency;

    @NotNull(message = "local_rate is required")
    @DecimalMin(value = "0", message = "local_rate must not be negative")
    private BigDecimal localRate;

    @NotNull(message = "bkw_buy_rate is required")
    @DecimalMin(value = "0", message = "bkw_buy_rate must not be negative")
    private BigDecimal bkwBuyRate;

    @NotNull(message = "bkw_sell_rate is required")
    @DecimalMin(value = "0", message = "bkw_sell_rate must not be negative")
    private BigDecimal bkwSellRate;

    @NotNull(message = "Billing interval is required")
    private BillingInterval billingInterval;

    @NotNull(message = "Period start is required")
    private LocalDate periodStart;

    /** Exclusive */
    @NotNull(message = "Period end is required")
    private LocalDate periodEnd;

    private boolean showDailyDetail;

    @Valid
    @NotEmpty(message = "At least one member is required")
    private List<MemberDTO> members;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemberDTO {

        private Long id;

        @NotBlank(message = "First name is required")
        private String firstName;

        @NotBlank(message = "Last name is required")
        private String lastName;

        private String street;
        private String zip;
        private String city;
        private String canton;
        private boolean host;

        @Valid
        private List<MeterDTO> meters;

        /** Applied in list order */
        @Valid
        private List<FeeDTO> fees;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MeterDTO {

        private Long id;

        @NotBlank(message = "Meter external id is required")
        @Size(max = 64, message = "Meter external id must not exceed 64 characters")
        private String externalId;

        @NotBlank(message = "Meter name is required")
        private String name;

        private boolean production;
        private boolean virtual;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FeeDTO {

        @NotBlank(message = "Fee name is required")
        @Size(max = 100, message = "Fee name must not exceed 100 characters")
        private String name;

        @NotNull(message = "Fee type is required")
        private FeeType type;

        @NotNull(message = "Fee value is required")
        @DecimalMin(value = "0", message = "Fee value must not be negative")
        private BigDecimal value;

        /** Per-kWh fees only; grid when absent */
        private FeeBasis basis;
    }
}
