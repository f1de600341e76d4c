package com.lynkvertx.vzev.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Configuration properties for the allocation and billing engine.
 * Numeric precision and tolerances are externalized here,
 * so the engine can be tuned via application.yml without code changes.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "vzev.engine")
public class BillingEngineConfig {

    /** Length of one measurement slot in minutes */
    private int slotMinutes = 15;

    /** Decimal places used for proportional shares (kWh) */
    private int allocationScale = 12;

    /** Rounding used for proportional shares; remainders go to the largest holder */
    private RoundingMode allocationRounding = RoundingMode.HALF_EVEN;

    /** Decimal places of kWh totals on bills */
    private int energyScale = 6;

    /** Decimal places of money amounts on bills */
    private int moneyScale = 2;

    /** Maximum conservation error of a slot allocation (kWh) */
    private BigDecimal toleranceKwh = new BigDecimal("1E-9");

    /** Allowed monthly deviation between computed grid flows and the virtual meters (kWh) */
    private BigDecimal crossCheckToleranceKwh = new BigDecimal("0.5");

    /** Time zone used when a collective does not define one */
    private String defaultZoneId = "Europe/Zurich";

    /** Currency used when a collective does not define one */
    private String defaultCurrency = "CHF";
}
