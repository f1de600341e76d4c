package com.lynkvertx.vzev.entity;

import com.lynkvertx.vzev.model.BillingInterval;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import javax.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Collective entity
 * An energy collective sharing one grid connection, with its billing rates and period
 */
@Entity
@Table(name = "collective")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Collective {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String name;

    /** IANA zone id, e.g. Europe/Zurich */
    @Column(name = "zone_id", length = 64)
    private String zoneId;

    @Column(name = "currency", length = 3)
    private String currency;

    @Column(name = "local_rate", precision = 10, scale = 4)
    private BigDecimal localRate;

    @Column(name = "bkw_buy_rate", precision = 10, scale = 4)
    private BigDecimal bkwBuyRate;

    @Column(name = "bkw_sell_rate", precision = 10, scale = 4)
    private BigDecimal bkwSellRate;

    @Enumerated(EnumType.STRING)
    @Column(name = "billing_interval", length = 20)
    private BillingInterval billingInterval;

    @Column(name = "period_start")
    private LocalDate periodStart;

    /** Exclusive */
    @Column(name = "period_end")
    private LocalDate periodEnd;

    @Column(name = "show_daily_detail", nullable = false)
    private boolean showDailyDetail;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
