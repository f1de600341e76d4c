package com.lynkvertx.vzev.entity;

import com.lynkvertx.vzev.model.ReadingQuality;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import javax.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Normalized 15-minute interval reading.
 * Immutable once stored; unique per meter and slot start.
 */
@Entity
@Table(name = "interval_reading",
    uniqueConstraints = @UniqueConstraint(name = "uk_reading_meter_slot", columnNames = {"meter_id", "slot_start"}),
    indexes = @Index(name = "idx_reading_meter_slot", columnList = "meter_id, slot_start"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntervalReading {

    /** Decimal places kept for energy_kwh */
    public static final int ENERGY_SCALE = 6;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "meter_id", nullable = false)
    private Long meterId;

    /** Physical slot start (UTC) */
    @Column(name = "slot_start", nullable = false)
    private Instant slotStart;

    @Column(name = "energy_kwh", precision = 14, scale = ENERGY_SCALE, nullable = false)
    private BigDecimal energyKwh;

    @Enumerated(EnumType.STRING)
    @Column(name = "quality", length = 16, nullable = false)
    private ReadingQuality quality;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
