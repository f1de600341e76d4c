package com.lynkvertx.vzev.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import javax.persistence.*;

/**
 * Meter entity
 * Owned by exactly one member. Virtual meters are grid-level aggregates of the host.
 */
@Entity
@Table(name = "meter", uniqueConstraints = @UniqueConstraint(name = "uk_meter_external_id", columnNames = "external_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Meter {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "member_id", nullable = false)
    private Long memberId;

    /** Metering point id as used by the grid operator */
    @Column(name = "external_id", nullable = false, length = 64)
    private String externalId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "is_production", nullable = false)
    private boolean production;

    @Column(name = "is_virtual", nullable = false)
    private boolean virtual;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "member_id", insertable = false, updatable = false)
    private Member member;
}
