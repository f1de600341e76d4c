package com.lynkvertx.vzev.entity;

import com.lynkvertx.vzev.model.FeeBasis;
import com.lynkvertx.vzev.model.FeeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import javax.persistence.*;
import java.math.BigDecimal;

/**
 * Custom fee line of a member
 */
@Entity
@Table(name = "member_fee", indexes = @Index(name = "idx_member_fee_member", columnList = "member_id, sort_order"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberFee {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "member_id", nullable = false)
    private Long memberId;

    /** Order of application; percent fees see the fees before them */
    @Column(name = "sort_order", nullable = false)
    private int position;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "fee_type", nullable = false, length = 16)
    private FeeType feeType;

    @Column(name = "fee_value", precision = 12, scale = 4, nullable = false)
    private BigDecimal value;

    @Enumerated(EnumType.STRING)
    @Column(name = "basis", length = 16)
    private FeeBasis basis;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "member_id", insertable = false, updatable = false)
    private Member member;
}
