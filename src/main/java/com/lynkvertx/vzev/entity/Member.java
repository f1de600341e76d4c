package com.lynkvertx.vzev.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import javax.persistence.*;
import java.time.LocalDateTime;

/**
 * Collective member entity
 */
@Entity
@Table(name = "collective_member")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Member {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "collective_id", nullable = false)
    private Long collectiveId;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    @Column(name = "street", length = 255)
    private String street;

    @Column(name = "zip", length = 20)
    private String zip;

    @Column(name = "city", length = 100)
    private String city;

    @Column(name = "canton", length = 20)
    private String canton;

    @Column(name = "is_host", nullable = false)
    private boolean host;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "collective_id", insertable = false, updatable = false)
    private Collective collective;
}
